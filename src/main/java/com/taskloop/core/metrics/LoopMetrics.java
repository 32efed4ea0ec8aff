package com.taskloop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for loop execution and tracker traffic.
 */
@Service
public class LoopMetrics {

    private final MeterRegistry registry;

    public LoopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordIteration(String outcome, long ms) {
        Timer.builder("taskloop.iteration.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGate(String gate, boolean passed) {
        Counter.builder("taskloop.gate.runs")
                .tag("gate", gate)
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordRunFinished(String terminalState) {
        Counter.builder("taskloop.runs.total")
                .tag("state", terminalState)
                .register(registry)
                .increment();
    }

    /**
     * Records one HTTP exchange with the issue tracker API.
     *
     * @param operation logical operation, e.g. "list" or "comment"
     * @param status    HTTP status, or 0 for a transport failure
     */
    public void recordApiCall(String operation, int status) {
        Counter.builder("taskloop.tracker.api_calls")
                .description("Issue tracker API requests")
                .tag("operation", operation)
                .tag("status", String.valueOf(status))
                .register(registry)
                .increment();
    }

    /**
     * @param result "hit", "stale", "miss" or "renewed"
     */
    public void recordCacheLookup(String result) {
        Counter.builder("taskloop.tracker.cache_lookups")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordBackoff(String reason, Duration delay) {
        Timer.builder("taskloop.tracker.backoff")
                .description("Delays inserted before tracker API calls")
                .tag("reason", reason)
                .register(registry)
                .record(delay);
    }
}
