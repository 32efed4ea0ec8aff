package com.taskloop.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskloop.core.agent.AgentInvoker;
import com.taskloop.core.agent.ProcessAgentInvoker;
import com.taskloop.core.gate.GateRunner;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.model.EffectiveConfig;
import com.taskloop.core.process.ProcessRunner;
import com.taskloop.core.state.RunStateStore;
import com.taskloop.core.tracker.TaskTracker;
import com.taskloop.core.tracker.TrackerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.time.Clock;

@Configuration
public class TaskloopConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaskloopConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    /**
     * The configured mode, resolved once at startup so a bad mode or value fails before any command runs.
     */
    @Bean
    public EffectiveConfig effectiveConfig(TaskloopProperties properties, ModeResolver modeResolver) {
        EffectiveConfig config = modeResolver.resolve(properties.getLoop().getMode(), properties.toLoopConfig(),
                properties.modeOverrides());
        log.debug("Effective loop configuration: {}", config);
        return config;
    }

    @Bean
    public TrackerFactory trackerFactory(TaskloopProperties properties, ObjectMapper objectMapper, Clock clock,
                                         LoopMetrics metrics, ProcessRunner processRunner) {
        return new TrackerFactory(properties, objectMapper, clock, metrics, System::getenv, processRunner);
    }

    /**
     * Created on first use, so help and version output never touch the task source or credentials.
     */
    @Bean
    @Lazy
    public TaskTracker taskTracker(TrackerFactory trackerFactory) {
        return trackerFactory.create();
    }

    @Bean
    public GateRunner gateRunner(ProcessRunner processRunner, TaskloopProperties properties, LoopMetrics metrics) {
        return new GateRunner(processRunner, properties.resolveProjectRoot(), metrics);
    }

    @Bean
    public AgentInvoker agentInvoker(TaskloopProperties properties, ProcessRunner processRunner) {
        var runner = properties.getRunner();
        if (runner.getArgv() == null || runner.getArgv().isEmpty()) {
            throw new ConfigException("taskloop.runner.argv must name the agent command");
        }
        return new ProcessAgentInvoker(runner.getArgv(), ProcessAgentInvoker.PromptMode.parse(runner.getPromptMode()),
                processRunner);
    }

    @Bean
    public RunStateStore runStateStore(TaskloopProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new RunStateStore(properties.resolveStateDir().resolve("state.json"), objectMapper, clock);
    }
}
