package com.taskloop.dispatch.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskloop.TaskloopApplication;
import com.taskloop.core.config.ConfigException;
import com.taskloop.core.config.TaskloopProperties;
import com.taskloop.core.engine.LoopEngine;
import com.taskloop.core.engine.LoopStatus;
import com.taskloop.core.engine.RunControl;
import com.taskloop.core.engine.RunRequest;
import com.taskloop.core.events.EventBus;
import com.taskloop.core.events.LoopEvent;
import com.taskloop.core.model.IterationResult;
import com.taskloop.core.model.LoopOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Newline-delimited JSON-RPC 2.0 control surface over a pair of streams.
 * <p>
 * One request per line in, one response or event notification per line out. A run started
 * through {@code run} executes on a single background worker; {@code step} runs inline.
 * Loop events published on the {@link EventBus} are forwarded as {@code method: "event"}
 * notifications with dots in the event type replaced by underscores.
 */
@Component
public class BridgeServer {

    private static final Logger log = LoggerFactory.getLogger(BridgeServer.class);

    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INTERNAL_ERROR = -32603;
    static final int INVALID_PARAMS = 400;
    static final int RUN_ACTIVE = 409;

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private final LoopEngine loopEngine;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final TaskloopProperties properties;
    private final Clock clock;

    private final Object writeLock = new Object();
    private Writer out;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "taskloop-bridge-run");
        t.setDaemon(true);
        return t;
    });
    private volatile Future<?> activeRun;
    private volatile RunControl activeControl;
    private volatile String activeRunId;

    public BridgeServer(LoopEngine loopEngine, EventBus eventBus, ObjectMapper objectMapper,
                        TaskloopProperties properties, Clock clock) {
        this.loopEngine = loopEngine;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Serves requests until {@code input} reaches end of stream, then stops any active run.
     */
    public void serve(InputStream input, OutputStream output) throws IOException {
        this.out = new OutputStreamWriter(output, StandardCharsets.UTF_8);
        EventBus.Subscription subscription = eventBus.subscribeAll(this::forward);
        try {
            emit("bridge_started", Map.of(
                    "version", TaskloopApplication.VERSION,
                    "cwd", properties.resolveProjectRoot().toString()));
            log.info("Bridge started");

            var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                handleLine(line).ifPresent(this::write);
            }
        } finally {
            shutdown();
            subscription.unsubscribe();
            emit("bridge_stopped", Map.of());
            log.info("Bridge stopped");
        }
    }

    /**
     * Handles one request line.
     *
     * @return the response, empty for notifications
     */
    Optional<ObjectNode> handleLine(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return Optional.of(error(null, PARSE_ERROR, "Parse error", e.getOriginalMessage()));
        }
        if (message == null || !message.isObject()) {
            return Optional.of(error(null, INVALID_REQUEST, "Invalid Request", "request must be a JSON object"));
        }

        JsonNode id = message.get("id");
        if (id != null && !(id.isTextual() || id.isNumber() || id.isNull())) {
            return Optional.of(error(null, INVALID_REQUEST, "Invalid Request", "id must be a string or number"));
        }
        JsonNode method = message.get("method");
        JsonNode version = message.get("jsonrpc");
        if ((version != null && !"2.0".equals(version.asText(null))) || method == null || !method.isTextual()) {
            return Optional.of(error(id, INVALID_REQUEST, "Invalid Request",
                    "expected jsonrpc \"2.0\" (or none) and a string method"));
        }
        JsonNode params = message.get("params");
        if (params != null && !params.isNull() && !params.isObject()) {
            return Optional.of(error(id, INVALID_PARAMS, "params must be an object", null));
        }
        if (params == null || params.isNull()) {
            params = objectMapper.createObjectNode();
        }

        try {
            Object result = dispatch(method.asText(), params);
            if (id == null) {
                return Optional.empty();
            }
            ObjectNode response = objectMapper.createObjectNode();
            response.put("jsonrpc", "2.0");
            response.set("id", id);
            response.set("result", objectMapper.valueToTree(result));
            return Optional.of(response);
        } catch (RpcError e) {
            log.debug("Request {} rejected: {} {}", method.asText(), e.code, e.getMessage());
            return id == null ? Optional.empty() : Optional.of(error(id, e.code, e.getMessage(), null));
        } catch (RuntimeException e) {
            log.error("Request {} failed: {}", method.asText(), e.getMessage(), e);
            return id == null ? Optional.empty()
                    : Optional.of(error(id, INTERNAL_ERROR, "Internal error", e.getMessage()));
        }
    }

    private Object dispatch(String method, JsonNode params) {
        return switch (method) {
            case "ping" -> ping();
            case "status" -> status();
            case "step" -> step(params);
            case "run" -> run(params);
            case "stop" -> stop();
            case "pause" -> pause();
            case "resume" -> resume();
            default -> throw new RpcError(METHOD_NOT_FOUND, "Method not found: " + method);
        };
    }

    private Map<String, Object> ping() {
        return Map.of(
                "ok", true,
                "version", TaskloopApplication.VERSION,
                "cwd", properties.resolveProjectRoot().toString(),
                "time", clock.instant().toString());
    }

    private Map<String, Object> status() {
        LoopStatus status = loopEngine.status();
        var result = new LinkedHashMap<String, Object>();
        result.put("tracker", status.trackerKind());
        result.put("mode", status.mode());
        if (status.counts() != null) {
            result.put("done", status.counts().total() - status.counts().open());
            result.put("open", status.counts().open());
            result.put("total", status.counts().total());
        }
        result.put("next", status.next() == null ? null
                : Map.of("id", status.next().id(), "title", status.next().title()));
        result.put("running", isRunning());
        RunControl control = activeControl;
        result.put("paused", control != null && control.isPaused());
        result.put("activeRunId", activeRunId);
        result.put("noProgressStreak", status.noProgressStreak());
        result.put("last", status.lastResult());
        result.put("warning", status.warning());
        return result;
    }

    private Object step(JsonNode params) {
        ensureNotRunning();
        RunRequest request = new RunRequest(optionalMode(params), null);
        resolveOrReject(request);
        Optional<IterationResult> result = loopEngine.step(request, new RunControl(), loopEngine.generateRunId());
        if (result.isEmpty()) {
            return Map.of("stopped", true);
        }
        return result.get();
    }

    private Map<String, Object> run(JsonNode params) {
        ensureNotRunning();
        JsonNode max = params.get("maxIterations");
        Integer maxIterations = null;
        if (max != null && !max.isNull()) {
            if (!max.canConvertToInt() || !max.isIntegralNumber()) {
                throw new RpcError(INVALID_PARAMS, "maxIterations must be an integer");
            }
            maxIterations = max.intValue();
        }
        RunRequest request = new RunRequest(optionalMode(params), maxIterations);
        resolveOrReject(request);

        String runId = loopEngine.generateRunId();
        RunControl control = new RunControl();
        activeControl = control;
        activeRunId = runId;
        activeRun = worker.submit(() -> runInBackground(request, control, runId));
        return Map.of("runId", runId);
    }

    private void runInBackground(RunRequest request, RunControl control, String runId) {
        try {
            LoopOutcome outcome = loopEngine.run(request, control, runId);
            log.info("Bridge run {} ended: {}", runId, outcome.terminalState());
        } catch (RuntimeException e) {
            log.error("Bridge run {} failed: {}", runId, e.getMessage(), e);
            eventBus.publish(new LoopEvent(LoopEvent.ERROR, runId, null,
                    Map.of("message", String.valueOf(e.getMessage())), clock.instant()));
            eventBus.publish(new LoopEvent(LoopEvent.RUN_STOPPED, runId, null,
                    Map.of("terminalState", "ERROR"), clock.instant()));
        } finally {
            activeControl = null;
            activeRunId = null;
        }
    }

    private Map<String, Object> stop() {
        RunControl control = activeControl;
        if (!isRunning() || control == null) {
            return Map.of("ok", true, "stopped", false);
        }
        control.requestStop();
        return Map.of("ok", true, "stopped", true);
    }

    private Map<String, Object> pause() {
        RunControl control = activeControl;
        if (!isRunning() || control == null) {
            return Map.of("ok", true, "paused", false);
        }
        control.pause();
        eventBus.publish(new LoopEvent(LoopEvent.RUN_PAUSED, activeRunId, null, Map.of(), clock.instant()));
        return Map.of("ok", true, "paused", true);
    }

    private Map<String, Object> resume() {
        RunControl control = activeControl;
        if (!isRunning() || control == null) {
            return Map.of("ok", true, "paused", false);
        }
        control.resume();
        eventBus.publish(new LoopEvent(LoopEvent.RUN_RESUMED, activeRunId, null, Map.of(), clock.instant()));
        return Map.of("ok", true, "paused", false);
    }

    private boolean isRunning() {
        Future<?> run = activeRun;
        return run != null && !run.isDone();
    }

    private void ensureNotRunning() {
        if (isRunning()) {
            throw new RpcError(RUN_ACTIVE, "A run is already active");
        }
    }

    private void resolveOrReject(RunRequest request) {
        try {
            loopEngine.resolve(request);
        } catch (ConfigException e) {
            throw new RpcError(INVALID_PARAMS, e.getMessage());
        }
    }

    private static String optionalMode(JsonNode params) {
        JsonNode mode = params.get("mode");
        if (mode == null || mode.isNull()) {
            return null;
        }
        if (!mode.isTextual()) {
            throw new RpcError(INVALID_PARAMS, "mode must be a string");
        }
        return mode.asText();
    }

    private void shutdown() {
        RunControl control = activeControl;
        if (control != null) {
            log.info("Input closed; stopping active run {}", activeRunId);
            control.requestStop();
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Active run did not stop within {}s; abandoning it", SHUTDOWN_WAIT_SECONDS);
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }

    private void forward(LoopEvent event) {
        var params = new LinkedHashMap<String, Object>();
        params.put("runId", event.runId());
        if (event.taskId() != null) {
            params.put("taskId", event.taskId());
        }
        params.put("timestamp", event.timestamp().toString());
        params.putAll(event.payload());
        emit(event.eventType().replace('.', '_'), params);
    }

    private void emit(String type, Map<String, Object> fields) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("type", type);
        params.setAll((ObjectNode) objectMapper.valueToTree(fields));
        ObjectNode notification = objectMapper.createObjectNode();
        notification.put("jsonrpc", "2.0");
        notification.put("method", "event");
        notification.set("params", params);
        write(notification);
    }

    private ObjectNode error(JsonNode id, int code, String message, String data) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("code", code);
        error.put("message", message);
        if (data != null) {
            error.put("data", data);
        }
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("error", error);
        return response;
    }

    private void write(ObjectNode message) {
        synchronized (writeLock) {
            try {
                out.write(objectMapper.writeValueAsString(message));
                out.write('\n');
                out.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Bridge output closed", e);
            }
        }
    }

    static final class RpcError extends RuntimeException {

        private final int code;

        RpcError(int code, String message) {
            super(message);
            this.code = code;
        }
    }
}
