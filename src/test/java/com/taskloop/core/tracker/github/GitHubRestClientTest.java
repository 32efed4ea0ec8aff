package com.taskloop.core.tracker.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.taskloop.core.cache.CacheStore;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.ratelimit.RateLimiter;
import com.taskloop.core.ratelimit.RetryBudget;
import com.taskloop.core.tracker.PartialUpdateException;
import com.taskloop.core.tracker.RateLimitExceededException;
import com.taskloop.core.tracker.TaskFilter;
import com.taskloop.core.tracker.TaskNotFoundException;
import com.taskloop.core.tracker.TrackerAuthException;
import com.taskloop.core.tracker.TrackerNetworkException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class GitHubRestClientTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    /** Scripted responder for one test. */
    @FunctionalInterface
    interface Responder {
        void respond(HttpExchange exchange) throws IOException;
    }

    private HttpServer server;
    private volatile Responder responder;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private SimpleMeterRegistry registry;
    private RateLimiter rateLimiter;
    private GitHubRestClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI());
            authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
            try {
                responder.respond(exchange);
            } finally {
                exchange.close();
            }
        });
        server.start();

        registry = new SimpleMeterRegistry();
        var budget = new RetryBudget(3, Duration.ZERO, Duration.ZERO, 0, Duration.ofSeconds(30));
        rateLimiter = new RateLimiter(50, budget, Clock.fixed(NOW, ZoneOffset.UTC), sleeps::add, () -> 0.5);
        client = new GitHubRestClient(baseUrl(), new GitHubCredentials("t0ken", "GITHUB_TOKEN"),
                new ObjectMapper(), rateLimiter, new LoopMetrics(registry), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private static void reply(HttpExchange exchange, int status, String body, Map<String, String> headers)
            throws IOException {
        headers.forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        if (bytes.length == 0) {
            exchange.sendResponseHeaders(status, -1);
            return;
        }
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
    }

    private static String issueJson(int number, String title, String... labels) {
        var labelJson = new StringBuilder();
        for (int i = 0; i < labels.length; i++) {
            labelJson.append(i > 0 ? "," : "").append("{\"name\":\"").append(labels[i]).append("\"}");
        }
        return "{\"number\":%d,\"title\":\"%s\",\"body\":null,\"state\":\"open\",\"labels\":[%s]}"
                .formatted(number, title, labelJson);
    }

    @Nested
    @DisplayName("listing issues")
    class Listing {

        @Test
        @DisplayName("follows pagination, skips pull requests and keeps the first ETag")
        void paginates() {
            responder = exchange -> {
                String query = exchange.getRequestURI().getQuery();
                if (query.contains("page=2")) {
                    reply(exchange, 200, "[" + issueJson(3, "Third") + "]", Map.of());
                } else {
                    reply(exchange, 200, "[" + issueJson(1, "First", "ready") + ","
                                    + "{\"number\":2,\"title\":\"PR\",\"pull_request\":{},\"labels\":[]}]",
                            Map.of("ETag", "\"abc\"",
                                    "Link", "<" + baseUrl() + "/repos/acme/widgets/issues?page=2>; rel=\"next\""));
                }
            };

            IssuePage page = client.listOpenIssues("acme/widgets", List.of("ready"), null);

            assertFalse(page.notModified());
            assertEquals("\"abc\"", page.etag());
            assertEquals(List.of(1L, 3L), page.issues().stream().map(IssueSnapshot::number).toList());
            assertEquals(List.of("ready"), page.issues().get(0).labels());
            assertEquals("", page.issues().get(0).body());
            assertTrue(requests.get(0).contains("state=open"));
            assertTrue(requests.get(0).contains("labels=ready"));
            assertEquals("Bearer t0ken", authHeaders.get(0));
        }

        @Test
        @DisplayName("a matching ETag yields an unchanged page")
        void notModified() {
            responder = exchange -> {
                if ("\"abc\"".equals(exchange.getRequestHeaders().getFirst("If-None-Match"))) {
                    reply(exchange, 304, "", Map.of());
                } else {
                    reply(exchange, 200, "[]", Map.of("ETag", "\"abc\""));
                }
            };

            IssuePage page = client.listOpenIssues("acme/widgets", List.of(), "\"abc\"");

            assertTrue(page.notModified());
            assertEquals("\"abc\"", page.etag());
        }
    }

    @Nested
    @DisplayName("status handling")
    class StatusHandling {

        @Test
        @DisplayName("404 on an issue raises TaskNotFoundException")
        void notFound() {
            responder = exchange -> reply(exchange, 404, "{\"message\":\"Not Found\"}", Map.of());

            assertThrows(TaskNotFoundException.class, () -> client.getIssue("acme/widgets", "42"));
        }

        @Test
        @DisplayName("401 raises TrackerAuthException naming the credential source")
        void unauthorized() {
            responder = exchange -> reply(exchange, 401, "{\"message\":\"Bad credentials\"}", Map.of());

            var e = assertThrows(TrackerAuthException.class, () -> client.getIssue("acme/widgets", "1"));
            assertTrue(e.getMessage().contains("GITHUB_TOKEN"));
        }

        @Test
        @DisplayName("a 5xx response is retried within the budget")
        void retriesServerErrors() {
            var calls = new AtomicInteger();
            responder = exchange -> {
                if (calls.incrementAndGet() == 1) {
                    reply(exchange, 502, "", Map.of());
                } else {
                    reply(exchange, 200, issueJson(7, "Seven"), Map.of());
                }
            };

            IssueSnapshot issue = client.getIssue("acme/widgets", "7");

            assertEquals("Seven", issue.title());
            assertEquals(2, requests.size());
        }

        @Test
        @DisplayName("persistent 5xx responses exhaust the budget")
        void serverErrorsExhaustBudget() {
            responder = exchange -> reply(exchange, 500, "", Map.of());

            assertThrows(TrackerNetworkException.class, () -> client.getIssue("acme/widgets", "7"));
            assertEquals(3, requests.size());
        }

        @Test
        @DisplayName("an exhausted quota with a distant reset fails fast with the reset time")
        void hardLimitBeyondPatience() {
            long reset = NOW.plusSeconds(3600).getEpochSecond();
            responder = exchange -> reply(exchange, 403, "{\"message\":\"API rate limit exceeded\"}",
                    Map.of("X-RateLimit-Remaining", "0", "X-RateLimit-Reset", String.valueOf(reset)));

            var e = assertThrows(RateLimitExceededException.class, () -> client.getIssue("acme/widgets", "1"));

            assertEquals(Instant.ofEpochSecond(reset), e.getResetAt());
            assertEquals(1, requests.size());
        }

        @Test
        @DisplayName("a 403 without rate-limit signals is an authorization failure")
        void forbidden() {
            responder = exchange -> reply(exchange, 403, "{\"message\":\"Resource not accessible\"}",
                    Map.of("X-RateLimit-Remaining", "4000"));

            assertThrows(TrackerAuthException.class, () -> client.getIssue("acme/widgets", "1"));
        }

        @Test
        @DisplayName("Retry-After within patience is awaited and the call retried")
        void retryAfterHonoured() {
            var calls = new AtomicInteger();
            responder = exchange -> {
                if (calls.incrementAndGet() == 1) {
                    reply(exchange, 429, "", Map.of("Retry-After", "2"));
                } else {
                    reply(exchange, 200, issueJson(1, "One"), Map.of());
                }
            };

            client.getIssue("acme/widgets", "1");

            assertTrue(sleeps.contains(Duration.ofSeconds(2)));
        }
    }

    @Test
    @DisplayName("quota headers update the rate limiter")
    void quotaRecorded() {
        long reset = NOW.plusSeconds(900).getEpochSecond();
        responder = exchange -> reply(exchange, 200, issueJson(1, "One"),
                Map.of("X-RateLimit-Remaining", "4321", "X-RateLimit-Reset", String.valueOf(reset)));

        client.getIssue("acme/widgets", "1");

        assertEquals(4321, client.rateLimitState().remaining());
        assertEquals(Instant.ofEpochSecond(reset), client.rateLimitState().resetAt());
        assertEquals(1.0, registry.find("taskloop.tracker.api_calls").tag("status", "200").counter().count());
    }

    @Test
    @DisplayName("removing an absent label is not an error")
    void removeAbsentLabel() {
        responder = exchange -> reply(exchange, 404, "{\"message\":\"Label does not exist\"}", Map.of());

        assertDoesNotThrow(() -> client.removeLabel("acme/widgets", "1", "in progress"));
        assertTrue(requests.get(0).startsWith("DELETE /repos/acme/widgets/issues/1/labels/in%20progress"));
    }

    @Test
    @DisplayName("createComment posts the body and returns the comment id")
    void createComment() {
        responder = exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            assertTrue(body.contains("All gates passed"));
            reply(exchange, 201, "{\"id\": 987}", Map.of());
        };

        assertEquals(987L, client.createComment("acme/widgets", "1", "All gates passed"));
    }

    @Nested
    @DisplayName("undoing a partial completion")
    class Compensation {

        @TempDir
        Path dir;

        private GitHubIssuesTracker tracker() {
            var options = new GitHubTrackerOptions("acme/widgets", TaskFilter.of("ready", List.of(), true),
                    true, true, List.of(), List.of("done"), true, Duration.ofSeconds(300), "blocked");
            var cache = new CacheStore<>(dir, "issues", IssueSnapshot.class,
                    new ObjectMapper().findAndRegisterModules());
            return new GitHubIssuesTracker(client, cache, options, Clock.fixed(NOW, ZoneOffset.UTC),
                    new LoopMetrics(registry));
        }

        @Test
        @DisplayName("a hard limit at the close step waits for the reset and still rolls back")
        void rollbackWaitsForReset() {
            long reset = NOW.plusSeconds(3600).getEpochSecond();
            responder = exchange -> {
                String method = exchange.getRequestMethod();
                String path = exchange.getRequestURI().getPath();
                String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
                if (method.equals("GET")) {
                    reply(exchange, 200, issueJson(7, "Seven", "ready"), Map.of());
                } else if (method.equals("POST") && path.endsWith("/comments")) {
                    reply(exchange, 201, "{\"id\": 55}", Map.of());
                } else if (method.equals("POST")) {
                    reply(exchange, 200, "[]", Map.of());
                } else if (method.equals("PATCH") && body.contains("closed")) {
                    reply(exchange, 403, "{\"message\":\"API rate limit exceeded\"}",
                            Map.of("X-RateLimit-Remaining", "0", "X-RateLimit-Reset", String.valueOf(reset)));
                } else if (method.equals("PATCH")) {
                    reply(exchange, 200, issueJson(7, "Seven", "ready", "done"), Map.of());
                } else {
                    reply(exchange, 204, "", Map.of());
                }
            };

            var e = assertThrows(PartialUpdateException.class, () -> tracker().markTaskDone("7", "All gates passed"));

            assertEquals("close", e.getFailedStep());
            assertTrue(e.isRolledBack());
            assertEquals(List.of(
                    "GET /repos/acme/widgets/issues/7",
                    "POST /repos/acme/widgets/issues/7/comments",
                    "POST /repos/acme/widgets/issues/7/labels",
                    "PATCH /repos/acme/widgets/issues/7",
                    "PATCH /repos/acme/widgets/issues/7",
                    "DELETE /repos/acme/widgets/issues/7/labels/done",
                    "DELETE /repos/acme/widgets/issues/comments/55"), requests);
            assertTrue(sleeps.contains(Duration.ofSeconds(3600)));
        }

        @Test
        @DisplayName("undo steps give up without a request when the reset is more than an hour out")
        void resetTooFarForRollback() {
            long reset = NOW.plusSeconds(7200).getEpochSecond();
            responder = exchange -> reply(exchange, 403, "{\"message\":\"API rate limit exceeded\"}",
                    Map.of("X-RateLimit-Remaining", "0", "X-RateLimit-Reset", String.valueOf(reset)));

            assertThrows(RateLimitExceededException.class, () -> client.getIssue("acme/widgets", "7"));
            assertThrows(RateLimitExceededException.class,
                    () -> client.compensate(() -> client.deleteComment("acme/widgets", 55)));

            assertEquals(1, requests.size());
            assertTrue(sleeps.isEmpty());
        }
    }
}
