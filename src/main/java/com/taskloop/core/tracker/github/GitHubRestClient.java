package com.taskloop.core.tracker.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.ratelimit.RateLimitState;
import com.taskloop.core.ratelimit.RateLimiter;
import com.taskloop.core.tracker.RateLimitExceededException;
import com.taskloop.core.tracker.TaskNotFoundException;
import com.taskloop.core.tracker.TrackerAuthException;
import com.taskloop.core.tracker.TrackerNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP client for the GitHub Issues REST API.
 *
 * <p>Every request goes through the {@link RateLimiter}: quota headers of each response
 * update its state, low quota inserts a backoff before the next call, and hard rejections
 * wait for the reset or fail fast with {@link RateLimitExceededException}. Transport
 * failures and 5xx responses are retried within the limiter's retry budget.
 */
public class GitHubRestClient implements GitHubApi {

    private static final Logger log = LoggerFactory.getLogger(GitHubRestClient.class);

    static final int MAX_PAGES = 20;
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"next\"");

    private final String apiUrl;
    private final GitHubCredentials credentials;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final LoopMetrics metrics;
    private final Duration requestTimeout;

    public GitHubRestClient(String apiUrl, GitHubCredentials credentials, ObjectMapper objectMapper,
                            RateLimiter rateLimiter, LoopMetrics metrics, Duration requestTimeout) {
        this(apiUrl, credentials, HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                objectMapper, rateLimiter, metrics, requestTimeout);
    }

    GitHubRestClient(String apiUrl, GitHubCredentials credentials, HttpClient httpClient, ObjectMapper objectMapper,
                     RateLimiter rateLimiter, LoopMetrics metrics, Duration requestTimeout) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.credentials = credentials;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.metrics = metrics;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public IssuePage listOpenIssues(String repo, Collection<String> labels, String etag) {
        var url = new StringBuilder(apiUrl).append("/repos/").append(repo)
                .append("/issues?state=open&per_page=100");
        if (labels != null && !labels.isEmpty()) {
            url.append("&labels=").append(encode(String.join(",", labels)));
        }

        var issues = new ArrayList<IssueSnapshot>();
        String next = url.toString();
        String firstEtag = null;
        for (int page = 1; next != null; page++) {
            if (page > MAX_PAGES) {
                log.warn("Stopped listing {} after {} pages", repo, MAX_PAGES);
                break;
            }
            var builder = request(URI.create(next)).GET();
            if (page == 1 && etag != null) {
                builder.header("If-None-Match", etag);
            }
            var response = send("list", builder.build());
            if (page == 1 && response.statusCode() == 304) {
                log.debug("Issue list for {} not modified", repo);
                return IssuePage.unchanged(etag);
            }
            expectSuccess(response, "GET issues of " + repo);
            if (page == 1) {
                firstEtag = response.headers().firstValue("ETag").orElse(null);
            }
            for (JsonNode node : readTree(response.body())) {
                if (node.has("pull_request")) {
                    continue;
                }
                issues.add(toSnapshot(node));
            }
            next = nextLink(response.headers()).orElse(null);
        }
        log.debug("Fetched {} open issue(s) from {}", issues.size(), repo);
        return new IssuePage(issues, firstEtag, false);
    }

    @Override
    public IssueSnapshot getIssue(String repo, String number) {
        var response = send("get", request(issueUri(repo, number, "")).GET().build());
        if (response.statusCode() == 404) {
            throw new TaskNotFoundException(number);
        }
        expectSuccess(response, "GET issue #" + number);
        return toSnapshot(readTree(response.body()));
    }

    @Override
    public long createComment(String repo, String number, String body) {
        ObjectNode payload = objectMapper.createObjectNode().put("body", body);
        var response = send("comment", request(issueUri(repo, number, "/comments"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build());
        if (response.statusCode() == 404) {
            throw new TaskNotFoundException(number);
        }
        expectSuccess(response, "POST comment on #" + number);
        return readTree(response.body()).path("id").asLong();
    }

    @Override
    public void deleteComment(String repo, long commentId) {
        var uri = URI.create(apiUrl + "/repos/" + repo + "/issues/comments/" + commentId);
        var response = send("delete_comment", request(uri).DELETE().build());
        if (response.statusCode() == 404) {
            log.debug("Comment {} already gone", commentId);
            return;
        }
        expectSuccess(response, "DELETE comment " + commentId);
    }

    @Override
    public void addLabels(String repo, String number, Collection<String> labels) {
        if (labels.isEmpty()) {
            return;
        }
        ObjectNode payload = objectMapper.createObjectNode();
        var array = payload.putArray("labels");
        labels.forEach(array::add);
        var response = send("add_labels", request(issueUri(repo, number, "/labels"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build());
        if (response.statusCode() == 404) {
            throw new TaskNotFoundException(number);
        }
        expectSuccess(response, "POST labels on #" + number);
    }

    @Override
    public void removeLabel(String repo, String number, String label) {
        var response = send("remove_label",
                request(issueUri(repo, number, "/labels/" + encodePath(label))).DELETE().build());
        if (response.statusCode() == 404) {
            log.debug("Label '{}' not present on #{}", label, number);
            return;
        }
        expectSuccess(response, "DELETE label '" + label + "' on #" + number);
    }

    @Override
    public void setClosed(String repo, String number, boolean closed) {
        ObjectNode payload = objectMapper.createObjectNode().put("state", closed ? "closed" : "open");
        var response = send(closed ? "close" : "reopen", request(issueUri(repo, number, ""))
                .header("Content-Type", "application/json")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build());
        if (response.statusCode() == 404) {
            throw new TaskNotFoundException(number);
        }
        expectSuccess(response, "PATCH state of #" + number);
    }

    @Override
    public void compensate(Runnable action) {
        rateLimiter.compensating(() -> {
            action.run();
            return null;
        });
    }

    @Override
    public RateLimitState rateLimitState() {
        return rateLimiter.state();
    }

    HttpResponse<String> send(String operation, HttpRequest request) {
        int attempt = 0;
        while (true) {
            attempt++;
            Duration throttled = rateLimiter.beforeRequest();
            if (!throttled.isZero()) {
                metrics.recordBackoff("low_quota", throttled);
            }

            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                metrics.recordApiCall(operation, 0);
                if (!rateLimiter.budget().canRetry(attempt)) {
                    throw new TrackerNetworkException("GitHub API request failed: %s %s (%s)"
                            .formatted(request.method(), request.uri().getPath(), e.getMessage()), e);
                }
                log.warn("GitHub API {} failed (attempt {}/{}): {}", operation, attempt,
                        rateLimiter.budget().maxAttempts(), e.getMessage());
                metrics.recordBackoff("transport", rateLimiter.retryDelay(attempt));
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TrackerNetworkException("Interrupted during GitHub API request", e);
            }

            int status = response.statusCode();
            metrics.recordApiCall(operation, status);
            recordQuota(response.headers());

            if (status == 401) {
                throw new TrackerAuthException("GitHub rejected the credentials from %s (HTTP 401). "
                        .formatted(credentials.source())
                        + "Run 'gh auth login' or refresh the token.");
            }
            if (isHardLimit(response)) {
                Duration waited = rateLimiter.onHardLimit(retryAfter(response.headers()).orElse(null));
                metrics.recordBackoff("hard_limit", waited);
                if (!rateLimiter.budget().canRetry(attempt)) {
                    throw new RateLimitExceededException(
                            "GitHub API rate limit persisted after %d attempt(s)".formatted(attempt),
                            rateLimiter.state().resetAt());
                }
                continue;
            }
            if (status == 403) {
                throw new TrackerAuthException(("GitHub denied %s %s (HTTP 403). Check that the token from %s "
                        + "has access to the repository.").formatted(request.method(), request.uri().getPath(),
                        credentials.source()));
            }
            if (status >= 500) {
                if (!rateLimiter.budget().canRetry(attempt)) {
                    throw new TrackerNetworkException("GitHub API %s %s failed (HTTP %d) after %d attempt(s)"
                            .formatted(request.method(), request.uri().getPath(), status, attempt));
                }
                log.warn("GitHub API {} returned HTTP {} (attempt {}/{})", operation, status, attempt,
                        rateLimiter.budget().maxAttempts());
                metrics.recordBackoff("server_error", rateLimiter.retryDelay(attempt));
                continue;
            }
            return response;
        }
    }

    private boolean isHardLimit(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status != 403 && status != 429) {
            return false;
        }
        HttpHeaders headers = response.headers();
        if (retryAfter(headers).isPresent()) {
            return true;
        }
        return headers.firstValue("X-RateLimit-Remaining").map(v -> v.trim().equals("0")).orElse(status == 429);
    }

    private void recordQuota(HttpHeaders headers) {
        Integer remaining = headers.firstValue("X-RateLimit-Remaining").map(GitHubRestClient::parseIntOrNull)
                .orElse(null);
        Instant resetAt = headers.firstValue("X-RateLimit-Reset").map(GitHubRestClient::parseLongOrNull)
                .map(Instant::ofEpochSecond)
                .orElse(null);
        rateLimiter.update(remaining, resetAt);
    }

    private static Optional<Duration> retryAfter(HttpHeaders headers) {
        return headers.firstValue("Retry-After")
                .map(GitHubRestClient::parseIntOrNull)
                .map(Duration::ofSeconds);
    }

    static Optional<String> nextLink(HttpHeaders headers) {
        return headers.firstValue("Link").flatMap(link -> {
            Matcher m = NEXT_LINK.matcher(link);
            return m.find() ? Optional.of(m.group(1)) : Optional.empty();
        });
    }

    private HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + credentials.token())
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .header("User-Agent", "taskloop");
    }

    private URI issueUri(String repo, String number, String suffix) {
        return URI.create(apiUrl + "/repos/" + repo + "/issues/" + number + suffix);
    }

    private void expectSuccess(HttpResponse<String> response, String what) {
        if (response.statusCode() >= 300) {
            throw new TrackerNetworkException("GitHub API %s failed (HTTP %d): %s"
                    .formatted(what, response.statusCode(), abbreviate(response.body())));
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new TrackerNetworkException("Unparseable GitHub API response: " + e.getMessage(), e);
        }
    }

    private static IssueSnapshot toSnapshot(JsonNode node) {
        var labels = new ArrayList<String>();
        for (JsonNode label : node.path("labels")) {
            String name = label.isTextual() ? label.asText() : label.path("name").asText("");
            if (!name.isEmpty()) {
                labels.add(name);
            }
        }
        JsonNode milestone = node.path("milestone");
        Integer milestoneNumber = milestone.hasNonNull("number") ? milestone.get("number").asInt() : null;
        return new IssueSnapshot(
                node.path("number").asLong(),
                node.path("title").asText(null),
                node.path("body").asText(""),
                List.copyOf(labels),
                milestoneNumber,
                "closed".equalsIgnoreCase(node.path("state").asText("open")));
    }

    private static Integer parseIntOrNull(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parseLongOrNull(String value) {
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String encodePath(String value) {
        return encode(value).replace("+", "%20");
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
