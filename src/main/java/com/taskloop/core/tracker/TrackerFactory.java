package com.taskloop.core.tracker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskloop.core.cache.CacheStore;
import com.taskloop.core.config.ConfigException;
import com.taskloop.core.config.TaskloopProperties;
import com.taskloop.core.metrics.LoopMetrics;
import com.taskloop.core.process.ProcessRunner;
import com.taskloop.core.ratelimit.RateLimiter;
import com.taskloop.core.ratelimit.RetryBudget;
import com.taskloop.core.ratelimit.Sleeper;
import com.taskloop.core.tracker.github.GitHubAuthResolver;
import com.taskloop.core.tracker.github.GitHubIssuesTracker;
import com.taskloop.core.tracker.github.GitHubRestClient;
import com.taskloop.core.tracker.github.GitHubTrackerOptions;
import com.taskloop.core.tracker.github.IssueSnapshot;
import com.taskloop.core.tracker.local.LocalFileTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Builds the tracker backend named by {@code taskloop.tracker.kind}.
 */
public class TrackerFactory {

    private static final Logger log = LoggerFactory.getLogger(TrackerFactory.class);

    private static final Pattern REPO = Pattern.compile("[A-Za-z0-9_.-]+/[A-Za-z0-9_.-]+");

    private final TaskloopProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final LoopMetrics metrics;
    private final Function<String, String> environment;
    private final ProcessRunner processRunner;

    public TrackerFactory(TaskloopProperties properties, ObjectMapper objectMapper, Clock clock, LoopMetrics metrics,
                          Function<String, String> environment, ProcessRunner processRunner) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        this.environment = environment;
        this.processRunner = processRunner;
    }

    public TaskTracker create() {
        String kind = properties.getTracker().getKind();
        String normalized = kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
        TaskTracker tracker = switch (normalized) {
            case "local" -> createLocal();
            case "github", "github_issues", "github-issues" -> createGitHub();
            default -> throw new ConfigException(
                    "Unknown tracker kind '%s'. Supported: local, github".formatted(kind));
        };
        log.info("Using {} tracker", tracker.kind());
        return tracker;
    }

    public TaskFilter filter() {
        var tracker = properties.getTracker();
        return TaskFilter.of(tracker.getLabelFilter(), tracker.getExcludeLabels(), tracker.isExcludeDrafts());
    }

    LocalFileTracker createLocal() {
        var local = properties.getTracker().getLocal();
        Path file = properties.resolveProjectRoot().resolve(local.getFile()).normalize();
        return new LocalFileTracker(file, filter(), local.getAddLabelsOnDone(),
                properties.getTracker().getBlockLabel(), objectMapper, clock);
    }

    GitHubIssuesTracker createGitHub() {
        var gh = properties.getTracker().getGithub();
        String repo = gh.getRepo() == null ? "" : gh.getRepo().trim();
        if (!REPO.matcher(repo).matches()) {
            throw new ConfigException(
                    "taskloop.tracker.github.repo must be 'owner/name', got '%s'".formatted(repo));
        }
        if (gh.getCacheTtlSeconds() < 0 || gh.getMaxAttempts() < 1 || gh.getRequestTimeoutSeconds() < 1) {
            throw new ConfigException("GitHub tracker limits must be positive "
                    + "(cache-ttl-seconds >= 0, max-attempts >= 1, request-timeout-seconds >= 1)");
        }

        var credentials = new GitHubAuthResolver(gh.getCredentialHelper(), gh.getTokenEnv(), gh.getToken(),
                environment, processRunner)
                .resolve(GitHubAuthResolver.Method.parse(gh.getAuthMethod()));

        RetryBudget budget;
        try {
            budget = new RetryBudget(gh.getMaxAttempts(), Duration.ofMillis(gh.getBaseDelayMillis()),
                    Duration.ofMillis(gh.getMaxDelayMillis()), gh.getJitter(),
                    Duration.ofSeconds(gh.getPatienceSeconds()));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid GitHub retry settings: " + e.getMessage(), e);
        }
        var rateLimiter = new RateLimiter(gh.getLowWaterMark(), budget, clock, Sleeper.SYSTEM,
                () -> ThreadLocalRandom.current().nextDouble());
        var client = new GitHubRestClient(gh.getApiUrl(), credentials, objectMapper, rateLimiter, metrics,
                Duration.ofSeconds(gh.getRequestTimeoutSeconds()));
        var cache = new CacheStore<>(properties.resolveStateDir().resolve("cache"), "issues", IssueSnapshot.class,
                objectMapper);
        var options = new GitHubTrackerOptions(repo, filter(), gh.isCloseOnDone(), gh.isCommentOnDone(),
                gh.getAddLabelsOnStart(), gh.getAddLabelsOnDone(), gh.isRemoveStartLabelsOnDone(),
                Duration.ofSeconds(gh.getCacheTtlSeconds()), properties.getTracker().getBlockLabel());
        return new GitHubIssuesTracker(client, cache, options, clock, metrics);
    }
}
