package com.taskloop.core.tracker.github;

import com.taskloop.core.config.ConfigException;
import com.taskloop.core.process.ProcessOutcome;
import com.taskloop.core.process.ProcessRunner;
import com.taskloop.core.tracker.TrackerAuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Resolves GitHub credentials, first available source wins:
 * <ol>
 *   <li>external credential helper (default {@code gh auth token})</li>
 *   <li>token from an environment variable (default {@code GITHUB_TOKEN})</li>
 *   <li>token embedded in configuration, accepted with a warning</li>
 * </ol>
 * Nothing is ever sent unauthenticated; when every allowed source fails a single
 * {@link TrackerAuthException} lists what was tried and how to fix it.
 */
public class GitHubAuthResolver {

    private static final Logger log = LoggerFactory.getLogger(GitHubAuthResolver.class);

    private static final Duration HELPER_TIMEOUT = Duration.ofSeconds(15);

    public enum Method {
        AUTO, EXTERNAL_HELPER, TOKEN;

        public static Method parse(String value) {
            String normalized = value == null ? "auto" : value.trim().toLowerCase(Locale.ROOT);
            return switch (normalized) {
                case "", "auto" -> AUTO;
                case "external-helper", "gh", "gh_cli" -> EXTERNAL_HELPER;
                case "token" -> TOKEN;
                default -> throw new ConfigException(
                        "Unknown GitHub auth method '%s'. Use auto, external-helper or token.".formatted(value));
            };
        }
    }

    private final List<String> helperCommand;
    private final String tokenEnv;
    private final String configToken;
    private final Function<String, String> environment;
    private final ProcessRunner processRunner;

    public GitHubAuthResolver(List<String> helperCommand, String tokenEnv, String configToken,
                              Function<String, String> environment, ProcessRunner processRunner) {
        this.helperCommand = helperCommand != null ? List.copyOf(helperCommand) : List.of();
        this.tokenEnv = tokenEnv;
        this.configToken = configToken;
        this.environment = environment;
        this.processRunner = processRunner;
    }

    public GitHubCredentials resolve(Method method) {
        var tried = new ArrayList<String>();

        if (method != Method.TOKEN) {
            var fromHelper = fromHelper(tried);
            if (fromHelper != null) {
                return fromHelper;
            }
        }
        if (method != Method.EXTERNAL_HELPER) {
            String envValue = tokenEnv == null || tokenEnv.isBlank() ? null : environment.apply(tokenEnv);
            if (envValue != null && !envValue.isBlank()) {
                log.info("Using GitHub token from ${}", tokenEnv);
                return new GitHubCredentials(envValue.trim(), "environment variable " + tokenEnv);
            }
            tried.add("environment variable %s: not set".formatted(tokenEnv));

            if (configToken != null && !configToken.isBlank()) {
                log.warn("Using GitHub token embedded in configuration; prefer ${} or a credential helper", tokenEnv);
                return new GitHubCredentials(configToken.trim(), "configuration");
            }
            tried.add("taskloop.tracker.github.token: not set");
        }

        throw new TrackerAuthException(remediation(method, tried));
    }

    private GitHubCredentials fromHelper(List<String> tried) {
        String label = String.join(" ", helperCommand);
        if (helperCommand.isEmpty()) {
            tried.add("credential helper: not configured");
            return null;
        }
        try {
            ProcessOutcome outcome = processRunner.run(helperCommand, null, null, HELPER_TIMEOUT);
            String token = outcome.output().strip();
            if (outcome.succeeded() && !token.isEmpty() && !token.contains("\n")) {
                log.info("Using GitHub token from credential helper '{}'", label);
                return new GitHubCredentials(token, "credential helper");
            }
            tried.add(outcome.timedOut()
                    ? "credential helper '%s': timed out".formatted(label)
                    : "credential helper '%s': exited %d without a token".formatted(label, outcome.exitCode()));
        } catch (IOException e) {
            tried.add("credential helper '%s': not installed (%s)".formatted(label, e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerAuthException("Interrupted while running credential helper '" + label + "'", e);
        }
        return null;
    }

    private String remediation(Method method, List<String> tried) {
        var sb = new StringBuilder("No GitHub credentials available (auth method ")
                .append(method.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                .append("). Tried:");
        for (String attempt : tried) {
            sb.append("\n  - ").append(attempt);
        }
        sb.append("\nFix: run 'gh auth login' (https://cli.github.com/)");
        if (method != Method.EXTERNAL_HELPER) {
            sb.append(" or export ").append(tokenEnv).append("=<personal access token with repo scope>");
        }
        return sb.toString();
    }
}
