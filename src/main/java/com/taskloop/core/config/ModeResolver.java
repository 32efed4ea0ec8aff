package com.taskloop.core.config;

import com.taskloop.core.model.EffectiveConfig;
import com.taskloop.core.model.GateCommand;
import com.taskloop.core.model.LoopConfig;
import com.taskloop.core.model.ModeOverride;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Folds a named mode's sparse overrides into the base loop configuration.
 * <p>
 * Every field present in the override replaces the base value; every absent field keeps
 * the base value. An unknown mode name is a {@link ConfigException}, never a silent default.
 */
@Component
public class ModeResolver {

    private static final Logger log = LoggerFactory.getLogger(ModeResolver.class);

    public static final String DEFAULT_MODE = "default";

    /**
     * Resolves the effective configuration for a run.
     *
     * @param modeName  requested mode, {@code null}/blank/"default" for the base configuration
     * @param base      base loop configuration
     * @param overrides override blocks keyed by mode name
     * @return the merged configuration
     * @throws ConfigException if the mode is unknown or the merged values are invalid
     */
    public EffectiveConfig resolve(String modeName, LoopConfig base, Map<String, ModeOverride> overrides) {
        String name = normalize(modeName);
        if (name.isEmpty() || DEFAULT_MODE.equals(name)) {
            var effective = EffectiveConfig.of(base);
            validate(DEFAULT_MODE, effective);
            return effective;
        }

        ModeOverride override = lookup(name, overrides);
        if (override == null) {
            var known = new TreeSet<String>();
            known.add(DEFAULT_MODE);
            overrides.keySet().forEach(k -> known.add(normalize(k)));
            throw new ConfigException("Unknown loop mode '%s'. Known modes: %s"
                    .formatted(modeName, String.join(", ", known)));
        }

        var effective = new EffectiveConfig(
                name,
                pick(override.maxIterations(), base.maxIterations()),
                pick(override.noProgressLimit(), base.noProgressLimit()),
                pick(override.gates(), base.gates()),
                pick(override.runnerTimeoutSeconds(), base.runnerTimeoutSeconds()),
                pick(override.sleepSecondsBetweenIterations(), base.sleepSecondsBetweenIterations()),
                pick(override.maxAttemptsPerTask(), base.maxAttemptsPerTask()),
                pick(override.skipBlockedTasks(), base.skipBlockedTasks()),
                pick(override.rateLimitPerHour(), base.rateLimitPerHour()));
        validate(name, effective);
        log.debug("Resolved loop mode '{}': {}", name, effective);
        return effective;
    }

    private static ModeOverride lookup(String name, Map<String, ModeOverride> overrides) {
        for (var entry : overrides.entrySet()) {
            if (normalize(entry.getKey()).equals(name)) {
                return entry.getValue() != null ? entry.getValue() : ModeOverride.EMPTY;
            }
        }
        return null;
    }

    private static <T> T pick(T override, T base) {
        return override != null ? override : base;
    }

    private static String normalize(String modeName) {
        return modeName == null ? "" : modeName.trim().toLowerCase(Locale.ROOT);
    }

    static void validate(String mode, EffectiveConfig config) {
        if (config.maxIterations() < 1) {
            throw new ConfigException("Mode '%s': max-iterations must be >= 1 (was %d)"
                    .formatted(mode, config.maxIterations()));
        }
        if (config.noProgressLimit() < 1) {
            throw new ConfigException("Mode '%s': no-progress-limit must be >= 1 (was %d)"
                    .formatted(mode, config.noProgressLimit()));
        }
        if (config.runnerTimeoutSeconds() < 1) {
            throw new ConfigException("Mode '%s': runner-timeout-seconds must be >= 1 (was %d)"
                    .formatted(mode, config.runnerTimeoutSeconds()));
        }
        if (config.sleepSecondsBetweenIterations() < 0) {
            throw new ConfigException("Mode '%s': sleep-seconds-between-iterations must be >= 0 (was %d)"
                    .formatted(mode, config.sleepSecondsBetweenIterations()));
        }
        if (config.maxAttemptsPerTask() < 0) {
            throw new ConfigException("Mode '%s': max-attempts-per-task must be >= 0 (was %d)"
                    .formatted(mode, config.maxAttemptsPerTask()));
        }
        if (config.rateLimitPerHour() < 0) {
            throw new ConfigException("Mode '%s': rate-limit-per-hour must be >= 0 (was %d)"
                    .formatted(mode, config.rateLimitPerHour()));
        }
        validateGates(mode, config.gates());
    }

    private static void validateGates(String mode, List<GateCommand> gates) {
        for (var gate : gates) {
            if (gate.command() == null || gate.command().isBlank()) {
                throw new ConfigException("Mode '%s': gate commands must not be blank".formatted(mode));
            }
            if (gate.timeoutSeconds() < 1) {
                throw new ConfigException("Mode '%s': gate '%s' timeout must be >= 1 second"
                        .formatted(mode, gate.name()));
            }
        }
    }
}
