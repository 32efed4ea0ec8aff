package com.taskloop.core.config;

import com.taskloop.core.model.GateCommand;
import com.taskloop.core.model.LoopConfig;
import com.taskloop.core.model.ModeOverride;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "taskloop", ignoreUnknownFields = false)
public class TaskloopProperties {

    /** Modes that always exist, with empty overrides unless configured. */
    public static final List<String> BUILT_IN_MODES = List.of("speed", "quality", "exploration");

    private String projectRoot = ".";
    private String stateDir = ".taskloop";
    private Loop loop = new Loop();
    private Runner runner = new Runner();
    private Tracker tracker = new Tracker();

    public Path resolveProjectRoot() {
        return Path.of(projectRoot).toAbsolutePath().normalize();
    }

    /**
     * State directory, resolved against the project root when relative.
     */
    public Path resolveStateDir() {
        return resolveProjectRoot().resolve(stateDir).normalize();
    }

    public LoopConfig toLoopConfig() {
        return new LoopConfig(loop.maxIterations, loop.noProgressLimit,
                toGates(loop.gates, loop.gateTimeoutSeconds), loop.runnerTimeoutSeconds,
                loop.mode, loop.sleepSecondsBetweenIterations, loop.maxAttemptsPerTask, loop.skipBlockedTasks,
                loop.rateLimitPerHour);
    }

    /**
     * Override blocks keyed by mode name: the built-in modes first, then any configured block.
     */
    public Map<String, ModeOverride> modeOverrides() {
        var result = new LinkedHashMap<String, ModeOverride>();
        BUILT_IN_MODES.forEach(name -> result.put(name, ModeOverride.EMPTY));
        loop.modes.forEach((name, mode) -> result.put(name, mode.toOverride(loop.gateTimeoutSeconds)));
        return result;
    }

    private static List<GateCommand> toGates(List<String> commands, int timeoutSeconds) {
        if (commands == null) {
            return null;
        }
        return commands.stream()
                .map(cmd -> GateCommand.of(cmd == null ? "" : cmd.trim(), timeoutSeconds))
                .toList();
    }

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public Loop getLoop() { return loop; }
    public void setLoop(Loop loop) { this.loop = loop; }
    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }
    public Tracker getTracker() { return tracker; }
    public void setTracker(Tracker tracker) { this.tracker = tracker; }

    public static class Loop {
        private int maxIterations = 10;
        private int noProgressLimit = 3;
        private int runnerTimeoutSeconds = 900;
        private int sleepSecondsBetweenIterations = 0;
        private int gateTimeoutSeconds = 600;
        private int maxAttemptsPerTask = 3;
        private boolean skipBlockedTasks = true;
        private int rateLimitPerHour = 0;
        private String mode = ModeResolver.DEFAULT_MODE;
        private List<String> gates = new ArrayList<>();
        private Map<String, Mode> modes = new LinkedHashMap<>();

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getNoProgressLimit() { return noProgressLimit; }
        public void setNoProgressLimit(int noProgressLimit) { this.noProgressLimit = noProgressLimit; }
        public int getRunnerTimeoutSeconds() { return runnerTimeoutSeconds; }
        public void setRunnerTimeoutSeconds(int runnerTimeoutSeconds) { this.runnerTimeoutSeconds = runnerTimeoutSeconds; }
        public int getSleepSecondsBetweenIterations() { return sleepSecondsBetweenIterations; }
        public void setSleepSecondsBetweenIterations(int sleepSecondsBetweenIterations) { this.sleepSecondsBetweenIterations = sleepSecondsBetweenIterations; }
        public int getGateTimeoutSeconds() { return gateTimeoutSeconds; }
        public void setGateTimeoutSeconds(int gateTimeoutSeconds) { this.gateTimeoutSeconds = gateTimeoutSeconds; }
        public int getMaxAttemptsPerTask() { return maxAttemptsPerTask; }
        public void setMaxAttemptsPerTask(int maxAttemptsPerTask) { this.maxAttemptsPerTask = maxAttemptsPerTask; }
        public boolean isSkipBlockedTasks() { return skipBlockedTasks; }
        public void setSkipBlockedTasks(boolean skipBlockedTasks) { this.skipBlockedTasks = skipBlockedTasks; }
        public int getRateLimitPerHour() { return rateLimitPerHour; }
        public void setRateLimitPerHour(int rateLimitPerHour) { this.rateLimitPerHour = rateLimitPerHour; }
        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }
        public List<String> getGates() { return gates; }
        public void setGates(List<String> gates) { this.gates = gates; }
        public Map<String, Mode> getModes() { return modes; }
        public void setModes(Map<String, Mode> modes) { this.modes = modes; }
    }

    /**
     * Sparse override block. Unset fields stay {@code null} and inherit the base value.
     */
    public static class Mode {
        private Integer maxIterations;
        private Integer noProgressLimit;
        private Integer runnerTimeoutSeconds;
        private Integer sleepSecondsBetweenIterations;
        private Integer maxAttemptsPerTask;
        private Boolean skipBlockedTasks;
        private Integer rateLimitPerHour;
        private List<String> gates;

        ModeOverride toOverride(int gateTimeoutSeconds) {
            return new ModeOverride(maxIterations, noProgressLimit, toGates(gates, gateTimeoutSeconds),
                    runnerTimeoutSeconds, sleepSecondsBetweenIterations, maxAttemptsPerTask, skipBlockedTasks,
                    rateLimitPerHour);
        }

        public Integer getMaxIterations() { return maxIterations; }
        public void setMaxIterations(Integer maxIterations) { this.maxIterations = maxIterations; }
        public Integer getNoProgressLimit() { return noProgressLimit; }
        public void setNoProgressLimit(Integer noProgressLimit) { this.noProgressLimit = noProgressLimit; }
        public Integer getRunnerTimeoutSeconds() { return runnerTimeoutSeconds; }
        public void setRunnerTimeoutSeconds(Integer runnerTimeoutSeconds) { this.runnerTimeoutSeconds = runnerTimeoutSeconds; }
        public Integer getSleepSecondsBetweenIterations() { return sleepSecondsBetweenIterations; }
        public void setSleepSecondsBetweenIterations(Integer sleepSecondsBetweenIterations) { this.sleepSecondsBetweenIterations = sleepSecondsBetweenIterations; }
        public Integer getMaxAttemptsPerTask() { return maxAttemptsPerTask; }
        public void setMaxAttemptsPerTask(Integer maxAttemptsPerTask) { this.maxAttemptsPerTask = maxAttemptsPerTask; }
        public Boolean getSkipBlockedTasks() { return skipBlockedTasks; }
        public void setSkipBlockedTasks(Boolean skipBlockedTasks) { this.skipBlockedTasks = skipBlockedTasks; }
        public Integer getRateLimitPerHour() { return rateLimitPerHour; }
        public void setRateLimitPerHour(Integer rateLimitPerHour) { this.rateLimitPerHour = rateLimitPerHour; }
        public List<String> getGates() { return gates; }
        public void setGates(List<String> gates) { this.gates = gates; }
    }

    public static class Runner {
        private List<String> argv = new ArrayList<>(List.of("claude", "-p", "--output-format", "text"));
        private String promptMode = "stdin";

        public List<String> getArgv() { return argv; }
        public void setArgv(List<String> argv) { this.argv = argv; }
        public String getPromptMode() { return promptMode; }
        public void setPromptMode(String promptMode) { this.promptMode = promptMode; }
    }

    public static class Tracker {
        private String kind = "local";
        private String labelFilter = "";
        private List<String> excludeLabels = new ArrayList<>(List.of("blocked"));
        private String blockLabel = "blocked";
        private boolean excludeDrafts = true;
        private Local local = new Local();
        private GitHub github = new GitHub();

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }
        public String getLabelFilter() { return labelFilter; }
        public void setLabelFilter(String labelFilter) { this.labelFilter = labelFilter; }
        public List<String> getExcludeLabels() { return excludeLabels; }
        public void setExcludeLabels(List<String> excludeLabels) { this.excludeLabels = excludeLabels; }
        public String getBlockLabel() { return blockLabel; }
        public void setBlockLabel(String blockLabel) { this.blockLabel = blockLabel; }
        public boolean isExcludeDrafts() { return excludeDrafts; }
        public void setExcludeDrafts(boolean excludeDrafts) { this.excludeDrafts = excludeDrafts; }
        public Local getLocal() { return local; }
        public void setLocal(Local local) { this.local = local; }
        public GitHub getGithub() { return github; }
        public void setGithub(GitHub github) { this.github = github; }
    }

    public static class Local {
        private String file = "tasks.json";
        private List<String> addLabelsOnDone = new ArrayList<>();

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
        public List<String> getAddLabelsOnDone() { return addLabelsOnDone; }
        public void setAddLabelsOnDone(List<String> addLabelsOnDone) { this.addLabelsOnDone = addLabelsOnDone; }
    }

    public static class GitHub {
        private String repo = "";
        private String apiUrl = "https://api.github.com";
        private String authMethod = "auto";
        private List<String> credentialHelper = new ArrayList<>(List.of("gh", "auth", "token"));
        private String tokenEnv = "GITHUB_TOKEN";
        private String token = "";
        private boolean closeOnDone = true;
        private boolean commentOnDone = true;
        private List<String> addLabelsOnStart = new ArrayList<>();
        private List<String> addLabelsOnDone = new ArrayList<>(List.of("completed"));
        private boolean removeStartLabelsOnDone = true;
        private int cacheTtlSeconds = 300;
        private int lowWaterMark = 50;
        private int maxAttempts = 4;
        private long baseDelayMillis = 500;
        private long maxDelayMillis = 30_000;
        private double jitter = 0.2;
        private int patienceSeconds = 60;
        private int requestTimeoutSeconds = 30;

        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getAuthMethod() { return authMethod; }
        public void setAuthMethod(String authMethod) { this.authMethod = authMethod; }
        public List<String> getCredentialHelper() { return credentialHelper; }
        public void setCredentialHelper(List<String> credentialHelper) { this.credentialHelper = credentialHelper; }
        public String getTokenEnv() { return tokenEnv; }
        public void setTokenEnv(String tokenEnv) { this.tokenEnv = tokenEnv; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public boolean isCloseOnDone() { return closeOnDone; }
        public void setCloseOnDone(boolean closeOnDone) { this.closeOnDone = closeOnDone; }
        public boolean isCommentOnDone() { return commentOnDone; }
        public void setCommentOnDone(boolean commentOnDone) { this.commentOnDone = commentOnDone; }
        public List<String> getAddLabelsOnStart() { return addLabelsOnStart; }
        public void setAddLabelsOnStart(List<String> addLabelsOnStart) { this.addLabelsOnStart = addLabelsOnStart; }
        public List<String> getAddLabelsOnDone() { return addLabelsOnDone; }
        public void setAddLabelsOnDone(List<String> addLabelsOnDone) { this.addLabelsOnDone = addLabelsOnDone; }
        public boolean isRemoveStartLabelsOnDone() { return removeStartLabelsOnDone; }
        public void setRemoveStartLabelsOnDone(boolean removeStartLabelsOnDone) { this.removeStartLabelsOnDone = removeStartLabelsOnDone; }
        public int getCacheTtlSeconds() { return cacheTtlSeconds; }
        public void setCacheTtlSeconds(int cacheTtlSeconds) { this.cacheTtlSeconds = cacheTtlSeconds; }
        public int getLowWaterMark() { return lowWaterMark; }
        public void setLowWaterMark(int lowWaterMark) { this.lowWaterMark = lowWaterMark; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBaseDelayMillis() { return baseDelayMillis; }
        public void setBaseDelayMillis(long baseDelayMillis) { this.baseDelayMillis = baseDelayMillis; }
        public long getMaxDelayMillis() { return maxDelayMillis; }
        public void setMaxDelayMillis(long maxDelayMillis) { this.maxDelayMillis = maxDelayMillis; }
        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }
        public int getPatienceSeconds() { return patienceSeconds; }
        public void setPatienceSeconds(int patienceSeconds) { this.patienceSeconds = patienceSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }
}
