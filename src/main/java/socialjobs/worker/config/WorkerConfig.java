package socialjobs.worker.config;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration holder for a social jobs worker.
 * All settings have sensible defaults and can be overridden from the environment.
 */
public final class WorkerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/social-jobs;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 4;

    // Worker identity
    private String workerId = "social-" + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x100000, 0xFFFFFF));

    // Loop timings
    private Duration idleDelay = Duration.ofMillis(1500);
    private Duration errorDelay = Duration.ofMillis(900);
    private Duration backoffBase = Duration.ofMillis(2500);
    private Duration backoffCap = Duration.ofSeconds(30);

    // Recovery
    private Duration stuckAfter = Duration.ofMinutes(10);
    private Duration reapInterval = Duration.ofSeconds(30);

    // Jobs
    private int defaultMaxAttempts = 3;

    // Generation
    private String openAiApiKey = null;
    private String openAiModel = "gpt-4.1-mini";
    private String openAiBaseUrl = "https://api.openai.com";
    private Duration openAiTimeout = Duration.ofSeconds(60);
    private boolean dryRun = false;

    // Audit (rows are only written when a system user is configured)
    private String systemUserId = null;

    // Status endpoint, 0 = disabled
    private int statusPort = 0;

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    public static WorkerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static WorkerConfig fromEnv(Map<String, String> env) {
        WorkerConfig config = new WorkerConfig();

        String dbUrl = env.get("SOCIAL_DB_URL");
        if (isSet(dbUrl)) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = env.get("SOCIAL_DB_POOL_SIZE");
        if (isSet(poolSize)) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String workerId = env.get("SOCIAL_WORKER_ID");
        if (isSet(workerId)) {
            config.workerId = workerId.trim();
        }

        config.idleDelay = millis(env, "SOCIAL_SLEEP_IDLE_MS", config.idleDelay);
        config.errorDelay = millis(env, "SOCIAL_SLEEP_ERROR_MS", config.errorDelay);
        config.backoffBase = millis(env, "SOCIAL_BACKOFF_BASE_MS", config.backoffBase);
        config.backoffCap = millis(env, "SOCIAL_BACKOFF_CAP_MS", config.backoffCap);
        config.stuckAfter = millis(env, "SOCIAL_STUCK_AFTER_MS", config.stuckAfter);
        config.reapInterval = millis(env, "SOCIAL_REAP_INTERVAL_MS", config.reapInterval);

        String maxAttempts = env.get("SOCIAL_MAX_ATTEMPTS");
        if (isSet(maxAttempts)) {
            config.defaultMaxAttempts = Integer.parseInt(maxAttempts.trim());
        }

        String apiKey = env.get("OPENAI_API_KEY");
        if (isSet(apiKey)) {
            config.openAiApiKey = apiKey.trim();
        }

        String model = env.get("OPENAI_MODEL");
        if (isSet(model)) {
            config.openAiModel = model.trim();
        }

        String baseUrl = env.get("OPENAI_BASE_URL");
        if (isSet(baseUrl)) {
            config.openAiBaseUrl = baseUrl.trim();
        }

        String dryRun = env.get("AI_DRY_RUN");
        if (isSet(dryRun)) {
            String v = dryRun.trim();
            config.dryRun = "1".equals(v) || "true".equalsIgnoreCase(v);
        }

        String systemUser = env.get("SYSTEM_USER_ID");
        if (isSet(systemUser)) {
            config.systemUserId = systemUser.trim();
        }

        String statusPort = env.get("SOCIAL_STATUS_PORT");
        if (isSet(statusPort)) {
            config.statusPort = Integer.parseInt(statusPort.trim());
        }

        return config;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static Duration millis(Map<String, String> env, String name, Duration fallback) {
        String value = env.get(name);
        if (!isSet(value)) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number of milliseconds: " + value, e);
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public String workerId() {
        return workerId;
    }

    public Duration idleDelay() {
        return idleDelay;
    }

    public Duration errorDelay() {
        return errorDelay;
    }

    public Duration backoffBase() {
        return backoffBase;
    }

    public Duration backoffCap() {
        return backoffCap;
    }

    public Duration stuckAfter() {
        return stuckAfter;
    }

    public Duration reapInterval() {
        return reapInterval;
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public String openAiApiKey() {
        return openAiApiKey;
    }

    public boolean hasOpenAiApiKey() {
        return openAiApiKey != null && !openAiApiKey.isBlank();
    }

    public String openAiModel() {
        return openAiModel;
    }

    public String openAiBaseUrl() {
        return openAiBaseUrl;
    }

    public Duration openAiTimeout() {
        return openAiTimeout;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public String systemUserId() {
        return systemUserId;
    }

    public boolean hasSystemUser() {
        return systemUserId != null && !systemUserId.isBlank();
    }

    public int statusPort() {
        return statusPort;
    }

    // Fluent setters for testing/customization
    public WorkerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public WorkerConfig withWorkerId(String workerId) {
        this.workerId = workerId;
        return this;
    }

    public WorkerConfig withIdleDelay(Duration idleDelay) {
        this.idleDelay = idleDelay;
        return this;
    }

    public WorkerConfig withErrorDelay(Duration errorDelay) {
        this.errorDelay = errorDelay;
        return this;
    }

    public WorkerConfig withBackoff(Duration base, Duration cap) {
        this.backoffBase = base;
        this.backoffCap = cap;
        return this;
    }

    public WorkerConfig withStuckAfter(Duration stuckAfter) {
        this.stuckAfter = stuckAfter;
        return this;
    }

    public WorkerConfig withReapInterval(Duration reapInterval) {
        this.reapInterval = reapInterval;
        return this;
    }

    public WorkerConfig withMaxAttempts(int attempts) {
        this.defaultMaxAttempts = attempts;
        return this;
    }

    public WorkerConfig withOpenAi(String apiKey, String baseUrl) {
        this.openAiApiKey = apiKey;
        this.openAiBaseUrl = baseUrl;
        return this;
    }

    public WorkerConfig withDryRun(boolean dryRun) {
        this.dryRun = dryRun;
        return this;
    }

    public WorkerConfig withSystemUserId(String systemUserId) {
        this.systemUserId = systemUserId;
        return this;
    }

    public WorkerConfig withStatusPort(int port) {
        this.statusPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", workerId='" + workerId + '\'' +
                ", idleDelay=" + idleDelay.toMillis() + "ms" +
                ", errorDelay=" + errorDelay.toMillis() + "ms" +
                ", backoff=" + backoffBase.toMillis() + ".." + backoffCap.toMillis() + "ms" +
                ", stuckAfter=" + stuckAfter.toMillis() + "ms" +
                ", maxAttempts=" + defaultMaxAttempts +
                ", model='" + openAiModel + '\'' +
                ", apiKeySet=" + hasOpenAiApiKey() +
                ", dryRun=" + dryRun +
                ", statusPort=" + statusPort +
                '}';
    }
}
