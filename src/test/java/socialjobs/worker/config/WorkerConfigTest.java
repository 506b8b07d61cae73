package socialjobs.worker.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerConfigTest {

    @Test
    void defaultsMatchWorkerTimings() {
        WorkerConfig config = WorkerConfig.defaults();

        assertEquals(Duration.ofMillis(1500), config.idleDelay());
        assertEquals(Duration.ofMillis(900), config.errorDelay());
        assertEquals(Duration.ofMillis(2500), config.backoffBase());
        assertEquals(Duration.ofSeconds(30), config.backoffCap());
        assertEquals(Duration.ofMinutes(10), config.stuckAfter());
        assertEquals(Duration.ofSeconds(30), config.reapInterval());
        assertEquals(3, config.defaultMaxAttempts());
        assertEquals("gpt-4.1-mini", config.openAiModel());
        assertFalse(config.dryRun());
        assertFalse(config.hasSystemUser());
        assertFalse(config.hasOpenAiApiKey());
        assertEquals(0, config.statusPort());
        assertTrue(config.workerId().startsWith("social-"));
    }

    @Test
    void readsEnvironment() {
        WorkerConfig config = WorkerConfig.fromEnv(Map.of(
                "SOCIAL_WORKER_ID", "worker-a",
                "SOCIAL_SLEEP_IDLE_MS", "200",
                "SOCIAL_BACKOFF_BASE_MS", "100",
                "SOCIAL_BACKOFF_CAP_MS", "400",
                "SOCIAL_MAX_ATTEMPTS", "5",
                "OPENAI_API_KEY", "sk-test",
                "OPENAI_MODEL", "gpt-test",
                "AI_DRY_RUN", "1",
                "SYSTEM_USER_ID", "system-user",
                "SOCIAL_STATUS_PORT", "8091"));

        assertEquals("worker-a", config.workerId());
        assertEquals(Duration.ofMillis(200), config.idleDelay());
        assertEquals(Duration.ofMillis(100), config.backoffBase());
        assertEquals(Duration.ofMillis(400), config.backoffCap());
        assertEquals(5, config.defaultMaxAttempts());
        assertTrue(config.hasOpenAiApiKey());
        assertEquals("gpt-test", config.openAiModel());
        assertTrue(config.dryRun());
        assertEquals("system-user", config.systemUserId());
        assertEquals(8091, config.statusPort());
    }

    @Test
    void blankValuesKeepDefaults() {
        WorkerConfig config = WorkerConfig.fromEnv(Map.of("SOCIAL_SLEEP_IDLE_MS", " ", "AI_DRY_RUN", "0"));

        assertEquals(Duration.ofMillis(1500), config.idleDelay());
        assertFalse(config.dryRun());
    }

    @Test
    void rejectsNonNumericDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> WorkerConfig.fromEnv(Map.of("SOCIAL_STUCK_AFTER_MS", "ten minutes")));
    }

    @Test
    void toStringHidesApiKey() {
        String text = WorkerConfig.defaults().withOpenAi("sk-secret", "http://localhost").toString();

        assertFalse(text.contains("sk-secret"));
        assertTrue(text.contains("apiKeySet=true"));
    }
}
