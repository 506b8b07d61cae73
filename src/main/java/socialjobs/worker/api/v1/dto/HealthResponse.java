package socialjobs.worker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("loop") String loop,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("queuedJobs") Integer queuedJobs,
        @JsonProperty("runningJobs") Integer runningJobs,
        @JsonProperty("completed") Long completed,
        @JsonProperty("retried") Long retried,
        @JsonProperty("failed") Long failed) {

    public static HealthResponse healthy(String workerId, String loop, String uptime, int queuedJobs,
            int runningJobs, long completed, long retried, long failed) {
        return new HealthResponse("healthy", "ok", workerId, loop, uptime, queuedJobs, runningJobs,
                completed, retried, failed);
    }

    public static HealthResponse unhealthy(String workerId, String database) {
        return new HealthResponse("unhealthy", database, workerId, null, null, null, null, null, null, null);
    }
}
