package socialjobs.worker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import socialjobs.worker.model.JobRecord;

import java.time.Instant;

/**
 * Response DTO for job details and its diagnostic trail.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("status") String status,
        @JsonProperty("orgId") String orgId,
        @JsonProperty("activityId") String activityId,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("lockedBy") String lockedBy,
        @JsonProperty("lockedAt") Instant lockedAt,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("lastErrorAt") Instant lastErrorAt,
        @JsonProperty("lastTraceId") String lastTraceId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static JobResponse from(JobRecord job) {
        return new JobResponse(
                job.id(),
                job.jobType(),
                job.status().dbValue(),
                job.orgId(),
                job.activityId(),
                job.attempts(),
                job.maxAttempts(),
                job.lockedBy(),
                job.lockedAt(),
                job.lastError(),
                job.lastErrorAt(),
                job.lastTraceId(),
                job.createdAt(),
                job.updatedAt());
    }
}
