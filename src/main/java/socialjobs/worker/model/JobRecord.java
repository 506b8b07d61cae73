package socialjobs.worker.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one row in the social_jobs table.
 */
public final class JobRecord {
    private final String id;
    private final String orgId;
    private final String leadId;
    private final String activityId;
    private final String jobType;
    private final JobStatus status;
    private final int attempts;
    private final int maxAttempts;
    private final String payload; // raw JSON, shape depends on jobType
    private final Instant lockedAt;
    private final String lockedBy;
    private final String lastError;
    private final Instant lastErrorAt;
    private final String lastTraceId;
    private final Instant createdAt;
    private final Instant updatedAt;

    private JobRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.orgId = builder.orgId;
        this.leadId = builder.leadId;
        this.activityId = builder.activityId;
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.payload = builder.payload;
        this.lockedAt = builder.lockedAt;
        this.lockedBy = builder.lockedBy;
        this.lastError = builder.lastError;
        this.lastErrorAt = builder.lastErrorAt;
        this.lastTraceId = builder.lastTraceId;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String orgId() {
        return orgId;
    }

    public String leadId() {
        return leadId;
    }

    public String activityId() {
        return activityId;
    }

    public String jobType() {
        return jobType;
    }

    public JobStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String payload() {
        return payload;
    }

    public Instant lockedAt() {
        return lockedAt;
    }

    public String lockedBy() {
        return lockedBy;
    }

    public String lastError() {
        return lastError;
    }

    public Instant lastErrorAt() {
        return lastErrorAt;
    }

    public String lastTraceId() {
        return lastTraceId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** True if one more failure would still leave the job retryable */
    public boolean hasAttemptsLeftAfterFailure() {
        return attempts + 1 < maxAttempts;
    }

    public boolean isTerminal() {
        return status == JobStatus.DONE || status == JobStatus.FAILED;
    }

    public boolean isLockedBy(String workerId) {
        return status == JobStatus.RUNNING && workerId != null && workerId.equals(lockedBy);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .orgId(orgId)
                .leadId(leadId)
                .activityId(activityId)
                .jobType(jobType)
                .status(status)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .payload(payload)
                .lockedAt(lockedAt)
                .lockedBy(lockedBy)
                .lastError(lastError)
                .lastErrorAt(lastErrorAt)
                .lastTraceId(lastTraceId)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String orgId;
        private String leadId;
        private String activityId;
        private String jobType;
        private JobStatus status = JobStatus.QUEUED;
        private int attempts = 0;
        private int maxAttempts = 3;
        private String payload = "{}";
        private Instant lockedAt;
        private String lockedBy;
        private String lastError;
        private Instant lastErrorAt;
        private String lastTraceId;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder leadId(String leadId) {
            this.leadId = leadId;
            return this;
        }

        public Builder activityId(String activityId) {
            this.activityId = activityId;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder lockedAt(Instant lockedAt) {
            this.lockedAt = lockedAt;
            return this;
        }

        public Builder lockedBy(String lockedBy) {
            this.lockedBy = lockedBy;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder lastErrorAt(Instant lastErrorAt) {
            this.lastErrorAt = lastErrorAt;
            return this;
        }

        public Builder lastTraceId(String lastTraceId) {
            this.lastTraceId = lastTraceId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public JobRecord build() {
            return new JobRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRecord job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRecord{id='" + id + "', type='" + jobType + "', status=" + status
                + ", attempts=" + attempts + "/" + maxAttempts + ", lockedBy='" + lockedBy + "'}";
    }
}
