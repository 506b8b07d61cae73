package socialjobs.worker.model;

import java.util.Locale;

/**
 * Job lifecycle status.
 * Persisted lowercase to stay compatible with rows written by other producers.
 */
public enum JobStatus {
    /** Waiting to be claimed */
    QUEUED,
    /** Claimed by a worker and being executed */
    RUNNING,
    /** Handler succeeded and the output is committed */
    DONE,
    /** Attempt budget exhausted */
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromDb(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
