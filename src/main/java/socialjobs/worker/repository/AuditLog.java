package socialjobs.worker.repository;

import java.util.Map;

/**
 * Append-only audit trail of job outcomes (social.done, social.retry, social.failed).
 * Writes are best effort: an audit failure never changes the outcome of a job.
 */
public interface AuditLog {

    String DONE = "social.done";
    String RETRY = "social.retry";
    String FAILED = "social.failed";

    void record(String orgId, String action, Map<String, Object> payload);

    static AuditLog noop() {
        return (orgId, action, payload) -> {
        };
    }
}
