package socialjobs.worker.dispatch;

/**
 * Payload of a job type this worker does not know. Kept raw for diagnostics.
 */
public record UnrecognizedPayload(String jobType, String rawJson) implements JobPayload {
}
