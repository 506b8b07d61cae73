package socialjobs.worker.dispatch;

/**
 * Outcome of a successful job execution.
 *
 * @param outputId id of the output row written or updated
 * @param traceId  trace id of the attempt
 */
public record JobResult(String outputId, String traceId) {
}
