package socialjobs.worker.dispatch;

/**
 * Decoded job payload, one variant per supported job type.
 */
public sealed interface JobPayload permits GenerateAssetsPayload, UnrecognizedPayload {

    /**
     * Job type this payload was decoded for.
     */
    String jobType();
}
