package socialjobs.worker.generation;

import java.util.Objects;

/**
 * Input of one generation call.
 *
 * @param systemInstructions system prompt
 * @param userContext        user prompt with the job's context and the expected JSON shape
 * @param verticalKey        vertical the content is for; used by the dry-run generator
 * @param traceId            correlation id of the current attempt, sent as X-Request-Id
 */
public record GenerationRequest(String systemInstructions, String userContext, String verticalKey, String traceId) {

    public GenerationRequest {
        Objects.requireNonNull(systemInstructions, "systemInstructions is required");
        Objects.requireNonNull(userContext, "userContext is required");
    }
}
