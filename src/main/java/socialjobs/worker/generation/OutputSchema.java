package socialjobs.worker.generation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Expected shape of a structured generation result.
 *
 * @param <T> typed result
 */
public interface OutputSchema<T> {

    /**
     * JSON skeleton shown to the model so it answers in this shape.
     */
    String describe();

    /**
     * Validate and normalize the parsed reply.
     *
     * @throws MalformedOutputException if a required field is missing or empty
     */
    T conform(JsonNode node) throws MalformedOutputException;
}
