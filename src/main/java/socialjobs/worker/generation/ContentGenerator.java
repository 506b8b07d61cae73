package socialjobs.worker.generation;

/**
 * Remote structured content generation.
 */
public interface ContentGenerator {

    /**
     * Generate content and conform it to the schema.
     *
     * @throws GenerationCallException  if the remote call fails
     * @throws MalformedOutputException if the reply does not match the schema
     */
    <T> T generate(GenerationRequest request, OutputSchema<T> schema) throws GenerationException;

    /**
     * Model identifier recorded in output metadata.
     */
    String model();

    /**
     * True if results are placeholders rather than real model output.
     */
    default boolean dryRun() {
        return false;
    }
}
