package socialjobs.worker.generation;

/**
 * The remote call succeeded but the content is not JSON or does not conform to the schema.
 */
public class MalformedOutputException extends GenerationException {

    public MalformedOutputException(String message) {
        super(message);
    }

    public MalformedOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
