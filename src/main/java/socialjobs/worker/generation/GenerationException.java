package socialjobs.worker.generation;

/**
 * Failure of the content generation collaborator.
 * Subclasses tell a failed remote call apart from a reply that does not fit the expected shape.
 */
public abstract class GenerationException extends Exception {

    protected GenerationException(String message) {
        super(message);
    }

    protected GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
