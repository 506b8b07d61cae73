package socialjobs.worker.generation;

/**
 * The remote call itself failed: transport error, non-2xx status or an unreadable envelope.
 */
public class GenerationCallException extends GenerationException {

    /** Status code used when no HTTP response was received */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;

    public GenerationCallException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GenerationCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
