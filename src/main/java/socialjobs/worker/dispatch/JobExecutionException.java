package socialjobs.worker.dispatch;

/**
 * A job could not be executed. The worker loop counts it against the job's attempts.
 */
public class JobExecutionException extends Exception {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
