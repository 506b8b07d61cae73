package socialjobs.worker.dispatch;

/**
 * No handler is registered for the job's type.
 */
public class UnknownJobTypeException extends JobExecutionException {

    private final String jobType;

    public UnknownJobTypeException(String jobType) {
        super("Unknown job_type: " + jobType);
        this.jobType = jobType;
    }

    public String jobType() {
        return jobType;
    }
}
