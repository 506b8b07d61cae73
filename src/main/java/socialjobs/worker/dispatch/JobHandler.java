package socialjobs.worker.dispatch;

import socialjobs.worker.model.JobRecord;

/**
 * Executes one job type.
 *
 * @param <P> payload variant this handler accepts
 */
public interface JobHandler<P extends JobPayload> {

    String jobType();

    Class<P> payloadType();

    /**
     * Run the job. Must either persist its whole side effect or throw.
     *
     * @throws JobExecutionException on any failure that should count as an attempt
     */
    JobResult handle(JobRecord job, P payload, String traceId) throws JobExecutionException;
}
