package socialjobs.worker.dispatch;

import socialjobs.worker.model.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes a claimed job to the handler registered for its type.
 */
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobPayloadDecoder decoder;
    private final Map<String, JobHandler<?>> handlers = new LinkedHashMap<>();

    public JobDispatcher(JobPayloadDecoder decoder, Collection<? extends JobHandler<?>> handlers) {
        this.decoder = decoder;
        for (JobHandler<?> handler : handlers) {
            if (this.handlers.putIfAbsent(handler.jobType(), handler) != null) {
                throw new IllegalArgumentException("Duplicate handler for job type: " + handler.jobType());
            }
        }
    }

    public Set<String> supportedJobTypes() {
        return handlers.keySet();
    }

    /**
     * Decode the payload and run the matching handler.
     *
     * @throws UnknownJobTypeException if no handler accepts the job type
     * @throws JobExecutionException   if decoding or the handler fails
     */
    public JobResult dispatch(JobRecord job, String traceId) throws JobExecutionException {
        JobHandler<?> handler = handlers.get(job.jobType());
        if (handler == null) {
            throw new UnknownJobTypeException(job.jobType());
        }

        JobPayload payload = decoder.decode(job.jobType(), job.payload());
        if (payload instanceof UnrecognizedPayload) {
            throw new UnknownJobTypeException(job.jobType());
        }

        log.debug("Dispatching job {} ({}) to {}", job.id(), job.jobType(), handler.getClass().getSimpleName());
        return invoke(handler, job, payload, traceId);
    }

    private static <P extends JobPayload> JobResult invoke(JobHandler<P> handler, JobRecord job,
            JobPayload payload, String traceId) throws JobExecutionException {
        if (!handler.payloadType().isInstance(payload)) {
            throw new JobExecutionException("Handler " + handler.jobType() + " cannot accept "
                    + payload.getClass().getSimpleName());
        }
        return handler.handle(job, handler.payloadType().cast(payload), traceId);
    }
}
