package socialjobs.worker.repository;

import socialjobs.worker.model.JobRecord;
import socialjobs.worker.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the shared job table.
 *
 * Every state change after the claim is scoped to the worker that holds the lock,
 * so a worker whose job was reaped can never overwrite the next owner's state.
 */
public interface JobRepository {

    /**
     * Insert a new job. Producers normally do this; the worker itself never creates jobs.
     *
     * @param job the job to save
     */
    void save(JobRecord job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<JobRecord> findById(String jobId);

    /**
     * Oldest queued job by creation time, without locking it.
     *
     * @return the claim candidate, empty if the queue is empty
     */
    Optional<JobRecord> findOldestQueued();

    /**
     * Conditionally move a job from queued to running under the given worker.
     * Affects the row only if it is still queued at update time.
     *
     * @param jobId    the candidate job
     * @param workerId the claiming worker
     * @return true if this call performed the transition
     */
    boolean tryClaim(String jobId, String workerId);

    /**
     * Find running jobs whose lock is older than the cutoff.
     *
     * @param lockedBefore jobs locked before this instant are considered stuck
     * @return list of stuck jobs, oldest lock first
     */
    List<JobRecord> findStuckRunning(Instant lockedBefore);

    /**
     * Put a stuck job back in the queue and clear its lock. Attempts are not changed.
     * Only applies if the row is still running under {@code lockedBy} with a lock older than the cutoff.
     *
     * @param jobId        the job ID
     * @param lockedBy     the lock holder observed when the job was found stuck
     * @param lockedBefore the cutoff used to find it
     * @return true if the job was requeued
     */
    boolean requeueStuck(String jobId, String lockedBy, Instant lockedBefore);

    /**
     * Mark a running job done, count the attempt and clear its lock.
     *
     * @param jobId    the job ID
     * @param workerId the worker that must still hold the lock
     * @param traceId  trace id of the successful attempt
     * @return false if the worker no longer owns the job
     */
    boolean markDone(String jobId, String workerId, String traceId);

    /**
     * Record a handler failure, increment attempts and put the job back in the queue.
     *
     * @param jobId    the job ID
     * @param workerId the worker that must still hold the lock
     * @param error    truncated error text
     * @param traceId  trace id of the failed attempt
     * @return false if the worker no longer owns the job
     */
    boolean requeue(String jobId, String workerId, String error, String traceId);

    /**
     * Record a handler failure, increment attempts and mark the job permanently failed.
     *
     * @param jobId    the job ID
     * @param workerId the worker that must still hold the lock
     * @param error    truncated error text
     * @param traceId  trace id of the failed attempt
     * @return false if the worker no longer owns the job
     */
    boolean markFailed(String jobId, String workerId, String error, String traceId);

    /**
     * Count jobs by status.
     */
    int countByStatus(JobStatus status);
}
