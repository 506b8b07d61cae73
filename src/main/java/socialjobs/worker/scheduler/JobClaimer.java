package socialjobs.worker.scheduler;

import socialjobs.worker.model.JobRecord;
import socialjobs.worker.model.JobStatus;
import socialjobs.worker.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Claims the oldest queued job for one worker.
 *
 * The claim is a conditional update that only matches a row still in {@code queued}, so among
 * concurrent workers at most one sees its update applied. A lost race returns empty and the
 * worker simply polls again later.
 */
public class JobClaimer {

    private static final Logger log = LoggerFactory.getLogger(JobClaimer.class);

    private final JobRepository jobs;

    public JobClaimer(JobRepository jobs) {
        this.jobs = jobs;
    }

    /**
     * @return the job now running under {@code workerId}, or empty if the queue is empty or the race was lost
     */
    public Optional<JobRecord> claimNext(String workerId) {
        Optional<JobRecord> candidate = jobs.findOldestQueued();
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        String jobId = candidate.get().id();
        if (!jobs.tryClaim(jobId, workerId)) {
            log.debug("Lost claim race for job {}", jobId);
            return Optional.empty();
        }

        Optional<JobRecord> claimed = jobs.findById(jobId)
                .filter(job -> job.status() == JobStatus.RUNNING && job.isLockedBy(workerId));
        if (claimed.isEmpty()) {
            log.warn("Job {} not held by {} right after claim", jobId, workerId);
        }
        return claimed;
    }
}
