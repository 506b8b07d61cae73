package socialjobs.worker.scheduler;

import socialjobs.worker.model.JobRecord;
import socialjobs.worker.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Returns jobs abandoned by crashed workers to the queue.
 *
 * A running job whose lock is older than the threshold is reset to queued with its lock cleared.
 * Attempts are left unchanged: the crashed attempt never reached finalize.
 */
public class StuckJobReaper {

    private static final Logger log = LoggerFactory.getLogger(StuckJobReaper.class);

    private final JobRepository jobs;
    private final Clock clock;

    public StuckJobReaper(JobRepository jobs, Clock clock) {
        this.jobs = jobs;
        this.clock = clock;
    }

    /**
     * Requeue every running job locked for longer than {@code stuckAfter}.
     *
     * @return number of jobs actually requeued
     */
    public int reapStuck(Duration stuckAfter) {
        Instant cutoff = clock.instant().minus(stuckAfter);

        List<JobRecord> stuck = jobs.findStuckRunning(cutoff);
        if (stuck.isEmpty()) {
            log.debug("No stuck jobs found");
            return 0;
        }

        int requeued = 0;
        for (JobRecord job : stuck) {
            try {
                if (jobs.requeueStuck(job.id(), job.lockedBy(), cutoff)) {
                    requeued++;
                    log.info("Requeued stuck job {} (locked by {} at {}, attempts {})",
                            job.id(), job.lockedBy(), job.lockedAt(), job.attempts());
                } else {
                    log.debug("Stuck job {} changed before it could be requeued", job.id());
                }
            } catch (Exception e) {
                log.error("Failed to requeue stuck job {}", job.id(), e);
            }
        }

        log.info("Stuck job reaper: {} requeued of {} found", requeued, stuck.size());
        return requeued;
    }
}
