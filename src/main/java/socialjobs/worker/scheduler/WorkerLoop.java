package socialjobs.worker.scheduler;

import socialjobs.worker.dispatch.JobDispatcher;
import socialjobs.worker.dispatch.JobExecutionException;
import socialjobs.worker.dispatch.JobResult;
import socialjobs.worker.model.FinalizeResult;
import socialjobs.worker.model.JobRecord;
import socialjobs.worker.repository.AuditLog;
import socialjobs.worker.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-threaded poll loop of one worker: reap if due, claim, dispatch, finalize.
 *
 * Every state change after the claim is scoped to this worker's lock. Exceptions outside the
 * handler are logged and followed by a short pause; they never end the loop.
 */
public class WorkerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    static final int MAX_ERROR_LENGTH = 2000;

    /**
     * Timings of the loop.
     */
    public record Timings(Duration idleDelay, Duration errorDelay, Duration stuckAfter, Duration reapInterval) {
    }

    public enum State {
        CREATED, RUNNING, STOPPING, STOPPED
    }

    private final String workerId;
    private final JobRepository jobs;
    private final JobClaimer claimer;
    private final StuckJobReaper reaper;
    private final JobDispatcher dispatcher;
    private final BackoffPolicy backoff;
    private final AuditLog audit;
    private final Timings timings;
    private final Sleeper sleeper;
    private final Clock clock;

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean stopRequested = false;
    private volatile State state = State.CREATED;
    private Instant lastReapAt = null;
    private Duration pendingBackoff = Duration.ZERO;

    public WorkerLoop(String workerId, JobRepository jobs, JobDispatcher dispatcher, BackoffPolicy backoff,
            AuditLog audit, Timings timings, Sleeper sleeper, Clock clock) {
        this.workerId = workerId;
        this.jobs = jobs;
        this.claimer = new JobClaimer(jobs);
        this.reaper = new StuckJobReaper(jobs, clock);
        this.dispatcher = dispatcher;
        this.backoff = backoff;
        this.audit = audit;
        this.timings = timings;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public void run() {
        state = State.RUNNING;
        MDC.put("workerId", workerId);
        log.info("Worker {} started", workerId);
        try {
            while (!stopRequested) {
                IterationOutcome outcome = runOnce();
                Duration pause = pauseAfter(outcome);
                if (!pause.isZero() && !stopRequested) {
                    sleeper.sleep(pause);
                }
            }
        } finally {
            state = State.STOPPED;
            log.info("Worker {} stopped (completed={}, retried={}, failed={})",
                    workerId, completed.get(), retried.get(), failed.get());
            MDC.remove("workerId");
        }
    }

    /**
     * Run a single iteration without the trailing pause.
     *
     * Linkage errors and stack overflows raised by a handler count as a failed attempt. Any other
     * {@link Error} outside the handler ends the loop.
     */
    public IterationOutcome runOnce() {
        if (stopRequested) {
            return IterationOutcome.STOPPED;
        }
        try {
            reapIfDue();

            Optional<JobRecord> claimed = claimer.claimNext(workerId);
            if (claimed.isEmpty()) {
                return IterationOutcome.IDLE;
            }
            return IterationOutcome.of(execute(claimed.get()));
        } catch (Exception e) {
            log.error("Worker loop error", e);
            return IterationOutcome.ERROR;
        }
    }

    /**
     * Ask the loop to exit at the next iteration boundary. A job in progress is finished first.
     */
    public void requestStop() {
        if (!stopRequested) {
            log.info("Stop requested for worker {}", workerId);
        }
        stopRequested = true;
        if (state == State.RUNNING) {
            state = State.STOPPING;
        }
        sleeper.wakeUp();
    }

    public String workerId() {
        return workerId;
    }

    public State state() {
        return state;
    }

    public long completedCount() {
        return completed.get();
    }

    public long retriedCount() {
        return retried.get();
    }

    public long failedCount() {
        return failed.get();
    }

    private void reapIfDue() {
        Instant now = clock.instant();
        if (lastReapAt != null && Duration.between(lastReapAt, now).compareTo(timings.reapInterval()) < 0) {
            return;
        }
        lastReapAt = now;
        reaper.reapStuck(timings.stuckAfter());
    }

    private FinalizeResult execute(JobRecord job) {
        String traceId = UUID.randomUUID().toString();
        MDC.put("traceId", traceId);
        MDC.put("jobId", job.id());
        try {
            log.info("Claimed job {} ({}), attempt {} of {}",
                    job.id(), job.jobType(), job.attempts() + 1, job.maxAttempts());

            JobResult result;
            try {
                result = dispatcher.dispatch(job, traceId);
            } catch (JobExecutionException | RuntimeException | LinkageError | StackOverflowError e) {
                return handleFailure(job, traceId, e);
            }

            if (!jobs.markDone(job.id(), workerId, traceId)) {
                return lostOwnership(job);
            }
            completed.incrementAndGet();
            log.info("Job {} done, output {}", job.id(), result.outputId());
            audit(job, AuditLog.DONE, traceId, Map.of("output_id", String.valueOf(result.outputId())));
            return FinalizeResult.COMPLETED;
        } finally {
            MDC.remove("traceId");
            MDC.remove("jobId");
        }
    }

    private FinalizeResult handleFailure(JobRecord job, String traceId, Throwable e) {
        String error = describe(e);
        int attempts = job.attempts() + 1;

        if (job.hasAttemptsLeftAfterFailure()) {
            if (!jobs.requeue(job.id(), workerId, error, traceId)) {
                return lostOwnership(job);
            }
            retried.incrementAndGet();
            pendingBackoff = backoff.delayFor(attempts);
            log.warn("Job {} failed (attempt {} of {}), retrying after {} ms: {}",
                    job.id(), attempts, job.maxAttempts(), pendingBackoff.toMillis(), error);
            audit(job, AuditLog.RETRY, traceId, Map.of("attempts", attempts, "error", error));
            return FinalizeResult.RETRIED;
        }

        if (!jobs.markFailed(job.id(), workerId, error, traceId)) {
            return lostOwnership(job);
        }
        failed.incrementAndGet();
        log.error("Job {} permanently failed after {} attempts: {}", job.id(), attempts, error, e);
        audit(job, AuditLog.FAILED, traceId, Map.of("attempts", attempts, "error", error));
        return FinalizeResult.FAILED;
    }

    private FinalizeResult lostOwnership(JobRecord job) {
        log.warn("Job {} is no longer owned by {}; result discarded", job.id(), workerId);
        return FinalizeResult.LOST_OWNERSHIP;
    }

    private void audit(JobRecord job, String action, String traceId, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", job.id());
        payload.put("job_type", job.jobType());
        payload.put("activity_id", job.activityId());
        payload.put("trace_id", traceId);
        payload.put("worker_id", workerId);
        payload.putAll(details);
        audit.record(job.orgId(), action, payload);
    }

    private Duration pauseAfter(IterationOutcome outcome) {
        switch (outcome) {
            case IDLE:
                return timings.idleDelay();
            case ERROR:
                return timings.errorDelay();
            case RETRIED:
                Duration pause = pendingBackoff;
                pendingBackoff = Duration.ZERO;
                return pause;
            default:
                return Duration.ZERO;
        }
    }

    // A plain JobExecutionException wrapping a cause is reported under the cause's type.
    static String describe(Throwable e) {
        Throwable reported = e.getClass() == JobExecutionException.class && e.getCause() != null ? e.getCause() : e;
        String message = reported.getClass().getSimpleName() + ": " + reported.getMessage();
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
