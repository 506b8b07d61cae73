package socialjobs.worker.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import socialjobs.worker.dispatch.JobDispatcher;
import socialjobs.worker.dispatch.JobPayloadDecoder;
import socialjobs.worker.handler.GenerateAssetsHandler;
import socialjobs.worker.model.JobRecord;
import socialjobs.worker.model.JobStatus;
import socialjobs.worker.model.OutputKey;
import socialjobs.worker.model.OutputRecord;
import socialjobs.worker.repository.AuditLog;
import socialjobs.worker.repository.JobRepository;
import socialjobs.worker.store.Database;
import socialjobs.worker.store.JdbcJobRepository;
import socialjobs.worker.store.JdbcLeadRepository;
import socialjobs.worker.store.JdbcOutputRepository;
import socialjobs.worker.store.JdbcVerticalProfileRepository;
import socialjobs.worker.testing.MutableClock;
import socialjobs.worker.testing.RecordingSleeper;
import socialjobs.worker.testing.ScriptedContentGenerator;
import socialjobs.worker.testing.TestDb;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkerLoopTest {

    private static final String WORKER = "worker-a";
    private static final WorkerLoop.Timings TIMINGS = new WorkerLoop.Timings(
            Duration.ofMillis(1500), Duration.ofMillis(900), Duration.ofMinutes(10), Duration.ofSeconds(30));

    private static Database db;

    private MutableClock clock;
    private JdbcJobRepository jobs;
    private JdbcOutputRepository outputs;
    private ScriptedContentGenerator generator;
    private RecordingSleeper sleeper;
    private List<String> auditActions;

    @BeforeAll
    static void setupDb() {
        db = TestDb.open("loop");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        TestDb.clear(db);
        clock = new MutableClock(Instant.parse("2025-01-10T10:00:00Z"));
        jobs = new JdbcJobRepository(db, clock);
        outputs = new JdbcOutputRepository(db, new ObjectMapper(), clock);
        generator = new ScriptedContentGenerator();
        sleeper = new RecordingSleeper();
        auditActions = new ArrayList<>();
    }

    private WorkerLoop loop(JobRepository jobRepository) {
        ObjectMapper mapper = new ObjectMapper();
        GenerateAssetsHandler handler = new GenerateAssetsHandler(
                new JdbcVerticalProfileRepository(db, mapper), new JdbcLeadRepository(db), outputs, generator);
        JobDispatcher dispatcher = new JobDispatcher(new JobPayloadDecoder(mapper), List.of(handler));
        AuditLog audit = (orgId, action, payload) -> auditActions.add(action);
        return new WorkerLoop(WORKER, jobRepository, dispatcher,
                new BackoffPolicy(Duration.ofMillis(2500), Duration.ofSeconds(30)),
                audit, TIMINGS, sleeper, clock);
    }

    @Test
    void idleWhenQueueIsEmpty() {
        assertEquals(IterationOutcome.IDLE, loop(jobs).runOnce());
    }

    @Test
    void successMarksJobDoneAndWritesOneOutput() throws Exception {
        jobs.save(TestDb.generateAssetsJob("job-1").build());

        assertEquals(IterationOutcome.COMPLETED, loop(jobs).runOnce());

        JobRecord job = jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.DONE, job.status());
        assertEquals(1, job.attempts());
        assertNull(job.lockedBy());

        OutputRecord output = outputs.findByKey(new OutputKey("org-1", "act-job-1", OutputKey.CHANNEL_MULTI))
                .orElseThrow();
        assertEquals(job.lastTraceId(), output.traceId());
        assertEquals("job-1", output.meta().get("job_id"));
        assertEquals(1, countOutputs());
        assertEquals(List.of(AuditLog.DONE), auditActions);
    }

    @Test
    @DisplayName("Fails twice then succeeds: done, attempts=3, a single output")
    void retriesThenSucceeds() throws Exception {
        jobs.save(TestDb.generateAssetsJob("job-1").maxAttempts(3).build());
        generator.failNext("upstream 500 #1", "upstream 500 #2");
        WorkerLoop loop = loop(jobs);

        assertEquals(IterationOutcome.RETRIED, loop.runOnce());
        JobRecord afterFirst = jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.QUEUED, afterFirst.status());
        assertEquals(1, afterFirst.attempts());
        assertEquals("GenerationCallException: upstream 500 #1", afterFirst.lastError());

        assertEquals(IterationOutcome.RETRIED, loop.runOnce());
        assertEquals(IterationOutcome.COMPLETED, loop.runOnce());

        JobRecord job = jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.DONE, job.status());
        assertEquals(3, job.attempts());
        assertEquals(1, countOutputs());
        assertEquals(3, generator.requests().size());
        assertEquals(List.of(AuditLog.RETRY, AuditLog.RETRY, AuditLog.DONE), auditActions);
    }

    @Test
    @DisplayName("Three failures exhaust the budget: failed, attempts=3, last error kept, no output")
    void exhaustsAttempts() throws Exception {
        jobs.save(TestDb.generateAssetsJob("job-1").maxAttempts(3).build());
        generator.failNext("boom 1", "boom 2", "boom 3");
        WorkerLoop loop = loop(jobs);

        assertEquals(IterationOutcome.RETRIED, loop.runOnce());
        assertEquals(IterationOutcome.RETRIED, loop.runOnce());
        assertEquals(IterationOutcome.FAILED, loop.runOnce());
        assertEquals(IterationOutcome.IDLE, loop.runOnce());

        JobRecord job = jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(3, job.attempts());
        assertTrue(job.lastError().contains("boom 3"));
        assertNull(job.lockedBy());
        assertEquals(0, countOutputs());
        assertEquals(1, loop.failedCount());
        assertEquals(List.of(AuditLog.RETRY, AuditLog.RETRY, AuditLog.FAILED), auditActions);
    }

    @Test
    void unknownJobTypeConsumesAttemptWithoutRunningHandler() {
        jobs.save(JobRecord.builder().id("job-x").orgId("org-1").jobType("publish_post").maxAttempts(1).build());

        assertEquals(IterationOutcome.FAILED, loop(jobs).runOnce());

        JobRecord job = jobs.findById("job-x").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(1, job.attempts());
        assertTrue(job.lastError().startsWith("UnknownJobTypeException"));
        assertTrue(generator.requests().isEmpty());
    }

    @Test
    @DisplayName("Handler stack overflow is a failed attempt, the loop keeps going")
    void handlerErrorConsumesAttempt() {
        jobs.save(TestDb.generateAssetsJob("job-1").maxAttempts(3).build());
        generator.crashNext(new StackOverflowError("deep prompt"));
        WorkerLoop loop = loop(jobs);

        assertEquals(IterationOutcome.RETRIED, loop.runOnce());
        JobRecord afterCrash = jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.QUEUED, afterCrash.status());
        assertEquals(1, afterCrash.attempts());
        assertEquals("StackOverflowError: deep prompt", afterCrash.lastError());

        assertEquals(IterationOutcome.COMPLETED, loop.runOnce());
        assertEquals(JobStatus.DONE, jobs.findById("job-1").orElseThrow().status());
    }

    @Test
    void lastErrorIsTruncated() {
        jobs.save(TestDb.generateAssetsJob("job-1").build());
        generator.failNext("x".repeat(5000));

        loop(jobs).runOnce();

        assertEquals(WorkerLoop.MAX_ERROR_LENGTH, jobs.findById("job-1").orElseThrow().lastError().length());
    }

    @Test
    @DisplayName("Job reaped while running: result discarded, new owner keeps the job")
    void lostOwnershipDiscardsResult() {
        jobs.save(TestDb.generateAssetsJob("job-1").build());
        JobRepository stealing = new DelegatingJobRepository(jobs) {
            @Override
            public boolean markDone(String jobId, String workerId, String traceId) {
                clock.advance(Duration.ofMinutes(11));
                new StuckJobReaper(jobs, clock).reapStuck(Duration.ofMinutes(10));
                jobs.tryClaim(jobId, "worker-b");
                return super.markDone(jobId, workerId, traceId);
            }
        };

        assertEquals(IterationOutcome.LOST_OWNERSHIP, loop(stealing).runOnce());

        JobRecord job = jobs.findById("job-1").orElseThrow();
        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals("worker-b", job.lockedBy());
        assertTrue(auditActions.isEmpty());
    }

    @Test
    void storeErrorsAreContained() {
        JobRepository broken = new DelegatingJobRepository(jobs) {
            @Override
            public java.util.Optional<JobRecord> findOldestQueued() {
                throw new RuntimeException("Failed to select oldest queued job");
            }
        };

        assertEquals(IterationOutcome.ERROR, loop(broken).runOnce());
    }

    @Test
    void reapsOnlyWhenIntervalElapsed() {
        List<Instant> sweeps = new ArrayList<>();
        JobRepository counting = new DelegatingJobRepository(jobs) {
            @Override
            public List<JobRecord> findStuckRunning(Instant lockedBefore) {
                sweeps.add(lockedBefore);
                return super.findStuckRunning(lockedBefore);
            }
        };
        WorkerLoop loop = loop(counting);

        loop.runOnce();
        clock.advance(Duration.ofSeconds(10));
        loop.runOnce();
        clock.advance(Duration.ofSeconds(25));
        loop.runOnce();

        assertEquals(2, sweeps.size());
    }

    @Test
    void runPausesPerOutcomeAndStopsOnRequest() throws Exception {
        jobs.save(TestDb.generateAssetsJob("job-1").build());
        generator.failNext("transient");
        WorkerLoop loop = loop(jobs);
        RecordingSleeper stopAfterIdle = sleeper;

        Thread runner = new Thread(loop, "loop-under-test");
        runner.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!stopAfterIdle.pauses().contains(TIMINGS.idleDelay()) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        loop.requestStop();
        runner.join(5000);

        assertFalse(runner.isAlive());
        assertEquals(WorkerLoop.State.STOPPED, loop.state());
        assertEquals(Duration.ofMillis(2500), stopAfterIdle.pauses().get(0));
        assertTrue(stopAfterIdle.pauses().contains(TIMINGS.idleDelay()));
        assertEquals(JobStatus.DONE, jobs.findById("job-1").orElseThrow().status());
        assertEquals(IterationOutcome.STOPPED, loop.runOnce());
    }

    private static int countOutputs() throws Exception {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM social_outputs")) {
            rs.next();
            int count = rs.getInt(1);
            conn.commit();
            return count;
        }
    }

    /**
     * Forwards every call to a real repository; tests override single methods.
     */
    private static class DelegatingJobRepository implements JobRepository {
        private final JobRepository delegate;

        DelegatingJobRepository(JobRepository delegate) {
            this.delegate = delegate;
        }

        @Override
        public void save(JobRecord job) {
            delegate.save(job);
        }

        @Override
        public java.util.Optional<JobRecord> findById(String jobId) {
            return delegate.findById(jobId);
        }

        @Override
        public java.util.Optional<JobRecord> findOldestQueued() {
            return delegate.findOldestQueued();
        }

        @Override
        public boolean tryClaim(String jobId, String workerId) {
            return delegate.tryClaim(jobId, workerId);
        }

        @Override
        public List<JobRecord> findStuckRunning(Instant lockedBefore) {
            return delegate.findStuckRunning(lockedBefore);
        }

        @Override
        public boolean requeueStuck(String jobId, String lockedBy, Instant lockedBefore) {
            return delegate.requeueStuck(jobId, lockedBy, lockedBefore);
        }

        @Override
        public boolean markDone(String jobId, String workerId, String traceId) {
            return delegate.markDone(jobId, workerId, traceId);
        }

        @Override
        public boolean requeue(String jobId, String workerId, String error, String traceId) {
            return delegate.requeue(jobId, workerId, error, traceId);
        }

        @Override
        public boolean markFailed(String jobId, String workerId, String error, String traceId) {
            return delegate.markFailed(jobId, workerId, error, traceId);
        }

        @Override
        public int countByStatus(JobStatus status) {
            return delegate.countByStatus(status);
        }
    }
}
