package socialjobs.worker.store;

import socialjobs.worker.model.JobRecord;
import socialjobs.worker.model.JobStatus;
import socialjobs.worker.testing.MutableClock;
import socialjobs.worker.testing.TestDb;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-01-10T10:00:00Z");

    private static Database db;

    private MutableClock clock;
    private JdbcJobRepository repo;

    @BeforeAll
    static void setup() {
        db = TestDb.open("jobs");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        TestDb.clear(db);
        clock = new MutableClock(T0);
        repo = new JdbcJobRepository(db, clock, 3);
    }

    @Test
    void saveAndFindById() {
        repo.save(TestDb.generateAssetsJob("job-1").leadId("lead-1").build());

        Optional<JobRecord> found = repo.findById("job-1");
        assertTrue(found.isPresent());
        assertEquals("org-1", found.get().orgId());
        assertEquals("lead-1", found.get().leadId());
        assertEquals("generate_assets", found.get().jobType());
        assertEquals(JobStatus.QUEUED, found.get().status());
        assertEquals(0, found.get().attempts());
        assertEquals(3, found.get().maxAttempts());
        assertEquals(T0, found.get().createdAt());
        assertNull(found.get().lockedBy());
    }

    @Test
    void findByIdMissing() {
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    void oldestQueuedIsByCreationTime() {
        repo.save(TestDb.generateAssetsJob("newer").createdAt(T0.plusSeconds(5)).build());
        repo.save(TestDb.generateAssetsJob("older").createdAt(T0).build());
        repo.save(TestDb.generateAssetsJob("done").status(JobStatus.DONE).createdAt(T0.minusSeconds(60)).build());

        assertEquals("older", repo.findOldestQueued().orElseThrow().id());
    }

    @Test
    void claimOnlyAppliesToQueuedRow() {
        repo.save(TestDb.generateAssetsJob("job-1").build());

        assertTrue(repo.tryClaim("job-1", "worker-a"));
        assertFalse(repo.tryClaim("job-1", "worker-b"));

        JobRecord job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals("worker-a", job.lockedBy());
        assertEquals(T0, job.lockedAt());
        assertEquals(0, job.attempts());
    }

    @Test
    void markDoneClearsLock() {
        repo.save(TestDb.generateAssetsJob("job-1").build());
        repo.tryClaim("job-1", "worker-a");

        assertTrue(repo.markDone("job-1", "worker-a", "trace-1"));

        JobRecord job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.DONE, job.status());
        assertNull(job.lockedBy());
        assertNull(job.lockedAt());
        assertEquals("trace-1", job.lastTraceId());
        assertEquals(1, job.attempts());
    }

    @Test
    void finalizeIsScopedToLockHolder() {
        repo.save(TestDb.generateAssetsJob("job-1").build());
        repo.tryClaim("job-1", "worker-a");

        assertFalse(repo.markDone("job-1", "worker-b", "trace-x"));
        assertFalse(repo.requeue("job-1", "worker-b", "boom", "trace-x"));
        assertFalse(repo.markFailed("job-1", "worker-b", "boom", "trace-x"));

        JobRecord job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals("worker-a", job.lockedBy());
        assertEquals(0, job.attempts());
    }

    @Test
    void requeueIncrementsAttemptsAndRecordsError() {
        repo.save(TestDb.generateAssetsJob("job-1").build());
        repo.tryClaim("job-1", "worker-a");

        assertTrue(repo.requeue("job-1", "worker-a", "RuntimeException: boom", "trace-1"));

        JobRecord job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.QUEUED, job.status());
        assertEquals(1, job.attempts());
        assertNull(job.lockedBy());
        assertEquals("RuntimeException: boom", job.lastError());
        assertEquals(T0, job.lastErrorAt());
        assertEquals("trace-1", job.lastTraceId());
    }

    @Test
    void markFailedIsTerminal() {
        repo.save(TestDb.generateAssetsJob("job-1").attempts(2).build());
        repo.tryClaim("job-1", "worker-a");

        assertTrue(repo.markFailed("job-1", "worker-a", "last error", "trace-3"));

        JobRecord job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(3, job.attempts());
        assertTrue(job.isTerminal());
        assertFalse(repo.tryClaim("job-1", "worker-b"));
    }

    @Test
    void stuckRunningJobsAreRequeuedWithoutSpendingAttempts() {
        repo.save(TestDb.generateAssetsJob("job-1").attempts(1).build());
        repo.tryClaim("job-1", "worker-a");
        clock.advance(Duration.ofMinutes(11));
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(10));

        List<JobRecord> stuck = repo.findStuckRunning(cutoff);
        assertEquals(1, stuck.size());
        assertTrue(repo.requeueStuck("job-1", "worker-a", cutoff));

        JobRecord job = repo.findById("job-1").orElseThrow();
        assertEquals(JobStatus.QUEUED, job.status());
        assertEquals(1, job.attempts());
        assertNull(job.lockedBy());
        assertEquals(JdbcJobRepository.STUCK_ERROR, job.lastError());
    }

    @Test
    void requeueStuckIgnoresFreshLock() {
        repo.save(TestDb.generateAssetsJob("job-1").build());
        Instant cutoff = clock.instant();
        clock.advance(Duration.ofSeconds(1));
        repo.tryClaim("job-1", "worker-a");

        assertTrue(repo.findStuckRunning(cutoff).isEmpty());
        assertFalse(repo.requeueStuck("job-1", "worker-a", cutoff));
        assertEquals(JobStatus.RUNNING, repo.findById("job-1").orElseThrow().status());
    }

    @Test
    void nonPositiveMaxAttemptsFallsBackToDefault() {
        repo.save(TestDb.generateAssetsJob("job-1").maxAttempts(0).build());

        assertEquals(3, repo.findById("job-1").orElseThrow().maxAttempts());
    }

    @Test
    void countByStatus() {
        repo.save(TestDb.generateAssetsJob("a").build());
        repo.save(TestDb.generateAssetsJob("b").build());
        repo.save(TestDb.generateAssetsJob("c").status(JobStatus.DONE).build());

        assertEquals(2, repo.countByStatus(JobStatus.QUEUED));
        assertEquals(1, repo.countByStatus(JobStatus.DONE));
        assertEquals(0, repo.countByStatus(JobStatus.RUNNING));
    }
}
