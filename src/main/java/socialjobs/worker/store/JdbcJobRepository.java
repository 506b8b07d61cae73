package socialjobs.worker.store;

import socialjobs.worker.model.JobRecord;
import socialjobs.worker.model.JobStatus;
import socialjobs.worker.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobRepository.
 *
 * The claim is a single conditional UPDATE guarded by {@code status = 'queued'}; the database's
 * row lock makes that a compare-and-swap, so no SELECT FOR UPDATE is needed.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    static final String STUCK_ERROR = "requeued: stuck running timeout";

    private final Database db;
    private final Clock clock;
    private final int defaultMaxAttempts;

    public JdbcJobRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcJobRepository(Database db, Clock clock) {
        this(db, clock, 3);
    }

    /**
     * @param defaultMaxAttempts budget applied to rows whose max_attempts is not positive
     */
    public JdbcJobRepository(Database db, Clock clock, int defaultMaxAttempts) {
        this.db = db;
        this.clock = clock;
        this.defaultMaxAttempts = defaultMaxAttempts;
    }

    @Override
    public void save(JobRecord job) {
        String sql = """
                    INSERT INTO social_jobs (id, org_id, lead_id, activity_id, job_type, status, attempts, max_attempts,
                                             payload, locked_at, locked_by, last_error, last_error_at, last_trace_id,
                                             created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = clock.instant();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.id());
            ps.setString(2, job.orgId());
            ps.setString(3, job.leadId());
            ps.setString(4, job.activityId());
            ps.setString(5, job.jobType());
            ps.setString(6, job.status().dbValue());
            ps.setInt(7, job.attempts());
            ps.setInt(8, job.maxAttempts());
            ps.setString(9, job.payload());
            setTimestamp(ps, 10, job.lockedAt());
            ps.setString(11, job.lockedBy());
            ps.setString(12, job.lastError());
            setTimestamp(ps, 13, job.lastErrorAt());
            ps.setString(14, job.lastTraceId());
            setTimestamp(ps, 15, job.createdAt() != null ? job.createdAt() : now);
            setTimestamp(ps, 16, job.updatedAt() != null ? job.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<JobRecord> findById(String jobId) {
        String sql = "SELECT * FROM social_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<JobRecord> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public Optional<JobRecord> findOldestQueued() {
        String sql = """
                    SELECT * FROM social_jobs
                    WHERE status = 'queued'
                    ORDER BY created_at, id
                    LIMIT 1
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            try (ResultSet rs = ps.executeQuery()) {
                Optional<JobRecord> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to select oldest queued job", e);
        }
    }

    @Override
    public boolean tryClaim(String jobId, String workerId) {
        String sql = """
                    UPDATE social_jobs
                    SET status = 'running', locked_by = ?, locked_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'queued'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(clock.instant());
            ps.setString(1, workerId);
            ps.setTimestamp(2, now);
            ps.setTimestamp(3, now);
            ps.setString(4, jobId);

            try {
                int updated = ps.executeUpdate();
                conn.commit();
                return updated == 1;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim job " + jobId + " for worker " + workerId, e);
        }
    }

    @Override
    public List<JobRecord> findStuckRunning(Instant lockedBefore) {
        String sql = """
                    SELECT * FROM social_jobs
                    WHERE status = 'running' AND locked_at < ?
                    ORDER BY locked_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(lockedBefore));
            List<JobRecord> stuck = executeQuery(ps);
            conn.commit();
            return stuck;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck jobs", e);
        }
    }

    @Override
    public boolean requeueStuck(String jobId, String lockedBy, Instant lockedBefore) {
        String sql = """
                    UPDATE social_jobs
                    SET status = 'queued', locked_by = NULL, locked_at = NULL,
                        last_error = ?, last_error_at = ?, updated_at = ?
                    WHERE id = ? AND status = 'running' AND locked_by = ? AND locked_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(clock.instant());
            ps.setString(1, STUCK_ERROR);
            ps.setTimestamp(2, now);
            ps.setTimestamp(3, now);
            ps.setString(4, jobId);
            ps.setString(5, lockedBy);
            ps.setTimestamp(6, Timestamp.from(lockedBefore));

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Job {} requeued after stuck lock held by {}", jobId, lockedBy);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to requeue stuck job: " + jobId, e);
        }
    }

    @Override
    public boolean markDone(String jobId, String workerId, String traceId) {
        String sql = """
                    UPDATE social_jobs
                    SET status = 'done', attempts = attempts + 1, locked_by = NULL, locked_at = NULL,
                        last_trace_id = ?, updated_at = ?
                    WHERE id = ? AND status = 'running' AND locked_by = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, traceId);
            ps.setTimestamp(2, Timestamp.from(clock.instant()));
            ps.setString(3, jobId);
            ps.setString(4, workerId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark job done: " + jobId, e);
        }
    }

    @Override
    public boolean requeue(String jobId, String workerId, String error, String traceId) {
        return finishWithError(jobId, workerId, JobStatus.QUEUED, error, traceId);
    }

    @Override
    public boolean markFailed(String jobId, String workerId, String error, String traceId) {
        return finishWithError(jobId, workerId, JobStatus.FAILED, error, traceId);
    }

    private boolean finishWithError(String jobId, String workerId, JobStatus next, String error, String traceId) {
        String sql = """
                    UPDATE social_jobs
                    SET status = ?, attempts = attempts + 1, locked_by = NULL, locked_at = NULL,
                        last_error = ?, last_error_at = ?, last_trace_id = ?, updated_at = ?
                    WHERE id = ? AND status = 'running' AND locked_by = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(clock.instant());
            ps.setString(1, next.dbValue());
            ps.setString(2, error);
            ps.setTimestamp(3, now);
            ps.setString(4, traceId);
            ps.setTimestamp(5, now);
            ps.setString(6, jobId);
            ps.setString(7, workerId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to move job " + jobId + " to " + next.dbValue(), e);
        }
    }

    @Override
    public int countByStatus(JobStatus status) {
        String sql = "SELECT COUNT(*) FROM social_jobs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.dbValue());

            try (ResultSet rs = ps.executeQuery()) {
                int count = rs.next() ? rs.getInt(1) : 0;
                conn.commit();
                return count;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
    }

    // Helper methods

    private List<JobRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private JobRecord mapRow(ResultSet rs) throws SQLException {
        int maxAttempts = rs.getInt("max_attempts");
        return JobRecord.builder()
                .id(rs.getString("id"))
                .orgId(rs.getString("org_id"))
                .leadId(rs.getString("lead_id"))
                .activityId(rs.getString("activity_id"))
                .jobType(rs.getString("job_type"))
                .status(JobStatus.fromDb(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(maxAttempts > 0 ? maxAttempts : defaultMaxAttempts)
                .payload(rs.getString("payload"))
                .lockedAt(toInstant(rs.getTimestamp("locked_at")))
                .lockedBy(rs.getString("locked_by"))
                .lastError(rs.getString("last_error"))
                .lastErrorAt(toInstant(rs.getTimestamp("last_error_at")))
                .lastTraceId(rs.getString("last_trace_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
