package socialjobs.worker.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import socialjobs.worker.repository.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Writes audit rows as the configured system user.
 */
public class JdbcAuditLog implements AuditLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditLog.class);

    private final Database db;
    private final ObjectMapper mapper;
    private final String systemUserId;
    private final Clock clock;

    public JdbcAuditLog(Database db, ObjectMapper mapper, String systemUserId) {
        this(db, mapper, systemUserId, Clock.systemUTC());
    }

    public JdbcAuditLog(Database db, ObjectMapper mapper, String systemUserId, Clock clock) {
        this.db = db;
        this.mapper = mapper;
        this.systemUserId = systemUserId;
        this.clock = clock;
    }

    @Override
    public void record(String orgId, String action, Map<String, Object> payload) {
        String sql = """
                    INSERT INTO audit_log (id, org_id, actor_user_id, actor_mode, action, payload, created_at)
                    VALUES (?, ?, ?, 'direct', ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, UUID.randomUUID().toString());
            ps.setString(2, orgId);
            ps.setString(3, systemUserId);
            ps.setString(4, action);
            ps.setString(5, mapper.writeValueAsString(payload));
            ps.setTimestamp(6, Timestamp.from(clock.instant()));

            ps.executeUpdate();
            conn.commit();
        } catch (Exception e) {
            log.warn("Audit write failed for {} in org {}: {}", action, orgId, e.getMessage());
        }
    }
}
