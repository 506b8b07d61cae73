package socialjobs.worker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import socialjobs.worker.model.OutputKey;
import socialjobs.worker.model.OutputRecord;
import socialjobs.worker.repository.OutputRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of OutputRepository.
 *
 * The write is one MERGE keyed on (org_id, activity_id, channel). Two workers inserting the same
 * new key at the same moment make one of the MERGEs hit the unique constraint (or H2's concurrent
 * update error); that statement is retried once and then takes the update branch.
 */
public class JdbcOutputRepository implements OutputRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOutputRepository.class);

    private static final String UNIQUE_VIOLATION = "23505";
    // H2 reports a row changed by a concurrent transaction with its own state
    private static final String CONCURRENT_UPDATE = "90131";
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private static final String MERGE_SQL = """
                MERGE INTO social_outputs o
                USING (SELECT CAST(? AS VARCHAR(64)) AS org_id,
                              CAST(? AS VARCHAR(64)) AS activity_id,
                              CAST(? AS VARCHAR(32)) AS channel) k
                ON o.org_id = k.org_id AND o.activity_id = k.activity_id AND o.channel = k.channel
                WHEN MATCHED THEN UPDATE SET
                    lead_id = ?, vertical_key = ?, status = ?, title = ?, hook = ?, caption = ?, cta = ?,
                    hashtags = ?, image_prompts = ?, meta = ?, updated_at = ?
                WHEN NOT MATCHED THEN INSERT
                    (id, org_id, activity_id, channel, lead_id, vertical_key, status, title, hook, caption, cta,
                     hashtags, image_prompts, assets, meta, created_at, updated_at)
                    VALUES (?, k.org_id, k.activity_id, k.channel, ?, ?, ?, ?, ?, ?, ?, ?, ?, '[]', ?, ?, ?)
            """;

    private final Database db;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JdbcOutputRepository(Database db, ObjectMapper mapper) {
        this(db, mapper, Clock.systemUTC());
    }

    public JdbcOutputRepository(Database db, ObjectMapper mapper, Clock clock) {
        this.db = db;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public OutputRecord upsert(OutputRecord output) {
        try {
            return mergeAndRead(output);
        } catch (SQLException e) {
            if (!UNIQUE_VIOLATION.equals(e.getSQLState()) && !CONCURRENT_UPDATE.equals(e.getSQLState())) {
                throw new RuntimeException("Failed to upsert output " + output.key(), e);
            }
            log.debug("Concurrent insert for output {}, retrying as update", output.key());
        }

        try {
            return mergeAndRead(output);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert output " + output.key() + " after retry", e);
        }
    }

    private OutputRecord mergeAndRead(OutputRecord output) throws SQLException {
        String hashtags = toJson(output.hashtags());
        String imagePrompts = toJson(output.imagePrompts());
        String meta = toJson(output.meta());
        String status = output.status() != null ? output.status() : OutputRecord.STATUS_DRAFT;
        String id = output.id() != null ? output.id() : UUID.randomUUID().toString();
        OutputKey key = output.key();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(MERGE_SQL)) {
                Timestamp now = Timestamp.from(clock.instant());
                int i = 1;
                // key
                ps.setString(i++, key.orgId());
                ps.setString(i++, key.activityId());
                ps.setString(i++, key.channel());
                // update branch
                ps.setString(i++, output.leadId());
                ps.setString(i++, output.verticalKey());
                ps.setString(i++, status);
                ps.setString(i++, output.title());
                ps.setString(i++, output.hook());
                ps.setString(i++, output.caption());
                ps.setString(i++, output.cta());
                ps.setString(i++, hashtags);
                ps.setString(i++, imagePrompts);
                ps.setString(i++, meta);
                ps.setTimestamp(i++, now);
                // insert branch
                ps.setString(i++, id);
                ps.setString(i++, output.leadId());
                ps.setString(i++, output.verticalKey());
                ps.setString(i++, status);
                ps.setString(i++, output.title());
                ps.setString(i++, output.hook());
                ps.setString(i++, output.caption());
                ps.setString(i++, output.cta());
                ps.setString(i++, hashtags);
                ps.setString(i++, imagePrompts);
                ps.setString(i++, meta);
                ps.setTimestamp(i++, now);
                ps.setTimestamp(i, now);

                ps.executeUpdate();

                OutputRecord stored = selectByKey(conn, key)
                        .orElseThrow(() -> new SQLException("Output " + key + " missing right after merge"));
                conn.commit();
                return stored;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    @Override
    public Optional<OutputRecord> findByKey(OutputKey key) {
        try (Connection conn = db.getConnection()) {
            Optional<OutputRecord> found = selectByKey(conn, key);
            conn.commit();
            return found;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find output " + key, e);
        }
    }

    private Optional<OutputRecord> selectByKey(Connection conn, OutputKey key) throws SQLException {
        String sql = "SELECT * FROM social_outputs WHERE org_id = ? AND activity_id = ? AND channel = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key.orgId());
            ps.setString(2, key.activityId());
            ps.setString(3, key.channel());

            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    private OutputRecord mapRow(ResultSet rs) throws SQLException {
        OutputKey key = new OutputKey(rs.getString("org_id"), rs.getString("activity_id"), rs.getString("channel"));
        return new OutputRecord(
                rs.getString("id"),
                key,
                rs.getString("lead_id"),
                rs.getString("vertical_key"),
                rs.getString("status"),
                rs.getString("title"),
                rs.getString("hook"),
                rs.getString("caption"),
                rs.getString("cta"),
                fromJson(rs.getString("hashtags"), STRING_LIST, List.of()),
                fromJson(rs.getString("image_prompts"), STRING_LIST, List.of()),
                fromJson(rs.getString("meta"), JSON_OBJECT, Map.of()),
                JdbcJobRepository.toInstant(rs.getTimestamp("created_at")),
                JdbcJobRepository.toInstant(rs.getTimestamp("updated_at")));
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Output field is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) throws SQLException {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column in social_outputs: " + e.getOriginalMessage(), e);
        }
    }
}
