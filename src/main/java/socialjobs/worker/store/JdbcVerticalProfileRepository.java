package socialjobs.worker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import socialjobs.worker.model.VerticalProfile;
import socialjobs.worker.repository.VerticalProfileRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of VerticalProfileRepository.
 * List columns hold JSON arrays; image style rules may be plain strings or {"rule": "..."} objects.
 */
public class JdbcVerticalProfileRepository implements VerticalProfileRepository {

    private final Database db;
    private final ObjectMapper mapper;

    public JdbcVerticalProfileRepository(Database db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
    }

    @Override
    public Optional<VerticalProfile> findActive(String verticalKey) {
        String sql = "SELECT * FROM social_vertical_profiles WHERE vertical_key = ? AND is_active = TRUE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, verticalKey);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<VerticalProfile> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load vertical profile: " + verticalKey, e);
        }
    }

    @Override
    public void save(VerticalProfile profile, boolean active) {
        String sql = """
                    MERGE INTO social_vertical_profiles (vertical_key, is_active, prompt_system, prompt_user_prefix,
                                                         tone, audience, brand_rules, image_style_rules,
                                                         hashtag_seed, cta_library, updated_at)
                    KEY (vertical_key)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, profile.verticalKey());
            ps.setBoolean(2, active);
            ps.setString(3, profile.promptSystem());
            ps.setString(4, profile.promptUserPrefix());
            ps.setString(5, profile.tone());
            ps.setString(6, profile.audience());
            ps.setString(7, profile.brandRules());
            ps.setString(8, mapper.writeValueAsString(profile.imageStyleRules()));
            ps.setString(9, mapper.writeValueAsString(profile.hashtagSeed()));
            ps.setString(10, mapper.writeValueAsString(profile.ctaLibrary()));
            JdbcJobRepository.setTimestamp(ps, 11, profile.version());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Failed to save vertical profile: " + profile.verticalKey(), e);
        }
    }

    private VerticalProfile mapRow(ResultSet rs) throws SQLException {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        Timestamp version = updatedAt != null ? updatedAt : rs.getTimestamp("created_at");

        return new VerticalProfile(
                rs.getString("vertical_key"),
                rs.getString("prompt_system"),
                rs.getString("prompt_user_prefix"),
                rs.getString("tone"),
                rs.getString("audience"),
                rs.getString("brand_rules"),
                textList(rs.getString("image_style_rules"), "rule"),
                textList(rs.getString("hashtag_seed"), null),
                textList(rs.getString("cta_library"), null),
                JdbcJobRepository.toInstant(version));
    }

    private List<String> textList(String json, String objectField) throws SQLException {
        List<String> values = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return values;
        }
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column in social_vertical_profiles: " + e.getOriginalMessage(), e);
        }
        if (!node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            String text = item.isTextual() ? item.asText()
                    : objectField != null && item.hasNonNull(objectField) ? item.get(objectField).asText() : null;
            if (text != null && !text.isBlank()) {
                values.add(text.trim());
            }
        }
        return values;
    }
}
