package socialjobs.worker.store;

import socialjobs.worker.model.Lead;
import socialjobs.worker.repository.LeadRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public class JdbcLeadRepository implements LeadRepository {

    private final Database db;

    public JdbcLeadRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<Lead> findById(String orgId, String leadId) {
        String sql = "SELECT * FROM leads WHERE org_id = ? AND id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, orgId);
            ps.setString(2, leadId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<Lead> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load lead " + leadId + " in org " + orgId, e);
        }
    }

    @Override
    public void save(Lead lead) {
        String sql = "INSERT INTO leads (id, org_id, name, company, city, notes, source) VALUES (?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, lead.id());
            ps.setString(2, lead.orgId());
            ps.setString(3, lead.name());
            ps.setString(4, lead.company());
            ps.setString(5, lead.city());
            ps.setString(6, lead.notes());
            ps.setString(7, lead.source());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save lead: " + lead.id(), e);
        }
    }

    private Lead mapRow(ResultSet rs) throws SQLException {
        return new Lead(
                rs.getString("id"),
                rs.getString("org_id"),
                rs.getString("name"),
                rs.getString("company"),
                rs.getString("city"),
                rs.getString("notes"),
                rs.getString("source"));
    }
}
