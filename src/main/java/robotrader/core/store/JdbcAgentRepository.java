package robotrader.core.store;

import robotrader.core.error.StoreException;
import robotrader.core.model.AgentProfile;
import robotrader.core.model.AgentRole;
import robotrader.core.repository.AgentRepository;
import robotrader.core.util.JsonCodec;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static robotrader.core.store.JdbcSupport.setTimestamp;
import static robotrader.core.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of AgentRepository.
 */
public class JdbcAgentRepository implements AgentRepository {

    /** SQLSTATE for a unique constraint violation. */
    private static final String DUPLICATE_KEY = "23505";

    private final ConnectionSource db;

    public JdbcAgentRepository(ConnectionSource db) {
        this.db = db;
    }

    @Override
    public boolean register(AgentProfile profile, Instant registeredAt) {
        String sql = """
                    INSERT INTO agents (agent_id, role, capabilities, active, registered_at, last_active_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, profile.agentId());
            ps.setString(2, profile.role().name());
            ps.setString(3, JsonCodec.toJson(profile.capabilities()));
            ps.setBoolean(4, profile.active());
            setTimestamp(ps, 5, registeredAt);
            setTimestamp(ps, 6, registeredAt);

            try {
                ps.executeUpdate();
            } catch (SQLException e) {
                conn.rollback();
                if (DUPLICATE_KEY.equals(e.getSQLState())) {
                    return false;
                }
                throw e;
            }
            conn.commit();
            return true;
        } catch (SQLException e) {
            throw new StoreException("Failed to register agent: " + profile.agentId(), e);
        }
    }

    @Override
    public Optional<AgentProfile> findById(String agentId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM agents WHERE agent_id = ?")) {

            ps.setString(1, agentId);
            List<AgentProfile> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to find agent: " + agentId, e);
        }
    }

    @Override
    public List<AgentProfile> findAll() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM agents ORDER BY agent_id")) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list agents", e);
        }
    }

    @Override
    public List<AgentProfile> findActiveByRole(AgentRole role) {
        String sql = "SELECT * FROM agents WHERE role = ? AND active = TRUE ORDER BY agent_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, role.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find agents by role: " + role, e);
        }
    }

    @Override
    public boolean updateActive(String agentId, boolean active, Instant at) {
        String sql = "UPDATE agents SET active = ?, last_active_at = ? WHERE agent_id = ? AND active <> ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, active);
            setTimestamp(ps, 2, at);
            ps.setString(3, agentId);
            ps.setBoolean(4, active);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update agent status: " + agentId, e);
        }
    }

    @Override
    public boolean touch(String agentId, Instant at) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "UPDATE agents SET last_active_at = ? WHERE agent_id = ?")) {

            setTimestamp(ps, 1, at);
            ps.setString(2, agentId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to record agent activity: " + agentId, e);
        }
    }

    private static List<AgentProfile> executeQuery(PreparedStatement ps) throws SQLException {
        List<AgentProfile> agents = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                agents.add(new AgentProfile(
                        rs.getString("agent_id"),
                        AgentRole.valueOf(rs.getString("role")),
                        JsonCodec.parseStringList(rs.getString("capabilities")),
                        rs.getBoolean("active"),
                        toInstant(rs, "registered_at"),
                        toInstant(rs, "last_active_at")));
            }
        }
        return agents;
    }
}
