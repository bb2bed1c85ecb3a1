package in.tickforge.infrastructure.persistence;

import in.tickforge.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL signal store.
 *
 * One row per (entity, key) in {@code signal_state}. Each write is an upsert inside its own
 * transaction, so a reader sees either the old row or the new one.
 */
public final class PostgresSignalStore implements SignalStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresSignalStore.class);

    private final DataSource dataSource;

    public PostgresSignalStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void init() {
        String sql = """
                CREATE TABLE IF NOT EXISTS signal_state (
                    entity_name TEXT NOT NULL,
                    storage_key TEXT NOT NULL,
                    payload     TEXT NOT NULL,
                    updated_at  TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    PRIMARY KEY (entity_name, storage_key)
                )
                """;

        try (Connection conn = dataSource.getConnection();
                Statement st = conn.createStatement()) {
            st.execute(sql);
            log.info("Postgres signal store ready");
        } catch (SQLException e) {
            log.error("Failed to create signal_state table: {}", e.getMessage());
            throw new PersistenceException("*", "signal_state", "Failed to initialize signal store", e);
        }
    }

    @Override
    public void write(String entityName, String storageKey, String payload) {
        String sql = """
                INSERT INTO signal_state (entity_name, storage_key, payload, updated_at)
                VALUES (?, ?, ?, NOW())
                ON CONFLICT (entity_name, storage_key) DO UPDATE SET
                    payload = EXCLUDED.payload,
                    updated_at = NOW()
                """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, entityName);
                ps.setString(2, storageKey);
                ps.setString(3, payload);
                ps.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to write {} {}: {}", entityName, storageKey, e.getMessage());
            throw new PersistenceException(entityName, storageKey, "Failed to write signal state", e);
        }
    }

    @Override
    public String read(String entityName, String storageKey) {
        String sql = """
                SELECT payload FROM signal_state
                WHERE entity_name = ? AND storage_key = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entityName);
            ps.setString(2, storageKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getString("payload");
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read {} {}: {}", entityName, storageKey, e.getMessage());
            throw new PersistenceException(entityName, storageKey, "Failed to read signal state", e);
        }
        return null;
    }

    @Override
    public void delete(String entityName, String storageKey) {
        String sql = """
                DELETE FROM signal_state
                WHERE entity_name = ? AND storage_key = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entityName);
            ps.setString(2, storageKey);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to delete {} {}: {}", entityName, storageKey, e.getMessage());
            throw new PersistenceException(entityName, storageKey, "Failed to delete signal state", e);
        }
    }

    @Override
    public List<String> keys(String entityName) {
        String sql = """
                SELECT storage_key FROM signal_state
                WHERE entity_name = ?
                ORDER BY storage_key
                """;

        List<String> keys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entityName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString("storage_key"));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list {}: {}", entityName, e.getMessage());
            throw new PersistenceException(entityName, "*", "Failed to list signal state", e);
        }
        return keys;
    }
}
