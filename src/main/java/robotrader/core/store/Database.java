package robotrader.core.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import robotrader.core.config.CoordinatorConfig;
import robotrader.core.error.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements ConnectionSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("robotrader-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for committing and closing the connection.
     */
    @Override
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Pool figures for status reporting.
     */
    public Map<String, Object> poolStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("pool_name", dataSource.getPoolName());
        stats.put("max_pool_size", dataSource.getMaximumPoolSize());
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool != null) {
            stats.put("threads_awaiting_connection", pool.getThreadsAwaitingConnection());
        }
        return stats;
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- QUEUE TASKS ----------
            st.addBatch("CREATE SEQUENCE IF NOT EXISTS queue_task_seq");
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS queue_tasks (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            seq             BIGINT NOT NULL,
                            queue_name      VARCHAR(64) NOT NULL,
                            task_type       VARCHAR(128) NOT NULL,
                            status          VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                            priority        INT NOT NULL DEFAULT 5,
                            payload         CLOB NOT NULL,
                            retry_count     INT NOT NULL DEFAULT 0,
                            max_retries     INT NOT NULL DEFAULT 3,
                            created_at      TIMESTAMP NOT NULL,
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP,
                            scheduled_at    TIMESTAMP,
                            duration_ms     BIGINT,
                            error           VARCHAR(4000)
                        );
                    """);

            // ---------- EVENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS events (
                            id              VARCHAR(64) PRIMARY KEY,
                            event_type      VARCHAR(64) NOT NULL,
                            source          VARCHAR(128) NOT NULL,
                            data            CLOB NOT NULL,
                            status          VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                            created_at      TIMESTAMP NOT NULL,
                            processed_at    TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS dead_letter_events (
                            id              VARCHAR(64) PRIMARY KEY,
                            event_id        VARCHAR(64) NOT NULL,
                            event_type      VARCHAR(64) NOT NULL,
                            handler         VARCHAR(128) NOT NULL,
                            error           VARCHAR(4000),
                            failed_at       TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- AGENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS agents (
                            agent_id        VARCHAR(64) PRIMARY KEY,
                            role            VARCHAR(64) NOT NULL,
                            capabilities    CLOB NOT NULL,
                            active          BOOLEAN NOT NULL DEFAULT TRUE,
                            registered_at   TIMESTAMP NOT NULL,
                            last_active_at  TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_tasks_order "
                    + "ON queue_tasks(queue_name, status, priority, created_at, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_tasks_status_started ON queue_tasks(status, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_tasks_completed ON queue_tasks(queue_name, completed_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_events_created ON events(created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_events_status ON events(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_dead_letters_failed ON dead_letter_events(failed_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
