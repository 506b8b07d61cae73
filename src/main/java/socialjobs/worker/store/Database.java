package socialjobs.worker.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import socialjobs.worker.config.WorkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with auto-commit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(WorkerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("social-jobs-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
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

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS social_jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            org_id          VARCHAR(64),
                            lead_id         VARCHAR(64),
                            activity_id     VARCHAR(64),
                            job_type        VARCHAR(64) NOT NULL,
                            status          VARCHAR(16) NOT NULL DEFAULT 'queued',
                            attempts        INT NOT NULL DEFAULT 0,
                            max_attempts    INT NOT NULL DEFAULT 3,
                            payload         CLOB,
                            locked_at       TIMESTAMP,
                            locked_by       VARCHAR(128),
                            last_error      VARCHAR(2048),
                            last_error_at   TIMESTAMP,
                            last_trace_id   VARCHAR(64),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- OUTPUTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS social_outputs (
                            id              VARCHAR(64) PRIMARY KEY,
                            org_id          VARCHAR(64) NOT NULL,
                            activity_id     VARCHAR(64) NOT NULL,
                            channel         VARCHAR(32) NOT NULL,
                            lead_id         VARCHAR(64),
                            vertical_key    VARCHAR(64),
                            status          VARCHAR(16) NOT NULL DEFAULT 'draft',
                            title           VARCHAR(1024),
                            hook            VARCHAR(2048),
                            caption         CLOB,
                            cta             VARCHAR(1024),
                            hashtags        CLOB,
                            image_prompts   CLOB,
                            assets          CLOB,
                            meta            CLOB,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_social_outputs_key UNIQUE (org_id, activity_id, channel)
                        );
                    """);

            // ---------- CONTEXT ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS social_vertical_profiles (
                            vertical_key        VARCHAR(64) PRIMARY KEY,
                            is_active           BOOLEAN DEFAULT TRUE,
                            prompt_system       CLOB,
                            prompt_user_prefix  CLOB,
                            tone                VARCHAR(256),
                            audience            VARCHAR(256),
                            brand_rules         CLOB,
                            image_style_rules   CLOB,
                            hashtag_seed        CLOB,
                            cta_library         CLOB,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS leads (
                            id          VARCHAR(64) PRIMARY KEY,
                            org_id      VARCHAR(64) NOT NULL,
                            name        VARCHAR(256),
                            company     VARCHAR(256),
                            city        VARCHAR(128),
                            notes       CLOB,
                            source      VARCHAR(128)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS audit_log (
                            id              VARCHAR(64) PRIMARY KEY,
                            org_id          VARCHAR(64),
                            actor_user_id   VARCHAR(64),
                            actor_mode      VARCHAR(32),
                            action          VARCHAR(64) NOT NULL,
                            payload         CLOB,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_social_jobs_status_created ON social_jobs(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_social_jobs_running_locked ON social_jobs(status, locked_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_audit_log_org ON audit_log(org_id, created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
