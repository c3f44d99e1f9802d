package cloudseed.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import cloudseed.engine.config.EngineConfig;
import cloudseed.engine.repository.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management for the JDBC task store.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("cloudseed-db-pool");
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

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS transfer_tasks (
                            id               VARCHAR(64) PRIMARY KEY,
                            source           CHARACTER LARGE OBJECT NOT NULL,
                            state            VARCHAR(20) NOT NULL,
                            download_handle  VARCHAR,
                            name             VARCHAR,
                            progress         DOUBLE DEFAULT 0,
                            local_path       VARCHAR,
                            remote_path      VARCHAR,
                            error            CHARACTER LARGE OBJECT,
                            failure_count    INT DEFAULT 0,
                            created_at       TIMESTAMP,
                            updated_at       TIMESTAMP
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_transfer_tasks_created ON transfer_tasks(created_at, id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new TaskStoreException("Failed to initialize database schema", e);
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
