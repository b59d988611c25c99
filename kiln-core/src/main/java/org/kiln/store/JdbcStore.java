package org.kiln.store;

import lombok.extern.slf4j.Slf4j;
import org.kiln.migration.DialectRegistry;
import org.kiln.migration.spi.dialect.DdlDialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handle on a relational store. Every unit of work gets its own connection, closed when the
 * work ends. The handle itself holds no per-call state and may be shared across threads.
 */
@Slf4j
public class JdbcStore {
    private final ConnectionFactory connections;
    private final DdlDialect dialect;
    private final String identity;
    private final int queryTimeoutSeconds;
    private final List<StatementListener> listeners = new CopyOnWriteArrayList<>();

    public JdbcStore(ConnectionFactory connections, DdlDialect dialect, String identity, int queryTimeoutSeconds) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
        if (queryTimeoutSeconds < 0) {
            throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
        }
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public static JdbcStore of(DataSource dataSource, DdlDialect dialect) {
        return new JdbcStore(dataSource::getConnection, dialect,
                "datasource@" + Integer.toHexString(System.identityHashCode(dataSource)), 0);
    }

    /**
     * Opens a store through {@link DriverManager}, detecting the dialect from the connection.
     */
    public static JdbcStore connect(String url, String username, String password) throws SQLException {
        return connect(url, username, password, null, 0);
    }

    /**
     * @param dialectName explicit dialect, or {@code null} to detect it from the connection
     */
    public static JdbcStore connect(String url, String username, String password,
                                    String dialectName, int queryTimeoutSeconds) throws SQLException {
        ConnectionFactory factory = () -> DriverManager.getConnection(url, username, password);
        DdlDialect dialect;
        if (dialectName != null && !dialectName.isBlank()) {
            dialect = DialectRegistry.resolve(dialectName);
        } else {
            try (Connection c = factory.open()) {
                dialect = DialectRegistry.detect(c);
            }
        }
        log.debug("Connected store {} with dialect {}", url, dialect.name());
        return new JdbcStore(factory, dialect, url, queryTimeoutSeconds);
    }

    public DdlDialect getDialect() {
        return dialect;
    }

    /**
     * Stable name of the underlying database, used to serialize migrations per store.
     */
    public String getIdentity() {
        return identity;
    }

    public void addListener(StatementListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StatementListener listener) {
        listeners.remove(listener);
    }

    /**
     * Runs {@code work} in auto-commit mode.
     */
    public <T> T withSession(SqlWork<T> work) throws SQLException {
        try (Connection c = connections.open()) {
            return work.execute(new StoreSession(c, queryTimeoutSeconds, listeners));
        }
    }

    /**
     * Runs {@code work} in one transaction: committed when it returns, rolled back when it
     * throws anything.
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        try (Connection c = connections.open()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                T result = work.execute(new StoreSession(c, queryTimeoutSeconds, listeners));
                c.commit();
                return result;
            } catch (SQLException | RuntimeException | Error e) {
                rollbackQuietly(c, e);
                throw e;
            } finally {
                restoreAutoCommit(c, autoCommit);
            }
        }
    }

    private static void rollbackQuietly(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private static void restoreAutoCommit(Connection c, boolean autoCommit) {
        try {
            if (!c.isClosed()) c.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.debug("Could not restore auto-commit: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "JdbcStore[" + identity + ", " + dialect.name() + "]";
    }
}
