package org.kiln.store;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Statements issued on one connection within one unit of work.
 */
@Slf4j
public class StoreSession {
    /** SQLState for a cancelled statement. */
    public static final String CANCELLED_STATE = "57014";

    private final Connection connection;
    private final int queryTimeoutSeconds;
    private final List<StatementListener> listeners;

    StoreSession(Connection connection, int queryTimeoutSeconds, List<StatementListener> listeners) {
        this.connection = connection;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.listeners = listeners;
    }

    public Connection getConnection() {
        return connection;
    }

    public int execute(String sql) throws SQLException {
        before(sql, List.of());
        try (Statement st = connection.createStatement()) {
            applyTimeout(st);
            st.execute(sql);
            return st.getUpdateCount();
        }
    }

    public int update(String sql, List<Object> params) throws SQLException {
        before(sql, params);
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            applyTimeout(ps);
            bind(ps, params);
            return ps.executeUpdate();
        }
    }

    /**
     * Runs an insert and returns the first generated key, or {@code null} when the store
     * generated none.
     */
    public Object insert(String sql, List<Object> params) throws SQLException {
        before(sql, params);
        try (PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            applyTimeout(ps);
            bind(ps, params);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                return keys.next() ? keys.getObject(1) : null;
            }
        }
    }

    public <T> List<T> query(String sql, List<Object> params, RowMapper<T> mapper) throws SQLException {
        before(sql, params);
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            applyTimeout(ps);
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
                return out;
            }
        }
    }

    private void before(String sql, List<Object> params) throws SQLException {
        if (Thread.currentThread().isInterrupted()) {
            throw new SQLException("Interrupted before executing statement", CANCELLED_STATE);
        }
        if (log.isDebugEnabled()) {
            log.debug("SQL: {} {}", sql, params.isEmpty() ? "" : params);
        }
        for (StatementListener l : listeners) {
            l.beforeStatement(sql, params);
        }
    }

    private void applyTimeout(Statement st) throws SQLException {
        if (queryTimeoutSeconds > 0) {
            st.setQueryTimeout(queryTimeoutSeconds);
        }
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }
}
