package org.kiln.store;

import java.util.List;

/**
 * Observes every statement a {@link JdbcStore} sends, just before it is executed.
 */
@FunctionalInterface
public interface StatementListener {
    void beforeStatement(String sql, List<Object> parameters);
}
