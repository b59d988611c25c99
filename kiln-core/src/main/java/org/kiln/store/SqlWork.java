package org.kiln.store;

import java.sql.SQLException;

@FunctionalInterface
public interface SqlWork<T> {
    T execute(StoreSession session) throws SQLException;
}
