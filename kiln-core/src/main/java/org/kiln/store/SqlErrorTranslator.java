package org.kiln.store;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Classifies store errors by SQLState class.
 */
public final class SqlErrorTranslator {

    public enum Category {
        CONSTRAINT_VIOLATION,
        CONNECTION_LOST,
        CANCELLED,
        OTHER
    }

    private SqlErrorTranslator() {
    }

    public static Category classify(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            String state = cur.getSQLState();
            if (cur instanceof SQLIntegrityConstraintViolationException || (state != null && state.startsWith("23"))) {
                return Category.CONSTRAINT_VIOLATION;
            }
            if (cur instanceof SQLNonTransientConnectionException
                    || cur instanceof SQLTransientConnectionException
                    || cur instanceof SQLRecoverableException
                    || (state != null && state.startsWith("08"))) {
                return Category.CONNECTION_LOST;
            }
            if (StoreSession.CANCELLED_STATE.equals(state)) {
                return Category.CANCELLED;
            }
        }
        return Category.OTHER;
    }

    /**
     * Finds which of the known constraint names the store mentions in its error message.
     * The longest match wins so that {@code uq_a__b_c} is preferred over {@code uq_a__b}.
     */
    public static Optional<String> findConstraintName(SQLException e, Collection<String> knownNames) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return knownNames.stream()
                .filter(n -> message.contains(n.toLowerCase(Locale.ROOT)))
                .max((a, b) -> Integer.compare(a.length(), b.length()));
    }
}
