package org.kiln.error;

import lombok.Getter;
import org.kiln.migration.operation.ChangeOperation;

import java.util.List;

/**
 * A migration failed while being applied. The store transaction was rolled back and no
 * ledger record was written.
 */
@Getter
public class ApplyException extends KilnException {

    public enum Kind {
        DIALECT_UNSUPPORTED,
        CONSTRAINT_VIOLATION,
        CONNECTION_LOST,
        STATEMENT_FAILED
    }

    private final Kind kind;
    private final String migrationName;
    /**
     * Operations reached before the failure, the failing one last.
     */
    private final List<ChangeOperation> attemptedOperations;
    private final List<String> attemptedStatements;

    public ApplyException(Kind kind, String migrationName, List<String> attemptedStatements, String message) {
        this(kind, migrationName, List.of(), attemptedStatements, message, null);
    }

    public ApplyException(Kind kind, String migrationName, List<String> attemptedStatements, String message, Throwable cause) {
        this(kind, migrationName, List.of(), attemptedStatements, message, cause);
    }

    public ApplyException(Kind kind, String migrationName, List<ChangeOperation> attemptedOperations,
                          List<String> attemptedStatements, String message, Throwable cause) {
        super(migrationName == null
                ? kind + ": " + message
                : kind + " while applying '" + migrationName + "': " + message, cause);
        this.kind = kind;
        this.migrationName = migrationName;
        this.attemptedOperations = attemptedOperations == null ? List.of() : List.copyOf(attemptedOperations);
        this.attemptedStatements = attemptedStatements == null ? List.of() : List.copyOf(attemptedStatements);
    }
}
