package org.kiln.migration;

import org.kiln.migration.operation.ChangeOperation;

import java.util.List;

/**
 * Statements planned for a list of operations. {@code owners.get(i)} is the index of the
 * operation that produced {@code statements.get(i)}.
 */
public record DdlPlan(List<ChangeOperation> operations, List<String> statements, List<Integer> owners) {

    public DdlPlan {
        operations = List.copyOf(operations);
        statements = List.copyOf(statements);
        owners = List.copyOf(owners);
        if (statements.size() != owners.size()) {
            throw new IllegalArgumentException("Every statement needs an owning operation");
        }
    }

    /**
     * The operations reached once the first {@code attemptedStatements} statements were run,
     * including the one the last attempted statement belongs to.
     */
    public List<ChangeOperation> operationsReached(int attemptedStatements) {
        if (attemptedStatements <= 0) return List.of();
        int last = owners.get(Math.min(attemptedStatements, owners.size()) - 1);
        return operations.subList(0, last + 1);
    }
}
