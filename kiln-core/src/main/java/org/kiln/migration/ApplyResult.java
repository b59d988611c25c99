package org.kiln.migration;

import java.util.List;

/**
 * Outcome of applying one migration.
 *
 * @param statements statements executed by this call, empty for a no-op
 */
public record ApplyResult(MigrationRecord record, Outcome outcome, List<String> statements) {

    public enum Outcome { APPLIED, NOOP }

    public static ApplyResult applied(MigrationRecord record, List<String> statements) {
        return new ApplyResult(record, Outcome.APPLIED, List.copyOf(statements));
    }

    public static ApplyResult noop(MigrationRecord record) {
        return new ApplyResult(record, Outcome.NOOP, List.of());
    }

    public boolean applied() {
        return outcome == Outcome.APPLIED;
    }
}
