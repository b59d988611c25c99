package org.kiln.migration;

import java.util.List;

/**
 * Ledger rows already in the store and local migrations still to deploy.
 */
public record MigrationStatus(List<MigrationRecord> applied, List<Migration> pending) {

    public MigrationStatus {
        applied = List.copyOf(applied);
        pending = List.copyOf(pending);
    }

    public boolean isUpToDate() {
        return pending.isEmpty();
    }
}
