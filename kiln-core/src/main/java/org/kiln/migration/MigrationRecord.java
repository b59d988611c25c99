package org.kiln.migration;

import java.time.LocalDateTime;

/**
 * One row of the migration ledger.
 */
public record MigrationRecord(
        String migrationName,
        int sequence,
        String checksum,
        LocalDateTime appliedAt,
        int operationCount
) {
}
