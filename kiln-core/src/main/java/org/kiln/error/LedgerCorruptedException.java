package org.kiln.error;

import lombok.Getter;

/**
 * The store's migration ledger disagrees with the local migration history.
 */
@Getter
public class LedgerCorruptedException extends KilnException {
    private final String migrationName;

    public LedgerCorruptedException(String migrationName, String message) {
        super(message);
        this.migrationName = migrationName;
    }
}
