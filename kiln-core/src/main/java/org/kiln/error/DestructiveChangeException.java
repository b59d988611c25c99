package org.kiln.error;

import lombok.Getter;
import org.kiln.migration.differs.DestructiveChange;

import java.util.List;
import java.util.stream.Collectors;

@Getter
public class DestructiveChangeException extends KilnException {
    private final String migrationName;
    private final List<DestructiveChange> changes;

    public DestructiveChangeException(String migrationName, List<DestructiveChange> changes) {
        super("Migration '" + migrationName + "' may lose data and was not confirmed:\n"
                + changes.stream().map(c -> "  - " + c.describe()).collect(Collectors.joining("\n")));
        this.migrationName = migrationName;
        this.changes = List.copyOf(changes);
    }
}
