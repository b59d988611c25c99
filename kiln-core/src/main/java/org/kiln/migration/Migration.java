package org.kiln.migration;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.kiln.migration.operation.ChangeOperation;
import org.kiln.model.SchemaSnapshot;

import java.util.List;
import java.util.Objects;

/**
 * A named, ordered list of change operations together with the snapshot they produce.
 * The checksum covers the operations only.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "snapshot")
public final class Migration {
    private final String name;
    private final List<ChangeOperation> operations;
    private final String checksum;
    private final SchemaSnapshot snapshot;

    private Migration(String name, List<ChangeOperation> operations, SchemaSnapshot snapshot) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Migration name must not be blank");
        }
        if (name.length() > 255) {
            throw new IllegalArgumentException("Migration name longer than 255 characters: " + name);
        }
        this.name = name;
        this.operations = List.copyOf(operations);
        this.checksum = SnapshotHasher.hash(this.operations);
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot must not be null");
    }

    public static Migration of(String name, List<ChangeOperation> operations, SchemaSnapshot snapshot) {
        return new Migration(name, operations, snapshot);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
