package org.kiln.migration.differs;

import org.kiln.model.SchemaSnapshot;

@FunctionalInterface
public interface EntityComponentDiffer {
    /**
     * Compares one entity present in both snapshots. {@code result} already carries the old
     * and new entity; the snapshots are passed for lookups across entities.
     */
    void diff(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, DiffResult.ModifiedEntity result);
}
