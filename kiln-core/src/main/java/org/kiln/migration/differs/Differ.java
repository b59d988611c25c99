package org.kiln.migration.differs;

import org.kiln.model.SchemaSnapshot;

@FunctionalInterface
public interface Differ {
    void diff(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, DiffResult result);
}
