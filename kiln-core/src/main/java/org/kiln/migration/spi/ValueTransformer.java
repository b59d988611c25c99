package org.kiln.migration.spi;

import org.kiln.model.FieldType;

/**
 * Renders a schema default literal as dialect SQL.
 */
public interface ValueTransformer {
    String quote(String value, FieldType type);
}
