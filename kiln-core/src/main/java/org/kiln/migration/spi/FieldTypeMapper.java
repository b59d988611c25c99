package org.kiln.migration.spi;

import org.kiln.model.FieldType;

public interface FieldTypeMapper {
    SqlType map(FieldType type);

    interface SqlType {
        String getSqlType(int length);
        boolean needsQuotes();
    }
}
