package org.kiln.migration.spi.dialect;

import org.kiln.migration.spi.FieldTypeMapper;
import org.kiln.migration.spi.ValueTransformer;

public interface BaseDialect {
    String name();
    String quoteIdentifier(String raw);
    FieldTypeMapper getFieldTypeMapper();
    ValueTransformer getValueTransformer();
}
