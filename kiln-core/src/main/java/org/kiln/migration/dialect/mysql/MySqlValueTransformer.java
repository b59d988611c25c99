package org.kiln.migration.dialect.mysql;

import org.kiln.migration.spi.ValueTransformer;
import org.kiln.migration.support.Literals;
import org.kiln.model.FieldType;

public class MySqlValueTransformer implements ValueTransformer {
    @Override
    public String quote(String value, FieldType type) {
        if (value == null) return "NULL";
        return switch (type) {
            case TEXT -> Literals.quoted(value.replace("\\", "\\\\"));
            case BOOLEAN -> Boolean.parseBoolean(value.trim()) ? "1" : "0";
            case DATE -> Literals.quoted(value.trim());
            case TIMESTAMP -> Literals.quoted(Literals.timestamp(value));
            case INTEGER, BIGINT, DECIMAL, DOUBLE -> Literals.number(value, type);
        };
    }
}
