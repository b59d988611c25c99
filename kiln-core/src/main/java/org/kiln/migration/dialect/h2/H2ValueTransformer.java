package org.kiln.migration.dialect.h2;

import org.kiln.migration.spi.ValueTransformer;
import org.kiln.migration.support.Literals;
import org.kiln.model.FieldType;

public class H2ValueTransformer implements ValueTransformer {
    @Override
    public String quote(String value, FieldType type) {
        if (value == null) return "NULL";
        return switch (type) {
            case TEXT -> Literals.quoted(value);
            case BOOLEAN -> Boolean.parseBoolean(value.trim()) ? "TRUE" : "FALSE";
            case DATE -> "DATE " + Literals.quoted(value.trim());
            case TIMESTAMP -> "TIMESTAMP " + Literals.quoted(Literals.timestamp(value));
            case INTEGER, BIGINT, DECIMAL, DOUBLE -> Literals.number(value, type);
        };
    }
}
