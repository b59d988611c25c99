package org.kiln.migration.dialect.h2;

import org.kiln.migration.spi.FieldTypeMapper;
import org.kiln.model.FieldType;

import java.util.EnumMap;
import java.util.Map;

public class H2FieldTypeMapper implements FieldTypeMapper {

    // VARCHAR 최대 길이 초과 시 CLOB
    static final int MAX_VARCHAR_LENGTH = 1_000_000;

    private record H2SqlType(String template, boolean usesLength, boolean needsQuotes) implements SqlType {
        @Override
        public String getSqlType(int length) {
            if (!usesLength) return template;
            int len = length > 0 ? length : 255;
            return len > MAX_VARCHAR_LENGTH ? "CLOB" : String.format(template, len);
        }
    }

    private static final Map<FieldType, H2SqlType> TYPE_MAP = new EnumMap<>(Map.of(
            FieldType.INTEGER, new H2SqlType("INTEGER", false, false),
            FieldType.BIGINT, new H2SqlType("BIGINT", false, false),
            FieldType.DECIMAL, new H2SqlType("DECIMAL(19,4)", false, false),
            FieldType.DOUBLE, new H2SqlType("DOUBLE PRECISION", false, false),
            FieldType.TEXT, new H2SqlType("VARCHAR(%d)", true, true),
            FieldType.BOOLEAN, new H2SqlType("BOOLEAN", false, false),
            FieldType.DATE, new H2SqlType("DATE", false, true),
            FieldType.TIMESTAMP, new H2SqlType("TIMESTAMP", false, true)
    ));

    @Override
    public SqlType map(FieldType type) {
        return TYPE_MAP.get(type);
    }
}
