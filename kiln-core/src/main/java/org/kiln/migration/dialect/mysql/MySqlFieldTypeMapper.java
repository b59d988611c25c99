package org.kiln.migration.dialect.mysql;

import org.kiln.migration.spi.FieldTypeMapper;
import org.kiln.model.FieldType;

import java.util.EnumMap;
import java.util.Map;

public class MySqlFieldTypeMapper implements FieldTypeMapper {

    // utf8mb4 기준 VARCHAR 최대 문자 수, 초과 시 LONGTEXT
    static final int MAX_VARCHAR_LENGTH = 16_383;

    private record MySqlType(String template, boolean usesLength, boolean needsQuotes) implements SqlType {
        @Override
        public String getSqlType(int length) {
            if (!usesLength) return template;
            int len = length > 0 ? length : 255;
            return len > MAX_VARCHAR_LENGTH ? "LONGTEXT" : String.format(template, len);
        }
    }

    private static final Map<FieldType, MySqlType> TYPE_MAP = new EnumMap<>(Map.of(
            FieldType.INTEGER, new MySqlType("INT", false, false),
            FieldType.BIGINT, new MySqlType("BIGINT", false, false),
            FieldType.DECIMAL, new MySqlType("DECIMAL(19,4)", false, false),
            FieldType.DOUBLE, new MySqlType("DOUBLE", false, false),
            FieldType.TEXT, new MySqlType("VARCHAR(%d)", true, true),
            FieldType.BOOLEAN, new MySqlType("TINYINT(1)", false, false),
            FieldType.DATE, new MySqlType("DATE", false, true),
            FieldType.TIMESTAMP, new MySqlType("DATETIME(6)", false, true)
    ));

    @Override
    public SqlType map(FieldType type) {
        return TYPE_MAP.get(type);
    }
}
