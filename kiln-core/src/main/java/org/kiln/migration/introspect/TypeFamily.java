package org.kiln.migration.introspect;

import org.kiln.model.FieldType;

import java.sql.Types;

/**
 * Coarse column type used for drift checks. Lengths and precisions are not compared.
 */
public enum TypeFamily {
    INTEGER,
    BIGINT,
    DECIMAL,
    DOUBLE,
    TEXT,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    OTHER;

    public static TypeFamily of(FieldType type) {
        return switch (type) {
            case INTEGER -> INTEGER;
            case BIGINT -> BIGINT;
            case DECIMAL -> DECIMAL;
            case DOUBLE -> DOUBLE;
            case TEXT -> TEXT;
            case BOOLEAN -> BOOLEAN;
            case DATE -> DATE;
            case TIMESTAMP -> TIMESTAMP;
        };
    }

    /**
     * @param jdbcType a {@link Types} constant as reported by {@code DatabaseMetaData#getColumns}
     */
    public static TypeFamily ofJdbc(int jdbcType) {
        return switch (jdbcType) {
            case Types.INTEGER, Types.SMALLINT, Types.TINYINT -> INTEGER;
            case Types.BIGINT -> BIGINT;
            case Types.DECIMAL, Types.NUMERIC -> DECIMAL;
            case Types.DOUBLE, Types.FLOAT, Types.REAL -> DOUBLE;
            case Types.VARCHAR, Types.CHAR, Types.LONGVARCHAR, Types.CLOB,
                    Types.NVARCHAR, Types.NCHAR, Types.LONGNVARCHAR, Types.NCLOB -> TEXT;
            // MySQL reports TINYINT(1) as BIT
            case Types.BOOLEAN, Types.BIT -> BOOLEAN;
            case Types.DATE -> DATE;
            case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
            default -> OTHER;
        };
    }
}
