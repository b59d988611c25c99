package org.kiln.migration.support;

import org.kiln.model.FieldType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Literal formatting shared by the value transformers.
 */
public final class Literals {
    private static final DateTimeFormatter SQL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private Literals() {
    }

    public static String quoted(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    public static String timestamp(String isoValue) {
        return LocalDateTime.parse(isoValue.trim()).format(SQL_TIMESTAMP);
    }

    /**
     * Re-renders a numeric literal from its parsed value so that nothing but a number reaches SQL.
     */
    public static String number(String value, FieldType type) {
        Object parsed = type.parseLiteral(value);
        if (parsed instanceof BigDecimal bd) return bd.toPlainString();
        return String.valueOf(parsed);
    }
}
