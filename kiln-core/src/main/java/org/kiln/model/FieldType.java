package org.kiln.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Scalar kinds a field may carry. Each kind knows the Java type its values are
 * materialised as, which conversions preserve existing data, and how to coerce
 * caller-supplied values.
 */
public enum FieldType {
    INTEGER("integer", Integer.class),
    BIGINT("bigint", Long.class),
    DECIMAL("decimal", BigDecimal.class),
    DOUBLE("double", Double.class),
    TEXT("text", String.class),
    BOOLEAN("boolean", Boolean.class),
    DATE("date", LocalDate.class),
    TIMESTAMP("timestamp", LocalDateTime.class);

    // old type -> types it can be converted to without losing data
    private static final Map<FieldType, Set<FieldType>> WIDENING = Map.of(
            INTEGER, EnumSet.of(BIGINT, DECIMAL, DOUBLE, TEXT),
            BIGINT, EnumSet.of(DECIMAL, TEXT),
            DECIMAL, EnumSet.of(TEXT),
            DOUBLE, EnumSet.of(TEXT),
            TEXT, EnumSet.noneOf(FieldType.class),
            BOOLEAN, EnumSet.of(TEXT),
            DATE, EnumSet.of(TIMESTAMP, TEXT),
            TIMESTAMP, EnumSet.of(TEXT)
    );

    private final String keyword;
    private final Class<?> javaType;

    FieldType(String keyword, Class<?> javaType) {
        this.keyword = keyword;
        this.javaType = javaType;
    }

    public String keyword() {
        return keyword;
    }

    public Class<?> javaType() {
        return javaType;
    }

    public static Optional<FieldType> fromKeyword(String raw) {
        if (raw == null) return Optional.empty();
        String k = raw.trim().toLowerCase(Locale.ROOT);
        for (FieldType t : values()) {
            if (t.keyword.equals(k)) return Optional.of(t);
        }
        // common aliases
        return switch (k) {
            case "int" -> Optional.of(INTEGER);
            case "long" -> Optional.of(BIGINT);
            case "string", "varchar" -> Optional.of(TEXT);
            case "bool" -> Optional.of(BOOLEAN);
            case "datetime" -> Optional.of(TIMESTAMP);
            case "float" -> Optional.of(DOUBLE);
            default -> Optional.empty();
        };
    }

    public boolean isIntegral() {
        return this == INTEGER || this == BIGINT;
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }

    /**
     * Whether existing values of this type survive conversion to {@code target}.
     */
    public boolean canWidenTo(FieldType target) {
        return this == target || WIDENING.get(this).contains(target);
    }

    /**
     * Whether a foreign key of this type may reference a key of type {@code referenced}.
     */
    public boolean isReferenceCompatible(FieldType referenced) {
        if (this == referenced) return true;
        return isIntegral() && referenced.isIntegral();
    }

    /**
     * Converts a caller-supplied value into this type's Java representation.
     *
     * @throws IllegalArgumentException if the value cannot represent this type
     */
    public Object coerce(Object value) {
        if (value == null) return null;
        switch (this) {
            case INTEGER -> {
                if (value instanceof Integer) return value;
                if (value instanceof Short || value instanceof Byte) return ((Number) value).intValue();
                if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return l.intValue();
            }
            case BIGINT -> {
                if (value instanceof Long) return value;
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) return ((Number) value).longValue();
                if (value instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
            }
            case DECIMAL -> {
                if (value instanceof BigDecimal) return value;
                if (value instanceof Integer || value instanceof Long || value instanceof Short) return BigDecimal.valueOf(((Number) value).longValue());
                if (value instanceof Double || value instanceof Float) return BigDecimal.valueOf(((Number) value).doubleValue());
                if (value instanceof BigInteger bi) return new BigDecimal(bi);
            }
            case DOUBLE -> {
                if (value instanceof Double) return value;
                if (value instanceof Number n) return n.doubleValue();
            }
            case TEXT -> {
                if (value instanceof String) return value;
                if (value instanceof Character || value instanceof UUID) return value.toString();
                if (value instanceof Enum<?> e) return e.name();
            }
            case BOOLEAN -> {
                if (value instanceof Boolean) return value;
            }
            case DATE -> {
                if (value instanceof LocalDate) return value;
                if (value instanceof java.sql.Date d) return d.toLocalDate();
            }
            case TIMESTAMP -> {
                if (value instanceof LocalDateTime) return value;
                if (value instanceof Timestamp ts) return ts.toLocalDateTime();
            }
        }
        throw new IllegalArgumentException("Value of type " + value.getClass().getSimpleName()
                + " is not assignable to " + keyword);
    }

    /**
     * Parses a literal as written in a schema definition.
     *
     * @throws IllegalArgumentException if the literal is not a valid value of this type
     */
    public Object parseLiteral(String literal) {
        if (literal == null) return null;
        String s = literal.trim();
        try {
            return switch (this) {
                case INTEGER -> Integer.parseInt(s);
                case BIGINT -> Long.parseLong(s);
                case DECIMAL -> new BigDecimal(s);
                case DOUBLE -> Double.parseDouble(s);
                case TEXT -> literal;
                case BOOLEAN -> {
                    if (s.equalsIgnoreCase("true")) yield Boolean.TRUE;
                    if (s.equalsIgnoreCase("false")) yield Boolean.FALSE;
                    throw new IllegalArgumentException("Not a boolean literal: " + literal);
                }
                case DATE -> LocalDate.parse(s);
                case TIMESTAMP -> LocalDateTime.parse(s);
            };
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid " + keyword + " literal '" + literal + "'", e);
        }
    }
}
