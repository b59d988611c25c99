package org.kiln.client;

import java.util.Collection;

/**
 * {@code field operator value}. Unary operators carry a {@code null} value and {@link Operator#IN}
 * a collection.
 */
public record Condition(String field, Operator operator, Object value) {

    public Condition {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Condition field must not be blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Condition operator must not be null");
        }
    }

    @Override
    public String toString() {
        if (operator.isUnary()) {
            return field + " " + operator.sql();
        }
        if (value instanceof Collection<?> c) {
            return field + " " + operator.sql() + " " + c;
        }
        return field + " " + operator.sql() + " " + value;
    }
}
