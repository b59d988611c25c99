package org.kiln.client;

public enum Operator {
    EQ("="),
    NE("<>"),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    IN("IN"),
    IS_NULL("IS NULL"),
    NOT_NULL("IS NOT NULL"),
    LIKE("LIKE");

    private final String sql;

    Operator(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    /**
     * Whether the operator takes no value.
     */
    public boolean isUnary() {
        return this == IS_NULL || this == NOT_NULL;
    }
}
