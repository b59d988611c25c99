package org.kiln.model;

import java.util.Locale;
import java.util.Optional;

public enum OnDeleteAction {
    RESTRICT("RESTRICT"),
    CASCADE("CASCADE"),
    SET_NULL("SET NULL");

    private final String sql;

    OnDeleteAction(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    public static Optional<OnDeleteAction> fromKeyword(String raw) {
        if (raw == null) return Optional.empty();
        String k = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (OnDeleteAction a : values()) {
            if (a.name().equals(k)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
