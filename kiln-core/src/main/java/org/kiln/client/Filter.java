package org.kiln.client;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conjunction of conditions. Immutable; {@link #and} returns a new filter.
 */
public final class Filter {
    private static final Filter ALL = new Filter(List.of());

    private final List<Condition> conditions;

    private Filter(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    /** Matches every record. */
    public static Filter all() {
        return ALL;
    }

    public static Filter of(List<Condition> conditions) {
        return new Filter(conditions);
    }

    public static Filter where(String field, Operator operator, Object value) {
        return ALL.and(field, operator, value);
    }

    public static Filter eq(String field, Object value) {
        return where(field, Operator.EQ, value);
    }

    public static Filter isNull(String field) {
        return where(field, Operator.IS_NULL, null);
    }

    public Filter and(String field, Operator operator, Object value) {
        List<Condition> next = new ArrayList<>(conditions);
        next.add(new Condition(field, operator, value));
        return new Filter(next);
    }

    public Filter and(Condition condition) {
        List<Condition> next = new ArrayList<>(conditions);
        next.add(condition);
        return new Filter(next);
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Whether this filter is exactly {@code identityField = value}.
     */
    public boolean isLookupBy(String identityField) {
        return conditions.size() == 1
                && conditions.get(0).operator() == Operator.EQ
                && conditions.get(0).field().equals(identityField);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Filter f && f.conditions.equals(conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        if (conditions.isEmpty()) return "(all)";
        return conditions.stream().map(Condition::toString).collect(Collectors.joining(" AND "));
    }
}
