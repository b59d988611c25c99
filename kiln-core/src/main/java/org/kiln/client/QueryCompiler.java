package org.kiln.client;

import org.kiln.migration.spi.dialect.DdlDialect;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.ForeignKeyModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns validated queries into parameterised SQL for one dialect. Values never appear in
 * the SQL text.
 */
public class QueryCompiler {
    private final DdlDialect dialect;

    public QueryCompiler(DdlDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Compiles a validated {@link QueryDescription.Kind#READ}, {@link QueryDescription.Kind#COUNT}
     * or {@link QueryDescription.Kind#CREATE} query.
     */
    public CompiledStatement compile(EntityModel entity, QueryDescription query) {
        return switch (query.getKind()) {
            case READ -> select(entity, query.getFilter(), query.getOrderBy(), query.getLimit(), query.getOffset());
            case COUNT -> count(entity, query.getFilter());
            case CREATE -> insert(entity, query.getPayload());
            case UPDATE, DELETE -> throw new IllegalArgumentException(
                    query.getKind() + " is compiled against a located identity, see updateById/deleteById");
        };
    }

    public CompiledStatement select(EntityModel entity, Filter filter, List<Order> orderBy, Integer limit, Integer offset) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(selectList(entity))
                .append(" FROM ").append(dialect.quoteIdentifier(entity.getTableName()));
        appendWhere(sql, params, entity, filter);
        FieldModel identity = entity.getIdentityField();
        if (!filter.isLookupBy(identity.getName())) {
            sql.append(" ORDER BY ");
            if (orderBy.isEmpty()) {
                sql.append(column(identity));
            } else {
                sql.append(orderBy.stream()
                        .map(o -> column(field(entity, o.field())) + " " + o.direction().name())
                        .collect(Collectors.joining(", ")));
            }
        }
        sql.append(dialect.getLimitOffsetSql(limit, offset));
        return new CompiledStatement(sql.toString(), params);
    }

    public CompiledStatement count(EntityModel entity, Filter filter) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(dialect.quoteIdentifier(entity.getTableName()));
        appendWhere(sql, params, entity, filter);
        return new CompiledStatement(sql.toString(), params);
    }

    /**
     * @param values field name to value; fields not present get the column's store default
     */
    public CompiledStatement insert(EntityModel entity, Map<String, Object> values) {
        String table = dialect.quoteIdentifier(entity.getTableName());
        if (values.isEmpty()) {
            return new CompiledStatement("INSERT INTO " + table + " (" + column(entity.getIdentityField()) + ") VALUES (DEFAULT)", List.of());
        }
        List<String> columns = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (FieldModel f : entity.getFields()) {
            if (values.containsKey(f.getName())) {
                columns.add(column(f));
                params.add(values.get(f.getName()));
            }
        }
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return new CompiledStatement("INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")", params);
    }

    public CompiledStatement updateById(EntityModel entity, Map<String, Object> values, Object id) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Nothing to update on " + entity.getName());
        }
        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (FieldModel f : entity.getFields()) {
            if (values.containsKey(f.getName())) {
                assignments.add(column(f) + " = ?");
                params.add(values.get(f.getName()));
            }
        }
        params.add(id);
        return new CompiledStatement("UPDATE " + dialect.quoteIdentifier(entity.getTableName())
                + " SET " + String.join(", ", assignments)
                + " WHERE " + column(entity.getIdentityField()) + " = ?", params);
    }

    public CompiledStatement deleteById(EntityModel entity, Object id) {
        return new CompiledStatement("DELETE FROM " + dialect.quoteIdentifier(entity.getTableName())
                + " WHERE " + column(entity.getIdentityField()) + " = ?", List.of(id));
    }

    /**
     * All records of {@code entity} whose {@code keyField} is one of {@code keys}.
     */
    public CompiledStatement selectIn(EntityModel entity, FieldModel keyField, Collection<?> keys) {
        String placeholders = keys.stream().map(k -> "?").collect(Collectors.joining(", "));
        return new CompiledStatement("SELECT " + selectList(entity)
                + " FROM " + dialect.quoteIdentifier(entity.getTableName())
                + " WHERE " + column(keyField) + " IN (" + placeholders + ")"
                + " ORDER BY " + column(entity.getIdentityField()), new ArrayList<>(keys));
    }

    /**
     * Number of rows on the owning side of {@code fk} that point at {@code value}.
     */
    public CompiledStatement countReferences(ForeignKeyModel fk, Object value) {
        return new CompiledStatement("SELECT COUNT(*) FROM " + dialect.quoteIdentifier(fk.table())
                + " WHERE " + dialect.quoteIdentifier(fk.column()) + " = ?", List.of(value));
    }

    private void appendWhere(StringBuilder sql, List<Object> params, EntityModel entity, Filter filter) {
        if (filter.isEmpty()) return;
        List<String> parts = new ArrayList<>();
        for (Condition c : filter.conditions()) {
            String col = column(field(entity, c.field()));
            switch (c.operator()) {
                case IS_NULL, NOT_NULL -> parts.add(col + " " + c.operator().sql());
                case IN -> {
                    Collection<?> values = (Collection<?>) c.value();
                    parts.add(col + " IN (" + values.stream().map(v -> "?").collect(Collectors.joining(", ")) + ")");
                    params.addAll(values);
                }
                default -> {
                    parts.add(col + " " + c.operator().sql() + " ?");
                    params.add(c.value());
                }
            }
        }
        sql.append(" WHERE ").append(String.join(" AND ", parts));
    }

    private String selectList(EntityModel entity) {
        return entity.getFields().stream().map(this::column).collect(Collectors.joining(", "));
    }

    private String column(FieldModel field) {
        return dialect.quoteIdentifier(field.getColumnName());
    }

    private static FieldModel field(EntityModel entity, String name) {
        return entity.findField(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown field " + entity.getName() + "." + name));
    }
}
