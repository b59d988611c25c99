package org.kiln.client;

import org.kiln.error.ValidationException;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.FieldType;
import org.kiln.model.SchemaSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Checks a {@link QueryDescription} against the schema and normalizes its values to each
 * field's Java type. Runs before any store round-trip.
 */
public class QueryValidator {
    private final SchemaSnapshot schema;

    public QueryValidator(SchemaSnapshot schema) {
        this.schema = schema;
    }

    /**
     * @return the same query with filter and payload values converted to field types
     * @throws ValidationException on the first problem found
     */
    public QueryDescription validate(QueryDescription query) {
        if (query.getKind() == null) {
            throw new ValidationException(query.getEntity(), null, "Query kind must be set");
        }
        EntityModel entity = requireEntity(query.getEntity());
        Filter filter = validateFilter(entity, query.getFilter());

        Map<String, Object> payload = switch (query.getKind()) {
            case CREATE -> validateCreate(entity, query.getPayload());
            case UPDATE -> validateUpdate(entity, query.getPayload());
            case READ, DELETE, COUNT -> {
                if (!query.getPayload().isEmpty()) {
                    throw new ValidationException(entity.getName(), null, query.getKind() + " takes no payload");
                }
                yield Map.of();
            }
        };

        if (query.getKind() != QueryDescription.Kind.READ) {
            if (!query.getInclude().isEmpty() || !query.getOrderBy().isEmpty()
                    || query.getLimit() != null || query.getOffset() != null) {
                throw new ValidationException(entity.getName(), null,
                        "include, orderBy, limit and offset only apply to reads");
            }
        }
        for (String relation : query.getInclude()) {
            if (entity.findRelation(relation).isEmpty()) {
                throw new ValidationException(entity.getName(), relation,
                        "Unknown relation '" + relation + "' on " + entity.getName());
            }
        }
        for (Order order : query.getOrderBy()) {
            if (order.direction() == null) {
                throw new ValidationException(entity.getName(), order.field(), "Order direction must be set");
            }
            requireField(entity, order.field());
        }
        if (query.getLimit() != null && query.getLimit() < 0) {
            throw new ValidationException(entity.getName(), null, "limit must be >= 0");
        }
        if (query.getOffset() != null && query.getOffset() < 0) {
            throw new ValidationException(entity.getName(), null, "offset must be >= 0");
        }

        return query.toBuilder()
                .filter(filter)
                .payload(payload)
                .include(Collections.unmodifiableSet(new LinkedHashSet<>(query.getInclude())))
                .build();
    }

    public EntityModel requireEntity(String name) {
        return schema.findEntity(name)
                .orElseThrow(() -> new ValidationException(name, null, "Unknown entity '" + name + "'"));
    }

    private Filter validateFilter(EntityModel entity, Filter filter) {
        if (filter == null) return Filter.all();
        List<Condition> out = new ArrayList<>();
        for (Condition c : filter.conditions()) {
            FieldModel field = requireField(entity, c.field());
            out.add(new Condition(c.field(), c.operator(), conditionValue(entity, field, c)));
        }
        return Filter.of(out);
    }

    private Object conditionValue(EntityModel entity, FieldModel field, Condition c) {
        switch (c.operator()) {
            case IS_NULL, NOT_NULL -> {
                if (c.value() != null) {
                    throw new ValidationException(entity.getName(), field.getName(), c.operator() + " takes no value");
                }
                return null;
            }
            case IN -> {
                if (!(c.value() instanceof Collection<?> values) || values.isEmpty()) {
                    throw new ValidationException(entity.getName(), field.getName(), "IN needs a non-empty collection");
                }
                List<Object> coerced = new ArrayList<>();
                for (Object v : values) {
                    if (v == null) {
                        throw new ValidationException(entity.getName(), field.getName(), "IN values must not be null");
                    }
                    coerced.add(coerce(entity, field, v));
                }
                return List.copyOf(coerced);
            }
            case LIKE -> {
                if (field.getType() != FieldType.TEXT || !(c.value() instanceof String)) {
                    throw new ValidationException(entity.getName(), field.getName(), "LIKE needs a text field and a string pattern");
                }
                return c.value();
            }
            default -> {
                if (c.value() == null) {
                    throw new ValidationException(entity.getName(), field.getName(),
                            c.operator() + " with null; use IS_NULL or NOT_NULL");
                }
                return coerce(entity, field, c.value());
            }
        }
    }

    private Map<String, Object> validateCreate(EntityModel entity, Map<String, Object> payload) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : payload.entrySet()) {
            FieldModel field = requirePayloadField(entity, e.getKey());
            if (field.isStoreGenerated() && e.getValue() != null) {
                throw new ValidationException(entity.getName(), field.getName(), "Field is generated by the store");
            }
            if (field.isStoreGenerated()) continue;
            out.put(field.getName(), payloadValue(entity, field, e.getValue()));
        }
        for (FieldModel field : entity.getFields()) {
            if (field.isRequiredOnCreate() && !out.containsKey(field.getName())) {
                throw new ValidationException(entity.getName(), field.getName(),
                        "Missing required field '" + field.getName() + "'");
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private Map<String, Object> validateUpdate(EntityModel entity, Map<String, Object> payload) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : payload.entrySet()) {
            FieldModel field = requirePayloadField(entity, e.getKey());
            if (field.isIdentity()) {
                throw new ValidationException(entity.getName(), field.getName(), "Identity field is not updatable");
            }
            if (field.isStoreGenerated()) {
                throw new ValidationException(entity.getName(), field.getName(), "Field is generated by the store");
            }
            out.put(field.getName(), payloadValue(entity, field, e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    private Object payloadValue(EntityModel entity, FieldModel field, Object value) {
        if (value == null) {
            if (!field.isNullable()) {
                throw new ValidationException(entity.getName(), field.getName(), "Field '" + field.getName() + "' is required");
            }
            return null;
        }
        Object coerced = coerce(entity, field, value);
        if (coerced instanceof String s && s.length() > field.getLength()) {
            throw new ValidationException(entity.getName(), field.getName(),
                    "Value longer than " + field.getLength() + " characters");
        }
        return coerced;
    }

    private FieldModel requirePayloadField(EntityModel entity, String name) {
        if (entity.findField(name).isEmpty() && entity.findRelation(name).isPresent()) {
            throw new ValidationException(entity.getName(), name,
                    "Relation '" + name + "' is set through its foreign key field, not in the payload");
        }
        return requireField(entity, name);
    }

    private static FieldModel requireField(EntityModel entity, String name) {
        return entity.findField(name)
                .orElseThrow(() -> new ValidationException(entity.getName(), name,
                        "Unknown field '" + name + "' on " + entity.getName()));
    }

    private static Object coerce(EntityModel entity, FieldModel field, Object value) {
        try {
            return field.getType().coerce(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(entity.getName(), field.getName(), e.getMessage());
        }
    }
}
