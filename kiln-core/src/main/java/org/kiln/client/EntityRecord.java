package org.kiln.client;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row of an entity, plus any relations that were included in the read. Immutable.
 */
@EqualsAndHashCode
public final class EntityRecord {
    private final String entity;
    private final Map<String, Object> values;
    // included relations, keyed by relation name; a to-one value may be null
    private final Map<String, EntityRecord> toOne;
    private final Map<String, List<EntityRecord>> toMany;

    public EntityRecord(String entity, Map<String, Object> values) {
        this(entity, values, Map.of(), Map.of());
    }

    private EntityRecord(String entity, Map<String, Object> values,
                         Map<String, EntityRecord> toOne, Map<String, List<EntityRecord>> toMany) {
        this.entity = entity;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.toOne = Collections.unmodifiableMap(new LinkedHashMap<>(toOne));
        this.toMany = Collections.unmodifiableMap(new LinkedHashMap<>(toMany));
    }

    public String getEntity() {
        return entity;
    }

    /**
     * Field values by field name, in field declaration order.
     */
    public Map<String, Object> getValues() {
        return values;
    }

    public Object get(String field) {
        if (!values.containsKey(field)) {
            throw new IllegalArgumentException("No field '" + field + "' on " + entity);
        }
        return values.get(field);
    }

    public <T> T get(String field, Class<T> type) {
        return type.cast(get(field));
    }

    public boolean hasRelation(String relation) {
        return toOne.containsKey(relation) || toMany.containsKey(relation);
    }

    /**
     * A to-one relation that was included in the read.
     */
    public Optional<EntityRecord> getOne(String relation) {
        requireIncluded(relation);
        if (toMany.containsKey(relation)) {
            throw new IllegalArgumentException("Relation '" + relation + "' of " + entity + " is a collection");
        }
        return Optional.ofNullable(toOne.get(relation));
    }

    /**
     * A to-many relation that was included in the read.
     */
    public List<EntityRecord> getMany(String relation) {
        requireIncluded(relation);
        if (toOne.containsKey(relation)) {
            throw new IllegalArgumentException("Relation '" + relation + "' of " + entity + " is not a collection");
        }
        return toMany.get(relation);
    }

    EntityRecord withOne(String relation, EntityRecord related) {
        Map<String, EntityRecord> next = new LinkedHashMap<>(toOne);
        next.put(relation, related);
        return new EntityRecord(entity, values, next, toMany);
    }

    EntityRecord withMany(String relation, List<EntityRecord> related) {
        Map<String, List<EntityRecord>> next = new LinkedHashMap<>(toMany);
        next.put(relation, List.copyOf(related));
        return new EntityRecord(entity, values, toOne, next);
    }

    private void requireIncluded(String relation) {
        if (!hasRelation(relation)) {
            throw new IllegalArgumentException("Relation '" + relation + "' of " + entity + " was not included");
        }
    }

    @Override
    public String toString() {
        if (toOne.isEmpty() && toMany.isEmpty()) return entity + values;
        List<String> included = new ArrayList<>(toOne.keySet());
        included.addAll(toMany.keySet());
        return entity + values + " with " + included;
    }
}
