package org.kiln.client;

import lombok.extern.slf4j.Slf4j;
import org.kiln.model.Cardinality;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.RelationModel;
import org.kiln.model.SchemaSnapshot;
import org.kiln.store.StoreSession;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attaches included relations to already-read records. Each included relation costs exactly
 * one {@code IN} query for all parents together, never one query per parent.
 */
@Slf4j
public class RelationLoader {
    private final SchemaSnapshot schema;
    private final QueryCompiler compiler;
    private final RecordMapper mapper;

    public RelationLoader(SchemaSnapshot schema, QueryCompiler compiler, RecordMapper mapper) {
        this.schema = schema;
        this.compiler = compiler;
        this.mapper = mapper;
    }

    public List<EntityRecord> load(StoreSession session, EntityModel entity, List<EntityRecord> parents,
                                   Collection<String> include) throws SQLException {
        List<EntityRecord> out = parents;
        for (String name : include) {
            RelationModel relation = entity.findRelation(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown relation " + entity.getName() + "." + name));
            out = relation.isOwning()
                    ? loadOwning(session, entity, relation, out)
                    : loadInverse(session, entity, relation, out);
        }
        return out;
    }

    // parent holds the foreign key: one target per parent
    private List<EntityRecord> loadOwning(StoreSession session, EntityModel entity, RelationModel relation,
                                          List<EntityRecord> parents) throws SQLException {
        EntityModel target = schema.requireEntity(relation.getTarget());
        FieldModel fkField = requireField(entity, relation.getForeignKey());
        FieldModel refField = relation.getReferences() == null
                ? target.getIdentityField()
                : requireField(target, relation.getReferences());

        Set<Object> keys = new LinkedHashSet<>();
        for (EntityRecord p : parents) {
            Object v = p.get(fkField.getName());
            if (v != null) keys.add(v);
        }
        Map<Object, EntityRecord> byKey = new LinkedHashMap<>();
        for (EntityRecord r : fetch(session, target, refField, keys)) {
            byKey.put(key(r.get(refField.getName())), r);
        }
        List<EntityRecord> out = new ArrayList<>(parents.size());
        for (EntityRecord p : parents) {
            Object v = p.get(fkField.getName());
            out.add(p.withOne(relation.getName(), v == null ? null : byKey.get(key(v))));
        }
        return out;
    }

    // target holds the foreign key: a list (one-to-many) or at most one record (one-to-one)
    private List<EntityRecord> loadInverse(StoreSession session, EntityModel entity, RelationModel relation,
                                           List<EntityRecord> parents) throws SQLException {
        EntityModel target = schema.requireEntity(relation.getTarget());
        RelationModel owning = target.findRelation(relation.getMappedBy())
                .orElseThrow(() -> new IllegalStateException("Unknown mappedBy " + target.getName() + "." + relation.getMappedBy()));
        FieldModel childFk = requireField(target, owning.getForeignKey());
        FieldModel parentKey = owning.getReferences() == null
                ? entity.getIdentityField()
                : requireField(entity, owning.getReferences());

        Set<Object> keys = new LinkedHashSet<>();
        for (EntityRecord p : parents) {
            Object v = p.get(parentKey.getName());
            if (v != null) keys.add(v);
        }
        Map<Object, List<EntityRecord>> byKey = new LinkedHashMap<>();
        for (EntityRecord r : fetch(session, target, childFk, keys)) {
            byKey.computeIfAbsent(key(r.get(childFk.getName())), k -> new ArrayList<>()).add(r);
        }
        List<EntityRecord> out = new ArrayList<>(parents.size());
        for (EntityRecord p : parents) {
            Object v = p.get(parentKey.getName());
            List<EntityRecord> children = v == null ? List.of() : byKey.getOrDefault(key(v), List.of());
            if (owning.getCardinality() == Cardinality.ONE_TO_ONE) {
                out.add(p.withOne(relation.getName(), children.isEmpty() ? null : children.get(0)));
            } else {
                out.add(p.withMany(relation.getName(), children));
            }
        }
        return out;
    }

    private List<EntityRecord> fetch(StoreSession session, EntityModel target, FieldModel keyField,
                                     Set<Object> keys) throws SQLException {
        if (keys.isEmpty()) {
            return List.of();
        }
        CompiledStatement stmt = compiler.selectIn(target, keyField, keys);
        log.debug("Loading {} by {} for {} key(s)", target.getName(), keyField.getName(), keys.size());
        return session.query(stmt.sql(), stmt.parameters(), rs -> mapper.map(rs, target));
    }

    /**
     * Integral keys compare by value regardless of their boxed width.
     */
    static Object key(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger bi) return bi.longValue();
        if (value instanceof BigDecimal bd) return bd.stripTrailingZeros();
        return value;
    }

    private static FieldModel requireField(EntityModel entity, String name) {
        return entity.findField(name)
                .orElseThrow(() -> new IllegalStateException("Unknown field " + entity.getName() + "." + name));
    }
}
