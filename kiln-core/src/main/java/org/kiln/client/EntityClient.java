package org.kiln.client;

import lombok.extern.slf4j.Slf4j;
import org.kiln.error.ConstraintException;
import org.kiln.error.KilnException;
import org.kiln.error.NotFoundException;
import org.kiln.error.ValidationException;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldDefault;
import org.kiln.model.FieldModel;
import org.kiln.model.FieldType;
import org.kiln.model.ForeignKeyModel;
import org.kiln.model.OnDeleteAction;
import org.kiln.store.StoreSession;

import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD for one entity. Every call validates first and only then talks to the store; each
 * write runs in its own transaction.
 */
@Slf4j
public class EntityClient {
    private final KilnClient client;
    private final EntityModel entity;

    EntityClient(KilnClient client, EntityModel entity) {
        this.client = client;
        this.entity = entity;
    }

    public EntityModel getEntity() {
        return entity;
    }

    /**
     * Inserts a record and returns it as stored, including generated and defaulted values.
     */
    public EntityRecord create(Map<String, Object> payload) {
        QueryDescription query = client.validator().validate(describe(QueryDescription.Kind.CREATE)
                .payload(copy(payload))
                .build());
        Map<String, Object> values = generate(query.getPayload(), true);
        FieldModel identity = entity.getIdentityField();
        try {
            return client.getStore().inTransaction(session -> {
                CompiledStatement insert = client.compiler().insert(entity, values);
                Object key = session.insert(insert.sql(), insert.parameters());
                Object id = values.containsKey(identity.getName()) ? values.get(identity.getName()) : identityValue(identity, key);
                if (id == null) {
                    throw new KilnException("Store returned no key for new " + entity.getName());
                }
                return findById(session, id)
                        .orElseThrow(() -> new KilnException("New " + entity.getName() + " " + id + " could not be read back"));
            });
        } catch (SQLException e) {
            throw client.translate(e, entity.getName(), values);
        }
    }

    public List<EntityRecord> read(Filter filter, String... include) {
        return read(ReadQuery.builder().filter(filter).includes(Arrays.asList(include)).build());
    }

    public List<EntityRecord> read(ReadQuery read) {
        QueryDescription query = client.validator().validate(describe(QueryDescription.Kind.READ)
                .filter(read.getFilter())
                .include(read.getIncludes())
                .orderBy(read.getOrderBy())
                .limit(read.getLimit())
                .offset(read.getOffset())
                .build());
        try {
            return client.getStore().inTransaction(session -> {
                CompiledStatement select = client.compiler().compile(entity, query);
                List<EntityRecord> rows = session.query(select.sql(), select.parameters(), rs -> client.mapper().map(rs, entity));
                return client.relationLoader().load(session, entity, rows, query.getInclude());
            });
        } catch (SQLException e) {
            throw client.translate(e, entity.getName(), Map.of());
        }
    }

    /**
     * Direct lookup by identity.
     */
    public Optional<EntityRecord> findUnique(Object id, String... include) {
        List<EntityRecord> found = read(Filter.eq(entity.getIdentityField().getName(), id), include);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public long count(Filter filter) {
        QueryDescription query = client.validator().validate(describe(QueryDescription.Kind.COUNT).filter(filter).build());
        try {
            return client.getStore().withSession(session -> count(session, client.compiler().compile(entity, query)));
        } catch (SQLException e) {
            throw client.translate(e, entity.getName(), Map.of());
        }
    }

    /**
     * Updates the single record {@code filter} addresses. {@code ON_UPDATE} fields are
     * recomputed even when the payload is empty.
     *
     * @throws NotFoundException   when nothing matches
     * @throws ValidationException when more than one record matches, or the payload is invalid
     */
    public EntityRecord update(Filter filter, Map<String, Object> payload) {
        QueryDescription query = client.validator().validate(describe(QueryDescription.Kind.UPDATE)
                .filter(filter)
                .payload(copy(payload))
                .build());
        Map<String, Object> values = generate(query.getPayload(), false);
        try {
            return client.getStore().inTransaction(session -> {
                EntityRecord target = locateOne(session, query.getFilter());
                Object id = target.get(entity.getIdentityField().getName());
                if (!values.isEmpty()) {
                    CompiledStatement update = client.compiler().updateById(entity, values, id);
                    session.update(update.sql(), update.parameters());
                }
                return findById(session, id).orElseThrow(() -> new NotFoundException(entity.getName(), query.getFilter().toString()));
            });
        } catch (SQLException e) {
            throw client.translate(e, entity.getName(), values);
        }
    }

    /**
     * Deletes the single record {@code filter} addresses and returns it.
     *
     * @throws ConstraintException when a {@code RESTRICT} relation still references it
     */
    public EntityRecord delete(Filter filter) {
        QueryDescription query = client.validator().validate(describe(QueryDescription.Kind.DELETE).filter(filter).build());
        try {
            return client.getStore().inTransaction(session -> {
                EntityRecord target = locateOne(session, query.getFilter());
                checkRestrictingReferences(session, target);
                CompiledStatement delete = client.compiler().deleteById(entity, target.get(entity.getIdentityField().getName()));
                session.update(delete.sql(), delete.parameters());
                return target;
            });
        } catch (SQLException e) {
            throw client.translate(e, entity.getName(), Map.of());
        }
    }

    private void checkRestrictingReferences(StoreSession session, EntityRecord target) throws SQLException {
        for (ForeignKeyModel fk : client.getSchema().foreignKeysReferencing(entity.getName())) {
            if (fk.onDelete() != OnDeleteAction.RESTRICT) continue;
            FieldModel referenced = entity.findFieldByColumn(fk.referencedColumn())
                    .orElseThrow(() -> new IllegalStateException("Unknown referenced column " + fk.referencedColumn()));
            Object value = target.get(referenced.getName());
            if (value == null) continue;
            long references = count(session, client.compiler().countReferences(fk, value));
            if (fk.entity().equals(entity.getName()) && referencesItself(fk, target, value)) {
                references--;
            }
            if (references > 0) {
                throw new ConstraintException(entity.getName(), referenced.getName(), value, fk.name(),
                        references + " " + fk.entity() + " record(s) still reference this " + entity.getName()
                                + " through '" + fk.relation() + "' (ON DELETE RESTRICT)");
            }
        }
    }

    private boolean referencesItself(ForeignKeyModel fk, EntityRecord target, Object value) {
        return entity.findFieldByColumn(fk.column())
                .map(f -> target.get(f.getName()))
                .map(v -> RelationLoader.key(v).equals(RelationLoader.key(value)))
                .orElse(false);
    }

    private EntityRecord locateOne(StoreSession session, Filter filter) throws SQLException {
        CompiledStatement select = client.compiler().select(entity, filter, List.of(), 2, null);
        List<EntityRecord> found = session.query(select.sql(), select.parameters(), rs -> client.mapper().map(rs, entity));
        if (found.isEmpty()) {
            throw new NotFoundException(entity.getName(), filter.toString());
        }
        if (found.size() > 1) {
            throw new ValidationException(entity.getName(), null,
                    "Filter " + filter + " matches more than one " + entity.getName());
        }
        return found.get(0);
    }

    private Optional<EntityRecord> findById(StoreSession session, Object id) throws SQLException {
        CompiledStatement select = client.compiler().select(entity, Filter.eq(entity.getIdentityField().getName(), id),
                List.of(), null, null);
        List<EntityRecord> found = session.query(select.sql(), select.parameters(), rs -> client.mapper().map(rs, entity));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private static long count(StoreSession session, CompiledStatement stmt) throws SQLException {
        List<Long> rows = session.query(stmt.sql(), stmt.parameters(), rs -> rs.getLong(1));
        return rows.isEmpty() ? 0 : rows.get(0);
    }

    /**
     * Adds client-side generated values. On create, {@code ON_CREATE} and {@code ON_UPDATE}
     * generators fill fields the payload left out; on update, {@code ON_UPDATE} fields are
     * always recomputed.
     */
    private Map<String, Object> generate(Map<String, Object> payload, boolean creating) {
        Map<String, Object> out = new LinkedHashMap<>(payload);
        for (FieldModel f : entity.getFields()) {
            FieldDefault d = f.getDefaultValue();
            if (!d.isClientGenerated()) continue;
            if (creating && !out.containsKey(f.getName())) {
                out.put(f.getName(), generatedValue(f));
            } else if (!creating && d.getKind() == FieldDefault.Kind.ON_UPDATE) {
                out.put(f.getName(), generatedValue(f));
            }
        }
        return out;
    }

    private Object generatedValue(FieldModel field) {
        return switch (field.getDefaultValue().getGenerator()) {
            case NOW -> field.getType() == FieldType.DATE
                    ? LocalDate.now(client.getClock())
                    : LocalDateTime.now(client.getClock()).truncatedTo(ChronoUnit.MICROS);
            case UUID -> UUID.randomUUID().toString();
            case AUTOINCREMENT -> throw new IllegalStateException("Store-generated field " + field.getName());
        };
    }

    private static Object identityValue(FieldModel identity, Object key) {
        if (key instanceof Number n && identity.getType() == FieldType.INTEGER) return n.intValue();
        if (key instanceof Number n && identity.getType() == FieldType.BIGINT) return n.longValue();
        return identity.getType().coerce(key);
    }

    private QueryDescription.QueryDescriptionBuilder describe(QueryDescription.Kind kind) {
        return QueryDescription.builder().entity(entity.getName()).kind(kind);
    }

    private static Map<String, Object> copy(Map<String, Object> payload) {
        return payload == null ? Map.of() : new LinkedHashMap<>(payload);
    }
}
