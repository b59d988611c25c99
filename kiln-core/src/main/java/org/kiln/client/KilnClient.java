package org.kiln.client;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.kiln.error.ConstraintException;
import org.kiln.error.KilnException;
import org.kiln.model.ConstraintModel;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.ForeignKeyModel;
import org.kiln.model.SchemaSnapshot;
import org.kiln.store.JdbcStore;
import org.kiln.store.SqlErrorTranslator;

import java.sql.SQLException;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for record access. Holds the schema and the store it talks to; no per-call
 * state, so one instance can serve many threads.
 *
 * <pre>{@code
 * KilnClient client = new KilnClient(schema, store);
 * EntityRecord user = client.entity("User").create(Map.of("email", "a@example.com"));
 * }</pre>
 */
@Slf4j
@Getter
public class KilnClient {
    private final SchemaSnapshot schema;
    private final JdbcStore store;
    private final Clock clock;

    @Getter(AccessLevel.NONE)
    private final QueryValidator validator;
    @Getter(AccessLevel.NONE)
    private final QueryCompiler compiler;
    @Getter(AccessLevel.NONE)
    private final RecordMapper mapper;
    @Getter(AccessLevel.NONE)
    private final RelationLoader relationLoader;
    @Getter(AccessLevel.NONE)
    private final Map<String, ConstraintOwner> constraintOwners;

    record ConstraintOwner(String entity, String field) {}

    public KilnClient(SchemaSnapshot schema, JdbcStore store) {
        this(schema, store, Clock.systemDefaultZone());
    }

    public KilnClient(SchemaSnapshot schema, JdbcStore store, Clock clock) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.validator = new QueryValidator(schema);
        this.compiler = new QueryCompiler(store.getDialect());
        this.mapper = new RecordMapper();
        this.relationLoader = new RelationLoader(schema, compiler, mapper);
        this.constraintOwners = indexConstraints(schema);
    }

    /**
     * @throws org.kiln.error.ValidationException for an unknown entity name
     */
    public EntityClient entity(String name) {
        return new EntityClient(this, validator.requireEntity(name));
    }

    QueryValidator validator() {
        return validator;
    }

    QueryCompiler compiler() {
        return compiler;
    }

    RecordMapper mapper() {
        return mapper;
    }

    RelationLoader relationLoader() {
        return relationLoader;
    }

    /**
     * Store errors as client exceptions. Constraint violations name the entity and field
     * owning the violated constraint when the store's message mentions it.
     */
    RuntimeException translate(SQLException e, String entity, Map<String, Object> values) {
        if (SqlErrorTranslator.classify(e) == SqlErrorTranslator.Category.CONSTRAINT_VIOLATION) {
            Optional<String> name = SqlErrorTranslator.findConstraintName(e, constraintOwners.keySet());
            if (name.isPresent()) {
                ConstraintOwner owner = constraintOwners.get(name.get());
                Object value = owner.entity().equals(entity) && owner.field() != null ? values.get(owner.field()) : null;
                return new ConstraintException(owner.entity(), owner.field(), value, name.get(),
                        "Constraint " + name.get() + " violated on " + owner.entity()
                                + (owner.field() == null ? "" : "." + owner.field()), e);
            }
            return new ConstraintException(entity, null, null, null, "Constraint violated on " + entity + ": " + e.getMessage(), e);
        }
        return new KilnException("Store operation on " + entity + " failed: " + e.getMessage(), e);
    }

    private static Map<String, ConstraintOwner> indexConstraints(SchemaSnapshot schema) {
        Map<String, ConstraintOwner> out = new HashMap<>();
        for (EntityModel e : schema.getEntitiesInOrder()) {
            for (FieldModel f : e.getFields()) {
                if (f.getUniqueConstraintName() != null) {
                    out.put(f.getUniqueConstraintName(), new ConstraintOwner(e.getName(), f.getName()));
                }
            }
            for (ConstraintModel c : e.getConstraints()) {
                out.put(c.getName(), new ConstraintOwner(e.getName(), String.join(",", c.getFields())));
            }
            for (ForeignKeyModel fk : schema.foreignKeysOf(e)) {
                e.findFieldByColumn(fk.column())
                        .ifPresent(f -> out.put(fk.name(), new ConstraintOwner(e.getName(), f.getName())));
            }
        }
        return out;
    }
}
