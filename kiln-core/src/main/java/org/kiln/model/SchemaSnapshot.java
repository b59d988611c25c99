package org.kiln.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated set of entities. Entities are keyed by name and iterated in name order.
 * Instances are produced by {@code SchemaParser} or read back from a migration artifact.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SchemaSnapshot {
    @Builder.Default String version = "1";
    @Singular Map<String, EntityModel> entities;

    public static SchemaSnapshot empty() {
        return SchemaSnapshot.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public Optional<EntityModel> findEntity(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(entities.get(name));
    }

    /**
     * @throws IllegalArgumentException when no entity has this name
     */
    public EntityModel requireEntity(String name) {
        return findEntity(name).orElseThrow(() -> new IllegalArgumentException("Unknown entity: " + name));
    }

    @JsonIgnore
    public List<EntityModel> getEntitiesInOrder() {
        return entities.values().stream()
                .sorted(Comparator.comparing(EntityModel::getName))
                .toList();
    }

    /**
     * Foreign keys declared by {@code entity}'s owning relations, in relation name order.
     */
    public List<ForeignKeyModel> foreignKeysOf(EntityModel entity) {
        return entity.getOwningRelations().stream()
                .sorted(Comparator.comparing(RelationModel::getName))
                .map(r -> ForeignKeyModel.of(entity, r, requireEntity(r.getTarget())))
                .toList();
    }

    /**
     * Every foreign key whose referenced entity is {@code targetEntity}.
     */
    public List<ForeignKeyModel> foreignKeysReferencing(String targetEntity) {
        List<ForeignKeyModel> out = new ArrayList<>();
        for (EntityModel e : getEntitiesInOrder()) {
            for (ForeignKeyModel fk : foreignKeysOf(e)) {
                if (fk.referencedEntity().equals(targetEntity)) out.add(fk);
            }
        }
        return out;
    }
}
