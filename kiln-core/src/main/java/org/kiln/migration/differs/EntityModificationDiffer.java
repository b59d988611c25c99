package org.kiln.migration.differs;

import org.kiln.error.KilnException;
import org.kiln.model.EntityModel;
import org.kiln.model.SchemaSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs the component differs for every entity present in both snapshots with the same
 * physical table. Relation constraints are compared after fields.
 */
public class EntityModificationDiffer implements Differ {
    private final List<EntityComponentDiffer> componentDiffers;

    public EntityModificationDiffer() {
        this(List.of(
                new FieldDiffer(),
                new UniqueConstraintDiffer(),
                new RelationDiffer()
        ));
    }

    public EntityModificationDiffer(List<EntityComponentDiffer> componentDiffers) {
        this.componentDiffers = List.copyOf(componentDiffers);
    }

    @Override
    public void diff(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, DiffResult result) {
        var oldEntities = Optional.ofNullable(oldSchema.getEntities()).orElseGet(Map::of);
        var newEntities = new TreeMap<>(Optional.ofNullable(newSchema.getEntities()).orElseGet(Map::of));

        newEntities.forEach((name, newEntity) -> {
            EntityModel oldEntity = oldEntities.get(name);
            if (oldEntity == null || !oldEntity.getTableName().equals(newEntity.getTableName())) return;

            var modified = compareEntities(oldSchema, newSchema, oldEntity, newEntity);
            if (modified.isModified()) {
                result.getModifiedEntities().add(modified);
            }
        });
    }

    private DiffResult.ModifiedEntity compareEntities(SchemaSnapshot oldSchema, SchemaSnapshot newSchema,
                                                      EntityModel oldEntity, EntityModel newEntity) {
        var modified = DiffResult.ModifiedEntity.builder()
                .oldEntity(oldEntity)
                .newEntity(newEntity)
                .build();

        for (EntityComponentDiffer differ : componentDiffers) {
            try {
                differ.diff(oldSchema, newSchema, modified);
            } catch (RuntimeException e) {
                throw new KilnException("Differ failed: " + differ.getClass().getSimpleName()
                        + " on entity " + newEntity.getName() + " - " + e.getMessage(), e);
            }
        }
        return modified;
    }
}
