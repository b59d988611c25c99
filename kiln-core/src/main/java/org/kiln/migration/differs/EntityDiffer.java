package org.kiln.migration.differs;

import org.kiln.model.EntityModel;
import org.kiln.model.SchemaSnapshot;

import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Entity-level set difference by name. An entity whose physical table changed is treated
 * as dropped and re-created.
 */
public class EntityDiffer implements Differ {

    @Override
    public void diff(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, DiffResult result) {
        var oldEntities = Optional.ofNullable(oldSchema.getEntities()).orElseGet(Map::of);
        var newEntities = Optional.ofNullable(newSchema.getEntities()).orElseGet(Map::of);

        var names = new TreeSet<String>();
        names.addAll(oldEntities.keySet());
        names.addAll(newEntities.keySet());

        for (String name : names) {
            EntityModel oldEntity = oldEntities.get(name);
            EntityModel newEntity = newEntities.get(name);

            boolean tableChanged = oldEntity != null && newEntity != null
                    && !oldEntity.getTableName().equals(newEntity.getTableName());
            if (tableChanged) {
                result.getWarnings().add("Table of entity " + name + " changed from " + oldEntity.getTableName()
                        + " to " + newEntity.getTableName() + "; it is dropped and re-created");
            }

            if (oldEntity != null && (newEntity == null || tableChanged)) {
                result.getDroppedEntities().add(oldEntity);
                result.getDroppedForeignKeys().addAll(oldSchema.foreignKeysOf(oldEntity));
            }
            if (newEntity != null && (oldEntity == null || tableChanged)) {
                result.getAddedEntities().add(newEntity);
                result.getAddedForeignKeys().addAll(newSchema.foreignKeysOf(newEntity));
            }
        }
    }
}
