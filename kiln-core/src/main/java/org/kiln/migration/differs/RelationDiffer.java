package org.kiln.migration.differs;

import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.ForeignKeyModel;
import org.kiln.model.SchemaSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compares the foreign keys declared by owning relations. A foreign key is re-created when
 * its definition changes or when the type of either of its columns changes, since most
 * stores refuse to alter a column that takes part in a foreign key.
 */
public class RelationDiffer implements EntityComponentDiffer {

    @Override
    public void diff(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, DiffResult.ModifiedEntity result) {
        Map<String, ForeignKeyModel> oldKeys = byName(oldSchema, result.getOldEntity());
        Map<String, ForeignKeyModel> newKeys = byName(newSchema, result.getNewEntity());

        oldKeys.forEach((name, oldFk) -> {
            ForeignKeyModel newFk = newKeys.get(name);
            if (newFk == null) {
                result.getRelationDiffs().add(DiffResult.RelationDiff.builder()
                        .type(DiffResult.RelationDiff.Type.DROPPED)
                        .foreignKey(oldFk)
                        .build());
            } else if (!newFk.equals(oldFk) || columnsRetyped(oldSchema, newSchema, oldFk)) {
                result.getRelationDiffs().add(DiffResult.RelationDiff.builder()
                        .type(DiffResult.RelationDiff.Type.DROPPED)
                        .foreignKey(oldFk)
                        .changeDetail("re-created")
                        .build());
                result.getRelationDiffs().add(DiffResult.RelationDiff.builder()
                        .type(DiffResult.RelationDiff.Type.ADDED)
                        .foreignKey(newFk)
                        .changeDetail("re-created")
                        .build());
            }
        });
        newKeys.forEach((name, newFk) -> {
            if (!oldKeys.containsKey(name)) {
                result.getRelationDiffs().add(DiffResult.RelationDiff.builder()
                        .type(DiffResult.RelationDiff.Type.ADDED)
                        .foreignKey(newFk)
                        .build());
            }
        });
    }

    private static Map<String, ForeignKeyModel> byName(SchemaSnapshot schema, EntityModel entity) {
        Map<String, ForeignKeyModel> out = new LinkedHashMap<>();
        schema.foreignKeysOf(entity).forEach(fk -> out.put(fk.name(), fk));
        return out;
    }

    private static boolean columnsRetyped(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, ForeignKeyModel fk) {
        return retyped(oldSchema, newSchema, fk.entity(), fk.column())
                || retyped(oldSchema, newSchema, fk.referencedEntity(), fk.referencedColumn());
    }

    private static boolean retyped(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, String entity, String column) {
        FieldModel before = oldSchema.findEntity(entity).flatMap(e -> e.findFieldByColumn(column)).orElse(null);
        FieldModel after = newSchema.findEntity(entity).flatMap(e -> e.findFieldByColumn(column)).orElse(null);
        if (before == null || after == null) return false;
        return before.getType() != after.getType()
                || before.getLength() != after.getLength()
                || before.isNullable() != after.isNullable()
                || !Objects.equals(before.getName(), after.getName());
    }
}
