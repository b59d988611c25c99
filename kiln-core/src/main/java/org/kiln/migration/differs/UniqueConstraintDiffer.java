package org.kiln.migration.differs;

import org.kiln.model.ConstraintModel;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.SchemaSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table-level composite unique constraints, matched by name. A constraint whose column list
 * changed is dropped and re-added.
 */
public class UniqueConstraintDiffer implements EntityComponentDiffer {

    @Override
    public void diff(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, DiffResult.ModifiedEntity result) {
        Map<String, List<String>> oldConstraints = columnsByName(result.getOldEntity());
        Map<String, List<String>> newConstraints = columnsByName(result.getNewEntity());

        oldConstraints.forEach((name, columns) -> {
            List<String> newColumns = newConstraints.get(name);
            if (newColumns == null || !newColumns.equals(columns)) {
                result.getConstraintDiffs().add(DiffResult.UniqueConstraintDiff.builder()
                        .type(DiffResult.UniqueConstraintDiff.Type.DROPPED)
                        .name(name)
                        .columns(columns)
                        .build());
            }
        });
        newConstraints.forEach((name, columns) -> {
            List<String> oldColumns = oldConstraints.get(name);
            if (oldColumns == null || !oldColumns.equals(columns)) {
                result.getConstraintDiffs().add(DiffResult.UniqueConstraintDiff.builder()
                        .type(DiffResult.UniqueConstraintDiff.Type.ADDED)
                        .name(name)
                        .columns(columns)
                        .build());
            }
        });
    }

    private static Map<String, List<String>> columnsByName(EntityModel entity) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (ConstraintModel c : entity.getConstraints()) {
            out.put(c.getName(), c.getFields().stream()
                    .map(f -> entity.findField(f).map(FieldModel::getColumnName).orElse(f))
                    .toList());
        }
        return out;
    }
}
