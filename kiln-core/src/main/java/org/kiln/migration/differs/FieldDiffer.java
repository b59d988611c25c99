package org.kiln.migration.differs;

import org.kiln.migration.operation.AlterField;
import org.kiln.model.FieldModel;
import org.kiln.model.SchemaSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

public class FieldDiffer implements EntityComponentDiffer {

    @Override
    public void diff(SchemaSnapshot oldSchema, SchemaSnapshot newSchema, DiffResult.ModifiedEntity result) {
        Map<String, FieldModel> oldFields = index(result.getOldEntity().getFields());
        Map<String, FieldModel> newFields = index(result.getNewEntity().getFields());

        for (FieldModel newField : newFields.values()) {
            FieldModel oldField = oldFields.get(newField.getName());
            if (oldField == null) {
                result.getFieldDiffs().add(DiffResult.FieldDiff.builder()
                        .type(DiffResult.FieldDiff.Type.ADDED)
                        .field(newField)
                        .build());
            } else if (!oldField.getColumnName().equals(newField.getColumnName())) {
                // 컬럼명 변경은 drop + add
                result.getFieldDiffs().add(DiffResult.FieldDiff.builder()
                        .type(DiffResult.FieldDiff.Type.DROPPED)
                        .field(oldField)
                        .build());
                result.getFieldDiffs().add(DiffResult.FieldDiff.builder()
                        .type(DiffResult.FieldDiff.Type.ADDED)
                        .field(newField)
                        .changeDetail("Column changed from " + oldField.getColumnName() + " to " + newField.getColumnName())
                        .build());
            } else {
                var aspects = AlterField.aspectsBetween(oldField, newField);
                if (!aspects.isEmpty()) {
                    result.getFieldDiffs().add(DiffResult.FieldDiff.builder()
                            .type(DiffResult.FieldDiff.Type.MODIFIED)
                            .field(newField)
                            .oldField(oldField)
                            .changeDetail(aspects.toString())
                            .build());
                }
            }
        }

        oldFields.values().stream()
                .filter(f -> !newFields.containsKey(f.getName()))
                .forEach(f -> result.getFieldDiffs().add(DiffResult.FieldDiff.builder()
                        .type(DiffResult.FieldDiff.Type.DROPPED)
                        .field(f)
                        .build()));
    }

    private static Map<String, FieldModel> index(Iterable<FieldModel> fields) {
        Map<String, FieldModel> map = new LinkedHashMap<>();
        fields.forEach(f -> map.put(f.getName(), f));
        return map;
    }
}
