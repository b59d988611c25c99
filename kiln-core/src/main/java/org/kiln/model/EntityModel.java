package org.kiln.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class EntityModel {
    String name;
    String tableName;
    @Singular List<FieldModel> fields;
    @Singular List<RelationModel> relations;
    @Singular List<ConstraintModel> constraints;

    public Optional<FieldModel> findField(String fieldName) {
        if (fieldName == null) return Optional.empty();
        return fields.stream().filter(f -> f.getName().equals(fieldName)).findFirst();
    }

    public Optional<RelationModel> findRelation(String relationName) {
        if (relationName == null) return Optional.empty();
        return relations.stream().filter(r -> r.getName().equals(relationName)).findFirst();
    }

    public Optional<FieldModel> findFieldByColumn(String columnName) {
        if (columnName == null) return Optional.empty();
        return fields.stream().filter(f -> f.getColumnName().equalsIgnoreCase(columnName)).findFirst();
    }

    /**
     * @throws IllegalStateException for entities that were not built by the parser
     */
    @JsonIgnore
    public FieldModel getIdentityField() {
        return fields.stream()
                .filter(FieldModel::isIdentity)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Entity " + name + " has no identity field"));
    }

    @JsonIgnore
    public List<RelationModel> getOwningRelations() {
        return relations.stream().filter(RelationModel::isOwning).toList();
    }
}
