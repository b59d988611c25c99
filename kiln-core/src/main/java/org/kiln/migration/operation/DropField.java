package org.kiln.migration.operation;

import org.kiln.model.FieldModel;

public record DropField(String entity, String table, FieldModel field) implements ChangeOperation {
    @Override public Phase phase() { return Phase.DROP_FIELD; }
    @Override public String sortKey() { return field.getName(); }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitDropField(this); }

    @Override
    public String describe() {
        return "drop field " + entity + "." + field.getName();
    }
}
