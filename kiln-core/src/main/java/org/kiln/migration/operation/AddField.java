package org.kiln.migration.operation;

import org.kiln.model.FieldModel;

public record AddField(String entity, String table, FieldModel field) implements ChangeOperation {
    @Override public Phase phase() { return Phase.ADD_FIELD; }
    @Override public String sortKey() { return field.getName(); }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitAddField(this); }

    @Override
    public String describe() {
        return "add field " + entity + "." + field.getName() + " " + field.getType().keyword()
                + (field.isNullable() ? "?" : "");
    }
}
