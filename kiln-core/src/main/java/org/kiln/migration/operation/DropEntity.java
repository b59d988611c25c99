package org.kiln.migration.operation;

import org.kiln.model.EntityModel;

public record DropEntity(EntityModel definition) implements ChangeOperation {
    @Override public Phase phase() { return Phase.DROP_ENTITY; }
    @Override public String entity() { return definition.getName(); }
    @Override public String sortKey() { return ""; }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitDropEntity(this); }

    @Override
    public String describe() {
        return "drop entity " + definition.getName() + " (table " + definition.getTableName() + ")";
    }
}
