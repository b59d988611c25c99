package org.kiln.migration.operation;

import org.kiln.model.ForeignKeyModel;

public record DropRelationConstraint(ForeignKeyModel foreignKey) implements ChangeOperation {
    @Override public Phase phase() { return Phase.DROP_RELATION_CONSTRAINT; }
    @Override public String entity() { return foreignKey.entity(); }
    @Override public String sortKey() { return foreignKey.name(); }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitDropRelationConstraint(this); }

    @Override
    public String describe() {
        return "drop foreign key " + foreignKey.name() + " on " + foreignKey.table();
    }
}
