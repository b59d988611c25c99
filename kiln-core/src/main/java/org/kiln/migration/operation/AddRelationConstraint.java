package org.kiln.migration.operation;

import org.kiln.model.ForeignKeyModel;

public record AddRelationConstraint(ForeignKeyModel foreignKey) implements ChangeOperation {
    @Override public Phase phase() { return Phase.ADD_RELATION_CONSTRAINT; }
    @Override public String entity() { return foreignKey.entity(); }
    @Override public String sortKey() { return foreignKey.name(); }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitAddRelationConstraint(this); }

    @Override
    public String describe() {
        return "add foreign key " + foreignKey.name() + " " + foreignKey.table() + "(" + foreignKey.column() + ") -> "
                + foreignKey.referencedTable() + "(" + foreignKey.referencedColumn() + ") on delete " + foreignKey.onDelete();
    }
}
