package org.kiln.migration.operation;

import org.kiln.model.EntityModel;

/**
 * Creates the entity's table with columns, primary key and unique constraints. Foreign keys
 * follow as separate {@link AddRelationConstraint} operations.
 */
public record CreateEntity(EntityModel definition) implements ChangeOperation {
    @Override public Phase phase() { return Phase.CREATE_ENTITY; }
    @Override public String entity() { return definition.getName(); }
    @Override public String sortKey() { return ""; }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitCreateEntity(this); }

    @Override
    public String describe() {
        return "create entity " + definition.getName() + " (table " + definition.getTableName() + ")";
    }
}
