package org.kiln.migration.operation;

import java.util.List;

public record DropUniqueConstraint(String entity, String table, String name, List<String> columns) implements ChangeOperation {
    public DropUniqueConstraint {
        columns = List.copyOf(columns);
    }

    @Override public Phase phase() { return Phase.DROP_UNIQUE_CONSTRAINT; }
    @Override public String sortKey() { return name; }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitDropUniqueConstraint(this); }

    @Override
    public String describe() {
        return "drop unique " + name + " on " + table;
    }
}
