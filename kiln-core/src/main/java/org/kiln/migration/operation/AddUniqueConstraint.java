package org.kiln.migration.operation;

import java.util.List;

public record AddUniqueConstraint(String entity, String table, String name, List<String> columns) implements ChangeOperation {
    public AddUniqueConstraint {
        columns = List.copyOf(columns);
    }

    @Override public Phase phase() { return Phase.ADD_UNIQUE_CONSTRAINT; }
    @Override public String sortKey() { return name; }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitAddUniqueConstraint(this); }

    @Override
    public String describe() {
        return "add unique " + name + " on " + table + columns;
    }
}
