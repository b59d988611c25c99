package org.kiln.migration.contributor;

import org.kiln.migration.spi.dialect.DdlDialect;
import org.kiln.model.ConstraintModel;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-column unique fields and table-level unique constraints, in that order.
 */
public record UniqueConstraintContributor(List<NamedUnique> constraints) implements DdlContributor {

    public record NamedUnique(String name, List<String> columns) {}

    public static UniqueConstraintContributor of(EntityModel entity) {
        List<NamedUnique> out = new ArrayList<>();
        for (FieldModel f : entity.getFields()) {
            if (f.isSingleColumnUnique()) {
                out.add(new NamedUnique(f.getUniqueConstraintName(), List.of(f.getColumnName())));
            }
        }
        for (ConstraintModel c : entity.getConstraints()) {
            out.add(new NamedUnique(c.getName(), c.getFields().stream()
                    .map(name -> entity.findField(name).map(FieldModel::getColumnName).orElse(name))
                    .toList()));
        }
        return new UniqueConstraintContributor(out);
    }

    @Override
    public int priority() {
        return 60; // Constraint 정의
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (NamedUnique u : constraints) {
            if (u.name() == null || u.name().isEmpty()) {
                throw new IllegalStateException("Unique constraint name must not be null or empty for " + u.columns());
            }
            sb.append("  ").append(dialect.getUniqueDefinitionSql(u.name(), u.columns())).append(",\n");
        }
    }
}
