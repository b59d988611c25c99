package org.kiln.migration.operation;

import org.kiln.model.FieldModel;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Changes a field in place. The column name is the same on both sides; a changed column
 * name is expressed as drop + add.
 */
public record AlterField(String entity, String table, FieldModel from, FieldModel to) implements ChangeOperation {

    public enum Aspect { TYPE, LENGTH, NULLABILITY, DEFAULT, UNIQUENESS, IDENTITY }

    @Override public Phase phase() { return Phase.ALTER_FIELD; }
    @Override public String sortKey() { return to.getName(); }
    @Override public void accept(ChangeOperationVisitor visitor) { visitor.visitAlterField(this); }

    public Set<Aspect> changedAspects() {
        return aspectsBetween(from, to);
    }

    public static Set<Aspect> aspectsBetween(FieldModel from, FieldModel to) {
        Set<Aspect> out = EnumSet.noneOf(Aspect.class);
        if (from.getType() != to.getType()) out.add(Aspect.TYPE);
        if (from.getLength() != to.getLength()) out.add(Aspect.LENGTH);
        if (from.isNullable() != to.isNullable()) out.add(Aspect.NULLABILITY);
        if (!Objects.equals(from.getDefaultValue(), to.getDefaultValue())) out.add(Aspect.DEFAULT);
        if (from.isUnique() != to.isUnique()
                || !Objects.equals(from.getUniqueConstraintName(), to.getUniqueConstraintName())) {
            out.add(Aspect.UNIQUENESS);
        }
        if (from.isIdentity() != to.isIdentity()) out.add(Aspect.IDENTITY);
        return out;
    }

    @Override
    public String describe() {
        return "alter field " + entity + "." + to.getName() + " " + changedAspects();
    }
}
