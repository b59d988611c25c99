package org.kiln.migration.differs;

import org.kiln.migration.operation.AddField;
import org.kiln.migration.operation.AlterField;
import org.kiln.migration.operation.ChangeOperation;
import org.kiln.migration.operation.DropEntity;
import org.kiln.migration.operation.DropField;
import org.kiln.model.FieldModel;
import org.kiln.model.FieldType;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags operations that need explicit confirmation before they are applied.
 */
public class DestructiveChangeAnalyzer {

    public List<DestructiveChange> analyze(List<ChangeOperation> operations) {
        List<DestructiveChange> out = new ArrayList<>();
        for (ChangeOperation op : operations) {
            if (op instanceof DropEntity d) {
                out.add(new DestructiveChange(DestructiveChange.Kind.DROP_ENTITY, d.entity(), null,
                        "table " + d.definition().getTableName() + " and all its rows are removed"));
            } else if (op instanceof DropField d) {
                out.add(new DestructiveChange(DestructiveChange.Kind.DROP_FIELD, d.entity(), d.field().getName(),
                        "column " + d.field().getColumnName() + " is removed"));
                if (d.field().isIdentity()) {
                    out.add(new DestructiveChange(DestructiveChange.Kind.IDENTITY_CHANGE, d.entity(), d.field().getName(),
                            "identity field removed"));
                }
            } else if (op instanceof AddField a) {
                analyzeAdd(a, out);
            } else if (op instanceof AlterField a) {
                analyzeAlter(a, out);
            }
        }
        return out;
    }

    private void analyzeAdd(AddField a, List<DestructiveChange> out) {
        FieldModel f = a.field();
        if (!f.isNullable() && !f.getDefaultValue().isStatic()) {
            out.add(new DestructiveChange(DestructiveChange.Kind.REQUIRED_WITHOUT_DEFAULT, a.entity(), f.getName(),
                    "existing rows have no value for the new required field"));
        }
        if (f.isIdentity()) {
            out.add(new DestructiveChange(DestructiveChange.Kind.IDENTITY_CHANGE, a.entity(), f.getName(),
                    "identity field added to an existing entity"));
        }
    }

    private void analyzeAlter(AlterField a, List<DestructiveChange> out) {
        FieldModel from = a.from();
        FieldModel to = a.to();
        if (!from.getType().canWidenTo(to.getType())) {
            out.add(new DestructiveChange(DestructiveChange.Kind.TYPE_NARROWING, a.entity(), to.getName(),
                    from.getType().keyword() + " -> " + to.getType().keyword()));
        } else if (from.getType() == FieldType.TEXT && to.getType() == FieldType.TEXT && to.getLength() < from.getLength()) {
            out.add(new DestructiveChange(DestructiveChange.Kind.TYPE_NARROWING, a.entity(), to.getName(),
                    "text length " + from.getLength() + " -> " + to.getLength()));
        }
        if (from.isNullable() && !to.isNullable()) {
            out.add(new DestructiveChange(DestructiveChange.Kind.NULLABLE_TO_REQUIRED, a.entity(), to.getName(),
                    "rows holding null are rejected"));
        }
        if (from.isIdentity() != to.isIdentity()) {
            out.add(new DestructiveChange(DestructiveChange.Kind.IDENTITY_CHANGE, a.entity(), to.getName(),
                    from.isIdentity() ? "no longer the identity" : "becomes the identity"));
        }
    }
}
