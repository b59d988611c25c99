package org.kiln.migration;

import lombok.extern.slf4j.Slf4j;
import org.kiln.error.ApplyException;
import org.kiln.migration.operation.AddField;
import org.kiln.migration.operation.AddRelationConstraint;
import org.kiln.migration.operation.AddUniqueConstraint;
import org.kiln.migration.operation.AlterField;
import org.kiln.migration.operation.ChangeOperation;
import org.kiln.migration.operation.ChangeOperationVisitor;
import org.kiln.migration.operation.CreateEntity;
import org.kiln.migration.operation.DropEntity;
import org.kiln.migration.operation.DropField;
import org.kiln.migration.operation.DropRelationConstraint;
import org.kiln.migration.operation.DropUniqueConstraint;
import org.kiln.migration.spi.dialect.DdlDialect;
import org.kiln.model.ForeignKeyModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plans change operations into dialect statements. Planning is pure; nothing touches a store.
 */
@Slf4j
public class DdlGenerator {
    private final DdlDialect dialect;

    public DdlGenerator(DdlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public DdlDialect getDialect() {
        return dialect;
    }

    public List<String> plan(List<ChangeOperation> operations) {
        return plan(null, operations);
    }

    /**
     * @throws ApplyException with {@link ApplyException.Kind#DIALECT_UNSUPPORTED} when an
     *                        operation cannot be expressed in this dialect
     */
    public List<String> plan(String migrationName, List<ChangeOperation> operations) {
        return planWithOwners(migrationName, operations).statements();
    }

    /**
     * Like {@link #plan(String, List)}, keeping track of which operation produced each statement.
     */
    public DdlPlan planWithOwners(String migrationName, List<ChangeOperation> operations) {
        PlanningVisitor visitor = new PlanningVisitor();
        List<Integer> owners = new ArrayList<>();
        for (int i = 0; i < operations.size(); i++) {
            try {
                operations.get(i).accept(visitor);
            } catch (UnsupportedOperationException e) {
                throw new ApplyException(ApplyException.Kind.DIALECT_UNSUPPORTED, migrationName,
                        operations.subList(0, i + 1), visitor.statements, e.getMessage(), e);
            }
            while (owners.size() < visitor.statements.size()) owners.add(i);
        }
        log.debug("Planned {} statements for {} operations ({})", visitor.statements.size(), operations.size(), dialect.name());
        return new DdlPlan(operations, visitor.statements, owners);
    }

    /**
     * Renders statements as a script, one statement per line group, each terminated by {@code ;}.
     */
    public static String render(List<String> statements) {
        StringBuilder sb = new StringBuilder();
        for (String s : statements) {
            sb.append(s).append(";\n");
        }
        return sb.toString();
    }

    private final class PlanningVisitor implements ChangeOperationVisitor {
        private final List<String> statements = new ArrayList<>();

        @Override
        public void visitCreateEntity(CreateEntity op) {
            statements.add(dialect.getCreateTableSql(op.definition()));
        }

        @Override
        public void visitDropEntity(DropEntity op) {
            statements.add(dialect.getDropTableSql(op.definition().getTableName()));
        }

        @Override
        public void visitAddField(AddField op) {
            if (op.field().isIdentity()) {
                throw new UnsupportedOperationException("Cannot add identity field " + op.entity() + "." + op.field().getName()
                        + " to an existing table");
            }
            statements.add(dialect.getAddColumnSql(op.table(), op.field()));
            if (op.field().isSingleColumnUnique()) {
                statements.add(dialect.getAddUniqueSql(op.table(), op.field().getUniqueConstraintName(),
                        List.of(op.field().getColumnName())));
            }
        }

        @Override
        public void visitDropField(DropField op) {
            if (op.field().isIdentity()) {
                throw new UnsupportedOperationException("Cannot drop identity field " + op.entity() + "." + op.field().getName()
                        + " of an existing table");
            }
            if (op.field().isSingleColumnUnique()) {
                statements.add(dialect.getDropUniqueSql(op.table(), op.field().getUniqueConstraintName()));
            }
            statements.add(dialect.getDropColumnSql(op.table(), op.field()));
        }

        @Override
        public void visitAlterField(AlterField op) {
            statements.addAll(dialect.getAlterColumnSql(op.table(), op.from(), op.to()));
        }

        @Override
        public void visitAddRelationConstraint(AddRelationConstraint op) {
            ForeignKeyModel fk = op.foreignKey();
            if (!fk.columnUnique() && fk.indexName() != null) {
                statements.add(dialect.getCreateIndexSql(fk.table(), fk.indexName(), List.of(fk.column())));
            }
            statements.add(dialect.getAddForeignKeySql(fk));
        }

        @Override
        public void visitDropRelationConstraint(DropRelationConstraint op) {
            ForeignKeyModel fk = op.foreignKey();
            statements.add(dialect.getDropForeignKeySql(fk));
            if (!fk.columnUnique() && fk.indexName() != null) {
                statements.add(dialect.getDropIndexSql(fk.table(), fk.indexName()));
            }
        }

        @Override
        public void visitAddUniqueConstraint(AddUniqueConstraint op) {
            statements.add(dialect.getAddUniqueSql(op.table(), op.name(), op.columns()));
        }

        @Override
        public void visitDropUniqueConstraint(DropUniqueConstraint op) {
            statements.add(dialect.getDropUniqueSql(op.table(), op.name()));
        }
    }
}
