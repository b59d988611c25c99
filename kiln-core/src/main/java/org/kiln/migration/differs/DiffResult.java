package org.kiln.migration.differs;

import lombok.Builder;
import lombok.Getter;
import org.kiln.migration.operation.AddField;
import org.kiln.migration.operation.AddRelationConstraint;
import org.kiln.migration.operation.AddUniqueConstraint;
import org.kiln.migration.operation.AlterField;
import org.kiln.migration.operation.ChangeOperation;
import org.kiln.migration.operation.CreateEntity;
import org.kiln.migration.operation.DropEntity;
import org.kiln.migration.operation.DropField;
import org.kiln.migration.operation.DropRelationConstraint;
import org.kiln.migration.operation.DropUniqueConstraint;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.ForeignKeyModel;

import java.util.ArrayList;
import java.util.List;

@Builder
@Getter
public class DiffResult {
    @Builder.Default private List<EntityModel> addedEntities = new ArrayList<>();
    @Builder.Default private List<EntityModel> droppedEntities = new ArrayList<>();
    // foreign keys of added / dropped entities
    @Builder.Default private List<ForeignKeyModel> addedForeignKeys = new ArrayList<>();
    @Builder.Default private List<ForeignKeyModel> droppedForeignKeys = new ArrayList<>();
    @Builder.Default private List<ModifiedEntity> modifiedEntities = new ArrayList<>();
    @Builder.Default private List<String> warnings = new ArrayList<>();

    public boolean isEmpty() {
        return addedEntities.isEmpty() && droppedEntities.isEmpty() && modifiedEntities.isEmpty();
    }

    /**
     * Linearises the diff into executable order (see {@link ChangeOperation.Phase}).
     * The result depends only on the two snapshots, never on map iteration order.
     */
    public List<ChangeOperation> operations() {
        List<ChangeOperation> ops = new ArrayList<>();
        addedEntities.forEach(e -> ops.add(new CreateEntity(e)));
        droppedEntities.forEach(e -> ops.add(new DropEntity(e)));
        addedForeignKeys.forEach(fk -> ops.add(new AddRelationConstraint(fk)));
        droppedForeignKeys.forEach(fk -> ops.add(new DropRelationConstraint(fk)));
        modifiedEntities.forEach(m -> m.collect(ops));
        ops.sort(ChangeOperation.ORDER);
        return List.copyOf(ops);
    }

    @Builder
    @Getter
    public static class ModifiedEntity {
        private EntityModel oldEntity;
        private EntityModel newEntity;
        @Builder.Default private List<FieldDiff> fieldDiffs = new ArrayList<>();
        @Builder.Default private List<UniqueConstraintDiff> constraintDiffs = new ArrayList<>();
        @Builder.Default private List<RelationDiff> relationDiffs = new ArrayList<>();

        public boolean isModified() {
            return !fieldDiffs.isEmpty() || !constraintDiffs.isEmpty() || !relationDiffs.isEmpty();
        }

        void collect(List<ChangeOperation> ops) {
            String entity = newEntity.getName();
            String table = newEntity.getTableName();
            for (FieldDiff d : fieldDiffs) {
                switch (d.getType()) {
                    case ADDED -> ops.add(new AddField(entity, table, d.getField()));
                    case DROPPED -> ops.add(new DropField(entity, table, d.getField()));
                    case MODIFIED -> ops.add(new AlterField(entity, table, d.getOldField(), d.getField()));
                }
            }
            for (UniqueConstraintDiff d : constraintDiffs) {
                switch (d.getType()) {
                    case ADDED -> ops.add(new AddUniqueConstraint(entity, table, d.getName(), d.getColumns()));
                    case DROPPED -> ops.add(new DropUniqueConstraint(entity, table, d.getName(), d.getColumns()));
                }
            }
            for (RelationDiff d : relationDiffs) {
                switch (d.getType()) {
                    case ADDED -> ops.add(new AddRelationConstraint(d.getForeignKey()));
                    case DROPPED -> ops.add(new DropRelationConstraint(d.getForeignKey()));
                }
            }
        }
    }

    @Builder
    @Getter
    public static class FieldDiff {
        public enum Type { ADDED, DROPPED, MODIFIED }
        private Type type;
        private FieldModel field;
        private FieldModel oldField;
        private String changeDetail;
    }

    @Builder
    @Getter
    public static class UniqueConstraintDiff {
        public enum Type { ADDED, DROPPED }
        private Type type;
        private String name;
        private List<String> columns;
    }

    /**
     * A changed foreign key is reported as DROPPED (old definition) plus ADDED (new definition).
     */
    @Builder
    @Getter
    public static class RelationDiff {
        public enum Type { ADDED, DROPPED }
        private Type type;
        private ForeignKeyModel foreignKey;
        private String changeDetail;
    }
}
