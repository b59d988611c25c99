package org.kiln.migration.operation;

public interface ChangeOperationVisitor {
    void visitCreateEntity(CreateEntity op);
    void visitDropEntity(DropEntity op);
    void visitAddField(AddField op);
    void visitDropField(DropField op);
    void visitAlterField(AlterField op);
    void visitAddRelationConstraint(AddRelationConstraint op);
    void visitDropRelationConstraint(DropRelationConstraint op);
    void visitAddUniqueConstraint(AddUniqueConstraint op);
    void visitDropUniqueConstraint(DropUniqueConstraint op);
}
