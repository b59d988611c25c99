package org.kiln.model;

/**
 * Physical foreign key derived from an owning relation. Self-contained so that a stored
 * change operation can be planned without the snapshot that produced it.
 *
 * @param columnUnique whether the referencing column already carries a unique constraint,
 *                     in which case no separate index is created for it
 */
public record ForeignKeyModel(
        String name,
        String indexName,
        String entity,
        String relation,
        String table,
        String column,
        String referencedEntity,
        String referencedTable,
        String referencedColumn,
        OnDeleteAction onDelete,
        boolean columnUnique
) {
    public static ForeignKeyModel of(EntityModel owner, RelationModel relation, EntityModel target) {
        if (!relation.isOwning()) {
            throw new IllegalArgumentException("Relation " + owner.getName() + "." + relation.getName() + " is not the owning side");
        }
        FieldModel fk = owner.findField(relation.getForeignKey())
                .orElseThrow(() -> new IllegalArgumentException("Unknown foreign key field " + relation.getForeignKey()));
        FieldModel ref = relation.getReferences() == null
                ? target.getIdentityField()
                : target.findField(relation.getReferences())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown referenced field " + relation.getReferences()));
        return new ForeignKeyModel(
                relation.getConstraintName(),
                relation.getIndexName(),
                owner.getName(),
                relation.getName(),
                owner.getTableName(),
                fk.getColumnName(),
                target.getName(),
                target.getTableName(),
                ref.getColumnName(),
                relation.getOnDelete(),
                fk.isUnique() || fk.isIdentity());
    }
}
