package org.kiln.migration.operation;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Comparator;

/**
 * One structural change of a migration. Operations are serialized into migration artifacts
 * (tagged by {@code op}) and planned into statements per dialect by
 * {@link org.kiln.migration.DdlGenerator}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DropRelationConstraint.class, name = "dropRelationConstraint"),
        @JsonSubTypes.Type(value = DropUniqueConstraint.class, name = "dropUniqueConstraint"),
        @JsonSubTypes.Type(value = DropField.class, name = "dropField"),
        @JsonSubTypes.Type(value = DropEntity.class, name = "dropEntity"),
        @JsonSubTypes.Type(value = CreateEntity.class, name = "createEntity"),
        @JsonSubTypes.Type(value = AddField.class, name = "addField"),
        @JsonSubTypes.Type(value = AlterField.class, name = "alterField"),
        @JsonSubTypes.Type(value = AddUniqueConstraint.class, name = "addUniqueConstraint"),
        @JsonSubTypes.Type(value = AddRelationConstraint.class, name = "addRelationConstraint")
})
public interface ChangeOperation {

    /**
     * Linearisation order: phase, then entity name, then the field or constraint name.
     */
    Comparator<ChangeOperation> ORDER = Comparator
            .comparing(ChangeOperation::phase)
            .thenComparing(ChangeOperation::entity)
            .thenComparing(ChangeOperation::sortKey);

    /**
     * Execution phases in order. Dropping runs before creating so that names freed by a
     * drop can be reused; foreign keys are dropped first and added last.
     */
    enum Phase {
        DROP_RELATION_CONSTRAINT,
        DROP_UNIQUE_CONSTRAINT,
        DROP_FIELD,
        DROP_ENTITY,
        CREATE_ENTITY,
        ADD_FIELD,
        ALTER_FIELD,
        ADD_UNIQUE_CONSTRAINT,
        ADD_RELATION_CONSTRAINT
    }

    Phase phase();

    String entity();

    String sortKey();

    void accept(ChangeOperationVisitor visitor);

    String describe();
}
