package org.kiln.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One side of an association between two entities.
 * <p>
 * The owning side carries {@code foreignKey} (a field of its own entity) referencing
 * {@code references} on the target; the inverse side only names the owning relation
 * through {@code mappedBy}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RelationModel {
    String name;
    String target;
    @Builder.Default Cardinality cardinality = Cardinality.ONE_TO_MANY;

    // owning side
    @Builder.Default String foreignKey = null;
    @Builder.Default String references = null;
    @Builder.Default OnDeleteAction onDelete = OnDeleteAction.RESTRICT;
    @Builder.Default String constraintName = null;
    @Builder.Default String indexName = null;

    // inverse side
    @Builder.Default String mappedBy = null;

    @JsonIgnore
    public boolean isOwning() {
        return foreignKey != null;
    }

    /**
     * Whether resolving this relation yields a list rather than at most one record.
     */
    @JsonIgnore
    public boolean isCollection() {
        return !isOwning() && cardinality == Cardinality.ONE_TO_MANY;
    }
}
