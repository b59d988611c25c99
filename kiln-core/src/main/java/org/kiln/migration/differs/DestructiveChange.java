package org.kiln.migration.differs;

/**
 * A planned change that can lose or reject existing data.
 */
public record DestructiveChange(Kind kind, String entity, String field, String detail) {

    public enum Kind {
        DROP_ENTITY,
        DROP_FIELD,
        TYPE_NARROWING,
        NULLABLE_TO_REQUIRED,
        IDENTITY_CHANGE,
        REQUIRED_WITHOUT_DEFAULT
    }

    public String describe() {
        String target = field == null ? entity : entity + "." + field;
        return kind + " " + target + (detail == null ? "" : ": " + detail);
    }
}
