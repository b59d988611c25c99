package org.kiln.error;

import lombok.Getter;

/**
 * Schema definition rejected at parse time. {@code location} is a dotted path into the
 * definition, e.g. {@code entities.Post.relations.author}.
 */
@Getter
public class SchemaException extends KilnException {

    public enum Kind {
        UNKNOWN_TYPE,
        DUPLICATE_NAME,
        BAD_RELATION_TARGET,
        MISSING_IDENTITY,
        INVALID_DEFAULT,
        MALFORMED
    }

    private final Kind kind;
    private final String location;

    public SchemaException(Kind kind, String location, String message) {
        super(kind + " at " + location + ": " + message);
        this.kind = kind;
        this.location = location;
    }

    public SchemaException(Kind kind, String location, String message, Throwable cause) {
        super(kind + " at " + location + ": " + message, cause);
        this.kind = kind;
        this.location = location;
    }
}
