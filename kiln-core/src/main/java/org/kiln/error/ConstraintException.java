package org.kiln.error;

import lombok.Getter;

@Getter
public class ConstraintException extends KilnException {
    private final String entity;
    private final String field;
    private final Object value;
    private final String constraint;

    public ConstraintException(String entity, String field, Object value, String constraint, String message) {
        this(entity, field, value, constraint, message, null);
    }

    public ConstraintException(String entity, String field, Object value, String constraint, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
        this.field = field;
        this.value = value;
        this.constraint = constraint;
    }
}
