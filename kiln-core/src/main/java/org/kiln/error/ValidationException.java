package org.kiln.error;

import lombok.Getter;

/**
 * A query was rejected before reaching the store.
 */
@Getter
public class ValidationException extends KilnException {
    private final String entity;
    private final String field;

    public ValidationException(String entity, String field, String message) {
        super(message);
        this.entity = entity;
        this.field = field;
    }
}
