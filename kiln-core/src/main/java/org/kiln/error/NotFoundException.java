package org.kiln.error;

import lombok.Getter;

@Getter
public class NotFoundException extends KilnException {
    private final String entity;
    private final String filter;

    public NotFoundException(String entity, String filter) {
        super("No " + entity + " matches " + filter);
        this.entity = entity;
        this.filter = filter;
    }
}
