package org.kiln.model;

public enum Cardinality {
    ONE_TO_MANY,
    ONE_TO_ONE
}
