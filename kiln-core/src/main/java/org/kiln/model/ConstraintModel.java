package org.kiln.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Table-level composite unique constraint.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ConstraintModel {
    String name;
    @Singular List<String> fields;
}
