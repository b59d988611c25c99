package org.kiln.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class FieldModel {
    String name;
    String columnName;
    FieldType type;
    @Builder.Default int length = 255;
    @Builder.Default boolean nullable = false;
    @Builder.Default FieldDefault defaultValue = FieldDefault.none();
    @Builder.Default boolean unique = false;
    @Builder.Default boolean identity = false;
    @Builder.Default String uniqueConstraintName = null; // set when unique

    /**
     * A create payload must supply this field.
     */
    @JsonIgnore
    public boolean isRequiredOnCreate() {
        return !nullable && defaultValue.isNone();
    }

    @JsonIgnore
    public boolean isStoreGenerated() {
        return defaultValue.isAutoIncrement();
    }

    @JsonIgnore
    public boolean isSingleColumnUnique() {
        return unique && !identity;
    }
}
