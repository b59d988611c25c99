package org.kiln.migration;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ApplyOptions {
    /** Apply migrations flagged as destructive. */
    @Builder.Default
    boolean acceptDataLoss = false;

    public static ApplyOptions defaults() {
        return ApplyOptions.builder().build();
    }

    public static ApplyOptions acceptingDataLoss() {
        return ApplyOptions.builder().acceptDataLoss(true).build();
    }
}
