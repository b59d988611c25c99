package org.kiln.model.naming;

import java.util.Locale;

/**
 * Key under which declared names are compared. Two entity, table, field, column or
 * constraint names collide when their keys are equal.
 */
@FunctionalInterface
public interface CaseNormalizer {
    String normalize(String raw);

    /**
     * {@code User}, {@code user} and {@code USER } share one key.
     */
    static CaseNormalizer lower() {
        return raw -> raw == null ? "" : raw.strip().toLowerCase(Locale.ROOT);
    }
}
