package org.kiln.migration.contributor;

import org.kiln.migration.spi.dialect.DdlDialect;

/**
 * Contributes lines to the body of a {@code CREATE TABLE} statement. Lower priority goes first.
 */
public interface DdlContributor {
    int priority();

    void contribute(StringBuilder sb, DdlDialect dialect);
}
