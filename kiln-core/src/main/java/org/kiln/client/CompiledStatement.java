package org.kiln.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameterised SQL ready for a {@link org.kiln.store.StoreSession}. Parameters may contain
 * {@code null}.
 */
public record CompiledStatement(String sql, List<Object> parameters) {

    public CompiledStatement {
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }
}
