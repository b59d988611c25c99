package org.kiln.migration;

import org.kiln.error.ApplyException;
import org.kiln.migration.dialect.h2.H2Dialect;
import org.kiln.migration.dialect.mysql.MySqlDialect;
import org.kiln.migration.spi.dialect.DdlDialect;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Resolves dialects by name or from a live connection.
 */
public final class DialectRegistry {

    private static final Map<String, Supplier<DdlDialect>> DIALECTS = Map.of(
            "h2", H2Dialect::new,
            "mysql", MySqlDialect::new
    );

    private DialectRegistry() {
    }

    /**
     * @throws ApplyException with {@link ApplyException.Kind#DIALECT_UNSUPPORTED} for unknown names
     */
    public static DdlDialect resolve(String name) {
        if (name == null || name.isBlank()) {
            throw unsupported("Dialect name must not be blank");
        }
        Supplier<DdlDialect> supplier = DIALECTS.get(name.trim().toLowerCase(Locale.ROOT));
        if (supplier == null) {
            throw unsupported("Unsupported dialect '" + name + "', expected one of " + DIALECTS.keySet());
        }
        return supplier.get();
    }

    /**
     * Picks the dialect matching the connection's database product.
     */
    public static DdlDialect detect(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        String p = product == null ? "" : product.toLowerCase(Locale.ROOT);
        if (p.contains("h2")) return new H2Dialect();
        if (p.contains("mysql") || p.contains("mariadb")) return new MySqlDialect();
        throw unsupported("No dialect for database product '" + product + "'");
    }

    private static ApplyException unsupported(String message) {
        return new ApplyException(ApplyException.Kind.DIALECT_UNSUPPORTED, null, List.of(), message);
    }
}
