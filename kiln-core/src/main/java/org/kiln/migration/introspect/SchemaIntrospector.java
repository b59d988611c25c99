package org.kiln.migration.introspect;

import lombok.extern.slf4j.Slf4j;
import org.kiln.error.KilnException;
import org.kiln.model.OnDeleteAction;
import org.kiln.options.KilnOptions;
import org.kiln.store.JdbcStore;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.kiln.migration.introspect.StructuralShape.lower;
import static org.kiln.migration.introspect.StructuralShape.sortedLower;

/**
 * Reads a store's structure through JDBC {@link DatabaseMetaData}. The migration ledger
 * table is not part of the result.
 */
@Slf4j
public class SchemaIntrospector {
    private final String ledgerTable;

    public SchemaIntrospector() {
        this(KilnOptions.Migrations.LEDGER_TABLE);
    }

    public SchemaIntrospector(String ledgerTable) {
        this.ledgerTable = ledgerTable;
    }

    public StructuralShape introspect(JdbcStore store) {
        try {
            return store.withSession(session -> introspect(session.getConnection()));
        } catch (SQLException e) {
            throw new KilnException("Failed to introspect " + store + ": " + e.getMessage(), e);
        }
    }

    StructuralShape introspect(Connection connection) throws SQLException {
        DatabaseMetaData md = connection.getMetaData();
        String catalog = connection.getCatalog();
        String schema = connection.getSchema();

        Map<String, StructuralShape.Table> tables = new TreeMap<>();
        for (String table : tableNames(md, catalog, schema)) {
            if (table.equalsIgnoreCase(ledgerTable)) continue;
            List<String> pk = primaryKey(md, catalog, schema, table);
            tables.put(lower(table), new StructuralShape.Table(
                    lower(table),
                    new TreeMap<>(columns(md, catalog, schema, table)),
                    pk,
                    uniqueSets(md, catalog, schema, table, pk),
                    foreignKeys(md, catalog, schema, table)));
        }
        log.debug("Introspected {} table(s)", tables.size());
        return new StructuralShape(tables);
    }

    private static List<String> tableNames(DatabaseMetaData md, String catalog, String schema) throws SQLException {
        List<String> out = new ArrayList<>();
        try (ResultSet rs = md.getTables(catalog, schema, "%", null)) {
            while (rs.next()) {
                String type = rs.getString("TABLE_TYPE");
                // H2 2.x reports "BASE TABLE"
                if ("TABLE".equalsIgnoreCase(type) || "BASE TABLE".equalsIgnoreCase(type)) {
                    out.add(rs.getString("TABLE_NAME"));
                }
            }
        }
        return out;
    }

    private static Map<String, StructuralShape.Column> columns(DatabaseMetaData md, String catalog, String schema,
                                                               String table) throws SQLException {
        Map<String, StructuralShape.Column> out = new LinkedHashMap<>();
        try (ResultSet rs = md.getColumns(catalog, schema, table, "%")) {
            while (rs.next()) {
                String name = lower(rs.getString("COLUMN_NAME"));
                boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                out.put(name, new StructuralShape.Column(name, TypeFamily.ofJdbc(rs.getInt("DATA_TYPE")), nullable));
            }
        }
        return out;
    }

    private static List<String> primaryKey(DatabaseMetaData md, String catalog, String schema, String table) throws SQLException {
        Map<Short, String> bySeq = new TreeMap<>();
        try (ResultSet rs = md.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                bySeq.put(rs.getShort("KEY_SEQ"), lower(rs.getString("COLUMN_NAME")));
            }
        }
        return List.copyOf(bySeq.values());
    }

    private static Set<List<String>> uniqueSets(DatabaseMetaData md, String catalog, String schema, String table,
                                                List<String> pk) throws SQLException {
        Map<String, List<String>> byIndex = new TreeMap<>();
        try (ResultSet rs = md.getIndexInfo(catalog, schema, table, true, false)) {
            while (rs.next()) {
                String index = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (index == null || column == null || rs.getBoolean("NON_UNIQUE")) continue;
                byIndex.computeIfAbsent(index, k -> new ArrayList<>()).add(column);
            }
        }
        List<String> sortedPk = sortedLower(pk);
        Set<List<String>> out = new HashSet<>();
        for (List<String> columns : byIndex.values()) {
            List<String> normalized = sortedLower(columns);
            if (!normalized.equals(sortedPk)) out.add(normalized);
        }
        return out;
    }

    private static Set<StructuralShape.ForeignKey> foreignKeys(DatabaseMetaData md, String catalog, String schema,
                                                               String table) throws SQLException {
        Set<StructuralShape.ForeignKey> out = new HashSet<>();
        try (ResultSet rs = md.getImportedKeys(catalog, schema, table)) {
            while (rs.next()) {
                out.add(new StructuralShape.ForeignKey(
                        lower(rs.getString("FK_NAME")),
                        lower(rs.getString("FKCOLUMN_NAME")),
                        lower(rs.getString("PKTABLE_NAME")),
                        lower(rs.getString("PKCOLUMN_NAME")),
                        onDelete(rs.getInt("DELETE_RULE"))));
            }
        }
        return out;
    }

    private static OnDeleteAction onDelete(int rule) {
        return switch (rule) {
            case DatabaseMetaData.importedKeyCascade -> OnDeleteAction.CASCADE;
            case DatabaseMetaData.importedKeySetNull -> OnDeleteAction.SET_NULL;
            default -> OnDeleteAction.RESTRICT;
        };
    }
}
