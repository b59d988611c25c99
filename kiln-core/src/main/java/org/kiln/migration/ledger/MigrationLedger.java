package org.kiln.migration.ledger;

import lombok.extern.slf4j.Slf4j;
import org.kiln.migration.MigrationRecord;
import org.kiln.migration.spi.dialect.DdlDialect;
import org.kiln.options.KilnOptions;
import org.kiln.store.StoreSession;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only record of applied migrations, kept in the store it describes.
 */
@Slf4j
public class MigrationLedger {
    private final String table;

    public MigrationLedger() {
        this(KilnOptions.Migrations.LEDGER_TABLE);
    }

    public MigrationLedger(String table) {
        this.table = table;
    }

    public String getTable() {
        return table;
    }

    public void ensureTable(StoreSession session, DdlDialect dialect) throws SQLException {
        session.execute(dialect.getCreateLedgerTableSql(table));
    }

    public boolean exists(StoreSession session) throws SQLException {
        DatabaseMetaData md = session.getConnection().getMetaData();
        String escape = md.getSearchStringEscape();
        String pattern = escape == null ? table : table.replace("_", escape + "_");
        try (ResultSet rs = md.getTables(session.getConnection().getCatalog(), null, pattern, null)) {
            while (rs.next()) {
                if (table.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Ledger rows in sequence order; empty when the ledger table does not exist yet.
     */
    public List<MigrationRecord> read(StoreSession session, DdlDialect dialect) throws SQLException {
        if (!exists(session)) {
            return List.of();
        }
        String sql = "SELECT " + columns(dialect) + " FROM " + dialect.quoteIdentifier(table)
                + " ORDER BY " + dialect.quoteIdentifier("sequence");
        return session.query(sql, List.of(), rs -> new MigrationRecord(
                rs.getString(1),
                rs.getInt(2),
                rs.getString(3),
                rs.getObject(4, LocalDateTime.class),
                rs.getInt(5)));
    }

    public void append(StoreSession session, DdlDialect dialect, MigrationRecord record) throws SQLException {
        String sql = "INSERT INTO " + dialect.quoteIdentifier(table) + " (" + columns(dialect) + ") VALUES (?, ?, ?, ?, ?)";
        session.update(sql, List.of(record.migrationName(), record.sequence(), record.checksum(),
                record.appliedAt(), record.operationCount()));
        log.debug("Ledger: recorded {} as #{}", record.migrationName(), record.sequence());
    }

    private static String columns(DdlDialect dialect) {
        return String.join(", ",
                dialect.quoteIdentifier("migration_name"),
                dialect.quoteIdentifier("sequence"),
                dialect.quoteIdentifier("checksum"),
                dialect.quoteIdentifier("applied_at"),
                dialect.quoteIdentifier("operation_count"));
    }
}
