package org.kiln.migration.spi.dialect;

import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.ForeignKeyModel;

import java.util.List;

/**
 * Statement generation for one store dialect. Each method returns complete statements
 * without a trailing semicolon.
 */
public interface DdlDialect extends BaseDialect {
    // Table
    String openCreateTable(String tableName);
    String closeCreateTable();
    String getCreateTableSql(EntityModel entity);
    String getDropTableSql(String tableName);

    // Column
    String getColumnDefinitionSql(FieldModel field);
    String getAddColumnSql(String table, FieldModel field);
    String getDropColumnSql(String table, FieldModel field);

    /**
     * Statements turning {@code from} into {@code to}, in execution order.
     *
     * @throws UnsupportedOperationException when the change cannot be expressed
     */
    List<String> getAlterColumnSql(String table, FieldModel from, FieldModel to);

    // Primary key & unique
    String getPrimaryKeyDefinitionSql(List<String> pkColumns);
    String getUniqueDefinitionSql(String name, List<String> columns);
    String getAddUniqueSql(String table, String name, List<String> columns);
    String getDropUniqueSql(String table, String name);

    // Indexes
    String getCreateIndexSql(String table, String name, List<String> columns);
    String getDropIndexSql(String table, String name);

    // Relations
    String getAddForeignKeySql(ForeignKeyModel fk);
    String getDropForeignKeySql(ForeignKeyModel fk);

    // Ledger
    String getCreateLedgerTableSql(String ledgerTable);

    // Reads
    String getLimitOffsetSql(Integer limit, Integer offset);
}
