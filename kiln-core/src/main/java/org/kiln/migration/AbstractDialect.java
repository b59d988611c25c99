package org.kiln.migration;

import org.kiln.migration.contributor.ColumnContributor;
import org.kiln.migration.contributor.UniqueConstraintContributor;
import org.kiln.migration.spi.FieldTypeMapper;
import org.kiln.migration.spi.ValueTransformer;
import org.kiln.migration.spi.dialect.DdlDialect;
import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.FieldType;
import org.kiln.model.ForeignKeyModel;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Statements both supported dialects write the same way.
 */
public abstract class AbstractDialect implements DdlDialect {
    protected FieldTypeMapper fieldTypeMapper;
    protected ValueTransformer valueTransformer;

    protected AbstractDialect() {
        this.fieldTypeMapper = initializeFieldTypeMapper();
        this.valueTransformer = initializeValueTransformer();
    }

    protected abstract FieldTypeMapper initializeFieldTypeMapper();
    protected abstract ValueTransformer initializeValueTransformer();

    @Override
    public FieldTypeMapper getFieldTypeMapper() {
        return fieldTypeMapper;
    }

    @Override
    public ValueTransformer getValueTransformer() {
        return valueTransformer;
    }

    protected String sqlType(FieldModel field) {
        return fieldTypeMapper.map(field.getType()).getSqlType(field.getLength());
    }

    protected String defaultClause(FieldModel field) {
        if (!field.getDefaultValue().isStatic()) return "";
        return " DEFAULT " + valueTransformer.quote(field.getDefaultValue().getLiteral(), field.getType());
    }

    protected String columnList(List<String> columns) {
        return columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }

    // Table

    @Override
    public String getCreateTableSql(EntityModel entity) {
        return new CreateTableBuilder(entity.getTableName(), this)
                .add(new ColumnContributor(List.of(entity.getIdentityField().getColumnName()), entity.getFields()))
                .add(UniqueConstraintContributor.of(entity))
                .build();
    }

    @Override
    public String openCreateTable(String table) {
        return "CREATE TABLE " + quoteIdentifier(table) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n)";
    }

    @Override
    public String getDropTableSql(String tableName) {
        return "DROP TABLE " + quoteIdentifier(tableName);
    }

    // Column

    @Override
    public String getAddColumnSql(String table, FieldModel field) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + getColumnDefinitionSql(field);
    }

    @Override
    public String getDropColumnSql(String table, FieldModel field) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP COLUMN " + quoteIdentifier(field.getColumnName());
    }

    /**
     * Identity columns and their generator are fixed once the table exists.
     */
    protected void checkAlterable(FieldModel from, FieldModel to) {
        if (from.isIdentity() != to.isIdentity()) {
            throw new UnsupportedOperationException(name() + " cannot change the identity of existing column " + to.getColumnName());
        }
        if (from.isStoreGenerated() != to.isStoreGenerated()) {
            throw new UnsupportedOperationException(name() + " cannot change autoincrement of existing column " + to.getColumnName());
        }
    }

    // PK & unique

    @Override
    public String getPrimaryKeyDefinitionSql(List<String> pkColumns) {
        return "PRIMARY KEY (" + columnList(pkColumns) + ")";
    }

    @Override
    public String getUniqueDefinitionSql(String name, List<String> columns) {
        return "CONSTRAINT " + quoteIdentifier(name) + " UNIQUE (" + columnList(columns) + ")";
    }

    @Override
    public String getAddUniqueSql(String table, String name, List<String> columns) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD " + getUniqueDefinitionSql(name, columns);
    }

    // Indexes

    @Override
    public String getCreateIndexSql(String table, String name, List<String> columns) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Index name must not be null/blank");
        }
        return "CREATE INDEX " + quoteIdentifier(name) + " ON " + quoteIdentifier(table) + " (" + columnList(columns) + ")";
    }

    // Relations

    @Override
    public String getAddForeignKeySql(ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(fk.table())
                + " ADD CONSTRAINT " + quoteIdentifier(fk.name())
                + " FOREIGN KEY (" + quoteIdentifier(fk.column()) + ")"
                + " REFERENCES " + quoteIdentifier(fk.referencedTable()) + " (" + quoteIdentifier(fk.referencedColumn()) + ")"
                + " ON DELETE " + fk.onDelete().sql();
    }

    @Override
    public String getCreateLedgerTableSql(String ledgerTable) {
        String timestampType = fieldTypeMapper.map(FieldType.TIMESTAMP).getSqlType(0);
        return "CREATE TABLE IF NOT EXISTS " + quoteIdentifier(ledgerTable) + " (\n"
                + "  " + quoteIdentifier("migration_name") + " VARCHAR(255) NOT NULL,\n"
                + "  " + quoteIdentifier("sequence") + " INTEGER NOT NULL,\n"
                + "  " + quoteIdentifier("checksum") + " VARCHAR(64) NOT NULL,\n"
                + "  " + quoteIdentifier("applied_at") + " " + timestampType + " NOT NULL,\n"
                + "  " + quoteIdentifier("operation_count") + " INTEGER NOT NULL,\n"
                + "  CONSTRAINT " + quoteIdentifier("pk" + ledgerTable) + " PRIMARY KEY (" + quoteIdentifier("migration_name") + "),\n"
                + "  CONSTRAINT " + quoteIdentifier("uq" + ledgerTable + "__sequence") + " UNIQUE (" + quoteIdentifier("sequence") + ")\n"
                + ")";
    }

    @Override
    public String getLimitOffsetSql(Integer limit, Integer offset) {
        StringBuilder sb = new StringBuilder();
        if (limit != null) sb.append(" LIMIT ").append(limit);
        if (offset != null && offset > 0) sb.append(" OFFSET ").append(offset);
        return sb.toString();
    }

    @Override
    public String toString() {
        return name();
    }
}
