package org.kiln.migration.dialect.mysql;

import org.kiln.migration.AbstractDialect;
import org.kiln.migration.operation.AlterField;
import org.kiln.migration.spi.FieldTypeMapper;
import org.kiln.migration.spi.ValueTransformer;
import org.kiln.model.FieldModel;
import org.kiln.model.ForeignKeyModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class MySqlDialect extends AbstractDialect {

    // LIMIT 없이 OFFSET만 줄 수 없음
    private static final String MAX_ROWS = "18446744073709551615";

    public MySqlDialect() {
        super();
    }

    // 테스트 용
    public MySqlDialect(FieldTypeMapper fieldTypeMapper, ValueTransformer valueTransformer) {
        this.fieldTypeMapper = fieldTypeMapper;
        this.valueTransformer = valueTransformer;
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    protected FieldTypeMapper initializeFieldTypeMapper() {
        return new MySqlFieldTypeMapper();
    }

    @Override
    protected ValueTransformer initializeValueTransformer() {
        return new MySqlValueTransformer();
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "`" + raw.replace("`", "``") + "`";
    }

    @Override
    public String closeCreateTable() {
        return "\n) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 COLLATE=utf8mb4_unicode_ci";
    }

    @Override
    public String getColumnDefinitionSql(FieldModel f) {
        StringBuilder sb = new StringBuilder();
        sb.append(quoteIdentifier(f.getColumnName())).append(" ").append(sqlType(f));
        if (!f.isNullable() || f.isIdentity()) {
            sb.append(" NOT NULL");
        }
        if (f.isStoreGenerated()) {
            sb.append(" AUTO_INCREMENT");
        }
        sb.append(defaultClause(f));
        return sb.toString();
    }

    /**
     * Type, length, nullability and static default are restated in one {@code MODIFY COLUMN};
     * uniqueness is a separate index.
     */
    @Override
    public List<String> getAlterColumnSql(String table, FieldModel from, FieldModel to) {
        checkAlterable(from, to);
        Set<AlterField.Aspect> aspects = AlterField.aspectsBetween(from, to);
        List<String> out = new ArrayList<>();

        if (aspects.contains(AlterField.Aspect.UNIQUENESS) && from.isSingleColumnUnique()) {
            out.add(getDropUniqueSql(table, from.getUniqueConstraintName()));
        }
        boolean staticDefaultChanged = aspects.contains(AlterField.Aspect.DEFAULT)
                && (from.getDefaultValue().isStatic() || to.getDefaultValue().isStatic());
        if (aspects.contains(AlterField.Aspect.TYPE)
                || aspects.contains(AlterField.Aspect.LENGTH)
                || aspects.contains(AlterField.Aspect.NULLABILITY)
                || staticDefaultChanged) {
            out.add("ALTER TABLE " + quoteIdentifier(table) + " MODIFY COLUMN " + getColumnDefinitionSql(to));
        }
        if (aspects.contains(AlterField.Aspect.UNIQUENESS) && to.isSingleColumnUnique()) {
            out.add(getAddUniqueSql(table, to.getUniqueConstraintName(), List.of(to.getColumnName())));
        }
        return out;
    }

    @Override
    public String getDropUniqueSql(String table, String name) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP INDEX " + quoteIdentifier(name);
    }

    @Override
    public String getDropIndexSql(String table, String name) {
        return "DROP INDEX " + quoteIdentifier(name) + " ON " + quoteIdentifier(table);
    }

    @Override
    public String getDropForeignKeySql(ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(fk.table()) + " DROP FOREIGN KEY " + quoteIdentifier(fk.name());
    }

    @Override
    public String getLimitOffsetSql(Integer limit, Integer offset) {
        if (limit == null && offset != null && offset > 0) {
            return " LIMIT " + MAX_ROWS + " OFFSET " + offset;
        }
        return super.getLimitOffsetSql(limit, offset);
    }
}
