package org.kiln.migration.dialect.h2;

import org.kiln.migration.AbstractDialect;
import org.kiln.migration.spi.FieldTypeMapper;
import org.kiln.migration.spi.ValueTransformer;
import org.kiln.model.FieldModel;
import org.kiln.model.ForeignKeyModel;
import org.kiln.migration.operation.AlterField;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class H2Dialect extends AbstractDialect {

    public H2Dialect() {
        super();
    }

    // 테스트 용
    public H2Dialect(FieldTypeMapper fieldTypeMapper, ValueTransformer valueTransformer) {
        this.fieldTypeMapper = fieldTypeMapper;
        this.valueTransformer = valueTransformer;
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    protected FieldTypeMapper initializeFieldTypeMapper() {
        return new H2FieldTypeMapper();
    }

    @Override
    protected ValueTransformer initializeValueTransformer() {
        return new H2ValueTransformer();
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String getColumnDefinitionSql(FieldModel f) {
        StringBuilder sb = new StringBuilder();
        sb.append(quoteIdentifier(f.getColumnName())).append(" ").append(sqlType(f));
        if (f.isStoreGenerated()) {
            sb.append(" GENERATED BY DEFAULT AS IDENTITY");
        }
        sb.append(defaultClause(f));
        if (!f.isNullable() || f.isIdentity()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    /**
     * H2 changes one aspect per statement.
     */
    @Override
    public List<String> getAlterColumnSql(String table, FieldModel from, FieldModel to) {
        checkAlterable(from, to);
        Set<AlterField.Aspect> aspects = AlterField.aspectsBetween(from, to);
        String alterTable = "ALTER TABLE " + quoteIdentifier(table);
        String alterColumn = alterTable + " ALTER COLUMN " + quoteIdentifier(to.getColumnName());
        List<String> out = new ArrayList<>();

        if (aspects.contains(AlterField.Aspect.UNIQUENESS) && from.isSingleColumnUnique()) {
            out.add(getDropUniqueSql(table, from.getUniqueConstraintName()));
        }
        if (aspects.contains(AlterField.Aspect.TYPE) || aspects.contains(AlterField.Aspect.LENGTH)) {
            out.add(alterColumn + " SET DATA TYPE " + sqlType(to));
        }
        if (aspects.contains(AlterField.Aspect.NULLABILITY)) {
            out.add(alterColumn + (to.isNullable() ? " DROP NOT NULL" : " SET NOT NULL"));
        }
        if (aspects.contains(AlterField.Aspect.DEFAULT)) {
            if (to.getDefaultValue().isStatic()) {
                out.add(alterColumn + " SET" + defaultClause(to));
            } else if (from.getDefaultValue().isStatic()) {
                out.add(alterColumn + " DROP DEFAULT");
            }
        }
        if (aspects.contains(AlterField.Aspect.UNIQUENESS) && to.isSingleColumnUnique()) {
            out.add(getAddUniqueSql(table, to.getUniqueConstraintName(), List.of(to.getColumnName())));
        }
        return out;
    }

    @Override
    public String getDropUniqueSql(String table, String name) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP CONSTRAINT " + quoteIdentifier(name);
    }

    @Override
    public String getDropIndexSql(String table, String name) {
        return "DROP INDEX " + quoteIdentifier(name);
    }

    @Override
    public String getDropForeignKeySql(ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(fk.table()) + " DROP CONSTRAINT " + quoteIdentifier(fk.name());
    }

    @Override
    public String getLimitOffsetSql(Integer limit, Integer offset) {
        StringBuilder sb = new StringBuilder();
        if (offset != null && offset > 0) sb.append(" OFFSET ").append(offset).append(" ROWS");
        if (limit != null) sb.append(" FETCH FIRST ").append(limit).append(" ROWS ONLY");
        return sb.toString();
    }
}
