package org.kiln.migration.contributor;

import org.kiln.migration.spi.dialect.DdlDialect;
import org.kiln.model.FieldModel;

import java.util.List;

public record ColumnContributor(List<String> pkColumns, List<FieldModel> fields) implements DdlContributor {
    @Override
    public int priority() {
        return 40; // Column 정의
    }

    @Override
    public void contribute(StringBuilder sb, DdlDialect dialect) {
        for (FieldModel f : fields) {
            sb.append("  ").append(dialect.getColumnDefinitionSql(f)).append(",\n");
        }
        if (pkColumns != null && !pkColumns.isEmpty()) {
            sb.append("  ").append(dialect.getPrimaryKeyDefinitionSql(pkColumns)).append(",\n");
        }
    }
}
