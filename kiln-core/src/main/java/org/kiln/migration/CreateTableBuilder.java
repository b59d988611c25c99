package org.kiln.migration;

import org.kiln.migration.contributor.DdlContributor;
import org.kiln.migration.spi.dialect.DdlDialect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class CreateTableBuilder {
    private final String table;
    private final DdlDialect dialect;
    private final List<DdlContributor> body = new ArrayList<>();

    public CreateTableBuilder(String table, DdlDialect d) {
        this.table = table;
        this.dialect = d;
    }

    public CreateTableBuilder add(DdlContributor c) {
        body.add(c);
        return this;
    }

    public String build() {
        StringBuilder sb = new StringBuilder(dialect.openCreateTable(table));

        body.stream()
                .sorted(Comparator.comparingInt(DdlContributor::priority))
                .forEach(c -> c.contribute(sb, dialect));

        trimTrailingComma(sb);

        return sb.append(dialect.closeCreateTable()).toString();
    }

    private void trimTrailingComma(StringBuilder sb) {
        int last = sb.lastIndexOf(",\n");
        if (last != -1 && last == sb.length() - 2) sb.delete(last, last + 2);
    }
}
