package org.kiln.migration.introspect;

import org.kiln.model.EntityModel;
import org.kiln.model.FieldModel;
import org.kiln.model.ForeignKeyModel;
import org.kiln.model.OnDeleteAction;
import org.kiln.model.SchemaSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Structure of a store that matters for drift: tables, columns (type family and
 * nullability), primary keys, unique column sets and foreign keys. All names are compared
 * case-insensitively and held in lower case.
 */
public final class StructuralShape {

    public record Column(String name, TypeFamily family, boolean nullable) {
        @Override
        public String toString() {
            return name + " " + family + (nullable ? " NULL" : " NOT NULL");
        }
    }

    public record ForeignKey(String name, String column, String referencedTable, String referencedColumn,
                             OnDeleteAction onDelete) {
        @Override
        public String toString() {
            return name + " (" + column + ") -> " + referencedTable + "(" + referencedColumn + ") ON DELETE " + onDelete.sql();
        }
    }

    public record Table(String name,
                        SortedMap<String, Column> columns,
                        List<String> primaryKey,
                        Set<List<String>> uniqueSets,
                        Set<ForeignKey> foreignKeys) {

        public Table {
            columns = new TreeMap<>(columns);
            primaryKey = List.copyOf(primaryKey);
            TreeSet<List<String>> uniques = new TreeSet<>(Comparator.comparing(Object::toString));
            uniqueSets.forEach(u -> uniques.add(List.copyOf(u)));
            uniqueSets = uniques;
            TreeSet<ForeignKey> fks = new TreeSet<>(Comparator.comparing(ForeignKey::name).thenComparing(ForeignKey::column));
            fks.addAll(foreignKeys);
            foreignKeys = fks;
        }
    }

    private final SortedMap<String, Table> tables;

    public StructuralShape(Map<String, Table> tables) {
        this.tables = new TreeMap<>(tables);
    }

    public SortedMap<String, Table> getTables() {
        return tables;
    }

    /**
     * Shape a store must have once {@code snapshot} has been migrated into it.
     */
    public static StructuralShape of(SchemaSnapshot snapshot) {
        Map<String, Table> tables = new TreeMap<>();
        for (EntityModel e : snapshot.getEntitiesInOrder()) {
            SortedMap<String, Column> columns = new TreeMap<>();
            for (FieldModel f : e.getFields()) {
                String col = lower(f.getColumnName());
                columns.put(col, new Column(col, TypeFamily.of(f.getType()), f.isNullable() && !f.isIdentity()));
            }
            Set<List<String>> uniques = new TreeSet<>(Comparator.comparing(Object::toString));
            for (FieldModel f : e.getFields()) {
                if (f.isSingleColumnUnique()) uniques.add(List.of(lower(f.getColumnName())));
            }
            e.getConstraints().forEach(c -> uniques.add(sortedLower(c.getFields().stream()
                    .map(name -> e.findField(name).map(FieldModel::getColumnName).orElse(name))
                    .toList())));
            Set<ForeignKey> fks = new TreeSet<>(Comparator.comparing(ForeignKey::name));
            for (ForeignKeyModel fk : snapshot.foreignKeysOf(e)) {
                fks.add(new ForeignKey(lower(fk.name()), lower(fk.column()), lower(fk.referencedTable()),
                        lower(fk.referencedColumn()), fk.onDelete()));
            }
            String table = lower(e.getTableName());
            tables.put(table, new Table(table, columns, List.of(lower(e.getIdentityField().getColumnName())), uniques, fks));
        }
        return new StructuralShape(tables);
    }

    /**
     * Human-readable differences from {@code actual}'s point of view; empty when equal.
     */
    public List<String> differencesFrom(StructuralShape actual) {
        List<String> out = new ArrayList<>();
        for (String name : tables.keySet()) {
            if (!actual.tables.containsKey(name)) out.add("missing table " + name);
        }
        for (String name : actual.tables.keySet()) {
            if (!tables.containsKey(name)) out.add("unexpected table " + name);
        }
        for (Table expected : tables.values()) {
            Table found = actual.tables.get(expected.name());
            if (found == null) continue;
            compareColumns(expected, found, out);
            if (!expected.primaryKey().equals(found.primaryKey())) {
                out.add(expected.name() + ": primary key " + found.primaryKey() + ", expected " + expected.primaryKey());
            }
            if (!expected.uniqueSets().equals(found.uniqueSets())) {
                out.add(expected.name() + ": unique sets " + found.uniqueSets() + ", expected " + expected.uniqueSets());
            }
            if (!expected.foreignKeys().equals(found.foreignKeys())) {
                out.add(expected.name() + ": foreign keys " + found.foreignKeys() + ", expected " + expected.foreignKeys());
            }
        }
        return out;
    }

    private static void compareColumns(Table expected, Table found, List<String> out) {
        for (Column c : expected.columns().values()) {
            Column other = found.columns().get(c.name());
            if (other == null) {
                out.add(expected.name() + ": missing column " + c.name());
            } else if (!c.equals(other)) {
                out.add(expected.name() + ": column " + other + ", expected " + c);
            }
        }
        for (String name : found.columns().keySet()) {
            if (!expected.columns().containsKey(name)) out.add(expected.name() + ": unexpected column " + name);
        }
    }

    static String lower(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }

    static List<String> sortedLower(List<String> names) {
        return names.stream().map(StructuralShape::lower).sorted().toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuralShape that)) return false;
        return tables.equals(that.tables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tables);
    }

    @Override
    public String toString() {
        return "StructuralShape" + tables.keySet();
    }
}
