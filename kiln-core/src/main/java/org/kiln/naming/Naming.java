package org.kiln.naming;

import java.util.List;

/**
 * Generated names for constraints and indexes. Physical table and column names come from
 * {@link org.kiln.spi.naming.NamingStrategy}.
 */
public interface Naming {
    String pkName(String tableName, List<String> columns);
    String fkName(String fromTable, List<String> fromColumns, String toTable, List<String> toColumns);
    String uqName(String tableName, List<String> columns);
    String ixName(String tableName, List<String> columns);
}
