package org.kiln.naming;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class DefaultNaming implements Naming {
    private final int maxLength;

    public DefaultNaming(int maxNameLength) {
        if (maxNameLength < 10) {
            throw new IllegalArgumentException("maxNameLength must be at least 10, got " + maxNameLength);
        }
        this.maxLength = maxNameLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    @Override
    public String fkName(String childTable, List<String> childCols, String parentTable, List<String> parentCols) {
        // only child columns take part in the name
        String base = "fk_"
                + norm(childTable)
                + "__"
                + joinNormalizedColumns(childCols)
                + "__"
                + norm(parentTable);
        return clampWithHash(base);
    }

    @Override
    public String pkName(String table, List<String> cols) {
        return buildNameWithColumns("pk_", table, cols);
    }

    @Override
    public String uqName(String table, List<String> cols) {
        return buildNameWithColumns("uq_", table, cols);
    }

    @Override
    public String ixName(String table, List<String> cols) {
        return buildNameWithColumns("ix_", table, cols);
    }

    private String buildNameWithColumns(String prefix, String table, List<String> cols) {
        String base = prefix + norm(table) + "__" + joinNormalizedColumns(cols);
        return clampWithHash(base);
    }

    /**
     * Normalize, sort case-insensitively, join with '_'. Empty for null or empty input.
     */
    private String joinNormalizedColumns(List<String> cols) {
        if (cols == null || cols.isEmpty()) return "";
        List<String> normalized = cols.stream()
                .map(this::norm)
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.sort(normalized, String.CASE_INSENSITIVE_ORDER);
        return String.join("_", normalized);
    }

    /**
     * Normalization rules:
     *  - null -> "null"
     *  - characters outside [A-Za-z0-9_] -> '_'
     *  - runs of '_' collapse to one
     *  - lowercase
     *  - empty or all-'_' results become 'x'
     */
    private String norm(String s) {
        if (s == null) return "null";
        String x = s.replaceAll("[^A-Za-z0-9_]", "_");
        x = x.replaceAll("_+", "_");
        x = x.toLowerCase();
        if (x.isEmpty() || x.chars().allMatch(ch -> ch == '_')) {
            return "x";
        }
        return x;
    }

    // Over the limit: [prefix] + '_' + [hex(hash)]
    private String clampWithHash(String name) {
        if (name.length() <= maxLength) return name;
        String hash = computeStableHash(name);
        int keep = Math.max(1, maxLength - (hash.length() + 1));
        return name.substring(0, keep) + "_" + hash;
    }

    private String computeStableHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            // first 4 bytes, 8 hex chars
            return String.format("%02x%02x%02x%02x", hash[0], hash[1], hash[2], hash[3]);
        } catch (NoSuchAlgorithmException e) {
            return Integer.toHexString(input.hashCode());
        }
    }
}
