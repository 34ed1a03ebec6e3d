package com.hits.service.storage.impl;

import java.util.regex.Pattern;

/** Names of the partitioned counters table and its hash partitions within a schema. */
final class CounterTable {

    static final String TABLE = "counters";

    private static final Pattern IDENTIFIER_RE = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

    private final String schema;

    CounterTable(String schema) {
        String normalized = schema == null || schema.isBlank() ? "public" : schema.trim();
        if (!IDENTIFIER_RE.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid counter schema name: " + schema);
        }
        this.schema = normalized;
    }

    String schema() {
        return schema;
    }

    String qualifiedName() {
        return schema + "." + TABLE;
    }

    /** Partition {@code remainder} of the hash-partitioned parent, e.g. {@code public.counters_p7}. */
    String partitionName(int remainder) {
        return qualifiedName() + "_p" + remainder;
    }
}
