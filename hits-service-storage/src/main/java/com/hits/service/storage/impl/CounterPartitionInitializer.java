package com.hits.service.storage.impl;

import com.hits.service.core.config.HitsProperties;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Creates the {@code counters} table, hash-partitioned by key, and any missing partitions.
 *
 * <p>Idempotent. The partition count is a deployment-time constant: when the table is
 * already partitioned under a different modulus nothing is created, since re-partitioning
 * live data is an operational migration.
 */
@Service
@Slf4j
public class CounterPartitionInitializer {

    private static final String PARTITION_MODULI_SQL =
            """
            SELECT DISTINCT (regexp_match(pg_get_expr(c.relpartbound, c.oid, true), 'modulus (\\d+)', 'i'))[1]::int
            FROM pg_inherits i
            JOIN pg_class c ON c.oid = i.inhrelid
            JOIN pg_class p ON p.oid = i.inhparent
            JOIN pg_namespace n ON n.oid = p.relnamespace
            WHERE n.nspname = ?
              AND p.relname = ?
            """;

    private final JdbcTemplate jdbc;
    private final HitsProperties properties;

    public CounterPartitionInitializer(JdbcTemplate jdbc, HitsProperties properties) {
        this.jdbc = jdbc;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.getStorage().isInitialize()) {
            log.info("Counter table initialization disabled (hits.storage.initialize=false)");
            return;
        }
        log.info("Ensuring counters table and partitions at startup...");
        ensurePartitions();
    }

    /**
     * Ensures the parent table and every {@code MODULUS n} partition exist.
     *
     * @return false when the table is partitioned under another modulus and was left alone
     */
    public boolean ensurePartitions() {
        int partitionCount = properties.getStorage().getPartitions();
        if (partitionCount < 1) {
            throw new IllegalStateException("hits.storage.partitions must be positive, was " + partitionCount);
        }
        CounterTable table = new CounterTable(properties.getStorage().getSchema());

        ensureParentTable(table);

        List<Integer> moduli = existingModuli(table);
        if (!moduli.isEmpty() && !moduli.equals(List.of(partitionCount))) {
            log.warn(
                    "Counters table {} uses modulus {} but {} partitions are configured; layout left unchanged",
                    table.qualifiedName(),
                    moduli,
                    partitionCount);
            return false;
        }

        for (int remainder = 0; remainder < partitionCount; remainder++) {
            ensurePartition(table, remainder, partitionCount);
        }
        log.info("Counters table {} has {} hash partitions", table.qualifiedName(), partitionCount);
        return true;
    }

    private void ensureParentTable(CounterTable table) {
        jdbc.execute("CREATE SCHEMA IF NOT EXISTS " + table.schema());
        jdbc.execute(String.format(
                """
                CREATE TABLE IF NOT EXISTS %s (
                    key TEXT NOT NULL,
                    count BIGINT NOT NULL DEFAULT 0,
                    minute_window TIMESTAMPTZ NOT NULL,
                    PRIMARY KEY (key, minute_window)
                ) PARTITION BY HASH (key)
                """,
                table.qualifiedName()));
    }

    private List<Integer> existingModuli(CounterTable table) {
        return jdbc.queryForList(PARTITION_MODULI_SQL, Integer.class, table.schema(), CounterTable.TABLE).stream()
                .filter(Objects::nonNull)
                .sorted()
                .toList();
    }

    private void ensurePartition(CounterTable table, int remainder, int modulus) {
        String partitionName = table.partitionName(remainder);
        if (log.isDebugEnabled()) {
            log.debug("Ensuring counter partition {} (MODULUS {} REMAINDER {})", partitionName, modulus, remainder);
        }
        jdbc.execute(String.format(
                "CREATE TABLE IF NOT EXISTS %s PARTITION OF %s FOR VALUES WITH (MODULUS %d, REMAINDER %d)",
                partitionName, table.qualifiedName(), modulus, remainder));
    }
}
