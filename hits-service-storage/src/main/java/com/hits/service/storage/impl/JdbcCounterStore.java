package com.hits.service.storage.impl;

import com.hits.service.core.bucket.TimeBucketer;
import com.hits.service.core.config.HitsProperties;
import com.hits.service.core.counter.CounterStore;
import com.hits.service.core.counter.HitKeyValidator;
import com.hits.service.core.counter.StoreUnavailableException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * PostgreSQL counter store over the hash-partitioned {@code counters} table.
 *
 * <p>Increments are a single conditional upsert, so the first hit of a window creates the
 * row and later ones bump it under the row lock of that window. A key's rows all hash to
 * the same partition; unrelated keys never share a row lock.
 */
@Repository
@Slf4j
public class JdbcCounterStore implements CounterStore {

    private static final String INCREMENT_SQL =
            """
            INSERT INTO %1$s (key, count, minute_window)
            VALUES (:key, 1, :window)
            ON CONFLICT (key, minute_window)
            DO UPDATE SET count = %1$s.count + 1
            RETURNING count
            """;

    private static final String SUM_RANGE_SQL =
            """
            SELECT CAST(COALESCE(SUM(count), 0) AS BIGINT)
            FROM %s
            WHERE key = :key
              AND minute_window >= :fromInclusive
              AND minute_window < :toExclusive
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final TimeBucketer bucketer;
    private final HitKeyValidator keyValidator;
    private final String incrementSql;
    private final String sumRangeSql;

    public JdbcCounterStore(
            NamedParameterJdbcTemplate jdbc,
            TimeBucketer bucketer,
            HitKeyValidator keyValidator,
            HitsProperties properties) {
        this.jdbc = jdbc;
        this.bucketer = bucketer;
        this.keyValidator = keyValidator;
        String table = new CounterTable(properties.getStorage().getSchema()).qualifiedName();
        this.incrementSql = INCREMENT_SQL.formatted(table);
        this.sumRangeSql = SUM_RANGE_SQL.formatted(table);
    }

    @Override
    public long increment(String key, Instant timestamp) {
        String validKey = keyValidator.validate(key);
        Instant window = bucketer.bucket(timestamp);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("key", validKey)
                .addValue("window", utc(window), Types.TIMESTAMP_WITH_TIMEZONE);
        try {
            Long count = jdbc.queryForObject(incrementSql, params, Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException ex) {
            throw translate("increment", validKey, ex);
        }
    }

    @Override
    public long sumRange(String key, Instant from, Instant to) {
        String validKey = keyValidator.validate(key);
        if (!from.isBefore(to)) {
            return 0L;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("key", validKey)
                .addValue("fromInclusive", utc(from), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("toExclusive", utc(to), Types.TIMESTAMP_WITH_TIMEZONE);
        try {
            Long total = jdbc.queryForObject(sumRangeSql, params, Long.class);
            return total != null ? total : 0L;
        } catch (DataAccessException ex) {
            throw translate("sumRange", validKey, ex);
        }
    }

    private RuntimeException translate(String operation, String key, DataAccessException ex) {
        if (ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException) {
            log.warn("Counter store unavailable during {} for key={}: {}", operation, key, ex.getMessage());
            return new StoreUnavailableException("Counter store unavailable during " + operation, ex);
        }
        log.error("Counter store {} failed for key={}", operation, key, ex);
        return ex;
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
