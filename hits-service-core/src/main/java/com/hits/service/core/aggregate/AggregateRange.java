package com.hits.service.core.aggregate;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Named ranges the aggregator can compute. Each range is half-open: {@code [start(now), now)}.
 */
public enum AggregateRange {
    TOTAL,
    TODAY,
    THIS_MONTH,
    THIS_YEAR;

    /** First instant of the range ending at {@code now}, with calendar boundaries taken in {@code zone}. */
    public Instant start(Instant now, ZoneId zone) {
        ZonedDateTime zdt = now.atZone(zone);
        return switch (this) {
            case TOTAL -> Instant.EPOCH;
            case TODAY -> zdt.toLocalDate().atStartOfDay(zone).toInstant();
            case THIS_MONTH -> zdt.toLocalDate().withDayOfMonth(1).atStartOfDay(zone).toInstant();
            case THIS_YEAR -> zdt.toLocalDate().withDayOfYear(1).atStartOfDay(zone).toInstant();
        };
    }
}
