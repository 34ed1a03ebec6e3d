package com.hits.service.core.aggregate;

import java.util.Map;

/**
 * Statistics for one key as handed to badge renderers. Ranges that are not configured are
 * reported as zero.
 */
public record HitAggregate(long total, long today, long thisMonth, long thisYear) {

    public static HitAggregate from(Map<AggregateRange, Long> values) {
        return new HitAggregate(
                values.getOrDefault(AggregateRange.TOTAL, 0L),
                values.getOrDefault(AggregateRange.TODAY, 0L),
                values.getOrDefault(AggregateRange.THIS_MONTH, 0L),
                values.getOrDefault(AggregateRange.THIS_YEAR, 0L));
    }

    public long get(AggregateRange range) {
        return switch (range) {
            case TOTAL -> total;
            case TODAY -> today;
            case THIS_MONTH -> thisMonth;
            case THIS_YEAR -> thisYear;
        };
    }
}
