package com.hits.service.core.aggregate;

import com.hits.service.core.bucket.TimeBucketer;
import com.hits.service.core.config.HitsProperties;
import com.hits.service.core.counter.CounterStore;
import com.hits.service.core.counter.HitKeyValidator;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read path of the engine. Every configured range is summed with its own
 * {@link CounterStore#sumRange} call; no range is derived from another.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationService {

    private final CounterStore counterStore;
    private final TimeBucketer bucketer;
    private final HitKeyValidator keyValidator;
    private final HitsProperties properties;

    public HitAggregate aggregate(String key) {
        return aggregate(key, null);
    }

    /** Computes the configured ranges for {@code key}, each ending at {@code now} (exclusive). */
    public HitAggregate aggregate(String key, Instant now) {
        String validKey = keyValidator.validate(key);
        Instant end = now != null ? now : bucketer.now();
        ZoneId zone = properties.zoneId();

        Map<AggregateRange, Long> values = new EnumMap<>(AggregateRange.class);
        for (AggregateRange range : configuredRanges()) {
            Instant start = range.start(end, zone);
            values.put(range, counterStore.sumRange(validKey, start, end));
        }
        HitAggregate aggregate = HitAggregate.from(values);
        if (log.isDebugEnabled()) {
            log.debug("Aggregated key={} until={} ranges={} -> {}", validKey, end, values.keySet(), aggregate);
        }
        return aggregate;
    }

    private EnumSet<AggregateRange> configuredRanges() {
        List<AggregateRange> ranges = properties.getAggregation().getRanges();
        if (ranges == null || ranges.isEmpty()) {
            return EnumSet.noneOf(AggregateRange.class);
        }
        return EnumSet.copyOf(ranges);
    }
}
