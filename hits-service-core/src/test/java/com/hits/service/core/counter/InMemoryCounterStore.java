package com.hits.service.core.counter;

import com.hits.service.core.bucket.TimeBucketer;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Thread-safe counter store double keyed by {@code (key, window)}. */
public class InMemoryCounterStore implements CounterStore {

    private final Map<String, ConcurrentSkipListMap<Instant, Long>> rows = new ConcurrentHashMap<>();
    private final TimeBucketer bucketer;
    private final HitKeyValidator keyValidator;
    private final AtomicInteger sumCalls = new AtomicInteger();

    public InMemoryCounterStore(TimeBucketer bucketer, HitKeyValidator keyValidator) {
        this.bucketer = bucketer;
        this.keyValidator = keyValidator;
    }

    @Override
    public long increment(String key, Instant timestamp) {
        String validKey = keyValidator.validate(key);
        Instant window = bucketer.bucket(timestamp);
        return rows.computeIfAbsent(validKey, k -> new ConcurrentSkipListMap<>()).merge(window, 1L, Long::sum);
    }

    @Override
    public long sumRange(String key, Instant from, Instant to) {
        String validKey = keyValidator.validate(key);
        sumCalls.incrementAndGet();
        if (!from.isBefore(to)) {
            return 0L;
        }
        ConcurrentSkipListMap<Instant, Long> windows = rows.get(validKey);
        if (windows == null) {
            return 0L;
        }
        return windows.subMap(from, true, to, false).values().stream()
                .mapToLong(Long::longValue)
                .sum();
    }

    public int rowCount() {
        return rows.values().stream().mapToInt(Map::size).sum();
    }

    public int sumCalls() {
        return sumCalls.get();
    }
}
