package com.hits.service.core.counter;

import com.hits.service.core.bucket.TimeBucketer;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Write path of the engine. Validates the key, hands the hit to the {@link CounterStore} and
 * announces it with a {@link HitRecordedEvent}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HitCounterService {

    private final CounterStore counterStore;
    private final TimeBucketer bucketer;
    private final HitKeyValidator keyValidator;
    private final ApplicationEventPublisher eventPublisher;

    /** Records a hit at the current instant. */
    public long recordHit(String key) {
        return recordHit(key, null);
    }

    /**
     * Records a hit at {@code timestamp}, or now when it is null.
     *
     * @return the count of the hit's one-minute window after the increment
     */
    public long recordHit(String key, Instant timestamp) {
        String validKey = keyValidator.validate(key);
        Instant occurredAt = timestamp != null ? timestamp : bucketer.now();
        long count = counterStore.increment(validKey, occurredAt);
        Instant window = bucketer.bucket(occurredAt);
        if (log.isDebugEnabled()) {
            log.debug("Recorded hit key={} window={} count={}", validKey, window, count);
        }
        eventPublisher.publishEvent(new HitRecordedEvent(validKey, window, count));
        return count;
    }

    /**
     * Records a hit now and returns the all-time total for the key, the hit included.
     * The total is read after the increment, so concurrent hits on the same key may also be counted.
     */
    public long recordHitAndGetTotal(String key) {
        Instant now = bucketer.now();
        recordHit(key, now);
        return counterStore.sumRange(key, Instant.EPOCH, bucketer.bucketEnd(now));
    }
}
