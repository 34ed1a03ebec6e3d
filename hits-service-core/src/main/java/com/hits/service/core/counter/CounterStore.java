package com.hits.service.core.counter;

import java.time.Instant;

/**
 * Durable table of {@code (key, window) -> count} rows.
 *
 * <p>Implementations hold no in-process counter state and are safe to share across
 * concurrent callers. Increments on the same {@code (key, window)} must never lose an
 * update; increments on different keys must not serialize behind each other.
 *
 * <p>Both operations reject a key that {@link HitKeyValidator} refuses with
 * {@link InvalidKeyException} before any storage access, and report an unreachable or
 * timed-out store with {@link StoreUnavailableException}. Neither retries internally.
 */
public interface CounterStore {

    /**
     * Records one hit for {@code key} in the one-minute window containing {@code timestamp}.
     * Creates the row with {@code count = 1} when absent, otherwise increments it in place.
     *
     * @return the count of that window after the increment
     */
    long increment(String key, Instant timestamp);

    /**
     * Sums the counts of every window of {@code key} whose start lies in {@code [from, to)}.
     * Returns {@code 0} when nothing matches, including when {@code from} is not before {@code to}.
     */
    long sumRange(String key, Instant from, Instant to);
}
