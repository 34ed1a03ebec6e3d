package com.hits.service.core.bucket;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Maps hit timestamps onto the one-minute windows used as the storage granularity.
 *
 * <p>A window is identified by its start instant; the window containing {@code t} is
 * {@code [bucket(t), bucket(t) + 1 minute)}. All calendar aggregation downstream is built
 * from these half-open windows.
 */
@Component
public class TimeBucketer {

    public static final Duration WINDOW = Duration.ofMinutes(1);

    private final Clock clock;

    public TimeBucketer(Clock clock) {
        this.clock = clock;
    }

    /** Start of the minute containing {@code timestamp}, in UTC. */
    public Instant bucket(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        return timestamp.atZone(ZoneOffset.UTC).withSecond(0).withNano(0).toInstant();
    }

    /** Exclusive end of the window containing {@code timestamp}. */
    public Instant bucketEnd(Instant timestamp) {
        return bucket(timestamp).plus(WINDOW);
    }

    /** Window for the current instant of the configured clock. */
    public Instant currentBucket() {
        return bucket(now());
    }

    public Instant now() {
        return Instant.now(clock);
    }
}
