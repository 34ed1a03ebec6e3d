package com.hits.service.core.counter;

import java.time.Instant;

/** Published after a hit has been stored. {@code count} is the window count after the increment. */
public record HitRecordedEvent(String key, Instant window, long count) {}
