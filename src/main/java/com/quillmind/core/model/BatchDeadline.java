package com.quillmind.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Point in time after which the caller no longer wants the rest of a batch.
 */
public record BatchDeadline(Instant expiresAt) {

    private static final BatchDeadline NONE = new BatchDeadline(Instant.MAX);

    public static BatchDeadline none() {
        return NONE;
    }

    public static BatchDeadline after(Duration timeout, Clock clock) {
        return new BatchDeadline(clock.instant().plus(timeout));
    }

    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(expiresAt);
    }
}
