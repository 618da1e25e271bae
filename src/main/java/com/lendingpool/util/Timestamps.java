package com.lendingpool.util;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Accrual runs on whole seconds. Truncating "now" keeps sub-second remainders from
 * being dropped between two accruals.
 */
public final class Timestamps {
    private Timestamps() {}

    public static Instant now(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}
