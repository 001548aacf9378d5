package com.kmg.repost.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Random;

/**
 * Computes the next eligible run of a schedule: the period rounded down to whole minutes
 * (never less than one), plus a uniformly drawn number of jitter minutes in {@code [0, jitter)}.
 * Failures use the same rule as successes.
 */
public class JitterPolicy {
    /** Ten years; longer periods overflow the instant range. */
    public static final double MAX_PERIOD_HOURS = 87_600;

    private final Random random;

    public JitterPolicy(Random random) {
        this.random = Objects.requireNonNull(random);
    }

    public Instant computeNextRun(double periodHours, int jitterMinutes, Instant now) {
        if (Double.isNaN(periodHours) || periodHours > MAX_PERIOD_HOURS) {
            throw new IllegalArgumentException("Period must not exceed " + MAX_PERIOD_HOURS + " hours: " + periodHours);
        }
        long baseMinutes = baseMinutes(periodHours);
        int jitter = Math.max(0, jitterMinutes);
        int drawn = jitter == 0 ? 0 : random.nextInt(jitter);
        return now.plus(Duration.ofMinutes(baseMinutes + drawn));
    }

    public static long baseMinutes(double periodHours) {
        return Math.max(1L, (long) Math.floor(periodHours * 60));
    }
}
