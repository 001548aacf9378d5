package com.kmg.repost.support;

import com.kmg.repost.model.Schedule;

import java.time.Instant;

public final class Schedules {
    public static final String LISTING_URL = "https://www.leboncoin.fr/ad/voitures/2400000001";

    private Schedules() {
    }

    public static Schedule schedule(String id, boolean active, Instant nextRun) {
        return new Schedule(id, LISTING_URL + "?ref=" + id, 48, 7, nextRun, null, active, Instant.parse("2026-01-01T00:00:00Z"));
    }

    public static Schedule schedule(String id, double periodHours, int jitterMinutes, Instant nextRun) {
        return new Schedule(id, LISTING_URL + "?ref=" + id, periodHours, jitterMinutes, nextRun, null, true,
                Instant.parse("2026-01-01T00:00:00Z"));
    }
}
