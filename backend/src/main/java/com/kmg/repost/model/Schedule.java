package com.kmg.repost.model;

import java.time.Instant;

/**
 * One recurring repost job. {@code nextRun} and {@code lastResult} are null until first set;
 * a null {@code nextRun} means the schedule is due immediately.
 */
public record Schedule(
        String id,
        String url,
        double periodHours,
        int jitterMinutes,
        Instant nextRun,
        String lastResult,
        boolean active,
        Instant createdAt
) {
    public boolean isDueAt(Instant now) {
        return active && (nextRun == null || !nextRun.isAfter(now));
    }
}
