package com.kmg.repost.dto;

/**
 * Timestamps are epoch milliseconds; {@code nextRun} and {@code lastResult} may be null.
 */
public record ScheduleView(
        String id,
        String url,
        double periodHours,
        int jitterMinutes,
        Long nextRun,
        String lastResult,
        boolean active,
        long createdAt,
        boolean running
) {
}
