package com.kmg.repost.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * {@code periodHours} and {@code jitterMinutes} fall back to the configured defaults when omitted.
 */
public record CreateScheduleRequest(
        @NotBlank String url,
        @Positive @DecimalMax("87600") Double periodHours,
        @PositiveOrZero Integer jitterMinutes
) {
}
