package com.kmg.repost.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JitterPolicyTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldStayWithinPeriodPlusJitterWindow() {
        JitterPolicy policy = new JitterPolicy(new Random(42));
        Random inputs = new Random(7);

        for (int i = 0; i < 500; i++) {
            double periodHours = 1.0 / 60 + inputs.nextDouble() * 96;
            int jitterMinutes = inputs.nextInt(120);
            long base = JitterPolicy.baseMinutes(periodHours);

            long delta = Duration.between(T0, policy.computeNextRun(periodHours, jitterMinutes, T0)).toMillis();

            assertThat(delta).isBetween(base * 60_000, (base + jitterMinutes) * 60_000);
            assertThat(delta).isPositive();
        }
    }

    @Test
    void shouldPlaceTwoDayScheduleInsideSevenMinuteWindow() {
        JitterPolicy policy = new JitterPolicy(new Random());

        Instant next = policy.computeNextRun(48, 7, T0);

        long delta = next.toEpochMilli() - T0.toEpochMilli();
        assertThat(delta).isBetween(172_800_000L, 172_800_000L + 420_000L);
    }

    @Test
    void shouldUseExactPeriodWhenJitterIsZero() {
        JitterPolicy policy = new JitterPolicy(new Random(1));

        assertThat(policy.computeNextRun(2, 0, T0)).isEqualTo(T0.plus(Duration.ofMinutes(120)));
    }

    @Test
    void shouldTreatNegativeJitterAsZero() {
        JitterPolicy policy = new JitterPolicy(new Random(1));

        assertThat(policy.computeNextRun(1, -5, T0)).isEqualTo(T0.plus(Duration.ofMinutes(60)));
    }

    @Test
    void shouldNeverScheduleLessThanOneMinuteAhead() {
        JitterPolicy policy = new JitterPolicy(new Random(1));

        assertThat(JitterPolicy.baseMinutes(0.001)).isEqualTo(1);
        assertThat(policy.computeNextRun(0.001, 0, T0)).isEqualTo(T0.plus(Duration.ofMinutes(1)));
    }

    @Test
    void shouldRoundPeriodDownToWholeMinutes() {
        // 1.51h = 90.6 minutes
        assertThat(JitterPolicy.baseMinutes(1.51)).isEqualTo(90);
    }

    @Test
    void shouldBeDeterministicForSameSeed() {
        JitterPolicy first = new JitterPolicy(new Random(99));
        JitterPolicy second = new JitterPolicy(new Random(99));

        for (int i = 0; i < 20; i++) {
            assertThat(first.computeNextRun(48, 30, T0)).isEqualTo(second.computeNextRun(48, 30, T0));
        }
    }

    @Test
    void shouldSpreadRunsAcrossJitterWindow() {
        JitterPolicy policy = new JitterPolicy(new Random(3));
        Set<Instant> distinct = new HashSet<>();

        for (int i = 0; i < 200; i++) {
            distinct.add(policy.computeNextRun(48, 7, T0));
        }

        assertThat(distinct).hasSize(7);
    }

    @Test
    void shouldRejectPeriodsAboveMaximum() {
        JitterPolicy policy = new JitterPolicy(new Random(1));

        assertThatThrownBy(() -> policy.computeNextRun(1e13, 7, T0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.computeNextRun(Double.POSITIVE_INFINITY, 7, T0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(policy.computeNextRun(JitterPolicy.MAX_PERIOD_HOURS, 0, T0))
                .isEqualTo(T0.plus(Duration.ofHours(87_600)));
    }
}
