package com.kmg.repost.repo;

import static com.kmg.repost.support.Schedules.schedule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kmg.repost.error.ScheduleNotFoundException;
import com.kmg.repost.model.ActionOutcome;
import com.kmg.repost.model.Schedule;
import com.kmg.repost.support.TestDatabase;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

class ScheduleRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private JdbcTemplate jdbcTemplate;
    private ScheduleRepository repository;

    @BeforeEach
    void setUp() {
        jdbcTemplate = TestDatabase.create(tempDir);
        repository = new ScheduleRepository(jdbcTemplate);
    }

    @Test
    void shouldSelectOnlyActiveDueSchedules() {
        repository.insert(schedule("A", true, T0.minusMillis(1000)));
        repository.insert(schedule("B", false, T0.minusMillis(1000)));

        List<Schedule> due = repository.selectDue(T0);

        assertThat(due).extracting(Schedule::id).containsExactly("A");
    }

    @Test
    void shouldTreatUnsetNextRunAsDue() {
        repository.insert(schedule("fresh", true, null));
        repository.insert(schedule("paused-fresh", false, null));

        assertThat(repository.selectDue(T0)).extracting(Schedule::id).containsExactly("fresh");
    }

    @Test
    void shouldIncludeBoundaryAndExcludeFutureRuns() {
        repository.insert(schedule("exact", true, T0));
        repository.insert(schedule("future", true, T0.plusMillis(1)));
        repository.insert(schedule("past", true, T0.minusSeconds(3600)));

        assertThat(repository.selectDue(T0)).extracting(Schedule::id).containsExactlyInAnyOrder("exact", "past");
    }

    @Test
    void shouldReturnSameSetOnRepeatedSelection() {
        repository.insert(schedule("A", true, T0.minusSeconds(10)));
        repository.insert(schedule("B", true, null));
        repository.insert(schedule("C", false, T0.minusSeconds(10)));
        repository.insert(schedule("D", true, T0.plusSeconds(10)));

        List<Schedule> first = repository.selectDue(T0);
        List<Schedule> second = repository.selectDue(T0);

        assertThat(second).containsExactlyInAnyOrderElementsOf(first);
        assertThat(first).extracting(Schedule::id).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    void shouldRoundTripAllColumns() {
        Schedule stored = new Schedule("full", "https://www.leboncoin.fr/ad/1", 1.5, 12,
                T0.plusSeconds(60), "OK: done", false, T0.minusSeconds(60));
        repository.insert(stored);

        assertThat(repository.findById("full")).contains(stored);
        assertThat(repository.findById("missing")).isEmpty();
    }

    @Test
    void shouldRecordFormattedOutcomeAndNextRun() {
        repository.insert(schedule("A", true, T0.minusSeconds(5)));
        Instant next = T0.plusSeconds(172_800);

        repository.recordOutcome("A", ActionOutcome.failed("Repost button not found"), next);

        Schedule updated = repository.findById("A").orElseThrow();
        assertThat(updated.lastResult()).isEqualTo("ERR: Repost button not found");
        assertThat(updated.nextRun()).isEqualTo(next);
        assertThat(updated.periodHours()).isEqualTo(48);
        assertThat(updated.jitterMinutes()).isEqualTo(7);
        assertThat(updated.active()).isTrue();
        assertThat(repository.selectDue(T0)).isEmpty();
    }

    @Test
    void shouldFailRecordingOutcomeForUnknownId() {
        assertThatThrownBy(() -> repository.recordOutcome("ghost", ActionOutcome.succeeded("x"), T0))
                .isInstanceOf(ScheduleNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void shouldToggleActiveWithoutTouchingRunState() {
        repository.insert(schedule("A", true, T0.plusSeconds(300)));
        repository.recordOutcome("A", ActionOutcome.succeeded("Clicked repost flow"), T0.plusSeconds(600));
        Schedule before = repository.findById("A").orElseThrow();

        assertThat(repository.toggleActive("A")).isFalse();
        assertThat(repository.toggleActive("A")).isTrue();

        Schedule after = repository.findById("A").orElseThrow();
        assertThat(after.nextRun()).isEqualTo(before.nextRun());
        assertThat(after.lastResult()).isEqualTo("OK: Clicked repost flow");
        assertThat(after.active()).isTrue();
    }

    @Test
    void shouldFailTogglingUnknownId() {
        assertThatThrownBy(() -> repository.toggleActive("ghost"))
                .isInstanceOf(ScheduleNotFoundException.class);
    }

    @Test
    void shouldListNewestFirstAndDelete() {
        repository.insert(new Schedule("old", "https://www.leboncoin.fr/ad/1", 48, 7, null, null, true, T0));
        repository.insert(new Schedule("new", "https://www.leboncoin.fr/ad/2", 48, 7, null, null, true, T0.plusSeconds(1)));

        assertThat(repository.findAll()).extracting(Schedule::id).containsExactly("new", "old");

        assertThat(repository.delete("old")).isTrue();
        assertThat(repository.delete("old")).isFalse();
        assertThat(repository.findAll()).extracting(Schedule::id).containsExactly("new");
    }

    @Test
    void shouldReportToggleOfScheduleDeletedMidUpdateAsNotFound() {
        repository.insert(schedule("A", true, T0));
        jdbcTemplate.execute("CREATE TRIGGER drop_after_toggle AFTER UPDATE OF active ON schedules "
                + "WHEN NEW.id = 'A' BEGIN DELETE FROM schedules WHERE id = 'A'; END");

        assertThatThrownBy(() -> repository.toggleActive("A"))
                .isInstanceOf(ScheduleNotFoundException.class)
                .hasMessageContaining("A");
        assertThat(repository.findById("A")).isEmpty();
    }
}
