package com.kmg.repost.repo;

import com.kmg.repost.error.ScheduleNotFoundException;
import com.kmg.repost.model.ActionOutcome;
import com.kmg.repost.model.Schedule;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ScheduleRepository {
    private final JdbcTemplate jdbcTemplate;

    public ScheduleRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<Schedule> MAPPER = new RowMapper<>() {
        @Override
        public Schedule mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Schedule(
                    rs.getString("id"),
                    rs.getString("url"),
                    rs.getDouble("period_hours"),
                    rs.getInt("jitter_minutes"),
                    SqlTime.readInstant(rs, "next_run"),
                    rs.getString("last_result"),
                    rs.getInt("active") == 1,
                    SqlTime.readInstant(rs, "created_at")
            );
        }
    };

    public void insert(Schedule schedule) {
        jdbcTemplate.update(
                """
                INSERT INTO schedules(id, url, period_hours, jitter_minutes, next_run, last_result, active, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                schedule.id(),
                schedule.url(),
                schedule.periodHours(),
                schedule.jitterMinutes(),
                SqlTime.toMillis(schedule.nextRun()),
                schedule.lastResult(),
                schedule.active() ? 1 : 0,
                SqlTime.toMillis(schedule.createdAt())
        );
    }

    public List<Schedule> findAll() {
        return jdbcTemplate.query("SELECT * FROM schedules ORDER BY created_at DESC", MAPPER);
    }

    public Optional<Schedule> findById(String id) {
        List<Schedule> rows = jdbcTemplate.query("SELECT * FROM schedules WHERE id = ?", MAPPER, id);
        return rows.stream().findFirst();
    }

    /**
     * Active schedules whose next run is unset or not after {@code now}.
     */
    public List<Schedule> selectDue(Instant now) {
        return jdbcTemplate.query(
                """
                SELECT * FROM schedules
                 WHERE active = 1
                   AND (next_run IS NULL OR next_run <= ?)
                """,
                MAPPER,
                now.toEpochMilli()
        );
    }

    /**
     * Writes the result of one execution as a single update. Period, jitter and the active flag are left alone.
     */
    public void recordOutcome(String id, ActionOutcome outcome, Instant nextRun) {
        int updated = jdbcTemplate.update(
                "UPDATE schedules SET last_result = ?, next_run = ? WHERE id = ?",
                outcome.toResultText(),
                SqlTime.toMillis(nextRun),
                id
        );
        if (updated == 0) {
            throw new ScheduleNotFoundException(id);
        }
    }

    public boolean toggleActive(String id) {
        int updated = jdbcTemplate.update(
                "UPDATE schedules SET active = CASE WHEN active = 1 THEN 0 ELSE 1 END WHERE id = ?",
                id
        );
        if (updated == 0) {
            throw new ScheduleNotFoundException(id);
        }
        // A delete may land between the two statements.
        return jdbcTemplate.query("SELECT active FROM schedules WHERE id = ?", (rs, rowNum) -> rs.getInt(1) == 1, id)
                .stream()
                .findFirst()
                .orElseThrow(() -> new ScheduleNotFoundException(id));
    }

    public boolean delete(String id) {
        return jdbcTemplate.update("DELETE FROM schedules WHERE id = ?", id) > 0;
    }
}
