package com.kmg.repost.service;

import com.kmg.repost.error.ScheduleBusyException;
import com.kmg.repost.error.ScheduleNotFoundException;
import com.kmg.repost.model.ActionOutcome;
import com.kmg.repost.model.Schedule;
import com.kmg.repost.repo.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs schedules through the action executor and writes each outcome back with a freshly jittered next run.
 *
 * <p>Every execution holds an in-memory lease on its schedule id, so a tick batch and a manual run
 * never act on the same schedule at the same time. Records of a batch are processed one after another;
 * a failing record does not stop the rest of the batch.
 */
@Service
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final ScheduleRepository scheduleRepository;
    private final ActionExecutor actionExecutor;
    private final JitterPolicy jitterPolicy;
    private final EventService eventService;
    private final Clock clock;

    private final Set<String> runningIds = ConcurrentHashMap.newKeySet();

    public JobRunner(
            ScheduleRepository scheduleRepository,
            ActionExecutor actionExecutor,
            JitterPolicy jitterPolicy,
            EventService eventService,
            Clock clock
    ) {
        this.scheduleRepository = scheduleRepository;
        this.actionExecutor = actionExecutor;
        this.jitterPolicy = jitterPolicy;
        this.eventService = eventService;
        this.clock = clock;
    }

    /**
     * Runs one schedule immediately, whether or not it is due or active.
     */
    public ActionOutcome runNow(String scheduleId) {
        Schedule schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        if (!runningIds.add(scheduleId)) {
            throw new ScheduleBusyException(scheduleId);
        }
        try {
            return execute(schedule);
        } finally {
            runningIds.remove(scheduleId);
        }
    }

    /**
     * Runs a batch selected at {@code now}. Each record is re-read once its lease is held and skipped
     * unless it is still due at {@code now}, so a run finished meanwhile by another batch or a manual
     * request is not repeated.
     *
     * @return number of schedules that were executed and recorded
     */
    public int runBatch(List<Schedule> dueSchedules, Instant now) {
        int processed = 0;
        for (Schedule selected : dueSchedules) {
            String id = selected.id();
            if (!runningIds.add(id)) {
                log.info("[JOB] Skipping {}: already running", id);
                continue;
            }
            try {
                Optional<Schedule> current = scheduleRepository.findById(id);
                if (current.isEmpty()) {
                    log.info("[JOB] Skipping {}: deleted since selection", id);
                    continue;
                }
                if (!current.get().isDueAt(now)) {
                    log.info("[JOB] Skipping {}: no longer due (next run {})", id, current.get().nextRun());
                    continue;
                }
                execute(current.get());
                processed++;
            } catch (ScheduleNotFoundException e) {
                log.info("[JOB] Schedule {} was deleted while running; outcome dropped", id);
            } catch (RuntimeException e) {
                log.error("[JOB] Failed to record run of {}: {}", id, e.getMessage(), e);
            } finally {
                runningIds.remove(id);
            }
        }
        return processed;
    }

    public boolean isRunning(String scheduleId) {
        return runningIds.contains(scheduleId);
    }

    private ActionOutcome execute(Schedule schedule) {
        log.info("[JOB] Running {} {}", schedule.id(), schedule.url());
        eventService.publish("schedule-started", schedule.id(), "Repost started", Map.of("url", schedule.url()));

        ActionOutcome outcome = invokeExecutor(schedule.url());
        Instant nextRun = jitterPolicy.computeNextRun(schedule.periodHours(), schedule.jitterMinutes(), clock.instant());
        scheduleRepository.recordOutcome(schedule.id(), outcome, nextRun);

        if (outcome.ok()) {
            log.info("[JOB] {} succeeded: {} (next run {})", schedule.id(), outcome.detail(), nextRun);
        } else {
            log.warn("[JOB] {} failed: {} (next run {})", schedule.id(), outcome.detail(), nextRun);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("lastResult", outcome.toResultText());
        payload.put("nextRun", nextRun.toEpochMilli());
        eventService.publish("schedule-completed", schedule.id(), "Repost finished", payload);
        return outcome;
    }

    private ActionOutcome invokeExecutor(String target) {
        try {
            ActionOutcome outcome = actionExecutor.execute(target);
            if (outcome == null) {
                return ActionOutcome.failed("Action executor returned no outcome");
            }
            return outcome;
        } catch (RuntimeException e) {
            log.warn("[JOB] Action executor threw for {}: {}", target, e.getMessage(), e);
            return ActionOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
