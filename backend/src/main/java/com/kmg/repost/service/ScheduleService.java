package com.kmg.repost.service;

import com.kmg.repost.config.RepostProperties;
import com.kmg.repost.dto.CreateScheduleRequest;
import com.kmg.repost.dto.RunNowResponse;
import com.kmg.repost.dto.ScheduleView;
import com.kmg.repost.dto.ToggleResponse;
import com.kmg.repost.error.InvalidScheduleException;
import com.kmg.repost.error.ScheduleNotFoundException;
import com.kmg.repost.model.ActionOutcome;
import com.kmg.repost.model.Schedule;
import com.kmg.repost.repo.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class ScheduleService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository scheduleRepository;
    private final JobRunner jobRunner;
    private final JitterPolicy jitterPolicy;
    private final EventService eventService;
    private final RepostProperties properties;
    private final Clock clock;
    private final Pattern targetPattern;

    public ScheduleService(
            ScheduleRepository scheduleRepository,
            JobRunner jobRunner,
            JitterPolicy jitterPolicy,
            EventService eventService,
            RepostProperties properties,
            Clock clock
    ) {
        this.scheduleRepository = scheduleRepository;
        this.jobRunner = jobRunner;
        this.jitterPolicy = jitterPolicy;
        this.eventService = eventService;
        this.properties = properties;
        this.clock = clock;
        this.targetPattern = Pattern.compile(properties.getTarget().getUrlPattern(), Pattern.CASE_INSENSITIVE);
    }

    public String create(CreateScheduleRequest request) {
        String url = request.url() == null ? "" : request.url().trim();
        if (!targetPattern.matcher(url).matches()) {
            throw new InvalidScheduleException("Invalid listing URL: " + url);
        }

        if (request.periodHours() != null
                && (request.periodHours().isNaN() || request.periodHours() > JitterPolicy.MAX_PERIOD_HOURS)) {
            throw new InvalidScheduleException("periodHours must be at most " + JitterPolicy.MAX_PERIOD_HOURS);
        }

        RepostProperties.Defaults defaults = properties.getDefaults();
        double periodHours = Math.max(
                defaults.getMinPeriodHours(),
                request.periodHours() != null ? request.periodHours() : defaults.getPeriodHours()
        );
        int jitterMinutes = Math.max(
                0,
                request.jitterMinutes() != null ? request.jitterMinutes() : defaults.getJitterMinutes()
        );

        Instant now = clock.instant();
        Schedule schedule = new Schedule(
                UUID.randomUUID().toString(),
                url,
                periodHours,
                jitterMinutes,
                jitterPolicy.computeNextRun(periodHours, jitterMinutes, now),
                null,
                true,
                now
        );
        scheduleRepository.insert(schedule);
        log.info("Schedule created: {} {} every {}h (+{}m jitter)", schedule.id(), url, periodHours, jitterMinutes);
        eventService.publish("schedule-created", schedule.id(), "Schedule created", Map.of("url", url));
        return schedule.id();
    }

    public List<ScheduleView> list() {
        return scheduleRepository.findAll().stream()
                .map(this::toView)
                .toList();
    }

    public ScheduleView get(String id) {
        return scheduleRepository.findById(id)
                .map(this::toView)
                .orElseThrow(() -> new ScheduleNotFoundException(id));
    }

    public ToggleResponse toggle(String id) {
        boolean active = scheduleRepository.toggleActive(id);
        log.info("Schedule {} is now {}", id, active ? "active" : "paused");
        eventService.publish("schedule-toggled", id, active ? "Schedule resumed" : "Schedule paused", Map.of("active", active));
        return new ToggleResponse(id, active);
    }

    public void delete(String id) {
        if (scheduleRepository.delete(id)) {
            log.info("Schedule deleted: {}", id);
            eventService.publish("schedule-deleted", id, "Schedule deleted", null);
        }
    }

    public RunNowResponse runNow(String id) {
        ActionOutcome outcome = jobRunner.runNow(id);
        return new RunNowResponse(id, outcome.ok(), outcome.detail(), outcome.toResultText());
    }

    private ScheduleView toView(Schedule schedule) {
        return new ScheduleView(
                schedule.id(),
                schedule.url(),
                schedule.periodHours(),
                schedule.jitterMinutes(),
                schedule.nextRun() == null ? null : schedule.nextRun().toEpochMilli(),
                schedule.lastResult(),
                schedule.active(),
                schedule.createdAt().toEpochMilli(),
                jobRunner.isRunning(schedule.id())
        );
    }
}
