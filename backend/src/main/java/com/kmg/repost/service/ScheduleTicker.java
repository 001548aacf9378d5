package com.kmg.repost.service;

import com.kmg.repost.config.RepostProperties;
import com.kmg.repost.model.Schedule;
import com.kmg.repost.repo.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Fires every {@code repost.scheduler.tick-interval} and hands the due schedules to the {@link JobRunner}.
 * Batches run on their own executor, so a slow batch never holds back the next tick.
 */
@Component
public class ScheduleTicker implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ScheduleTicker.class);

    private final ScheduleRepository scheduleRepository;
    private final JobRunner jobRunner;
    private final TaskScheduler taskScheduler;
    private final Executor batchExecutor;
    private final RepostProperties properties;
    private final Clock clock;

    private volatile ScheduledFuture<?> tickHandle;

    public ScheduleTicker(
            ScheduleRepository scheduleRepository,
            JobRunner jobRunner,
            @Qualifier("tickScheduler") TaskScheduler taskScheduler,
            @Qualifier("batchExecutor") Executor batchExecutor,
            RepostProperties properties,
            Clock clock
    ) {
        this.scheduleRepository = scheduleRepository;
        this.jobRunner = jobRunner;
        this.taskScheduler = taskScheduler;
        this.batchExecutor = batchExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (tickHandle != null) {
            return;
        }
        RepostProperties.Scheduler config = properties.getScheduler();
        if (!config.isEnabled()) {
            log.info("Schedule ticker disabled by configuration.");
            return;
        }
        tickHandle = taskScheduler.scheduleAtFixedRate(
                this::tick,
                clock.instant().plus(config.getInitialDelay()),
                config.getTickInterval()
        );
        log.info("Schedule ticker started (interval={}, initialDelay={})",
                config.getTickInterval(), config.getInitialDelay());
    }

    @Override
    public synchronized void stop() {
        if (tickHandle == null) {
            return;
        }
        tickHandle.cancel(false);
        tickHandle = null;
        log.info("Schedule ticker stopped.");
    }

    @Override
    public boolean isRunning() {
        return tickHandle != null;
    }

    void tick() {
        Instant now = clock.instant();
        try {
            batchExecutor.execute(() -> onTick(now));
        } catch (RejectedExecutionException e) {
            log.warn("Tick at {} rejected: {}", now, e.getMessage());
        }
    }

    /**
     * Runs one batch over every schedule due at {@code now}.
     *
     * @return number of schedules executed
     */
    public int onTick(Instant now) {
        List<Schedule> due;
        try {
            due = scheduleRepository.selectDue(now);
        } catch (RuntimeException e) {
            log.error("Failed to select due schedules: {}", e.getMessage(), e);
            return 0;
        }
        if (due.isEmpty()) {
            return 0;
        }
        log.info("Tick at {}: {} due schedule(s)", now, due.size());
        return jobRunner.runBatch(due, now);
    }
}
