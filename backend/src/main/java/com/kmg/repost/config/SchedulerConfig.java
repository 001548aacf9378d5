package com.kmg.repost.config;

import com.kmg.repost.service.JitterPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JitterPolicy jitterPolicy() {
        return new JitterPolicy(new Random());
    }

    @Bean
    public ThreadPoolTaskScheduler tickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("repost-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService batchExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("repost-batch-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
    }
}
