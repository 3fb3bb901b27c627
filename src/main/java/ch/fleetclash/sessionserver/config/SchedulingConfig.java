package ch.fleetclash.sessionserver.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Configuration for task scheduling and background work.
 *
 * <p>Provides:
 * <ul>
 *   <li>a {@link TaskScheduler} for {@code @Scheduled} sweeps and the per-game turn timers</li>
 *   <li>a single-threaded {@link TaskExecutor} for background persistence, so writes of one game
 *       reach storage in the order they were issued</li>
 *   <li>the {@link Clock} all components read time from</li>
 * </ul>
 */
@Configuration
public class SchedulingConfig {

    /**
     * Creates a task scheduler with a fixed thread pool.
     *
     * <p>Configuration:
     * <ul>
     *   <li>Pool size: 5 threads (heartbeats, sweeps and turn timers)</li>
     *   <li>Thread name prefix: "fleetclash-scheduler-" for easier debugging</li>
     * </ul>
     *
     * @return configured task scheduler
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(5);
        scheduler.setThreadNamePrefix("fleetclash-scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public TaskExecutor persistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("fleetclash-persistence-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
