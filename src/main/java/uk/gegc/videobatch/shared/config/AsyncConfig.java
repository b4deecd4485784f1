package uk.gegc.videobatch.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import uk.gegc.videobatch.features.scheduler.config.SchedulerProperties;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools behind the generation scheduler.
 *
 * <p>The timer drives the scheduler tick, the poll delays of every execution unit and the
 * reconciliation sweep. Blocking provider and store calls are handed to the generation
 * executor so a slow provider never delays a tick; the executor rejects rather than run
 * work on the caller's thread.
 */
@Configuration
@EnableScheduling
@Slf4j
public class AsyncConfig {

    @Bean(name = "generationTaskExecutor")
    public ThreadPoolTaskExecutor generationTaskExecutor(SchedulerProperties properties) {
        SchedulerProperties.Pool pool = properties.getExecutor();
        requireCapacityFor(pool, properties.getGlobalConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setKeepAliveSeconds(pool.getKeepAliveSeconds());
        executor.setThreadNamePrefix("generation-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Generation executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                pool.getCorePoolSize(), pool.getMaxPoolSize(), pool.getQueueCapacity(), pool.getKeepAliveSeconds());
        return executor;
    }

    /**
     * Each in-flight task has at most one step waiting on the executor at a time, so threads plus
     * queue slots must cover the global concurrency cap. Anything rejected beyond that is never run on
     * the timer thread; the task stays running until the stale sweep fails and refunds it.
     */
    static void requireCapacityFor(SchedulerProperties.Pool pool, int globalConcurrency) {
        int capacity = pool.getMaxPoolSize() + pool.getQueueCapacity();
        if (capacity < globalConcurrency) {
            throw new IllegalStateException(String.format(
                    "scheduler.executor max-pool-size + queue-capacity (%d) must be at least scheduler.global-concurrency (%d)",
                    capacity, globalConcurrency));
        }
    }

    @Bean(name = "generationTimer")
    public ThreadPoolTaskScheduler generationTimer(SchedulerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getExecutor().getTimerPoolSize());
        scheduler.setThreadNamePrefix("generation-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
