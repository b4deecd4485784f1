package uk.gegc.videobatch.features.scheduler.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Concurrency caps and timing of the in-process generation scheduler.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /**
     * Start the tick loop with the application context.
     * Disabled in tests, which drive {@code tick()} by hand.
     */
    private boolean enabled = true;

    /**
     * Maximum number of tasks executing at once across all owners.
     */
    @Positive
    private int globalConcurrency = 10;

    /**
     * Maximum number of tasks executing at once for a single owner.
     */
    @Positive
    private int perUserConcurrency = 10;

    /**
     * Delay between two scheduler ticks.
     */
    @NotNull
    private Duration tickInterval = Duration.ofMillis(100);

    /**
     * Delay between two polls of the remote job.
     */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(3);

    /**
     * Total time a remote job may take before the attempt is failed as a timeout.
     */
    @NotNull
    private Duration maxPollDuration = Duration.ofMinutes(15);

    /**
     * Maximum length of the error summary stored on a failed task.
     */
    @Positive
    private int errorSummaryMaxLength = 500;

    private Pool executor = new Pool();

    @Data
    public static class Pool {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 200;
        private int keepAliveSeconds = 60;
        private int timerPoolSize = 2;
    }
}
