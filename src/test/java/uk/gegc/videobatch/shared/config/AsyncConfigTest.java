package uk.gegc.videobatch.shared.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.videobatch.features.scheduler.config.SchedulerProperties;

import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AsyncConfig")
class AsyncConfigTest {

    private final AsyncConfig config = new AsyncConfig();

    @Test
    @DisplayName("default pool sizing covers the default global concurrency")
    void defaultsAreConsistent() {
        assertThatCode(() -> AsyncConfig.requireCapacityFor(new SchedulerProperties.Pool(), 10))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("a pool smaller than the global cap is refused at startup")
    void undersizedPoolRejected() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.setGlobalConcurrency(50);
        properties.getExecutor().setMaxPoolSize(8);
        properties.getExecutor().setQueueCapacity(10);

        assertThatThrownBy(() -> config.generationTaskExecutor(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("global-concurrency (50)");
    }

    @Test
    @DisplayName("a saturated executor rejects instead of running work on the calling thread")
    void saturatedExecutorAborts() {
        ThreadPoolTaskExecutor executor = config.generationTaskExecutor(new SchedulerProperties());
        try {
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }
}
