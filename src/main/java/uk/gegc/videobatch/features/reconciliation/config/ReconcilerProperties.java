package uk.gegc.videobatch.features.reconciliation.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "reconciler")
public class ReconcilerProperties {

    /**
     * Run the periodic sweep. Reconcile-on-read is always active.
     */
    private boolean enabled = true;

    /**
     * A running task without any update for this long is considered abandoned.
     */
    @NotNull
    private Duration staleRunningThreshold = Duration.ofMinutes(30);

    @NotNull
    private Duration sweepInterval = Duration.ofSeconds(60);

    @NotBlank
    private String staleReason = "Timed out while running";
}
