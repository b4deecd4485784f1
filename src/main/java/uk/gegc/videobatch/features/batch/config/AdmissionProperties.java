package uk.gegc.videobatch.features.batch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Validated
@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {

    @Min(1)
    private int maxPromptLength = 3000;

    @Min(1)
    private int minCount = 1;

    @Min(1)
    private int maxCount = 50;

    /**
     * Accepted submissions per owner inside {@link #rateWindow}.
     */
    @Min(1)
    private int maxBatchesPerMinute = 10;

    @NotNull
    private Duration rateWindow = Duration.ofSeconds(60);

    @NotNull
    private Duration idempotencyWindow = Duration.ofSeconds(60);

    @Min(1)
    private int maxIdempotencyKeyLength = 64;

    @NotNull
    private Set<String> orientations = new LinkedHashSet<>(List.of("portrait", "landscape"));
}
