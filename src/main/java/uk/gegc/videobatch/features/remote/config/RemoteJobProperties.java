package uk.gegc.videobatch.features.remote.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "remote")
public class RemoteJobProperties {

    @NotBlank
    private String baseUrl = "https://yunwu.ai/v1";

    private String apiKey;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(60);

    /**
     * Public origin used to turn a relative media reference into a URL the provider can fetch.
     * Left empty, relative references are sent unchanged.
     */
    private String mediaBaseUrl;
}
