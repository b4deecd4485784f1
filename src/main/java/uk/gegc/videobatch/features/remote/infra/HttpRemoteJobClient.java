package uk.gegc.videobatch.features.remote.infra;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import uk.gegc.videobatch.features.remote.application.RemoteJobClient;
import uk.gegc.videobatch.features.remote.application.RemoteJobException;
import uk.gegc.videobatch.features.remote.application.RemoteJobHandle;
import uk.gegc.videobatch.features.remote.application.RemoteJobRequest;
import uk.gegc.videobatch.features.remote.application.RemoteJobSnapshot;
import uk.gegc.videobatch.features.remote.application.RemoteJobStatus;
import uk.gegc.videobatch.features.remote.config.RemoteJobProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider adapter over the {@code /video/create} and {@code /video/query} endpoints.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpRemoteJobClient implements RemoteJobClient {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    private static final String PRO_MODEL = "sora-2-pro";

    private final RestClient restClient;
    private final RemoteJobProperties properties;

    @Override
    public RemoteJobHandle create(RemoteJobRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("prompt", request.prompt());
        payload.put("orientation", request.orientation());
        payload.put("size", providerSize(request.size()));
        payload.put("duration", request.duration());
        payload.put("watermark", false);
        if (PRO_MODEL.equals(request.model())) {
            payload.put("private", false);
        }
        String mediaUrl = resolveMediaUrl(request.mediaReference());
        if (mediaUrl != null) {
            payload.put("images", List.of(mediaUrl));
        }

        log.debug("Creating remote job: model={} orientation={} size={} duration={} hasMedia={}",
                request.model(), request.orientation(), payload.get("size"), request.duration(), mediaUrl != null);

        JsonNode body;
        try {
            body = restClient.post()
                    .uri("/video/create")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (StringUtils.hasText(request.idempotencyKey())) {
                            headers.set(IDEMPOTENCY_HEADER, request.idempotencyKey());
                        }
                    })
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw new RemoteJobException("Provider rejected job creation: HTTP " + e.getStatusCode().value()
                    + " " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new RemoteJobException("Provider unreachable during job creation: " + e.getMessage(), e);
        }

        String jobId = firstText(body, "id", "task_id");
        if (jobId == null) {
            throw new RemoteJobException("Provider did not return a job id");
        }
        return new RemoteJobHandle(jobId);
    }

    @Override
    public RemoteJobSnapshot poll(RemoteJobHandle handle) {
        JsonNode body;
        try {
            body = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/video/query").queryParam("id", handle.jobId()).build())
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw new RemoteJobException("Provider rejected status query for job " + handle.jobId()
                    + ": HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new RemoteJobException("Provider unreachable while polling job " + handle.jobId()
                    + ": " + e.getMessage(), e);
        }
        if (body == null) {
            throw new RemoteJobException("Empty status response for job " + handle.jobId());
        }

        JsonNode data = body.path("data");
        String rawStatus = firstText(data, "status");
        if (rawStatus == null) {
            rawStatus = firstText(body, "status");
        }
        RemoteJobStatus status = RemoteJobStatus.fromProviderValue(rawStatus);

        String locator = firstText(data, "video_url");
        if (locator == null) {
            locator = firstText(body, "video_url", "result_url");
        }
        String progress = firstText(body, "progress");
        if (progress == null) {
            progress = firstText(data, "progress");
        }

        log.debug("Polled remote job {}: raw={} mapped={} hasResult={}", handle.jobId(), rawStatus, status,
                locator != null);
        return new RemoteJobSnapshot(
                status,
                locator,
                firstText(body, "error", "message", "fail_reason"),
                progress);
    }

    static String providerSize(String size) {
        return "small".equals(size) ? "small" : "large";
    }

    String resolveMediaUrl(String mediaReference) {
        if (!StringUtils.hasText(mediaReference)) {
            return null;
        }
        if (mediaReference.startsWith("http://") || mediaReference.startsWith("https://")) {
            return mediaReference;
        }
        if (!StringUtils.hasText(properties.getMediaBaseUrl())) {
            return mediaReference;
        }
        String base = properties.getMediaBaseUrl().endsWith("/")
                ? properties.getMediaBaseUrl().substring(0, properties.getMediaBaseUrl().length() - 1)
                : properties.getMediaBaseUrl();
        String path = mediaReference.startsWith("/") ? mediaReference : "/" + mediaReference;
        return base + path;
    }

    private static String firstText(JsonNode node, String... fields) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                String text = value.asText();
                if (StringUtils.hasText(text)) {
                    return text;
                }
            }
        }
        return null;
    }
}
