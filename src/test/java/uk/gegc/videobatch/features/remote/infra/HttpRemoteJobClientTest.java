package uk.gegc.videobatch.features.remote.infra;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;
import uk.gegc.videobatch.features.remote.application.RemoteJobException;
import uk.gegc.videobatch.features.remote.application.RemoteJobHandle;
import uk.gegc.videobatch.features.remote.application.RemoteJobRequest;
import uk.gegc.videobatch.features.remote.application.RemoteJobSnapshot;
import uk.gegc.videobatch.features.remote.application.RemoteJobStatus;
import uk.gegc.videobatch.features.remote.config.RemoteJobProperties;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the HTTP adapter against stubbed provider responses.
 */
@DisplayName("HttpRemoteJobClient")
class HttpRemoteJobClientTest {

    private WireMockServer wireMockServer;
    private RemoteJobProperties properties;
    private HttpRemoteJobClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        WireMock.configureFor("localhost", wireMockServer.port());

        properties = new RemoteJobProperties();
        properties.setBaseUrl(wireMockServer.baseUrl() + "/v1");
        properties.setMediaBaseUrl("https://app.example.com/");
        RestClient restClient = RestClient.builder().baseUrl(properties.getBaseUrl()).build();
        client = new HttpRemoteJobClient(restClient, properties);
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    private static RemoteJobRequest request(String model, String size, String media) {
        return new RemoteJobRequest("a cat surfing", media, model, "portrait", size, 15, "task-abc-0");
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("posts the job payload with the idempotency header and returns the job id")
        void create_success() {
            stubFor(post(urlEqualTo("/v1/video/create"))
                    .willReturn(okJson("""
                            {"id": "job-123", "status": "queued"}
                            """)));

            RemoteJobHandle handle = client.create(request("sora-2", "small", null));

            assertThat(handle.jobId()).isEqualTo("job-123");
            verify(postRequestedFor(urlEqualTo("/v1/video/create"))
                    .withHeader("Idempotency-Key", equalTo("task-abc-0"))
                    .withRequestBody(matchingJsonPath("$.model", equalTo("sora-2")))
                    .withRequestBody(matchingJsonPath("$.size", equalTo("small")))
                    .withRequestBody(matchingJsonPath("$.duration", equalTo("15")))
                    .withRequestBody(matchingJsonPath("$.watermark", equalTo("false")))
                    .withRequestBody(notMatching(".*\"private\".*"))
                    .withRequestBody(notMatching(".*\"images\".*")));
        }

        @Test
        @DisplayName("pro model sends private=false, large size and the resolved media url")
        void create_proWithMedia() {
            stubFor(post(urlEqualTo("/v1/video/create"))
                    .willReturn(okJson("""
                            {"task_id": "job-777"}
                            """)));

            RemoteJobHandle handle = client.create(request("sora-2-pro", "large", "/uploads/ref.png"));

            assertThat(handle.jobId()).isEqualTo("job-777");
            verify(postRequestedFor(urlEqualTo("/v1/video/create"))
                    .withRequestBody(matchingJsonPath("$.private", equalTo("false")))
                    .withRequestBody(matchingJsonPath("$.size", equalTo("large")))
                    .withRequestBody(matchingJsonPath("$.images[0]",
                            equalTo("https://app.example.com/uploads/ref.png"))));
        }

        @Test
        @DisplayName("an HTTP error becomes a RemoteJobException carrying the status")
        void create_httpError() {
            stubFor(post(urlEqualTo("/v1/video/create"))
                    .willReturn(aResponse().withStatus(429).withBody("{\"error\":\"slow down\"}")));

            assertThatThrownBy(() -> client.create(request("sora-2", "small", null)))
                    .isInstanceOf(RemoteJobException.class)
                    .hasMessageContaining("429");
        }

        @Test
        @DisplayName("a response without a job id is rejected")
        void create_missingId() {
            stubFor(post(urlEqualTo("/v1/video/create"))
                    .willReturn(okJson("{\"status\": \"queued\"}")));

            assertThatThrownBy(() -> client.create(request("sora-2", "small", null)))
                    .isInstanceOf(RemoteJobException.class)
                    .hasMessageContaining("job id");
        }
    }

    @Nested
    @DisplayName("poll")
    class Poll {

        @Test
        @DisplayName("nested data fields win over top-level ones")
        void poll_completedNested() {
            stubFor(get(urlPathEqualTo("/v1/video/query"))
                    .withQueryParam("id", equalTo("job-123"))
                    .willReturn(okJson("""
                            {
                              "status": "processing",
                              "progress": "100%",
                              "data": {
                                "status": "completed",
                                "video_url": "https://cdn.example.com/job-123.mp4"
                              }
                            }
                            """)));

            RemoteJobSnapshot snapshot = client.poll(new RemoteJobHandle("job-123"));

            assertThat(snapshot.status()).isEqualTo(RemoteJobStatus.COMPLETED);
            assertThat(snapshot.resultLocator()).isEqualTo("https://cdn.example.com/job-123.mp4");
            assertThat(snapshot.progress()).isEqualTo("100%");
        }

        @Test
        @DisplayName("flat responses fall back to top-level status and locator")
        void poll_flat() {
            stubFor(get(urlPathEqualTo("/v1/video/query"))
                    .willReturn(okJson("""
                            {"status": "success", "result_url": "https://cdn.example.com/flat.mp4"}
                            """)));

            RemoteJobSnapshot snapshot = client.poll(new RemoteJobHandle("job-9"));

            assertThat(snapshot.status()).isEqualTo(RemoteJobStatus.COMPLETED);
            assertThat(snapshot.hasResult()).isTrue();
            assertThat(snapshot.resultLocator()).isEqualTo("https://cdn.example.com/flat.mp4");
        }

        @Test
        @DisplayName("failed jobs carry the provider's reason")
        void poll_failed() {
            stubFor(get(urlPathEqualTo("/v1/video/query"))
                    .willReturn(okJson("""
                            {"data": {"status": "failed"}, "fail_reason": "content policy"}
                            """)));

            RemoteJobSnapshot snapshot = client.poll(new RemoteJobHandle("job-5"));

            assertThat(snapshot.status()).isEqualTo(RemoteJobStatus.FAILED);
            assertThat(snapshot.error()).isEqualTo("content policy");
            assertThat(snapshot.hasResult()).isFalse();
        }

        @Test
        @DisplayName("an unknown status keeps the job in progress")
        void poll_unknownStatus() {
            stubFor(get(urlPathEqualTo("/v1/video/query"))
                    .willReturn(okJson("{\"status\": \"moderation\"}")));

            assertThat(client.poll(new RemoteJobHandle("job-1")).status()).isEqualTo(RemoteJobStatus.IN_PROGRESS);
        }

        @Test
        @DisplayName("server errors are wrapped")
        void poll_serverError() {
            stubFor(get(urlPathEqualTo("/v1/video/query"))
                    .willReturn(aResponse().withStatus(502)));

            assertThatThrownBy(() -> client.poll(new RemoteJobHandle("job-1")))
                    .isInstanceOf(RemoteJobException.class)
                    .hasMessageContaining("502");
        }
    }

    @Test
    @DisplayName("media references resolve against the public base url unless already absolute")
    void resolveMediaUrl() {
        assertThat(client.resolveMediaUrl(null)).isNull();
        assertThat(client.resolveMediaUrl("https://elsewhere/x.png")).isEqualTo("https://elsewhere/x.png");
        assertThat(client.resolveMediaUrl("uploads/x.png")).isEqualTo("https://app.example.com/uploads/x.png");

        properties.setMediaBaseUrl(null);
        assertThat(client.resolveMediaUrl("uploads/x.png")).isEqualTo("uploads/x.png");
    }
}
