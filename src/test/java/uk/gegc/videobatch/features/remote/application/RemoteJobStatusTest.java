package uk.gegc.videobatch.features.remote.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RemoteJobStatus")
class RemoteJobStatusTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "pending, PENDING",
            "queued, QUEUED",
            "in_progress, IN_PROGRESS",
            "In Progress, IN_PROGRESS",
            "processing, IN_PROGRESS",
            "completed, COMPLETED",
            "SUCCESS, COMPLETED",
            "failed, FAILED",
            "error, FAILED",
            "canceled, CANCELLED",
            "cancelled, CANCELLED"
    })
    @DisplayName("maps the provider vocabulary case-insensitively")
    void mapsKnownValues(String raw, RemoteJobStatus expected) {
        assertThat(RemoteJobStatus.fromProviderValue(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "warming_up", "moderation"})
    @DisplayName("blank and unknown values keep the job in progress")
    void unknownIsInProgress(String raw) {
        assertThat(RemoteJobStatus.fromProviderValue(raw)).isEqualTo(RemoteJobStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("only completed, failed and cancelled are terminal")
    void terminalStatuses() {
        assertThat(RemoteJobStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(RemoteJobStatus.FAILED.isTerminal()).isTrue();
        assertThat(RemoteJobStatus.CANCELLED.isTerminal()).isTrue();
        assertThat(RemoteJobStatus.QUEUED.isTerminal()).isFalse();
        assertThat(RemoteJobStatus.IN_PROGRESS.isTerminal()).isFalse();
    }
}
