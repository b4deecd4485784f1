package uk.gegc.videobatch.features.scheduler.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.scheduling.TaskScheduler;
import uk.gegc.videobatch.BaseUnitTest;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.remote.application.RemoteJobClient;
import uk.gegc.videobatch.features.remote.application.RemoteJobException;
import uk.gegc.videobatch.features.remote.application.RemoteJobHandle;
import uk.gegc.videobatch.features.remote.application.RemoteJobRequest;
import uk.gegc.videobatch.features.remote.application.RemoteJobSnapshot;
import uk.gegc.videobatch.features.remote.application.RemoteJobStatus;
import uk.gegc.videobatch.testsupport.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("TaskExecutionUnit")
class TaskExecutionUnitTest extends BaseUnitTest {

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(3);
    private static final Duration MAX_POLL = Duration.ofSeconds(30);

    @Mock private RemoteJobClient client;
    @Mock private TaskLifecycleService lifecycle;
    @Mock private TaskScheduler timer;

    private MutableClock clock;
    private final Executor sameThread = Runnable::run;
    private final RemoteJobHandle handle = new RemoteJobHandle("remote-1");

    private ClaimedTask task;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-07-01T12:00:00Z"));
        task = new ClaimedTask(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), "a lighthouse at dusk",
                null, "sora-2", "landscape", "small", 10, 10, 2);

        // Timers fire immediately after moving the clock to their trigger time.
        lenient().when(timer.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(inv -> {
            clock.set(inv.getArgument(1));
            ((Runnable) inv.getArgument(0)).run();
            return null;
        });
        lenient().when(lifecycle.currentStatus(task.taskId())).thenReturn(Optional.of(TaskStatus.RUNNING));
    }

    private ExecutionOutcome run() {
        return new TaskExecutionUnit(task, client, lifecycle, timer, sameThread, POLL_INTERVAL, MAX_POLL, clock)
                .start()
                .join();
    }

    private static RemoteJobSnapshot snapshot(RemoteJobStatus status, String locator, String error, String progress) {
        return new RemoteJobSnapshot(status, locator, error, progress);
    }

    @Test
    @DisplayName("a failed progress write is logged and polling continues to the result")
    void progressWriteFault_keepsPolling() {
        when(client.create(any())).thenReturn(handle);
        when(client.poll(handle)).thenReturn(
                snapshot(RemoteJobStatus.IN_PROGRESS, null, null, "Rendering frames 3/10"),
                snapshot(RemoteJobStatus.COMPLETED, "https://cdn/done.mp4", null, null));
        doThrow(new IllegalStateException("value too long for column progress"))
                .when(lifecycle).recordProgress(task.taskId(), "Rendering frames 3/10");

        ExecutionOutcome outcome = run();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.resultLocator()).isEqualTo("https://cdn/done.mp4");
        verify(client, times(2)).poll(handle);
    }

    @Test
    @DisplayName("a task cancelled before execution never reaches the provider")
    void cancelledBeforeCall() {
        when(lifecycle.currentStatus(task.taskId())).thenReturn(Optional.of(TaskStatus.CANCELLED));

        ExecutionOutcome outcome = run();

        assertThat(outcome.errorKind()).isEqualTo(ExecutionErrorKind.CANCELLED);
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("a task that is no longer running ends as a lost claim")
    void notRunning_claimLost() {
        when(lifecycle.currentStatus(task.taskId())).thenReturn(Optional.of(TaskStatus.FAILED));

        assertThat(run().errorKind()).isEqualTo(ExecutionErrorKind.CLAIM_LOST);
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("creates the job with a per-attempt idempotency key and completes with the locator")
    void success() {
        when(client.create(any())).thenReturn(handle);
        when(client.poll(handle)).thenReturn(
                snapshot(RemoteJobStatus.QUEUED, null, null, null),
                snapshot(RemoteJobStatus.IN_PROGRESS, null, null, "40%"),
                snapshot(RemoteJobStatus.COMPLETED, "https://cdn/v.mp4", null, "100%"));

        ExecutionOutcome outcome = run();

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.resultLocator()).isEqualTo("https://cdn/v.mp4");

        ArgumentCaptor<RemoteJobRequest> request = ArgumentCaptor.forClass(RemoteJobRequest.class);
        verify(client).create(request.capture());
        assertThat(request.getValue().idempotencyKey()).isEqualTo("task-" + task.taskId() + "-2");
        assertThat(request.getValue().prompt()).isEqualTo("a lighthouse at dusk");

        verify(lifecycle).recordRemoteJob(task.taskId(), "remote-1");
        verify(lifecycle).recordProgress(task.taskId(), "queued");
        verify(lifecycle).recordProgress(task.taskId(), "40%");
    }

    @Test
    @DisplayName("completed without a locator keeps polling")
    void completedWithoutLocator_keepsPolling() {
        when(client.create(any())).thenReturn(handle);
        when(client.poll(handle)).thenReturn(
                snapshot(RemoteJobStatus.COMPLETED, null, null, null),
                snapshot(RemoteJobStatus.COMPLETED, "https://cdn/late.mp4", null, null));

        ExecutionOutcome outcome = run();

        assertThat(outcome.resultLocator()).isEqualTo("https://cdn/late.mp4");
        verify(client, times(2)).poll(handle);
    }

    @Test
    @DisplayName("creation failure is a provider error")
    void createFails() {
        when(client.create(any())).thenThrow(new RemoteJobException("HTTP 502"));

        ExecutionOutcome outcome = run();

        assertThat(outcome.errorKind()).isEqualTo(ExecutionErrorKind.PROVIDER_ERROR);
        assertThat(outcome.errorSummary()).contains("HTTP 502");
        verify(client, never()).poll(any());
    }

    @Test
    @DisplayName("provider-reported failure carries the provider's reason")
    void providerFailed() {
        when(client.create(any())).thenReturn(handle);
        when(client.poll(handle)).thenReturn(snapshot(RemoteJobStatus.FAILED, null, "content policy", null));

        ExecutionOutcome outcome = run();

        assertThat(outcome.errorKind()).isEqualTo(ExecutionErrorKind.PROVIDER_ERROR);
        assertThat(outcome.errorSummary()).isEqualTo("content policy");
    }

    @Test
    @DisplayName("provider-side cancellation is a provider error")
    void providerCancelled() {
        when(client.create(any())).thenReturn(handle);
        when(client.poll(handle)).thenReturn(snapshot(RemoteJobStatus.CANCELLED, null, null, null));

        assertThat(run().errorKind()).isEqualTo(ExecutionErrorKind.PROVIDER_ERROR);
    }

    @Test
    @DisplayName("an exception while polling fails the attempt")
    void pollThrows() {
        when(client.create(any())).thenReturn(handle);
        when(client.poll(handle)).thenThrow(new RemoteJobException("connection reset"));

        ExecutionOutcome outcome = run();

        assertThat(outcome.errorKind()).isEqualTo(ExecutionErrorKind.PROVIDER_ERROR);
        assertThat(outcome.errorSummary()).isEqualTo("connection reset");
    }

    @Test
    @DisplayName("a job still running at the deadline times out")
    void timeout() {
        when(client.create(any())).thenReturn(handle);
        when(client.poll(handle)).thenReturn(snapshot(RemoteJobStatus.IN_PROGRESS, null, null, null));

        ExecutionOutcome outcome = run();

        assertThat(outcome.errorKind()).isEqualTo(ExecutionErrorKind.TIMEOUT);
        // polls at 0s, 3s, ... 27s; the 30s timer hits the deadline
        verify(client, times(10)).poll(handle);
        verify(lifecycle, times(1)).recordProgress(eq(task.taskId()), any());
    }

    @Test
    @DisplayName("store faults outside the provider interaction complete the future exceptionally")
    void storeFault_propagates() {
        when(lifecycle.currentStatus(task.taskId())).thenThrow(new IllegalStateException("db down"));

        var future = new TaskExecutionUnit(task, client, lifecycle, timer, sameThread, POLL_INTERVAL, MAX_POLL, clock)
                .start();

        assertThat(future).isCompletedExceptionally();
    }
}
