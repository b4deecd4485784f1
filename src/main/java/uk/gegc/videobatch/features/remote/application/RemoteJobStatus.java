package uk.gegc.videobatch.features.remote.application;

import java.util.Locale;
import java.util.Map;

/**
 * Normalized status of a provider job.
 */
public enum RemoteJobStatus {
    PENDING,
    QUEUED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    private static final Map<String, RemoteJobStatus> PROVIDER_VALUES = Map.ofEntries(
            Map.entry("pending", PENDING),
            Map.entry("queued", QUEUED),
            Map.entry("in-progress", IN_PROGRESS),
            Map.entry("in_progress", IN_PROGRESS),
            Map.entry("processing", IN_PROGRESS),
            Map.entry("running", IN_PROGRESS),
            Map.entry("completed", COMPLETED),
            Map.entry("success", COMPLETED),
            Map.entry("succeeded", COMPLETED),
            Map.entry("failed", FAILED),
            Map.entry("failure", FAILED),
            Map.entry("error", FAILED),
            Map.entry("cancelled", CANCELLED),
            Map.entry("canceled", CANCELLED)
    );

    /**
     * Maps a raw provider status. Anything unrecognized, including blank, is {@link #IN_PROGRESS}
     * so a provider contract change never terminates a job early.
     */
    public static RemoteJobStatus fromProviderValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return IN_PROGRESS;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '-');
        return PROVIDER_VALUES.getOrDefault(normalized, IN_PROGRESS);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
