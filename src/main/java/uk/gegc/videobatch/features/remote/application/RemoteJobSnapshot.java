package uk.gegc.videobatch.features.remote.application;

public record RemoteJobSnapshot(
        RemoteJobStatus status,
        String resultLocator,
        String error,
        String progress
) {
    public static RemoteJobSnapshot of(RemoteJobStatus status) {
        return new RemoteJobSnapshot(status, null, null, null);
    }

    public boolean hasResult() {
        return resultLocator != null && !resultLocator.isBlank();
    }
}
