package uk.gegc.videobatch.features.remote.application;

public record RemoteJobHandle(String jobId) {
    public RemoteJobHandle {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
    }
}
