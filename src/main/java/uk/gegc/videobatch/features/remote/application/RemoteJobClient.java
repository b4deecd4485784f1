package uk.gegc.videobatch.features.remote.application;

/**
 * Port to the external video generation provider.
 *
 * <p>Both calls block on I/O and throw {@link RemoteJobException} (or any other runtime
 * exception) on failure; callers treat every exception as a failed attempt.
 */
public interface RemoteJobClient {

    RemoteJobHandle create(RemoteJobRequest request);

    RemoteJobSnapshot poll(RemoteJobHandle handle);
}
