package uk.gegc.videobatch.features.remote.application;

/**
 * The provider could not be reached or answered with something unusable.
 */
public class RemoteJobException extends RuntimeException {

    public RemoteJobException(String message) {
        super(message);
    }

    public RemoteJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
