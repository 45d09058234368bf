package io.pockethive.httpmock;

/**
 * Thrown when {@link MockServer#stop()} is called on a server that has already stopped.
 */
public class AlreadyStoppedException extends IllegalStateException {

    public AlreadyStoppedException(String message) {
        super(message);
    }
}
