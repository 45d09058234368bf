package io.pockethive.httpmock;

/**
 * Lifecycle of a {@link MockServer}. {@link #STOPPED} is terminal.
 */
public enum ServerState {
    CREATED,
    RUNNING,
    STOPPED
}
