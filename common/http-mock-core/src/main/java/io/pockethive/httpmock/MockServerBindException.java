package io.pockethive.httpmock;

import java.net.InetSocketAddress;

/**
 * Indicates that the mock server could not bind its listening socket.
 */
public class MockServerBindException extends RuntimeException {

    private final transient InetSocketAddress address;

    public MockServerBindException(InetSocketAddress address, Throwable cause) {
        super("Unable to bind HTTP mock server to " + address, cause);
        this.address = address;
    }

    public InetSocketAddress address() {
        return address;
    }
}
