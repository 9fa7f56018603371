package org.endlesssource.streambridge.api;

/**
 * Base type for every failure raised by the bridge.
 */
public class StreamBridgeException extends RuntimeException {
    public StreamBridgeException(String message) {
        super(message);
    }

    public StreamBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
