package org.endlesssource.streambridge.api;

/**
 * A bound backend returned a malformed, error-flagged or mistyped payload.
 * Fatal for the current operation only; the selected strategy stays in place.
 */
public class BackendException extends StreamBridgeException {
    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
