package org.endlesssource.streambridge.api;

/**
 * No provider extension was found, or none of the strategies could bind to it.
 * Fatal for the current request; shown to users as "content service unreachable".
 */
public class BackendUnavailableException extends StreamBridgeException {
    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
