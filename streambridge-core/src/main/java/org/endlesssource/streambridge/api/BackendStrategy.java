package org.endlesssource.streambridge.api;

/**
 * Communication technique used to reach a provider extension.
 */
public enum BackendStrategy {
    /** In-process binding to the extension's own classes. */
    DIRECT,
    /** Indirect calls through the host's extension-action and directory primitives. */
    RPC
}
