package org.endlesssource.streambridge.spi;

import org.endlesssource.streambridge.api.BackendStrategy;

/**
 * SPI implemented by strategy modules.
 */
public interface BackendStrategyProvider {

    /**
     * The strategy this provider implements.
     */
    BackendStrategy strategy();

    /**
     * Position in the selection order; lower is tried first.
     */
    int order();

    /**
     * Bind to the extension.
     * @throws org.endlesssource.streambridge.api.BackendUnavailableException if binding is impossible
     */
    ContentBackend create(String extensionId, HostPlatform platform);
}
