package org.endlesssource.streambridge.direct;

import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.api.BackendUnavailableException;
import org.endlesssource.streambridge.spi.BackendStrategyProvider;
import org.endlesssource.streambridge.spi.ContentBackend;
import org.endlesssource.streambridge.spi.HostPlatform;

public final class DirectStrategyProvider implements BackendStrategyProvider {
    @Override
    public BackendStrategy strategy() {
        return BackendStrategy.DIRECT;
    }

    @Override
    public int order() {
        return 0;
    }

    @Override
    public ContentBackend create(String extensionId, HostPlatform platform) {
        if (platform.moduleLoader() == null) {
            throw new BackendUnavailableException("Host cannot load extension code in-process");
        }
        return DirectContentBackend.bind(extensionId, platform.moduleLoader());
    }
}
