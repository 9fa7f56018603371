package org.endlesssource.streambridge.test;

import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.spi.BackendStrategyProvider;
import org.endlesssource.streambridge.spi.ContentBackend;
import org.endlesssource.streambridge.spi.HostPlatform;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Registered through META-INF/services so {@code StrategyRegistry.load()} finds it.
 */
public final class DummyStrategyProvider implements BackendStrategyProvider {
    private static final AtomicReference<HostPlatform> LAST_PLATFORM = new AtomicReference<>();

    @Override
    public BackendStrategy strategy() {
        return BackendStrategy.RPC;
    }

    @Override
    public int order() {
        return 100;
    }

    @Override
    public ContentBackend create(String extensionId, HostPlatform platform) {
        LAST_PLATFORM.set(platform);
        return new DummyContentBackend(extensionId, strategy());
    }

    public static HostPlatform consumeLastPlatform() {
        return LAST_PLATFORM.getAndSet(null);
    }
}
