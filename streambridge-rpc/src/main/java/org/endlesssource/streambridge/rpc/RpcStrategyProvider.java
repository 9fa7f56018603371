package org.endlesssource.streambridge.rpc;

import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.api.BackendUnavailableException;
import org.endlesssource.streambridge.spi.BackendStrategyProvider;
import org.endlesssource.streambridge.spi.ContentBackend;
import org.endlesssource.streambridge.spi.HostPlatform;

public final class RpcStrategyProvider implements BackendStrategyProvider {
    @Override
    public BackendStrategy strategy() {
        return BackendStrategy.RPC;
    }

    @Override
    public int order() {
        return 10;
    }

    @Override
    public ContentBackend create(String extensionId, HostPlatform platform) {
        if (platform.rpcExecutor() == null) {
            throw new BackendUnavailableException("Host offers no RPC channel");
        }
        return RpcContentBackend.connect(extensionId, platform.registry(), platform.rpcExecutor());
    }
}
