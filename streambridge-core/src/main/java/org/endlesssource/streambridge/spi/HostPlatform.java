package org.endlesssource.streambridge.spi;

import java.util.Objects;

/**
 * The host primitives available to strategies.
 * A host that cannot load extension code in-process passes a null {@code moduleLoader};
 * one without an RPC channel passes a null {@code rpcExecutor}.
 */
public record HostPlatform(ExtensionRegistry registry, ModuleLoader moduleLoader, RpcExecutor rpcExecutor) {
    public HostPlatform {
        Objects.requireNonNull(registry, "registry must not be null");
    }
}
