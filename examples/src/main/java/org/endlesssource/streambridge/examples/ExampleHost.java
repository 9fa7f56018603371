package org.endlesssource.streambridge.examples;

import org.endlesssource.streambridge.cache.FileResponseCache;
import org.endlesssource.streambridge.direct.ClassPathModuleLoader;
import org.endlesssource.streambridge.platform.DirectoryExtensionRegistry;
import org.endlesssource.streambridge.rpc.ProcessRpcExecutor;
import org.endlesssource.streambridge.spi.HostPlatform;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Host wiring shared by the examples: extensions from a directory, a
 * class-path module loader and a process-based RPC executor.
 * <p>
 * {@code STREAMBRIDGE_EXTENSIONS_DIR} and {@code STREAMBRIDGE_CACHE_DIR}
 * override the default locations under the user's home.
 */
final class ExampleHost implements Closeable {
    private final DirectoryExtensionRegistry registry;
    private final ClassPathModuleLoader moduleLoader;
    private final HostPlatform platform;
    private final FileResponseCache cache;

    private ExampleHost(Path extensionsDir, Path cacheDir) {
        this.registry = new DirectoryExtensionRegistry(extensionsDir);
        this.moduleLoader = new ClassPathModuleLoader(registry::installPath);
        this.platform = new HostPlatform(registry, moduleLoader, new ProcessRpcExecutor(registry::installPath));
        this.cache = new FileResponseCache(cacheDir);
    }

    static ExampleHost fromEnvironment() {
        Path base = Path.of(System.getProperty("user.home"), ".streambridge");
        return new ExampleHost(
                directory("STREAMBRIDGE_EXTENSIONS_DIR", base.resolve("extensions")),
                directory("STREAMBRIDGE_CACHE_DIR", base.resolve("cache")));
    }

    HostPlatform platform() {
        return platform;
    }

    FileResponseCache cache() {
        return cache;
    }

    Path extensionsDir() {
        return registry.getRoot();
    }

    @Override
    public void close() throws IOException {
        moduleLoader.close();
    }

    private static Path directory(String variable, Path fallback) {
        String value = System.getenv(variable);
        return value == null || value.isBlank() ? fallback : Path.of(value);
    }
}
