package org.endlesssource.streambridge.spi;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Host primitive giving in-process access to a provider extension's code.
 */
public interface ModuleLoader {

    /**
     * Where the extension is installed, if it is.
     */
    Optional<Path> installPath(String extensionId);

    /**
     * Make code under {@code path} visible to {@link #importModule(String)}.
     */
    void addSearchPath(Path path);

    /**
     * Import a module by name; empty when nothing on the search path provides it.
     */
    Optional<LoadedModule> importModule(String moduleName);
}
