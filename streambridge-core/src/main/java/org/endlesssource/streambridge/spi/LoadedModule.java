package org.endlesssource.streambridge.spi;

import java.util.Optional;

/**
 * A module (Java package) imported from a provider extension.
 */
public interface LoadedModule {

    String name();

    /**
     * Look up a class of this module by its simple name.
     */
    Optional<Class<?>> findClass(String simpleName);
}
