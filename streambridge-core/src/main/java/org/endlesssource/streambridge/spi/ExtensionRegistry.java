package org.endlesssource.streambridge.spi;

import java.util.List;
import java.util.Optional;

/**
 * Host primitive listing the extensions installed next to this one.
 */
public interface ExtensionRegistry {

    /**
     * True when an extension with this id is installed.
     */
    boolean exists(String extensionId);

    /**
     * All installed extensions of a category, in the host's order.
     */
    List<ExtensionInfo> enumerate(String category);

    /**
     * Installation details, including whether the extension is enabled.
     */
    Optional<ExtensionInfo> details(String extensionId);
}
