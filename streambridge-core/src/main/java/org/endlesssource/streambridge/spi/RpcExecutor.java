package org.endlesssource.streambridge.spi;

import java.util.List;
import java.util.Map;

/**
 * Host primitives for reaching an extension without loading its code.
 */
public interface RpcExecutor {

    /**
     * Run an extension action and return its opaque result: a map, a scalar,
     * or a JSON-encoded string that still needs decoding.
     */
    Object executeExtensionAction(String extensionId, Map<String, String> params);

    /**
     * Browse a plugin URL the way the host's file browser would.
     */
    List<DirectoryEntry> listDirectory(String uri);
}
