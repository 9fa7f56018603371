package org.endlesssource.streambridge.spi;

import java.util.Objects;

/**
 * An installed extension as reported by the host.
 */
public record ExtensionInfo(String id, String category, boolean enabled) {
    public ExtensionInfo {
        Objects.requireNonNull(id, "id must not be null");
        category = category == null ? "" : category;
    }
}
