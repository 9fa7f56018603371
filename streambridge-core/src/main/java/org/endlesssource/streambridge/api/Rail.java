package org.endlesssource.streambridge.api;

import java.util.List;
import java.util.Objects;

/**
 * A titled row of catalog entries shown on the home view.
 *
 * @param nextCursor opaque pagination token, null on the last page
 */
public record Rail(String identifier, String title, String contentType, List<VideoItem> items, String nextCursor) {
    public Rail {
        Objects.requireNonNull(identifier, "identifier must not be null");
        title = title == null ? identifier : title;
        contentType = contentType == null ? "videos" : contentType;
        items = items == null ? List.of() : List.copyOf(items);
    }
}
