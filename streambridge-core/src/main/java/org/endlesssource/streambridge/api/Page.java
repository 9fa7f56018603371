package org.endlesssource.streambridge.api;

import java.util.List;

/**
 * One page of a rail or a search result.
 *
 * @param nextCursor opaque token to pass back verbatim for the next page, null when there is none
 */
public record Page(List<VideoItem> items, String nextCursor) {
    public static final Page EMPTY = new Page(List.of(), null);

    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNextPage() {
        return nextCursor != null && !nextCursor.isEmpty();
    }
}
