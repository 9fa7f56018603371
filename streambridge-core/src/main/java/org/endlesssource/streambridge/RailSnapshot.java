package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.Page;
import org.endlesssource.streambridge.api.Rail;

import java.time.Duration;
import java.util.Objects;

/**
 * One rail of a built home view with the first page of its content.
 *
 * @param elapsed   time spent fetching the page
 * @param fromCache whether the page was served from the cache
 */
public record RailSnapshot(Rail rail, Page page, Duration elapsed, boolean fromCache) {
    public RailSnapshot {
        Objects.requireNonNull(rail, "rail must not be null");
        Objects.requireNonNull(page, "page must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }
}
