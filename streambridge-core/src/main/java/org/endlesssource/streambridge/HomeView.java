package org.endlesssource.streambridge;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A fully built home view.
 *
 * @param railsFromCache whether the rail list itself was served from the cache
 */
public record HomeView(List<RailSnapshot> rails, boolean railsFromCache, Duration elapsed) {
    public HomeView {
        rails = List.copyOf(rails);
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    /**
     * True when the rail list and every rail page were served from the cache.
     */
    public boolean isWarm() {
        return railsFromCache && rails.stream().allMatch(RailSnapshot::fromCache);
    }
}
