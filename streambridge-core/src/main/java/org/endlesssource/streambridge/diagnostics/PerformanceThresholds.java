package org.endlesssource.streambridge.diagnostics;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing limits for a home view build and for a single rail fetch, with
 * separate limits for warm (cached) and cold runs.
 */
public record PerformanceThresholds(Duration homeWarm, Duration homeCold, Duration railWarm, Duration railCold) {
    public static final PerformanceThresholds DEFAULT = new PerformanceThresholds(
            Duration.ofMillis(300), Duration.ofMillis(1500),
            Duration.ofMillis(100), Duration.ofMillis(800));

    public PerformanceThresholds {
        Objects.requireNonNull(homeWarm, "homeWarm must not be null");
        Objects.requireNonNull(homeCold, "homeCold must not be null");
        Objects.requireNonNull(railWarm, "railWarm must not be null");
        Objects.requireNonNull(railCold, "railCold must not be null");
    }

    public Duration home(boolean warm) {
        return warm ? homeWarm : homeCold;
    }

    public Duration rail(boolean warm) {
        return warm ? railWarm : railCold;
    }
}
