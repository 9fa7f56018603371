package org.endlesssource.streambridge.diagnostics;

import java.time.Duration;

public record RailTiming(String railId, int itemCount, Duration elapsed, boolean fromCache) {
}
