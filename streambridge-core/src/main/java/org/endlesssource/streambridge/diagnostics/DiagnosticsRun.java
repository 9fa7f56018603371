package org.endlesssource.streambridge.diagnostics;

import java.time.Duration;
import java.util.List;

/**
 * @param warm true only if the rail list and every rail came from the cache
 */
public record DiagnosticsRun(int number, boolean warm, Duration elapsed, List<RailTiming> rails) {
    public DiagnosticsRun {
        rails = List.copyOf(rails);
    }
}
