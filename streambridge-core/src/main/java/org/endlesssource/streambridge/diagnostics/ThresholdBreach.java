package org.endlesssource.streambridge.diagnostics;

import java.time.Duration;

/**
 * A timing that exceeded its limit.
 *
 * @param subject {@code "home"} for a whole run, otherwise the rail identifier
 */
public record ThresholdBreach(int run, String subject, Duration elapsed, Duration limit, boolean warm) {

    @Override
    public String toString() {
        return "run " + run + " " + subject + " took " + elapsed.toMillis() + " ms (limit "
                + limit.toMillis() + " ms, " + (warm ? "warm" : "cold") + ")";
    }
}
