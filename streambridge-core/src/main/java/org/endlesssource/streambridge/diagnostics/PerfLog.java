package org.endlesssource.streambridge.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Duration logging for timed operations. Breaches are always logged;
 * in-budget timings only when performance logging is on.
 */
public final class PerfLog {
    private static final Logger logger = LoggerFactory.getLogger(PerfLog.class);

    private PerfLog() {
    }

    /**
     * @return true if {@code elapsed} exceeded {@code limit}
     */
    public static boolean logDuration(String label, Duration elapsed, Duration limit, boolean perfLogging) {
        boolean breached = elapsed.compareTo(limit) > 0;
        if (breached) {
            logger.warn("{} took {} ms (threshold {} ms)", label, elapsed.toMillis(), limit.toMillis());
        } else if (perfLogging) {
            logger.info("{} took {} ms", label, elapsed.toMillis());
        }
        return breached;
    }
}
