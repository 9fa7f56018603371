package org.endlesssource.streambridge.examples;

import org.endlesssource.streambridge.StreamBridge;
import org.endlesssource.streambridge.api.StreamBridgeOptions;
import org.endlesssource.streambridge.diagnostics.DiagnosticsReport;
import org.endlesssource.streambridge.diagnostics.DiagnosticsRun;
import org.endlesssource.streambridge.diagnostics.RailTiming;
import org.endlesssource.streambridge.diagnostics.ThresholdBreach;
import org.endlesssource.streambridge.preflight.PreflightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Checks readiness, then times three home view builds. Exits non-zero when
 * a precondition fails or a threshold is breached.
 */
public final class DiagnosticsCliExample {
    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsCliExample.class);

    public static void main(String[] args) throws IOException {
        int status;
        try (ExampleHost host = ExampleHost.fromEnvironment()) {
            StreamBridge bridge = StreamBridge.create(host.platform(), host.cache(),
                    StreamBridgeOptions.defaults().withPerfLoggingEnabled(true));
            status = run(bridge);
        }
        System.exit(status);
    }

    static int run(StreamBridge bridge) {
        try {
            bridge.preflight().ensureReady();
        } catch (PreflightException e) {
            e.getFailures().forEach(failure -> logger.error("{}: {}", failure.code(), failure.remediation()));
            return 2;
        }

        DiagnosticsReport report = bridge.diagnostics().run();
        for (DiagnosticsRun run : report.runs()) {
            logger.info("Run {} ({}) took {} ms", run.number(), run.warm() ? "warm" : "cold", run.elapsed().toMillis());
            for (RailTiming rail : run.rails()) {
                logger.info("  {} -> {} items in {} ms{}", rail.railId(), rail.itemCount(),
                        rail.elapsed().toMillis(), rail.fromCache() ? " (cached)" : "");
            }
        }
        if (report.withinThresholds()) {
            logger.info("All timings within thresholds for {}", report.backend());
            return 0;
        }
        for (ThresholdBreach breach : report.breaches()) {
            logger.warn("Breach: {}", breach);
        }
        return 1;
    }

    private DiagnosticsCliExample() {
    }
}
