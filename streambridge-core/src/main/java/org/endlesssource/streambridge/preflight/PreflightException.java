package org.endlesssource.streambridge.preflight;

import org.endlesssource.streambridge.api.StreamBridgeException;

import java.util.List;

/**
 * Thrown when one or more readiness preconditions fail. Carries all of them.
 */
public class PreflightException extends StreamBridgeException {
    private final transient PreflightReport report;

    public PreflightException(PreflightReport report) {
        super(report.summary());
        this.report = report;
    }

    public PreflightReport getReport() {
        return report;
    }

    public List<PreflightFailure> getFailures() {
        return report.failures();
    }
}
