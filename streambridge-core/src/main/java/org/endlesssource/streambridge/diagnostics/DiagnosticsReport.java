package org.endlesssource.streambridge.diagnostics;

import org.endlesssource.streambridge.api.BackendDescriptor;

import java.util.List;

public record DiagnosticsReport(BackendDescriptor backend, List<DiagnosticsRun> runs, List<ThresholdBreach> breaches) {
    public DiagnosticsReport {
        runs = List.copyOf(runs);
        breaches = List.copyOf(breaches);
    }

    public boolean withinThresholds() {
        return breaches.isEmpty();
    }
}
