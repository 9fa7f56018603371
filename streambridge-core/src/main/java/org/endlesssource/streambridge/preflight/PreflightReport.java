package org.endlesssource.streambridge.preflight;

import org.endlesssource.streambridge.api.BackendDescriptor;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of one readiness check over a selected backend.
 */
public record PreflightReport(BackendDescriptor backend, List<PreflightFailure> failures) {
    public PreflightReport {
        Objects.requireNonNull(backend, "backend must not be null");
        failures = List.copyOf(failures);
    }

    public boolean ready() {
        return failures.isEmpty();
    }

    public String summary() {
        if (failures.isEmpty()) {
            return "ready (" + backend + ")";
        }
        return failures.stream()
                .map(failure -> failure.code() + ": " + failure.remediation())
                .collect(Collectors.joining("; "));
    }
}
