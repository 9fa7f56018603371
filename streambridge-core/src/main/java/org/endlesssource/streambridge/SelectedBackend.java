package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.BackendDescriptor;
import org.endlesssource.streambridge.spi.ContentBackend;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of backend selection: what was chosen, the live binding, and
 * every attempt made on the way.
 */
public record SelectedBackend(BackendDescriptor descriptor, ContentBackend backend, List<StrategyAttempt> attempts) {
    public SelectedBackend {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
        attempts = List.copyOf(attempts);
    }
}
