package org.endlesssource.streambridge.api;

import java.util.Objects;

/**
 * The provider extension chosen for this process and how it is reached.
 */
public record BackendDescriptor(String candidateId, BackendStrategy strategy) {
    public BackendDescriptor {
        Objects.requireNonNull(candidateId, "candidateId must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
    }

    @Override
    public String toString() {
        return strategy.name().toLowerCase() + " (" + candidateId + ")";
    }
}
