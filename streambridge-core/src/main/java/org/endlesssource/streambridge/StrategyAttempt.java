package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.BackendStrategy;

import java.util.Objects;

/**
 * Outcome of trying one strategy against a provider extension.
 */
public record StrategyAttempt(BackendStrategy strategy, String extensionId, boolean bound, String reason) {
    public StrategyAttempt(BackendStrategy strategy, String extensionId, boolean bound, String reason) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.extensionId = Objects.requireNonNull(extensionId, "extensionId must not be null");
        this.bound = bound;
        this.reason = reason == null ? "" : reason;
    }

    public static StrategyAttempt bound(BackendStrategy strategy, String extensionId) {
        return new StrategyAttempt(strategy, extensionId, true, "");
    }

    public static StrategyAttempt failed(BackendStrategy strategy, String extensionId, String reason) {
        return new StrategyAttempt(strategy, extensionId, false, reason);
    }

    @Override
    public String toString() {
        return strategy.name().toLowerCase() + ": " + (bound ? "bound" : reason);
    }
}
