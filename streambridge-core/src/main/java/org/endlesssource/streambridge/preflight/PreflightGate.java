package org.endlesssource.streambridge.preflight;

import org.endlesssource.streambridge.BackendSelector;
import org.endlesssource.streambridge.SelectedBackend;
import org.endlesssource.streambridge.api.BackendException;
import org.endlesssource.streambridge.spi.ContentBackend;
import org.endlesssource.streambridge.spi.ExtensionInfo;
import org.endlesssource.streambridge.spi.ExtensionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Checks that content calls can succeed before any is made.
 * <p>
 * Login state, the decryption component and DRM readiness are all evaluated
 * on every check so the caller can report every missing precondition at once.
 * An unknown login or DRM state passes.
 */
public final class PreflightGate {
    private static final Logger logger = LoggerFactory.getLogger(PreflightGate.class);

    private final BackendSelector selector;
    private final ExtensionRegistry registry;
    private final String decryptionComponentId;

    public PreflightGate(BackendSelector selector, ExtensionRegistry registry, String decryptionComponentId) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.decryptionComponentId = Objects.requireNonNull(decryptionComponentId, "decryptionComponentId must not be null");
    }

    /**
     * @throws org.endlesssource.streambridge.api.BackendUnavailableException if no backend can be selected
     */
    public PreflightReport check() {
        SelectedBackend selected = selector.select();
        ContentBackend backend = selected.backend();
        List<PreflightFailure> failures = new ArrayList<>();

        Optional<Boolean> loggedIn = probe("login state", backend::loggedIn);
        if (loggedIn.isEmpty()) {
            logger.warn("Login state of {} is unknown, assuming signed in", backend.extensionId());
        } else if (!loggedIn.get()) {
            failures.add(PreflightFailure.NOT_LOGGED_IN);
        }

        Optional<PreflightFailure> component = checkDecryptionComponent();
        component.ifPresent(failures::add);

        Optional<Boolean> drmReady = probe("DRM readiness", backend::drmReady);
        if (drmReady.isPresent() && !drmReady.get()) {
            failures.add(PreflightFailure.DRM_UNAVAILABLE);
        }

        PreflightReport report = new PreflightReport(selected.descriptor(), failures);
        if (report.ready()) {
            logger.debug("Preflight passed for {}", selected.descriptor());
        } else {
            logger.info("Preflight failed for {}: {}", selected.descriptor(), failures);
        }
        return report;
    }

    /**
     * Run {@link #check()} and fail if any precondition is not met.
     * @throws PreflightException listing every failed precondition
     */
    public PreflightReport ensureReady() {
        PreflightReport report = check();
        if (!report.ready()) {
            throw new PreflightException(report);
        }
        return report;
    }

    private Optional<PreflightFailure> checkDecryptionComponent() {
        Optional<ExtensionInfo> details;
        try {
            details = registry.details(decryptionComponentId);
        } catch (RuntimeException e) {
            logger.warn("Failed to query {}: {}", decryptionComponentId, e.getMessage());
            details = Optional.empty();
        }
        if (details.isEmpty()) {
            return Optional.of(PreflightFailure.DECRYPTION_COMPONENT_MISSING);
        }
        if (!details.get().enabled()) {
            return Optional.of(PreflightFailure.DECRYPTION_COMPONENT_DISABLED);
        }
        return Optional.empty();
    }

    private static Optional<Boolean> probe(String what, Supplier<Optional<Boolean>> call) {
        try {
            return call.get();
        } catch (BackendException e) {
            logger.warn("Could not read {}: {}", what, e.getMessage());
            return Optional.empty();
        }
    }
}
