package org.endlesssource.streambridge.spi;

import org.endlesssource.streambridge.api.BackendStrategy;

import java.util.Optional;

/**
 * A bound connection to a provider extension.
 * <p>
 * Fetch methods return raw, provider-shaped values (maps, lists, scalars) that
 * the normalizer turns into the canonical model. Implementations throw
 * {@link org.endlesssource.streambridge.api.BackendException} for malformed or
 * error-flagged payloads.
 */
public interface ContentBackend {

    String extensionId();

    BackendStrategy strategy();

    Object fetchHomeRails();

    Object fetchRail(String railId, String cursor, int limit);

    Object search(String query, String cursor, int limit);

    Object fetchPlayable(String id);

    /**
     * Marketplace/region code, empty when the provider does not expose one.
     */
    Optional<String> region();

    /**
     * Login state as reported by the provider, empty when unknown.
     */
    Optional<Boolean> loggedIn();

    /**
     * DRM readiness as reported by the provider, empty when unknown.
     */
    Optional<Boolean> drmReady();
}
