package org.endlesssource.streambridge.api;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration options for a {@code StreamBridge} instance.
 */
public final class StreamBridgeOptions {
    public static final List<String> DEFAULT_CANDIDATE_IDS = List.of(
            "plugin.video.amazonvod",
            "plugin.video.amazon-test",
            "plugin.video.primevideo");
    public static final String DEFAULT_FALLBACK_CATEGORY = "video-source";
    public static final List<String> DEFAULT_FALLBACK_PREFIXES = List.of("plugin.video.amazon", "plugin.video.prime");
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(300);
    public static final Duration MIN_CACHE_TTL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_PLAYABLE_CACHE_TTL = Duration.ofSeconds(60);
    public static final int DEFAULT_HOME_RAIL_PAGE_SIZE = 20;
    public static final String DEFAULT_DECRYPTION_COMPONENT_ID = "inputstream.adaptive";

    private final List<String> candidateIds;
    private final String fallbackCategory;
    private final List<String> fallbackPrefixes;
    private final boolean cacheEnabled;
    private final Duration cacheTtl;
    private final Duration playableCacheTtl;
    private final int homeRailPageSize;
    private final String decryptionComponentId;
    private final Set<BackendStrategy> enabledStrategies;
    private final boolean perfLoggingEnabled;

    private StreamBridgeOptions(List<String> candidateIds,
                                String fallbackCategory,
                                List<String> fallbackPrefixes,
                                boolean cacheEnabled,
                                Duration cacheTtl,
                                Duration playableCacheTtl,
                                int homeRailPageSize,
                                String decryptionComponentId,
                                Set<BackendStrategy> enabledStrategies,
                                boolean perfLoggingEnabled) {
        this.candidateIds = List.copyOf(Objects.requireNonNull(candidateIds, "candidateIds must not be null"));
        this.fallbackCategory = Objects.requireNonNull(fallbackCategory, "fallbackCategory must not be null");
        this.fallbackPrefixes = List.copyOf(Objects.requireNonNull(fallbackPrefixes, "fallbackPrefixes must not be null"));
        this.cacheEnabled = cacheEnabled;
        this.cacheTtl = requireAtLeast("cacheTtl", cacheTtl, MIN_CACHE_TTL);
        this.playableCacheTtl = requirePositive("playableCacheTtl", playableCacheTtl);
        if (homeRailPageSize <= 0) {
            throw new IllegalArgumentException("homeRailPageSize must be positive");
        }
        this.homeRailPageSize = homeRailPageSize;
        this.decryptionComponentId = requireNonBlank("decryptionComponentId", decryptionComponentId);
        Objects.requireNonNull(enabledStrategies, "enabledStrategies must not be null");
        if (enabledStrategies.isEmpty()) {
            throw new IllegalArgumentException("enabledStrategies must not be empty");
        }
        this.enabledStrategies = Set.copyOf(enabledStrategies);
        this.perfLoggingEnabled = perfLoggingEnabled;
    }

    public static StreamBridgeOptions defaults() {
        return new StreamBridgeOptions(DEFAULT_CANDIDATE_IDS, DEFAULT_FALLBACK_CATEGORY, DEFAULT_FALLBACK_PREFIXES,
                true, DEFAULT_CACHE_TTL, DEFAULT_PLAYABLE_CACHE_TTL, DEFAULT_HOME_RAIL_PAGE_SIZE,
                DEFAULT_DECRYPTION_COMPONENT_ID, EnumSet.allOf(BackendStrategy.class), false);
    }

    public List<String> getCandidateIds() {
        return candidateIds;
    }

    public String getFallbackCategory() {
        return fallbackCategory;
    }

    public List<String> getFallbackPrefixes() {
        return fallbackPrefixes;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public Duration getPlayableCacheTtl() {
        return playableCacheTtl;
    }

    public int getHomeRailPageSize() {
        return homeRailPageSize;
    }

    public String getDecryptionComponentId() {
        return decryptionComponentId;
    }

    public Set<BackendStrategy> getEnabledStrategies() {
        return enabledStrategies;
    }

    public boolean isPerfLoggingEnabled() {
        return perfLoggingEnabled;
    }

    public StreamBridgeOptions withCandidateIds(List<String> ids) {
        return new StreamBridgeOptions(ids, fallbackCategory, fallbackPrefixes, cacheEnabled, cacheTtl,
                playableCacheTtl, homeRailPageSize, decryptionComponentId, enabledStrategies, perfLoggingEnabled);
    }

    public StreamBridgeOptions withFallback(String category, List<String> prefixes) {
        return new StreamBridgeOptions(candidateIds, category, prefixes, cacheEnabled, cacheTtl,
                playableCacheTtl, homeRailPageSize, decryptionComponentId, enabledStrategies, perfLoggingEnabled);
    }

    public StreamBridgeOptions withCacheEnabled(boolean enabled) {
        return new StreamBridgeOptions(candidateIds, fallbackCategory, fallbackPrefixes, enabled, cacheTtl,
                playableCacheTtl, homeRailPageSize, decryptionComponentId, enabledStrategies, perfLoggingEnabled);
    }

    public StreamBridgeOptions withCacheTtl(Duration ttl) {
        return new StreamBridgeOptions(candidateIds, fallbackCategory, fallbackPrefixes, cacheEnabled, ttl,
                playableCacheTtl, homeRailPageSize, decryptionComponentId, enabledStrategies, perfLoggingEnabled);
    }

    public StreamBridgeOptions withPlayableCacheTtl(Duration ttl) {
        return new StreamBridgeOptions(candidateIds, fallbackCategory, fallbackPrefixes, cacheEnabled, cacheTtl,
                ttl, homeRailPageSize, decryptionComponentId, enabledStrategies, perfLoggingEnabled);
    }

    public StreamBridgeOptions withHomeRailPageSize(int pageSize) {
        return new StreamBridgeOptions(candidateIds, fallbackCategory, fallbackPrefixes, cacheEnabled, cacheTtl,
                playableCacheTtl, pageSize, decryptionComponentId, enabledStrategies, perfLoggingEnabled);
    }

    public StreamBridgeOptions withDecryptionComponentId(String componentId) {
        return new StreamBridgeOptions(candidateIds, fallbackCategory, fallbackPrefixes, cacheEnabled, cacheTtl,
                playableCacheTtl, homeRailPageSize, componentId, enabledStrategies, perfLoggingEnabled);
    }

    public StreamBridgeOptions withEnabledStrategies(Set<BackendStrategy> strategies) {
        return new StreamBridgeOptions(candidateIds, fallbackCategory, fallbackPrefixes, cacheEnabled, cacheTtl,
                playableCacheTtl, homeRailPageSize, decryptionComponentId, strategies, perfLoggingEnabled);
    }

    public StreamBridgeOptions withPerfLoggingEnabled(boolean enabled) {
        return new StreamBridgeOptions(candidateIds, fallbackCategory, fallbackPrefixes, cacheEnabled, cacheTtl,
                playableCacheTtl, homeRailPageSize, decryptionComponentId, enabledStrategies, enabled);
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Duration requireAtLeast(String name, Duration value, Duration minimum) {
        requirePositive(name, value);
        if (value.compareTo(minimum) < 0) {
            throw new IllegalArgumentException(name + " must be at least " + minimum.toSeconds() + "s");
        }
        return value;
    }

    private static String requireNonBlank(String name, String value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
