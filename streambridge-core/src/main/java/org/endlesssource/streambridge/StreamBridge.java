package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.BackendUnavailableException;
import org.endlesssource.streambridge.api.StreamBridgeOptions;
import org.endlesssource.streambridge.cache.ResponseCache;
import org.endlesssource.streambridge.diagnostics.DiagnosticsHarness;
import org.endlesssource.streambridge.diagnostics.PerformanceThresholds;
import org.endlesssource.streambridge.preflight.PreflightGate;
import org.endlesssource.streambridge.spi.HostPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point wiring locator, strategies, cache and facade for one host.
 * <p>
 * Creating a bridge does not touch the provider extension; the backend is
 * selected on the first call that needs it and kept for the bridge's lifetime.
 */
public final class StreamBridge {
    private static final Logger logger = LoggerFactory.getLogger(StreamBridge.class);

    private final StreamBridgeOptions options;
    private final BackendSelector selector;
    private final CatalogFacade facade;
    private final PreflightGate preflight;
    private final HomeViewBuilder homeViewBuilder;

    private StreamBridge(HostPlatform platform,
                         ResponseCache cache,
                         StreamBridgeOptions options,
                         StrategyRegistry strategies) {
        this.options = options;
        BackendLocator locator = new BackendLocator(platform.registry(),
                options.getCandidateIds(), options.getFallbackCategory(), options.getFallbackPrefixes());
        this.selector = new BackendSelector(locator, strategies, platform);
        this.facade = new CatalogFacade(selector, cache, options);
        this.preflight = new PreflightGate(selector, platform.registry(), options.getDecryptionComponentId());
        this.homeViewBuilder = new HomeViewBuilder(facade, options.getHomeRailPageSize());
    }

    public static StreamBridge create(HostPlatform platform, ResponseCache cache) {
        return create(platform, cache, StreamBridgeOptions.defaults());
    }

    /**
     * Create a bridge using the strategy modules found on the class path.
     */
    public static StreamBridge create(HostPlatform platform, ResponseCache cache, StreamBridgeOptions options) {
        return create(platform, cache, options, StrategyRegistry.load());
    }

    /**
     * Create a bridge with an explicit set of strategies.
     * Strategies not enabled in {@code options} are dropped.
     * @throws BackendUnavailableException if no enabled strategy remains
     */
    public static StreamBridge create(HostPlatform platform,
                                      ResponseCache cache,
                                      StreamBridgeOptions options,
                                      StrategyRegistry strategies) {
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(cache, "cache must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(strategies, "strategies must not be null");
        StrategyRegistry enabled = strategies.restrictTo(options.getEnabledStrategies());
        if (enabled.isEmpty()) {
            throw new BackendUnavailableException("No backend strategy module enabled (available: "
                    + strategies.strategies() + ", enabled: " + options.getEnabledStrategies() + ")");
        }
        logger.debug("Creating stream bridge with strategies {}", enabled.strategies());
        return new StreamBridge(platform, cache, options, enabled);
    }

    public StreamBridgeOptions getOptions() {
        return options;
    }

    public BackendSelector getSelector() {
        return selector;
    }

    /**
     * Cached catalog access for UI collaborators.
     */
    public CatalogFacade content() {
        return facade;
    }

    public PreflightGate preflight() {
        return preflight;
    }

    public HomeViewBuilder homeView() {
        return homeViewBuilder;
    }

    public DiagnosticsHarness diagnostics() {
        return diagnostics(PerformanceThresholds.DEFAULT);
    }

    public DiagnosticsHarness diagnostics(PerformanceThresholds thresholds) {
        return new DiagnosticsHarness(facade, homeViewBuilder, thresholds, options.isPerfLoggingEnabled());
    }
}
