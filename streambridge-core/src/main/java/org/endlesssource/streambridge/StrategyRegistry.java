package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.spi.BackendStrategyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The strategy providers available to a bridge, in the order they are tried.
 */
public final class StrategyRegistry {
    private static final Logger logger = LoggerFactory.getLogger(StrategyRegistry.class);

    private final List<BackendStrategyProvider> providers;

    private StrategyRegistry(List<BackendStrategyProvider> providers) {
        this.providers = providers.stream()
                .sorted(Comparator.comparingInt(BackendStrategyProvider::order)
                        .thenComparing(provider -> provider.strategy().name()))
                .toList();
    }

    /**
     * Providers registered through {@link ServiceLoader}.
     */
    public static StrategyRegistry load() {
        ServiceLoader<BackendStrategyProvider> loader = ServiceLoader.load(BackendStrategyProvider.class);
        List<BackendStrategyProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered strategy providers: {}",
                    providers.stream().map(p -> p.strategy().name()).collect(Collectors.joining(", ")));
        }
        return new StrategyRegistry(providers);
    }

    public static StrategyRegistry of(BackendStrategyProvider... providers) {
        return new StrategyRegistry(List.of(providers));
    }

    public static StrategyRegistry of(List<BackendStrategyProvider> providers) {
        return new StrategyRegistry(List.copyOf(providers));
    }

    /**
     * A registry holding only the providers whose strategy is enabled.
     */
    public StrategyRegistry restrictTo(Set<BackendStrategy> enabled) {
        return new StrategyRegistry(providers.stream()
                .filter(provider -> enabled.contains(provider.strategy()))
                .toList());
    }

    public List<BackendStrategyProvider> providers() {
        return providers;
    }

    public List<BackendStrategy> strategies() {
        return providers.stream().map(BackendStrategyProvider::strategy).distinct().toList();
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }
}
