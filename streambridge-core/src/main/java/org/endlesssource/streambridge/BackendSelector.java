package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.BackendDescriptor;
import org.endlesssource.streambridge.api.BackendUnavailableException;
import org.endlesssource.streambridge.spi.BackendStrategyProvider;
import org.endlesssource.streambridge.spi.ContentBackend;
import org.endlesssource.streambridge.spi.HostPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Chooses how to reach the provider extension, once.
 * <p>
 * The first successful selection is kept for the lifetime of this selector.
 * A failed selection is not remembered, so a later call retries discovery.
 */
public final class BackendSelector {
    private static final Logger logger = LoggerFactory.getLogger(BackendSelector.class);

    private final BackendLocator locator;
    private final StrategyRegistry strategies;
    private final HostPlatform platform;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile SelectedBackend selected;

    public BackendSelector(BackendLocator locator, StrategyRegistry strategies, HostPlatform platform) {
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
        this.strategies = Objects.requireNonNull(strategies, "strategies must not be null");
        this.platform = Objects.requireNonNull(platform, "platform must not be null");
    }

    /**
     * The selected backend, selecting it on first use.
     * @throws BackendUnavailableException if no provider extension is installed
     *                                     or no strategy can bind to it
     */
    public SelectedBackend select() {
        SelectedBackend current = selected;
        if (current != null) {
            return current;
        }
        lock.lock();
        try {
            if (selected == null) {
                selected = doSelect();
            }
            return selected;
        } finally {
            lock.unlock();
        }
    }

    public Optional<SelectedBackend> current() {
        return Optional.ofNullable(selected);
    }

    private SelectedBackend doSelect() {
        String extensionId = locator.discover()
                .orElseThrow(() -> new BackendUnavailableException("No provider extension is installed"));
        if (strategies.isEmpty()) {
            throw new BackendUnavailableException("No backend strategy is available for " + extensionId);
        }

        List<StrategyAttempt> attempts = new ArrayList<>();
        for (BackendStrategyProvider provider : strategies.providers()) {
            logger.debug("Trying {} strategy for {}", provider.strategy(), extensionId);
            try {
                ContentBackend backend = provider.create(extensionId, platform);
                attempts.add(StrategyAttempt.bound(provider.strategy(), extensionId));
                BackendDescriptor descriptor = new BackendDescriptor(extensionId, provider.strategy());
                logger.info("Using backend {}", descriptor);
                return new SelectedBackend(descriptor, backend, attempts);
            } catch (BackendUnavailableException e) {
                logger.debug("{} strategy unavailable for {}: {}", provider.strategy(), extensionId, e.getMessage());
                attempts.add(StrategyAttempt.failed(provider.strategy(), extensionId, e.getMessage()));
            } catch (RuntimeException | LinkageError e) {
                logger.warn("{} strategy failed to bind to {}", provider.strategy(), extensionId, e);
                attempts.add(StrategyAttempt.failed(provider.strategy(), extensionId,
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        throw new BackendUnavailableException("No strategy could bind to " + extensionId + ": "
                + attempts.stream().map(StrategyAttempt::toString).collect(Collectors.joining("; ")));
    }
}
