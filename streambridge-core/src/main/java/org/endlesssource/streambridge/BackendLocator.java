package org.endlesssource.streambridge;

import org.endlesssource.streambridge.spi.ExtensionInfo;
import org.endlesssource.streambridge.spi.ExtensionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the provider extension installed on this host.
 */
public final class BackendLocator {
    private static final Logger logger = LoggerFactory.getLogger(BackendLocator.class);

    private final ExtensionRegistry registry;
    private final List<String> candidateIds;
    private final String fallbackCategory;
    private final List<String> fallbackPrefixes;

    public BackendLocator(ExtensionRegistry registry,
                          List<String> candidateIds,
                          String fallbackCategory,
                          List<String> fallbackPrefixes) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.candidateIds = List.copyOf(candidateIds);
        this.fallbackCategory = Objects.requireNonNull(fallbackCategory, "fallbackCategory must not be null");
        this.fallbackPrefixes = List.copyOf(fallbackPrefixes);
    }

    /**
     * Return the first known candidate that is installed, falling back to a
     * prefix match over the installed extensions of the configured category.
     * Registry failures count as "not installed"; this method never throws.
     */
    public Optional<String> discover() {
        for (String candidate : candidateIds) {
            if (exists(candidate)) {
                logger.debug("Found provider extension {}", candidate);
                return Optional.of(candidate);
            }
        }
        logger.debug("No known provider extension installed, scanning category {}", fallbackCategory);

        List<ExtensionInfo> installed;
        try {
            installed = registry.enumerate(fallbackCategory);
        } catch (RuntimeException e) {
            logger.warn("Failed to enumerate {} extensions: {}", fallbackCategory, e.getMessage());
            return Optional.empty();
        }
        for (ExtensionInfo info : installed) {
            for (String prefix : fallbackPrefixes) {
                if (info.id().startsWith(prefix)) {
                    logger.debug("Found provider extension {} by prefix {}", info.id(), prefix);
                    return Optional.of(info.id());
                }
            }
        }
        logger.info("No provider extension found (candidates: {})", candidateIds);
        return Optional.empty();
    }

    private boolean exists(String candidate) {
        try {
            return registry.exists(candidate);
        } catch (RuntimeException e) {
            logger.debug("Existence probe for {} failed: {}", candidate, e.getMessage());
            return false;
        }
    }
}
