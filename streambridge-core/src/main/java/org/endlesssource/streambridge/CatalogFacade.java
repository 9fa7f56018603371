package org.endlesssource.streambridge;

import com.google.gson.reflect.TypeToken;
import org.endlesssource.streambridge.api.BackendDescriptor;
import org.endlesssource.streambridge.api.ContentService;
import org.endlesssource.streambridge.api.Fetched;
import org.endlesssource.streambridge.api.Page;
import org.endlesssource.streambridge.api.Playable;
import org.endlesssource.streambridge.api.Rail;
import org.endlesssource.streambridge.api.StreamBridgeOptions;
import org.endlesssource.streambridge.cache.ResponseCache;
import org.endlesssource.streambridge.normalize.ContentNormalizer;
import org.endlesssource.streambridge.spi.ContentBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Cached, normalized access to the selected backend.
 * <p>
 * Every read goes cache, then backend, then normalizer, then cache. A
 * {@link org.endlesssource.streambridge.api.BackendException} fails only the
 * read that raised it; the selected backend stays bound.
 */
public final class CatalogFacade implements ContentService {
    private static final Logger logger = LoggerFactory.getLogger(CatalogFacade.class);

    private static final Type RAILS_TYPE = new TypeToken<List<Rail>>() { }.getType();

    private final BackendSelector selector;
    private final ResponseCache cache;
    private final StreamBridgeOptions options;

    public CatalogFacade(BackendSelector selector, ResponseCache cache, StreamBridgeOptions options) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    @Override
    public BackendDescriptor descriptor() {
        return selector.select().descriptor();
    }

    @Override
    public Fetched<List<Rail>> homeRails(boolean forceRefresh) {
        return read(CacheKeys.homeRails(), RAILS_TYPE, options.getCacheTtl(), forceRefresh,
                backend -> ContentNormalizer.normalizeRails(backend.fetchHomeRails()));
    }

    @Override
    public Fetched<Page> rail(String railId, String cursor, int limit, boolean forceRefresh) {
        Objects.requireNonNull(railId, "railId must not be null");
        requirePositive(limit);
        return read(CacheKeys.rail(railId, cursor, limit), Page.class, options.getCacheTtl(), forceRefresh,
                backend -> ContentNormalizer.normalizePage(backend.fetchRail(railId, cursor, limit)));
    }

    @Override
    public Fetched<Page> search(String query, String cursor, int limit, boolean forceRefresh) {
        Objects.requireNonNull(query, "query must not be null");
        requirePositive(limit);
        String normalizedQuery = CacheKeys.normalizeQuery(query);
        if (normalizedQuery.isEmpty()) {
            return Fetched.cold(Page.EMPTY);
        }
        return read(CacheKeys.search(query, cursor, limit), Page.class, options.getCacheTtl(), forceRefresh,
                backend -> ContentNormalizer.normalizePage(backend.search(query.trim(), cursor, limit)));
    }

    @Override
    public Fetched<Playable> playable(String id, boolean forceRefresh) {
        Objects.requireNonNull(id, "id must not be null");
        return read(CacheKeys.playable(id), Playable.class, options.getPlayableCacheTtl(), forceRefresh,
                backend -> ContentNormalizer.normalizePlayable(backend.fetchPlayable(id)));
    }

    @Override
    public Optional<String> region() {
        if (options.isCacheEnabled()) {
            Optional<String> cached = cache.get(CacheKeys.REGION, options.getCacheTtl(), String.class);
            if (cached.isPresent()) {
                return cached;
            }
        }
        Optional<String> region = backend().region();
        if (options.isCacheEnabled()) {
            region.ifPresent(value -> cache.put(CacheKeys.REGION, value, options.getCacheTtl()));
        }
        return region;
    }

    /**
     * Drop cached reads whose key starts with {@code prefix}, see {@link CacheKeys}.
     */
    public int invalidate(String prefix) {
        return cache.clearPrefix(prefix);
    }

    private <T> Fetched<T> read(String key,
                                Type type,
                                Duration ttl,
                                boolean forceRefresh,
                                Function<ContentBackend, T> loader) {
        boolean useCache = options.isCacheEnabled();
        if (useCache && !forceRefresh) {
            Optional<T> cached = cache.get(key, ttl, type);
            if (cached.isPresent()) {
                logger.debug("Cache hit for {}", key);
                return Fetched.warm(cached.get());
            }
        }

        T value = timed(key, () -> loader.apply(backend()));
        if (useCache) {
            cache.put(key, value, ttl);
        }
        return Fetched.cold(value);
    }

    private <T> T timed(String key, Supplier<T> call) {
        long start = System.nanoTime();
        T value = call.get();
        if (logger.isDebugEnabled()) {
            logger.debug("Fetched {} from backend in {} ms", key, (System.nanoTime() - start) / 1_000_000);
        }
        return value;
    }

    private ContentBackend backend() {
        return selector.select().backend();
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }
}
