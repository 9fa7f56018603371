package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.BackendException;
import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.api.Fetched;
import org.endlesssource.streambridge.api.Page;
import org.endlesssource.streambridge.api.Playable;
import org.endlesssource.streambridge.api.Rail;
import org.endlesssource.streambridge.api.StreamBridgeOptions;
import org.endlesssource.streambridge.cache.FileResponseCache;
import org.endlesssource.streambridge.spi.HostPlatform;
import org.endlesssource.streambridge.test.DummyContentBackend;
import org.endlesssource.streambridge.test.FakeExtensionRegistry;
import org.endlesssource.streambridge.test.MutableClock;
import org.endlesssource.streambridge.test.ScriptedStrategyProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CatalogFacadeTest {
    private static final String EXTENSION = "plugin.video.amazonvod";

    @TempDir
    Path cacheDir;

    private MutableClock clock;
    private FileResponseCache cache;
    private DummyContentBackend backend;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        cache = new FileResponseCache(cacheDir, clock);
        backend = new DummyContentBackend(EXTENSION, BackendStrategy.RPC);
    }

    @Test
    void homeRails_firstReadIsCold_secondIsWarm() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());

        Fetched<List<Rail>> cold = facade.homeRails(false);
        Fetched<List<Rail>> warm = facade.homeRails(false);

        assertFalse(cold.fromCache());
        assertTrue(warm.fromCache());
        assertEquals(cold.value(), warm.value());
        assertEquals(List.of("popular", "new"), warm.value().stream().map(Rail::identifier).toList());
        assertEquals(1, backend.calls("home"));
    }

    @Test
    void forceRefresh_skipsLookupButStoresResult() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());
        facade.rail("popular", null, 20, false);

        Fetched<Page> refreshed = facade.rail("popular", null, 20, true);
        Fetched<Page> cached = facade.rail("popular", null, 20, false);

        assertFalse(refreshed.fromCache());
        assertTrue(cached.fromCache());
        assertEquals(2, backend.calls("rail"));
    }

    @Test
    void rail_cursorAndLimitAreSeparateCacheEntries() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());

        Page first = facade.getRail("popular", null, 20);
        Page second = facade.getRail("popular", first.nextCursor(), 20);
        facade.getRail("popular", null, 10);

        assertEquals(2, first.items().size());
        assertEquals("popular-p2", first.nextCursor());
        assertEquals("popular-popular-p2+", second.nextCursor());
        assertEquals(3, backend.calls("rail"));
    }

    @Test
    void expiredEntries_areFetchedAgain() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults().withCacheTtl(Duration.ofSeconds(60)));
        facade.homeRails(false);

        clock.advance(Duration.ofSeconds(61));

        assertFalse(facade.homeRails(false).fromCache());
        assertEquals(2, backend.calls("home"));
    }

    @Test
    void playable_usesShorterTtl() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());
        Playable playable = facade.getPlayable("B1");

        clock.advance(Duration.ofSeconds(61));
        Fetched<Playable> again = facade.playable("B1", false);

        assertEquals("https://cdn.example/B1.mpd", playable.streamUrl());
        assertEquals("https://license.example/B1", playable.licenseKey());
        assertFalse(again.fromCache());
        assertEquals(2, backend.calls("playable"));
    }

    @Test
    void search_normalizesQueryForCaching() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());

        facade.search("  Bosch ", null, 20, false);
        Fetched<Page> second = facade.search("bosch", null, 20, false);

        assertTrue(second.fromCache());
        assertEquals("s-Bosch", second.value().items().get(0).id());
        assertEquals(1, backend.calls("search"));
        assertEquals(Page.EMPTY, facade.search("   ", null, 20));
    }

    @Test
    void cacheDisabled_neverReadsOrWrites() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults().withCacheEnabled(false));

        facade.homeRails(false);
        assertFalse(facade.homeRails(false).fromCache());

        assertEquals(2, backend.calls("home"));
        assertEquals(Optional.empty(), cache.get(CacheKeys.homeRails(), Duration.ofHours(1), Object.class));
    }

    @Test
    void backendException_failsOnlyThatRead() {
        backend.playablePayload(Map.of("licenseUrl", "https://license.example"));
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());

        assertThrows(BackendException.class, () -> facade.getPlayable("B1"));
        assertThrows(BackendException.class, () -> facade.getRail("broken", null, 20));

        assertEquals(2, facade.getHomeRails().size());
        assertEquals(Optional.empty(), cache.get(CacheKeys.playable("B1"), Duration.ofHours(1), Object.class));
    }

    @Test
    void region_isCachedWhenPresent() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());

        assertEquals(Optional.of("DE"), facade.region());
        assertEquals(Optional.of("DE"), facade.region());
        assertEquals(1, backend.calls("region"));
    }

    @Test
    void invalidate_dropsEntriesByPrefix() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());
        facade.homeRails(false);
        facade.rail("popular", null, 20, false);

        assertEquals(1, facade.invalidate(CacheKeys.RAIL_PREFIX));

        assertTrue(facade.homeRails(false).fromCache());
        assertFalse(facade.rail("popular", null, 20, false).fromCache());
    }

    @Test
    void playable_warmReadEqualsColdRead_withNumericMetadata() {
        backend.playablePayload(Map.of(
                "url", "https://cdn.example/B1.mpd",
                "metadata", Map.of("runtime", 5400, "rating", 4.5f, "chapters", List.of(Map.of("start", 0)))));
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());

        Fetched<Playable> cold = facade.playable("B1", false);
        Fetched<Playable> warm = facade.playable("B1", false);

        assertFalse(cold.fromCache());
        assertTrue(warm.fromCache());
        assertEquals(cold.value(), warm.value());
        assertEquals(5400L, warm.value().metadata().get("runtime"));
    }

    @Test
    void invalidLimit_isRejected() {
        CatalogFacade facade = facade(StreamBridgeOptions.defaults());

        assertThrows(IllegalArgumentException.class, () -> facade.getRail("popular", null, 0));
    }

    private CatalogFacade facade(StreamBridgeOptions options) {
        FakeExtensionRegistry registry = new FakeExtensionRegistry().install(EXTENSION, "video-source");
        BackendLocator locator = new BackendLocator(registry, List.of(EXTENSION), "video-source", List.of());
        BackendSelector selector = new BackendSelector(locator,
                StrategyRegistry.of(ScriptedStrategyProvider.binding(BackendStrategy.RPC, 10, backend)),
                new HostPlatform(registry, null, null));
        return new CatalogFacade(selector, cache, options);
    }
}
