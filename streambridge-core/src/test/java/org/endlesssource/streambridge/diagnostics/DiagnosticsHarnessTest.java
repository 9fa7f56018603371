package org.endlesssource.streambridge.diagnostics;

import org.endlesssource.streambridge.BackendLocator;
import org.endlesssource.streambridge.BackendSelector;
import org.endlesssource.streambridge.CatalogFacade;
import org.endlesssource.streambridge.HomeViewBuilder;
import org.endlesssource.streambridge.StrategyRegistry;
import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.api.StreamBridgeOptions;
import org.endlesssource.streambridge.cache.FileResponseCache;
import org.endlesssource.streambridge.spi.HostPlatform;
import org.endlesssource.streambridge.test.DummyContentBackend;
import org.endlesssource.streambridge.test.FakeExtensionRegistry;
import org.endlesssource.streambridge.test.ScriptedStrategyProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsHarnessTest {
    private static final String EXTENSION = "plugin.video.amazonvod";
    private static final PerformanceThresholds GENEROUS = new PerformanceThresholds(
            Duration.ofMinutes(1), Duration.ofMinutes(1), Duration.ofMinutes(1), Duration.ofMinutes(1));

    @TempDir
    Path cacheDir;

    private FileResponseCache cache;
    private DummyContentBackend backend;
    private CatalogFacade facade;

    @BeforeEach
    void setUp() {
        cache = new FileResponseCache(cacheDir);
        backend = new DummyContentBackend(EXTENSION, BackendStrategy.DIRECT);
        FakeExtensionRegistry registry = new FakeExtensionRegistry().install(EXTENSION, "video-source");
        BackendSelector selector = new BackendSelector(
                new BackendLocator(registry, List.of(EXTENSION), "video-source", List.of()),
                StrategyRegistry.of(ScriptedStrategyProvider.binding(BackendStrategy.DIRECT, 0, backend)),
                new HostPlatform(registry, null, null));
        facade = new CatalogFacade(selector, cache, StreamBridgeOptions.defaults());
    }

    @Test
    void run_firstRunIsCold_laterRunsAreWarm() {
        DiagnosticsReport report = harness(GENEROUS).run();

        assertEquals(EXTENSION, report.backend().candidateId());
        assertEquals(3, report.runs().size());
        DiagnosticsRun first = report.runs().get(0);
        assertFalse(first.warm());
        assertTrue(first.rails().stream().noneMatch(RailTiming::fromCache));
        assertTrue(report.runs().get(1).warm());
        assertTrue(report.runs().get(2).warm());
        assertEquals(1, backend.calls("home"));
        assertEquals(2, backend.calls("rail"));
        assertTrue(report.withinThresholds());
    }

    @Test
    void run_firstRunIgnoresPreviouslyCachedEntries() {
        facade.homeRails(false);
        facade.rail("popular", null, 20, false);

        DiagnosticsReport report = harness(GENEROUS).run();

        assertFalse(report.runs().get(0).warm());
        assertEquals(2, backend.calls("home"));
    }

    @Test
    void run_breachesAreReportedPerRunAndRail() {
        PerformanceThresholds impossible = new PerformanceThresholds(
                Duration.ofNanos(-1), Duration.ofNanos(-1), Duration.ofNanos(-1), Duration.ofNanos(-1));

        DiagnosticsReport report = harness(impossible).run();

        assertFalse(report.withinThresholds());
        assertEquals(3 * (1 + 2), report.breaches().size());
        assertTrue(report.breaches().stream().anyMatch(b -> b.run() == 1 && b.subject().equals("home") && !b.warm()));
        assertTrue(report.breaches().stream().anyMatch(b -> b.run() == 2 && b.subject().equals("popular") && b.warm()));
    }

    @Test
    void perfLog_reportsBreachOnlyAboveLimit() {
        assertTrue(PerfLog.logDuration("x", Duration.ofMillis(301), Duration.ofMillis(300), false));
        assertFalse(PerfLog.logDuration("x", Duration.ofMillis(300), Duration.ofMillis(300), true));
    }

    @Test
    void defaultThresholds_coldAreLooserThanWarm() {
        PerformanceThresholds defaults = PerformanceThresholds.DEFAULT;

        assertEquals(Duration.ofMillis(300), defaults.home(true));
        assertEquals(Duration.ofMillis(1500), defaults.home(false));
        assertEquals(Duration.ofMillis(100), defaults.rail(true));
        assertEquals(Duration.ofMillis(800), defaults.rail(false));
    }

    private DiagnosticsHarness harness(PerformanceThresholds thresholds) {
        HomeViewBuilder builder = new HomeViewBuilder(facade, 20);
        return new DiagnosticsHarness(facade, builder, thresholds, true);
    }
}
