package org.endlesssource.streambridge.diagnostics;

import org.endlesssource.streambridge.CacheKeys;
import org.endlesssource.streambridge.CatalogFacade;
import org.endlesssource.streambridge.HomeView;
import org.endlesssource.streambridge.HomeViewBuilder;
import org.endlesssource.streambridge.RailSnapshot;
import org.endlesssource.streambridge.api.BackendDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the home view three times and checks each build against the
 * performance thresholds. The first run drops cached home and rail entries
 * and forces a refresh; the later runs read through the cache.
 */
public final class DiagnosticsHarness {
    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsHarness.class);

    public static final int RUNS = 3;

    private final CatalogFacade facade;
    private final HomeViewBuilder builder;
    private final PerformanceThresholds thresholds;
    private final boolean perfLogging;

    public DiagnosticsHarness(CatalogFacade facade,
                              HomeViewBuilder builder,
                              PerformanceThresholds thresholds,
                              boolean perfLogging) {
        this.facade = Objects.requireNonNull(facade, "facade must not be null");
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
        this.perfLogging = perfLogging;
    }

    public DiagnosticsReport run() {
        BackendDescriptor descriptor = facade.descriptor();
        logger.info("Running diagnostics against {}", descriptor);

        List<DiagnosticsRun> runs = new ArrayList<>(RUNS);
        List<ThresholdBreach> breaches = new ArrayList<>();
        for (int run = 1; run <= RUNS; run++) {
            boolean cold = run == 1;
            if (cold) {
                int cleared = facade.invalidate(CacheKeys.HOME_PREFIX) + facade.invalidate(CacheKeys.RAIL_PREFIX);
                logger.debug("Cleared {} cached entries before cold run", cleared);
            }
            HomeView view = builder.build(cold);
            boolean warm = view.isWarm();

            List<RailTiming> timings = new ArrayList<>(view.rails().size());
            for (RailSnapshot snapshot : view.rails()) {
                String railId = snapshot.rail().identifier();
                timings.add(new RailTiming(railId, snapshot.page().items().size(), snapshot.elapsed(), snapshot.fromCache()));
                if (PerfLog.logDuration("Run " + run + " rail " + railId, snapshot.elapsed(),
                        thresholds.rail(snapshot.fromCache()), perfLogging)) {
                    breaches.add(new ThresholdBreach(run, railId, snapshot.elapsed(),
                            thresholds.rail(snapshot.fromCache()), snapshot.fromCache()));
                }
            }
            if (PerfLog.logDuration("Run " + run + " home view (" + (warm ? "warm" : "cold") + ")",
                    view.elapsed(), thresholds.home(warm), perfLogging)) {
                breaches.add(new ThresholdBreach(run, "home", view.elapsed(), thresholds.home(warm), warm));
            }
            runs.add(new DiagnosticsRun(run, warm, view.elapsed(), timings));
        }

        if (!breaches.isEmpty()) {
            logger.warn("Diagnostics found {} threshold breach(es)", breaches.size());
        }
        return new DiagnosticsReport(descriptor, runs, breaches);
    }
}
