package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.ContentService;
import org.endlesssource.streambridge.api.Fetched;
import org.endlesssource.streambridge.api.Page;
import org.endlesssource.streambridge.api.Rail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Loads the home rails and the first page of each of them.
 */
public final class HomeViewBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HomeViewBuilder.class);

    private final ContentService service;
    private final int pageSize;
    private final LongSupplier nanoTime;

    public HomeViewBuilder(ContentService service, int pageSize) {
        this(service, pageSize, System::nanoTime);
    }

    HomeViewBuilder(ContentService service, int pageSize, LongSupplier nanoTime) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.pageSize = pageSize;
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime must not be null");
    }

    public HomeView build() {
        return build(false);
    }

    /**
     * @param forceRefresh bypass cache lookups for the rails and every rail page
     */
    public HomeView build(boolean forceRefresh) {
        long start = nanoTime.getAsLong();
        Fetched<List<Rail>> rails = service.homeRails(forceRefresh);

        List<RailSnapshot> snapshots = new ArrayList<>(rails.value().size());
        for (Rail rail : rails.value()) {
            long railStart = nanoTime.getAsLong();
            Fetched<Page> page = service.rail(rail.identifier(), null, pageSize, forceRefresh);
            Duration elapsed = Duration.ofNanos(nanoTime.getAsLong() - railStart);
            logger.debug("Rail {} loaded {} items in {} ms (cached: {})",
                    rail.identifier(), page.value().items().size(), elapsed.toMillis(), page.fromCache());
            snapshots.add(new RailSnapshot(rail, page.value(), elapsed, page.fromCache()));
        }

        return new HomeView(snapshots, rails.fromCache(), Duration.ofNanos(nanoTime.getAsLong() - start));
    }
}
