package org.endlesssource.streambridge;

import org.endlesssource.streambridge.api.BackendDescriptor;
import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.api.ContentService;
import org.endlesssource.streambridge.api.Fetched;
import org.endlesssource.streambridge.api.Page;
import org.endlesssource.streambridge.api.Playable;
import org.endlesssource.streambridge.api.Rail;
import org.endlesssource.streambridge.api.VideoItem;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class HomeViewBuilderTest {

    @Test
    void build_fetchesFirstPageOfEveryRail_andTimesEach() {
        StubService service = new StubService(false);
        AtomicLong clock = new AtomicLong();
        HomeViewBuilder builder = new HomeViewBuilder(service, 20, () -> clock.addAndGet(5_000_000L));

        HomeView view = builder.build();

        assertEquals(List.of("a:null:20:false", "b:null:20:false"), service.railCalls);
        assertEquals(2, view.rails().size());
        assertEquals("a", view.rails().get(0).rail().identifier());
        assertEquals("a-1", view.rails().get(0).page().items().get(0).id());
        assertEquals(Duration.ofMillis(5), view.rails().get(0).elapsed());
        assertEquals(Duration.ofMillis(25), view.elapsed());
        assertFalse(view.isWarm());
    }

    @Test
    void build_forceRefresh_isPassedToEveryRead() {
        StubService service = new StubService(true);
        HomeViewBuilder builder = new HomeViewBuilder(service, 5);

        HomeView view = builder.build(true);

        assertEquals(List.of("a:null:5:true", "b:null:5:true"), service.railCalls);
        assertTrue(service.homeForced);
        assertTrue(view.isWarm());
    }

    @Test
    void isWarm_requiresRailListFromCacheToo() {
        HomeView view = new HomeView(List.of(), false, Duration.ZERO);

        assertFalse(view.isWarm());
    }

    @Test
    void invalidPageSize_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HomeViewBuilder(new StubService(false), 0));
    }

    private static final class StubService implements ContentService {
        private final boolean fromCache;
        private final List<String> railCalls = new ArrayList<>();
        private boolean homeForced;

        StubService(boolean fromCache) {
            this.fromCache = fromCache;
        }

        @Override
        public BackendDescriptor descriptor() {
            return new BackendDescriptor("ext.a", BackendStrategy.DIRECT);
        }

        @Override
        public Fetched<List<Rail>> homeRails(boolean forceRefresh) {
            homeForced = forceRefresh;
            return new Fetched<>(List.of(
                    new Rail("a", "A", null, List.of(), null),
                    new Rail("b", "B", null, List.of(), null)), fromCache);
        }

        @Override
        public Fetched<Page> rail(String railId, String cursor, int limit, boolean forceRefresh) {
            railCalls.add(railId + ":" + cursor + ":" + limit + ":" + forceRefresh);
            VideoItem item = new VideoItem(railId + "-1", "Item", null, null, null, null, false, false, true);
            return new Fetched<>(new Page(List.of(item), null), fromCache);
        }

        @Override
        public Fetched<Page> search(String query, String cursor, int limit, boolean forceRefresh) {
            return new Fetched<>(Page.EMPTY, fromCache);
        }

        @Override
        public Fetched<Playable> playable(String id, boolean forceRefresh) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Optional<String> region() {
            return Optional.empty();
        }
    }
}
