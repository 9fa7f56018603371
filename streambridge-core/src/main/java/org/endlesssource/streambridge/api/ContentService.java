package org.endlesssource.streambridge.api;

import java.util.List;
import java.util.Optional;

/**
 * The catalog operations offered to UI collaborators.
 * <p>
 * The {@code forceRefresh} variants skip the cache lookup but still store the
 * fresh result; their {@link Fetched} tag tells cold reads from warm ones.
 */
public interface ContentService {

    /**
     * The backend this service talks to, selecting it on first use.
     * @throws BackendUnavailableException if no backend can be bound
     */
    BackendDescriptor descriptor();

    Fetched<List<Rail>> homeRails(boolean forceRefresh);

    Fetched<Page> rail(String railId, String cursor, int limit, boolean forceRefresh);

    Fetched<Page> search(String query, String cursor, int limit, boolean forceRefresh);

    Fetched<Playable> playable(String id, boolean forceRefresh);

    /**
     * Marketplace/region reported by the backend, if it exposes one.
     */
    Optional<String> region();

    default List<Rail> getHomeRails() {
        return homeRails(false).value();
    }

    default Page getRail(String railId, String cursor, int limit) {
        return rail(railId, cursor, limit, false).value();
    }

    default Page search(String query, String cursor, int limit) {
        return search(query, cursor, limit, false).value();
    }

    default Playable getPlayable(String id) {
        return playable(id, false).value();
    }
}
