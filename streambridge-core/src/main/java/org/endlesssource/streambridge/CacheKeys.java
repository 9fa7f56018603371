package org.endlesssource.streambridge;

import java.util.Locale;

/**
 * Cache key scheme for facade reads. Keys start with the operation name so a
 * whole operation can be dropped with {@code clearPrefix}.
 */
public final class CacheKeys {
    public static final String HOME_PREFIX = "home";
    public static final String RAIL_PREFIX = "rail";
    public static final String SEARCH_PREFIX = "search";
    public static final String PLAYABLE_PREFIX = "playable";
    public static final String REGION = "region";

    private static final String ROOT_CURSOR = "root";

    private CacheKeys() {
    }

    public static String homeRails() {
        return HOME_PREFIX + ":rails";
    }

    public static String rail(String railId, String cursor, int limit) {
        return RAIL_PREFIX + ":" + railId + ":" + cursorPart(cursor) + ":" + limit;
    }

    public static String search(String query, String cursor, int limit) {
        return SEARCH_PREFIX + ":" + normalizeQuery(query) + ":" + cursorPart(cursor) + ":" + limit;
    }

    public static String playable(String id) {
        return PLAYABLE_PREFIX + ":" + id;
    }

    static String normalizeQuery(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }

    private static String cursorPart(String cursor) {
        return cursor == null || cursor.isEmpty() ? ROOT_CURSOR : cursor;
    }
}
