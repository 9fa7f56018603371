package org.endlesssource.streambridge.cache;

import com.google.gson.JsonElement;

/**
 * Persisted form of one cache entry.
 *
 * @param timestamp epoch milliseconds of the write
 */
record CacheEntry(String key, JsonElement value, long timestamp, long ttlSeconds) {

    boolean isExpired(long nowMillis, long ttlMillis) {
        return nowMillis - timestamp > ttlMillis;
    }
}
