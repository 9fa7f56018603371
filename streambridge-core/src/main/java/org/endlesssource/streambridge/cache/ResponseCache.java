package org.endlesssource.streambridge.cache;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Optional;

/**
 * TTL key/value store for normalized backend responses.
 * <p>
 * Reads never fail: a missing, expired or unreadable entry is simply a miss.
 */
public interface ResponseCache {

    /**
     * Read a value stored under {@code key} if it is younger than {@code ttl}.
     * Expired and corrupt entries are evicted.
     *
     * @param type the stored value's type, e.g. a {@code TypeToken} type for generics
     */
    <T> Optional<T> get(String key, Duration ttl, Type type);

    /**
     * Store {@code value}, replacing any previous entry for {@code key}.
     */
    void put(String key, Object value, Duration ttl);

    void evict(String key);

    /**
     * Evict every entry whose key starts with {@code prefix}.
     *
     * @return number of evicted entries
     */
    int clearPrefix(String prefix);

    void clearAll();
}
