package org.endlesssource.streambridge.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * A facade read result tagged with whether it was served from the cache.
 */
public record Fetched<T>(T value, boolean fromCache) {
    public Fetched {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static <T> Fetched<T> cold(T value) {
        return new Fetched<>(value, false);
    }

    public static <T> Fetched<T> warm(T value) {
        return new Fetched<>(value, true);
    }

    public <R> Fetched<R> map(Function<? super T, ? extends R> mapper) {
        return new Fetched<>(mapper.apply(value), fromCache);
    }
}
