package org.endlesssource.streambridge.api;

import java.util.Map;
import java.util.Objects;

/**
 * Everything a player needs to start a stream.
 *
 * @param licenseKey license server location, null for clear streams
 */
public record Playable(String streamUrl,
                       String manifestType,
                       String licenseKey,
                       Map<String, String> headers,
                       Map<String, Object> metadata) {
    public Playable {
        Objects.requireNonNull(streamUrl, "streamUrl must not be null");
        manifestType = manifestType == null ? "mpd" : manifestType;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
