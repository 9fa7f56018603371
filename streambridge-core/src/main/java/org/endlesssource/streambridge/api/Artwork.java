package org.endlesssource.streambridge.api;

/**
 * Artwork locations for a catalog entry. Each field is null when unknown.
 */
public record Artwork(String poster, String fanart, String thumb) {
    public static final Artwork NONE = new Artwork(null, null, null);

    public boolean isEmpty() {
        return poster == null && fanart == null && thumb == null;
    }
}
