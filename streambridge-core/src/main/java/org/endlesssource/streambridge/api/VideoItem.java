package org.endlesssource.streambridge.api;

import java.util.Objects;

/**
 * A single catalog entry.
 * <p>
 * {@code id} and {@code title} are always present. {@code year} and
 * {@code durationSeconds} are null when the provider did not report a usable value.
 */
public record VideoItem(String id,
                        String title,
                        String plot,
                        Integer year,
                        Integer durationSeconds,
                        Artwork art,
                        boolean movie,
                        boolean show,
                        boolean playable) {
    public VideoItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        plot = plot == null ? "" : plot;
        art = art == null ? Artwork.NONE : art;
    }
}
