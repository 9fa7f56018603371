package org.endlesssource.streambridge.spi;

import java.util.Map;

/**
 * One entry of a host directory listing.
 *
 * @param file          plugin URL of the entry
 * @param art           artwork locations keyed by kind (poster, fanart, thumb)
 * @param streamDetails raw stream details, e.g. {@code duration} in seconds
 * @param resume        raw resume point information
 */
public record DirectoryEntry(String label,
                             String file,
                             String plot,
                             Map<String, String> art,
                             Map<String, Object> streamDetails,
                             Map<String, Object> resume,
                             boolean folder) {
    public DirectoryEntry {
        label = label == null ? "" : label;
        file = file == null ? "" : file;
        plot = plot == null ? "" : plot;
        art = art == null ? Map.of() : Map.copyOf(art);
        streamDetails = streamDetails == null ? Map.of() : Map.copyOf(streamDetails);
        resume = resume == null ? Map.of() : Map.copyOf(resume);
    }
}
