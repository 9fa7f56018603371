package org.endlesssource.streambridge.normalize;

import org.endlesssource.streambridge.api.Artwork;
import org.endlesssource.streambridge.api.BackendException;
import org.endlesssource.streambridge.api.Page;
import org.endlesssource.streambridge.api.Playable;
import org.endlesssource.streambridge.api.Rail;
import org.endlesssource.streambridge.api.VideoItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps provider-shaped payloads onto the canonical model.
 * <p>
 * Every canonical field is read from an ordered list of synonyms and the first
 * non-null value wins. Entries without an id or a title never leave this class.
 */
public final class ContentNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(ContentNormalizer.class);

    static final List<String> ID_KEYS = List.of("asin", "id", "content_id", "contentId");
    static final List<String> TITLE_KEYS = List.of("title", "name", "label");
    static final List<String> PLOT_KEYS = List.of("plot", "synopsis", "description", "overview");
    static final List<String> YEAR_KEYS = List.of("year", "releaseYear", "release_year", "premiered");
    static final List<String> DURATION_KEYS = List.of("duration_seconds", "durationSeconds", "duration", "runtime");
    static final List<String> MEDIA_TYPE_KEYS = List.of("mediatype", "media_type", "type", "contentType", "content_type");
    static final List<String> PLAYABLE_KEYS = List.of("is_playable", "isPlayable", "playable");
    static final List<String> ART_KEYS = List.of("art", "images", "artwork");
    static final List<String> POSTER_KEYS = List.of("poster", "boxart", "image", "cover");
    static final List<String> FANART_KEYS = List.of("fanart", "background", "heroImage", "backdrop");
    static final List<String> THUMB_KEYS = List.of("thumb", "thumbnail", "icon");

    static final List<String> ITEMS_KEYS = List.of("items", "results", "videos", "titles");
    static final List<String> CURSOR_KEYS = List.of("next_cursor", "nextCursor", "nextPageCursor", "next_token",
            "nextToken", "cursor");
    static final List<String> RAILS_KEYS = List.of("rails", "widgets", "collections");
    static final List<String> RAIL_ID_KEYS = List.of("identifier", "id", "rail_id", "railId");
    static final List<String> RAIL_TYPE_KEYS = List.of("content_type", "contentType");

    static final List<String> URL_KEYS = List.of("stream_url", "streamUrl", "url", "manifest", "manifestUrl",
            "manifest_url", "stream", "playbackUrl");
    static final List<String> MANIFEST_TYPE_KEYS = List.of("manifest_type", "manifestType", "type");
    static final List<String> LICENSE_KEYS = List.of("license_key", "licenseKey", "licenseUrl", "license_url");
    static final List<String> HEADER_KEYS = List.of("headers", "license_headers");
    static final List<String> METADATA_KEYS = List.of("metadata", "info");

    private static final Set<String> SHOW_TYPES = Set.of("show", "tvshow", "series", "season");
    private static final Set<String> MOVIE_TYPES = Set.of("movie", "film");

    private ContentNormalizer() {
    }

    /**
     * Normalize one raw catalog entry.
     *
     * @return empty when the entry has no id or no title
     */
    public static Optional<VideoItem> normalizeItem(Map<?, ?> raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String id = RawValues.string(RawValues.first(raw, ID_KEYS));
        String title = RawValues.string(RawValues.first(raw, TITLE_KEYS));
        if (id == null || title == null) {
            logger.debug("Dropping catalog entry without id/title: id={} title={}", id, title);
            return Optional.empty();
        }
        String plot = RawValues.string(RawValues.first(raw, PLOT_KEYS));
        Integer year = RawValues.year(RawValues.first(raw, YEAR_KEYS));
        Integer duration = RawValues.integer(RawValues.first(raw, DURATION_KEYS));
        if (duration != null && duration < 0) {
            duration = null;
        }

        String mediaType = Optional.ofNullable(RawValues.string(RawValues.first(raw, MEDIA_TYPE_KEYS)))
                .map(type -> type.toLowerCase(Locale.ROOT))
                .orElse("");
        boolean show = SHOW_TYPES.contains(mediaType);
        boolean movie = MOVIE_TYPES.contains(mediaType);
        Boolean playableFlag = RawValues.bool(RawValues.first(raw, PLAYABLE_KEYS));
        boolean playable = playableFlag != null ? playableFlag : !show;

        return Optional.of(new VideoItem(id, title, plot, year, duration, artwork(raw), movie, show, playable));
    }

    /**
     * Normalize a list of raw entries, silently dropping invalid ones.
     */
    public static List<VideoItem> normalizeItems(List<?> raw) {
        List<VideoItem> items = new ArrayList<>();
        if (raw == null) {
            return items;
        }
        for (Object element : raw) {
            if (element instanceof Map<?, ?> map) {
                normalizeItem(map).ifPresent(items::add);
            } else {
                logger.debug("Dropping catalog entry of type {}", element == null ? "null" : element.getClass().getName());
            }
        }
        return items;
    }

    /**
     * Normalize a rail or search page: either a bare list of entries or an
     * envelope holding the entries and an optional cursor.
     *
     * @throws BackendException if the payload is neither
     */
    public static Page normalizePage(Object raw) {
        if (raw instanceof List<?> list) {
            return new Page(normalizeItems(list), null);
        }
        if (raw instanceof Map<?, ?> envelope) {
            Object items = RawValues.first(envelope, ITEMS_KEYS);
            if (items == null && !envelope.isEmpty()) {
                throw new BackendException("Page payload has no item list (keys: " + envelope.keySet() + ")");
            }
            if (items != null && !(items instanceof List<?>)) {
                throw new BackendException("Page item list has unexpected type " + items.getClass().getName());
            }
            return new Page(normalizeItems((List<?>) items), RawValues.string(RawValues.first(envelope, CURSOR_KEYS)));
        }
        throw new BackendException("Unexpected page payload: " + describe(raw));
    }

    /**
     * Normalize the home payload into rails; rails without an identifier are dropped.
     *
     * @throws BackendException if the payload holds no rail list
     */
    public static List<Rail> normalizeRails(Object raw) {
        List<?> rawRails;
        if (raw instanceof List<?> list) {
            rawRails = list;
        } else if (raw instanceof Map<?, ?> envelope && RawValues.first(envelope, RAILS_KEYS) instanceof List<?> list) {
            rawRails = list;
        } else {
            throw new BackendException("Unexpected home payload: " + describe(raw));
        }

        List<Rail> rails = new ArrayList<>();
        for (Object element : rawRails) {
            if (!(element instanceof Map<?, ?> rawRail)) {
                continue;
            }
            normalizeRail(rawRail).ifPresent(rails::add);
        }
        return rails;
    }

    public static Optional<Rail> normalizeRail(Map<?, ?> raw) {
        String widgetType = RawValues.string(raw.get("type"));
        if (widgetType != null && widgetType.endsWith("Widget") && !widgetType.startsWith("Rail")) {
            logger.debug("Skipping non-rail widget {}", widgetType);
            return Optional.empty();
        }
        String identifier = RawValues.string(RawValues.first(raw, RAIL_ID_KEYS));
        if (identifier == null) {
            logger.debug("Dropping rail without identifier: {}", raw.keySet());
            return Optional.empty();
        }
        String title = RawValues.string(RawValues.first(raw, TITLE_KEYS));
        String contentType = RawValues.string(RawValues.first(raw, RAIL_TYPE_KEYS));
        Object items = RawValues.first(raw, ITEMS_KEYS);
        List<VideoItem> videoItems = items instanceof List<?> list ? normalizeItems(list) : List.of();
        String cursor = RawValues.string(RawValues.first(raw, CURSOR_KEYS));
        return Optional.of(new Rail(identifier, title, contentType, videoItems, cursor));
    }

    /**
     * Normalize playback resources.
     *
     * @throws BackendException if the payload is not a map or carries no stream URL
     */
    public static Playable normalizePlayable(Object raw) {
        if (!(raw instanceof Map<?, ?> payload)) {
            throw new BackendException("Unexpected playback payload: " + describe(raw));
        }
        String url = RawValues.string(RawValues.first(payload, URL_KEYS));
        if (url == null) {
            url = RawValues.string(RawValues.path(payload, "playbackUrls", "mainManifestUrl"));
        }
        if (url == null) {
            throw new BackendException("Playback payload has no stream URL (keys: " + payload.keySet() + ")");
        }

        String manifestType = RawValues.string(RawValues.first(payload, MANIFEST_TYPE_KEYS));
        String license = RawValues.string(RawValues.first(payload, LICENSE_KEYS));
        if (license == null) {
            license = RawValues.string(RawValues.path(payload, "license", "licenseUrl"));
        }

        Map<String, String> headers = new LinkedHashMap<>();
        if (RawValues.first(payload, HEADER_KEYS) instanceof Map<?, ?> rawHeaders) {
            rawHeaders.forEach((name, value) -> {
                String headerValue = RawValues.string(value);
                if (name != null && headerValue != null) {
                    headers.put(name.toString(), headerValue);
                }
            });
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (RawValues.first(payload, METADATA_KEYS) instanceof Map<?, ?> rawMetadata) {
            rawMetadata.forEach((name, value) -> {
                if (name != null && value != null) {
                    metadata.put(name.toString(), canonical(value));
                }
            });
        }
        String title = RawValues.string(payload.get("title"));
        if (title != null) {
            metadata.putIfAbsent("title", title);
        }
        Boolean live = RawValues.bool(RawValues.first(payload, List.of("is_live", "isLive", "live")));
        if (live != null) {
            metadata.putIfAbsent("live", live);
        }
        copyIfPresent(payload, "audioTracks", metadata);
        copyIfPresent(payload, "timedTextTracks", metadata);

        return new Playable(url, manifestType == null ? "mpd" : manifestType.toLowerCase(Locale.ROOT),
                license, headers, metadata);
    }

    private static Artwork artwork(Map<?, ?> raw) {
        Map<?, ?> art = RawValues.first(raw, ART_KEYS) instanceof Map<?, ?> nested ? nested : Map.of();
        String poster = firstString(art, raw, POSTER_KEYS);
        String fanart = firstString(art, raw, FANART_KEYS);
        String thumb = firstString(art, raw, THUMB_KEYS);
        if (poster == null && fanart == null && thumb == null) {
            return Artwork.NONE;
        }
        return new Artwork(poster, fanart, thumb);
    }

    private static String firstString(Map<?, ?> nested, Map<?, ?> raw, List<String> keys) {
        String value = RawValues.string(RawValues.first(nested, keys));
        return value != null ? value : RawValues.string(RawValues.first(raw, keys));
    }

    private static void copyIfPresent(Map<?, ?> payload, String key, Map<String, Object> metadata) {
        Object value = payload.get(key);
        if (value != null) {
            metadata.putIfAbsent(key, canonical(value));
        }
    }

    /**
     * Integral numbers become {@code Long}, decimals {@code Double}, nested maps
     * drop null values. The result reads back unchanged from the response cache.
     */
    static Object canonical(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((name, nested) -> {
                if (name != null && nested != null) {
                    converted.put(name.toString(), canonical(nested));
                }
            });
            return converted;
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(nested -> converted.add(canonical(nested)));
            return converted;
        }
        return value;
    }

    private static String describe(Object raw) {
        return raw == null ? "null" : raw.getClass().getSimpleName();
    }
}
