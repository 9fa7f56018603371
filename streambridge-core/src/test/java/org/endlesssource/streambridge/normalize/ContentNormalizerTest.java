package org.endlesssource.streambridge.normalize;

import org.endlesssource.streambridge.api.Artwork;
import org.endlesssource.streambridge.api.BackendException;
import org.endlesssource.streambridge.api.Page;
import org.endlesssource.streambridge.api.Playable;
import org.endlesssource.streambridge.api.Rail;
import org.endlesssource.streambridge.api.VideoItem;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContentNormalizerTest {

    @Test
    void normalizeItem_minimalEntry() {
        Optional<VideoItem> item = ContentNormalizer.normalizeItem(Map.of("asin", "B1", "title", "X"));

        assertEquals(Optional.of(new VideoItem("B1", "X", "", null, null, Artwork.NONE, false, false, true)), item);
    }

    @Test
    void normalizeItem_missingIdOrTitle_isDropped() {
        assertTrue(ContentNormalizer.normalizeItem(Map.of("title", "X")).isEmpty());
        assertTrue(ContentNormalizer.normalizeItem(Map.of("asin", "B1")).isEmpty());
        assertTrue(ContentNormalizer.normalizeItem(Map.of("asin", "B1", "title", "  ")).isEmpty());
    }

    @Test
    void normalizeItem_coalescesSynonymsAndNestedValues() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("contentId", 42);
        raw.put("name", Map.of("default", "Localized"));
        raw.put("synopsis", "Plot");
        raw.put("premiered", "2019-05-01");
        raw.put("runtime", "5400");
        raw.put("mediatype", "Movie");
        raw.put("images", Map.of("boxart", "p.jpg", "heroImage", "f.jpg"));
        raw.put("thumbnail", "t.jpg");

        VideoItem item = ContentNormalizer.normalizeItem(raw).orElseThrow();

        assertEquals("42", item.id());
        assertEquals("Localized", item.title());
        assertEquals("Plot", item.plot());
        assertEquals(Integer.valueOf(2019), item.year());
        assertEquals(Integer.valueOf(5400), item.durationSeconds());
        assertEquals(new Artwork("p.jpg", "f.jpg", "t.jpg"), item.art());
        assertTrue(item.movie());
        assertFalse(item.show());
        assertTrue(item.playable());
    }

    @Test
    void normalizeItem_invalidNumbers_becomeNull() {
        VideoItem item = ContentNormalizer.normalizeItem(
                Map.of("id", "x", "title", "X", "year", "soon", "duration", -5)).orElseThrow();

        assertNull(item.year());
        assertNull(item.durationSeconds());
    }

    @Test
    void normalizeItem_showsAreNotPlayableUnlessFlagged() {
        VideoItem show = ContentNormalizer.normalizeItem(Map.of("id", "s", "title", "S", "type", "series")).orElseThrow();
        VideoItem flagged = ContentNormalizer.normalizeItem(
                Map.of("id", "s", "title", "S", "type", "series", "isPlayable", "true")).orElseThrow();

        assertTrue(show.show());
        assertFalse(show.playable());
        assertTrue(flagged.playable());
    }

    @Test
    void normalizePage_acceptsListsAndEnvelopes() {
        Page fromList = ContentNormalizer.normalizePage(List.of(Map.of("id", "a", "title", "A"), "junk"));
        Page fromEnvelope = ContentNormalizer.normalizePage(Map.of(
                "results", List.of(Map.of("id", "a", "title", "A"), Map.of("title", "dropped")),
                "nextPageCursor", "abc"));

        assertEquals(1, fromList.items().size());
        assertNull(fromList.nextCursor());
        assertEquals(1, fromEnvelope.items().size());
        assertEquals("abc", fromEnvelope.nextCursor());
        assertTrue(fromEnvelope.hasNextPage());
        assertEquals(Page.EMPTY, ContentNormalizer.normalizePage(Map.of()));
    }

    @Test
    void normalizePage_malformedPayload_throws() {
        assertThrows(BackendException.class, () -> ContentNormalizer.normalizePage("nope"));
        assertThrows(BackendException.class, () -> ContentNormalizer.normalizePage(Map.of("total", 3)));
        assertThrows(BackendException.class, () -> ContentNormalizer.normalizePage(Map.of("items", "x")));
    }

    @Test
    void normalizeRails_readsWidgetsAndSkipsNonRails() {
        Object home = Map.of("widgets", List.of(
                Map.of("type", "RailWidget", "id", "popular", "title", Map.of("default", "Popular"),
                        "items", List.of(Map.of("asin", "B1", "title", "X"))),
                Map.of("type", "BannerWidget", "id", "promo"),
                Map.of("title", "no identifier")));

        List<Rail> rails = ContentNormalizer.normalizeRails(home);

        assertEquals(1, rails.size());
        assertEquals("popular", rails.get(0).identifier());
        assertEquals("Popular", rails.get(0).title());
        assertEquals("videos", rails.get(0).contentType());
        assertEquals(1, rails.get(0).items().size());
    }

    @Test
    void normalizeRails_unexpectedPayload_throws() {
        assertThrows(BackendException.class, () -> ContentNormalizer.normalizeRails(Map.of("items", List.of())));
        assertThrows(BackendException.class, () -> ContentNormalizer.normalizeRails(null));
    }

    @Test
    void normalizePlayable_withoutUrl_throws() {
        assertThrows(BackendException.class,
                () -> ContentNormalizer.normalizePlayable(Map.of("licenseUrl", "https://license.example")));
        assertThrows(BackendException.class, () -> ContentNormalizer.normalizePlayable(List.of()));
    }

    @Test
    void normalizePlayable_flatPayload() {
        Playable playable = ContentNormalizer.normalizePlayable(Map.of(
                "manifestUrl", "https://cdn.example/a.mpd",
                "licenseUrl", "https://license.example/a",
                "headers", Map.of("User-Agent", "test"),
                "title", "A"));

        assertEquals("https://cdn.example/a.mpd", playable.streamUrl());
        assertEquals("mpd", playable.manifestType());
        assertEquals("https://license.example/a", playable.licenseKey());
        assertEquals(Map.of("User-Agent", "test"), playable.headers());
        assertEquals("A", playable.metadata().get("title"));
    }

    @Test
    void normalizePlayable_nestedPlaybackPayload() {
        Playable playable = ContentNormalizer.normalizePlayable(Map.of(
                "playbackUrls", Map.of("mainManifestUrl", "https://cdn.example/b.mpd"),
                "license", Map.of("licenseUrl", "https://license.example/b"),
                "audioTracks", List.of("en", "de"),
                "manifestType", "HLS"));

        assertEquals("https://cdn.example/b.mpd", playable.streamUrl());
        assertEquals("hls", playable.manifestType());
        assertEquals("https://license.example/b", playable.licenseKey());
        assertEquals(List.of("en", "de"), playable.metadata().get("audioTracks"));
    }
}
