package org.endlesssource.streambridge.rpc;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@code plugin://<extension>/?key=value&...} URLs.
 */
final class PluginUri {
    static final String SCHEME = "plugin";

    private PluginUri() {
    }

    static String of(String extensionId, Map<String, String> params) {
        StringJoiner query = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (value != null) {
                query.add(encode(key) + "=" + encode(value));
            }
        });
        return SCHEME + "://" + extensionId + "/?" + query;
    }

    /**
     * Extension id of a plugin URL, or null for other URLs.
     */
    static String extensionId(String uri) {
        int start = uri.indexOf("://");
        if (start < 0 || !uri.regionMatches(true, 0, SCHEME, 0, start)) {
            return null;
        }
        int end = uri.indexOf('/', start + 3);
        return end < 0 ? uri.substring(start + 3) : uri.substring(start + 3, end);
    }

    /**
     * Decoded query parameters; later duplicates win.
     */
    static Map<String, String> query(String uri) {
        Map<String, String> params = new LinkedHashMap<>();
        if (uri == null) {
            return params;
        }
        int mark = uri.indexOf('?');
        if (mark < 0) {
            return params;
        }
        int fragment = uri.indexOf('#', mark);
        String query = fragment < 0 ? uri.substring(mark + 1) : uri.substring(mark + 1, fragment);
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(decode(key), decode(value));
        }
        return params;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
