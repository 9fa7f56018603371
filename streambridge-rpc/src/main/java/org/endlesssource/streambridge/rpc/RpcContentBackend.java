package org.endlesssource.streambridge.rpc;

import org.endlesssource.streambridge.api.BackendException;
import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.api.BackendUnavailableException;
import org.endlesssource.streambridge.api.StreamBridgeException;
import org.endlesssource.streambridge.spi.ContentBackend;
import org.endlesssource.streambridge.spi.DirectoryEntry;
import org.endlesssource.streambridge.spi.ExtensionRegistry;
import org.endlesssource.streambridge.spi.RpcExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reaches the provider extension through host RPC without loading its code.
 * <p>
 * Rail pages come from browsing the extension's listing URL; everything else
 * is an extension action. Nothing is probed up front, so an action the
 * extension does not understand only fails when it is called.
 */
public final class RpcContentBackend implements ContentBackend {
    private static final Logger logger = LoggerFactory.getLogger(RpcContentBackend.class);

    static final String ACTION_HOME = "home";
    static final String ACTION_LIST = "list";
    static final String ACTION_SEARCH = "search";
    static final String ACTION_PLAYABLE = "playable";
    static final String ACTION_REGION = "region";
    static final String ACTION_LOGIN_STATE = "login_state";
    static final String ACTION_DRM_READY = "drm_ready";

    private final String extensionId;
    private final RpcExecutor executor;

    private RpcContentBackend(String extensionId, RpcExecutor executor) {
        this.extensionId = extensionId;
        this.executor = executor;
    }

    /**
     * @throws BackendUnavailableException if the extension is not installed
     */
    public static RpcContentBackend connect(String extensionId, ExtensionRegistry registry, RpcExecutor executor) {
        Objects.requireNonNull(extensionId, "extensionId must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        boolean installed;
        try {
            installed = registry.exists(extensionId);
        } catch (RuntimeException e) {
            throw new BackendUnavailableException("Cannot query extension " + extensionId + ": " + e.getMessage(), e);
        }
        if (!installed) {
            throw new BackendUnavailableException("Extension " + extensionId + " is not installed");
        }
        return new RpcContentBackend(extensionId, executor);
    }

    @Override
    public String extensionId() {
        return extensionId;
    }

    @Override
    public BackendStrategy strategy() {
        return BackendStrategy.RPC;
    }

    @Override
    public Object fetchHomeRails() {
        return action(ACTION_HOME, Map.of());
    }

    @Override
    public Object fetchRail(String railId, String cursor, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", ACTION_LIST);
        params.put("rail", railId);
        params.put("cursor", cursor);
        params.put("limit", Integer.toString(limit));
        String uri = PluginUri.of(extensionId, params);

        List<DirectoryEntry> entries = call("list " + railId, () -> executor.listDirectory(uri));
        List<Map<String, Object>> items = new ArrayList<>(entries.size());
        String nextCursor = null;
        for (DirectoryEntry entry : entries) {
            Map<String, String> query = PluginUri.query(entry.file());
            String entryCursor = query.get("cursor");
            if (entryCursor != null && !entryCursor.isEmpty()) {
                nextCursor = entryCursor;
                continue;
            }
            items.add(toItem(entry, query));
        }
        logger.debug("Listed {} entries of rail {} (next cursor: {})", items.size(), railId, nextCursor);

        Map<String, Object> page = new LinkedHashMap<>();
        page.put("items", items);
        page.put("nextCursor", nextCursor);
        return page;
    }

    @Override
    public Object search(String query, String cursor, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("cursor", cursor);
        params.put("limit", Integer.toString(limit));
        return action(ACTION_SEARCH, params);
    }

    @Override
    public Object fetchPlayable(String id) {
        return action(ACTION_PLAYABLE, Map.of("asin", id));
    }

    @Override
    public Optional<String> region() {
        Object value = action(ACTION_REGION, Map.of());
        if (value instanceof Map<?, ?> map) {
            value = map.containsKey("region") ? map.get("region") : map.get("marketplace");
        }
        if (value == null) {
            return Optional.empty();
        }
        String region = value.toString().trim();
        return region.isEmpty() ? Optional.empty() : Optional.of(region);
    }

    @Override
    public Optional<Boolean> loggedIn() {
        return flag(ACTION_LOGIN_STATE, "loggedIn");
    }

    @Override
    public Optional<Boolean> drmReady() {
        return flag(ACTION_DRM_READY, "drmReady");
    }

    private Optional<Boolean> flag(String action, String field) {
        Object value = action(action, Map.of());
        if (value instanceof Map<?, ?> map) {
            value = map.get(field);
        }
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("false")) {
                return Optional.of(Boolean.parseBoolean(normalized));
            }
        }
        return Optional.empty();
    }

    private Object action(String action, Map<String, String> arguments) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", action);
        arguments.forEach((key, value) -> {
            if (value != null) {
                params.put(key, value);
            }
        });
        Object raw = call(action, () -> executor.executeExtensionAction(extensionId, params));
        return PayloadDecoder.decode(raw);
    }

    private <T> T call(String what, Supplier<T> rpc) {
        try {
            return rpc.get();
        } catch (StreamBridgeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendException("RPC " + what + " on " + extensionId + " failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> toItem(DirectoryEntry entry, Map<String, String> query) {
        Map<String, Object> item = new LinkedHashMap<>();
        String id = query.containsKey("asin") ? query.get("asin") : query.get("id");
        if (id != null) {
            item.put("id", id);
        }
        item.put("title", entry.label());
        item.put("plot", entry.plot());
        item.put("art", entry.art());
        Object duration = entry.streamDetails().get("duration");
        if (duration != null) {
            item.put("duration", duration);
        }
        String type = query.get("type");
        if (type != null) {
            item.put("type", type);
        }
        item.put("is_playable", !entry.folder());
        if (!entry.resume().isEmpty()) {
            item.put("resume", entry.resume());
        }
        return item;
    }
}
