package org.endlesssource.streambridge.direct;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.endlesssource.streambridge.api.BackendException;
import org.endlesssource.streambridge.api.BackendStrategy;
import org.endlesssource.streambridge.api.BackendUnavailableException;
import org.endlesssource.streambridge.spi.ContentBackend;
import org.endlesssource.streambridge.spi.LoadedModule;
import org.endlesssource.streambridge.spi.ModuleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Calls into the provider extension's own code, loaded in-process.
 * <p>
 * Binding walks the candidate modules and classes in order and keeps the
 * first instance that offers at least the rail and playback capabilities.
 */
public final class DirectContentBackend implements ContentBackend {
    private static final Logger logger = LoggerFactory.getLogger(DirectContentBackend.class);
    private static final Gson GSON = new Gson();

    static final List<String> DEFAULT_MODULES = List.of(
            "resources.lib.backend",
            "resources.lib",
            "plugin.video.backend",
            "backend");
    static final List<String> DEFAULT_CLASSES = List.of(
            "PrimeVideo",
            "PrimeApi",
            "ContentApi",
            "Backend");

    private final String extensionId;
    private final Object target;
    private final CapabilityProbe probe;

    private DirectContentBackend(String extensionId, Object target, CapabilityProbe probe) {
        this.extensionId = extensionId;
        this.target = target;
        this.probe = probe;
    }

    /**
     * Load and bind the extension's entry point.
     * @throws BackendUnavailableException if the extension has no install path
     *                                     or no candidate class qualifies
     */
    public static DirectContentBackend bind(String extensionId, ModuleLoader loader) {
        return bind(extensionId, loader, DEFAULT_MODULES, DEFAULT_CLASSES);
    }

    static DirectContentBackend bind(String extensionId,
                                     ModuleLoader loader,
                                     List<String> moduleNames,
                                     List<String> classNames) {
        Objects.requireNonNull(extensionId, "extensionId must not be null");
        Objects.requireNonNull(loader, "loader must not be null");
        Path installPath = loader.installPath(extensionId)
                .orElseThrow(() -> new BackendUnavailableException("Extension " + extensionId + " has no install path"));
        loader.addSearchPath(installPath);

        List<String> rejected = new ArrayList<>();
        for (String moduleName : moduleNames) {
            Optional<LoadedModule> module;
            try {
                module = loader.importModule(moduleName);
            } catch (RuntimeException | LinkageError e) {
                rejected.add(moduleName + ": " + e.getMessage());
                continue;
            }
            if (module.isEmpty()) {
                logger.debug("Module {} not found in {}", moduleName, extensionId);
                continue;
            }
            for (String className : classNames) {
                String qualified = moduleName + "." + className;
                Optional<Class<?>> type;
                try {
                    type = module.get().findClass(className);
                } catch (RuntimeException | LinkageError e) {
                    logger.debug("Could not load {}", qualified, e);
                    rejected.add(qualified + ": " + e.getClass().getSimpleName() + " " + e.getMessage());
                    continue;
                }
                if (type.isEmpty()) {
                    continue;
                }
                Object instance;
                try {
                    instance = instantiate(type.get(), extensionId);
                } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
                    Throwable cause = e instanceof InvocationTargetException && e.getCause() != null ? e.getCause() : e;
                    logger.debug("Could not instantiate {}", qualified, cause);
                    rejected.add(qualified + ": " + cause.getClass().getSimpleName() + " " + cause.getMessage());
                    continue;
                }

                CapabilityProbe probe = CapabilityProbe.inspect(instance);
                List<Capability> missing = probe.missingRequired();
                if (!missing.isEmpty()) {
                    logger.debug("Rejecting {}: missing {}", qualified, missing);
                    rejected.add(qualified + ": missing " + missing);
                    continue;
                }
                for (Capability gap : probe.missingOptional()) {
                    logger.warn("{} does not offer {}; that feature will be unavailable",
                            qualified, gap.name().toLowerCase(Locale.ROOT));
                }
                logger.debug("Bound {} for {}", qualified, extensionId);
                return new DirectContentBackend(extensionId, instance, probe);
            }
        }
        throw new BackendUnavailableException("No usable entry point in " + extensionId
                + (rejected.isEmpty() ? " (no candidate class found)" : ": " + String.join("; ", rejected)));
    }

    private static Object instantiate(Class<?> type, String extensionId) throws ReflectiveOperationException {
        try {
            Constructor<?> noArgs = type.getConstructor();
            return noArgs.newInstance();
        } catch (NoSuchMethodException e) {
            Constructor<?> withId = type.getConstructor(String.class);
            return withId.newInstance(extensionId);
        }
    }

    @Override
    public String extensionId() {
        return extensionId;
    }

    @Override
    public BackendStrategy strategy() {
        return BackendStrategy.DIRECT;
    }

    public Class<?> boundType() {
        return target.getClass();
    }

    @Override
    public Object fetchHomeRails() {
        return raw(probe.invoke(Capability.HOME, Map.of()));
    }

    @Override
    public Object fetchRail(String railId, String cursor, int limit) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("railId", railId);
        args.put("cursor", cursor);
        args.put("limit", limit);
        return raw(probe.invoke(Capability.RAIL, args));
    }

    @Override
    public Object search(String query, String cursor, int limit) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("query", query);
        args.put("cursor", cursor);
        args.put("limit", limit);
        return raw(probe.invoke(Capability.SEARCH, args));
    }

    @Override
    public Object fetchPlayable(String id) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("id", id);
        return raw(probe.invoke(Capability.PLAYABLE, args));
    }

    @Override
    public Optional<String> region() {
        if (!probe.supports(Capability.REGION)) {
            return Optional.empty();
        }
        Object value = raw(probe.invoke(Capability.REGION, Map.of()));
        if (value == null) {
            return Optional.empty();
        }
        String region = value.toString().trim();
        return region.isEmpty() ? Optional.empty() : Optional.of(region);
    }

    @Override
    public Optional<Boolean> loggedIn() {
        return flag(Capability.LOGIN);
    }

    @Override
    public Optional<Boolean> drmReady() {
        return flag(Capability.DRM);
    }

    private Optional<Boolean> flag(Capability capability) {
        if (!probe.supports(capability)) {
            return Optional.empty();
        }
        Object value = raw(probe.invoke(capability, Map.of()));
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof String text && !text.isBlank()) {
            return Optional.of(Boolean.parseBoolean(text.trim()));
        }
        return Optional.empty();
    }

    /**
     * Reduce whatever the extension returned to maps, lists and scalars.
     */
    static Object raw(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Optional<?> optional) {
            return raw(optional.orElse(null));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            map.forEach((key, nested) -> converted.put(String.valueOf(key), raw(nested)));
            return converted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> converted = new ArrayList<>(collection.size());
            collection.forEach(nested -> converted.add(raw(nested)));
            return converted;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> converted = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                converted.add(raw(Array.get(value, i)));
            }
            return converted;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        try {
            return GSON.fromJson(GSON.toJsonTree(value), Object.class);
        } catch (JsonParseException e) {
            throw new BackendException("Cannot read a " + value.getClass().getName() + " result", e);
        }
    }
}
