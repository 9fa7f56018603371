package org.endlesssource.streambridge.cache;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ResponseCache} keeping one JSON document per key in a directory.
 * <p>
 * File names are the SHA-1 of the key, so a damaged document only ever costs
 * its own entry. All file I/O is serialized on a single lock.
 */
public final class FileResponseCache implements ResponseCache {
    private static final Logger logger = LoggerFactory.getLogger(FileResponseCache.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Clock clock;
    private final Gson gson;
    private final Object lock = new Object();

    public FileResponseCache(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileResponseCache(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.gson = new GsonBuilder()
                .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
                .create();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create cache directory " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public <T> Optional<T> get(String key, Duration ttl, Type type) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        synchronized (lock) {
            Path file = fileFor(key);
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            CacheEntry entry = read(file);
            if (entry == null || entry.value() == null || !key.equals(entry.key())) {
                logger.debug("Evicting unreadable cache entry {}", key);
                delete(file);
                return Optional.empty();
            }
            if (entry.isExpired(clock.millis(), ttl.toMillis())) {
                logger.debug("Evicting expired cache entry {}", key);
                delete(file);
                return Optional.empty();
            }
            try {
                T value = gson.fromJson(entry.value(), type);
                if (value == null) {
                    delete(file);
                    return Optional.empty();
                }
                return Optional.of(value);
            } catch (JsonParseException | IllegalArgumentException | NullPointerException e) {
                logger.debug("Evicting cache entry {} that no longer matches {}: {}", key, type, e.getMessage());
                delete(file);
                return Optional.empty();
            }
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        CacheEntry entry = new CacheEntry(key, gson.toJsonTree(value), clock.millis(), ttl.toSeconds());
        String json = gson.toJson(entry);
        synchronized (lock) {
            Path file = fileFor(key);
            Path temp = null;
            try {
                temp = Files.createTempFile(directory, "entry", ".tmp");
                Files.writeString(temp, json, StandardCharsets.UTF_8);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                logger.warn("Failed to write cache entry {}: {}", key, e.getMessage());
                if (temp != null) {
                    delete(temp);
                }
            }
        }
    }

    @Override
    public void evict(String key) {
        synchronized (lock) {
            delete(fileFor(key));
        }
    }

    @Override
    public int clearPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        int evicted = 0;
        synchronized (lock) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
                for (Path file : files) {
                    CacheEntry entry = read(file);
                    if (entry == null || entry.key() == null || !entry.key().startsWith(prefix)) {
                        continue;
                    }
                    delete(file);
                    evicted++;
                }
            } catch (IOException e) {
                logger.warn("Failed to scan cache directory {}: {}", directory, e.getMessage());
            }
        }
        logger.debug("Cleared {} cache entries with prefix '{}'", evicted, prefix);
        return evicted;
    }

    @Override
    public void clearAll() {
        synchronized (lock) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
                for (Path file : files) {
                    delete(file);
                }
            } catch (IOException e) {
                logger.warn("Failed to clear cache directory {}: {}", directory, e.getMessage());
            }
        }
    }

    Path fileFor(String key) {
        return directory.resolve(sha1(key) + SUFFIX);
    }

    private CacheEntry read(Path file) {
        try {
            return gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), CacheEntry.class);
        } catch (IOException | JsonParseException e) {
            logger.debug("Unreadable cache document {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete cache document {}: {}", file, e.getMessage());
        }
    }

    private static String sha1(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }
}
