package org.endlesssource.streambridge.rpc;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.endlesssource.streambridge.api.BackendException;
import org.endlesssource.streambridge.spi.DirectoryEntry;
import org.endlesssource.streambridge.spi.RpcExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs extension actions as a child process.
 * <p>
 * Each extension ships an executable at {@code bin/extension-action} that takes
 * {@code key=value} arguments and prints its result on stdout. Directory
 * listings are requested with {@code action=browse uri=<plugin url>} and must
 * print a JSON array of entries.
 */
public final class ProcessRpcExecutor implements RpcExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ProcessRpcExecutor.class);
    private static final Gson GSON = new Gson();
    private static final Type ENTRIES_TYPE = new TypeToken<List<DirectoryEntry>>() { }.getType();

    public static final String EXECUTABLE = "bin/extension-action";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final Function<String, Optional<Path>> installPaths;
    private final Duration timeout;

    public ProcessRpcExecutor(Function<String, Optional<Path>> installPaths) {
        this(installPaths, DEFAULT_TIMEOUT);
    }

    public ProcessRpcExecutor(Function<String, Optional<Path>> installPaths, Duration timeout) {
        this.installPaths = Objects.requireNonNull(installPaths, "installPaths must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    @Override
    public Object executeExtensionAction(String extensionId, Map<String, String> params) {
        return run(extensionId, params);
    }

    @Override
    public List<DirectoryEntry> listDirectory(String uri) {
        String extensionId = PluginUri.extensionId(uri);
        if (extensionId == null || extensionId.isEmpty()) {
            throw new BackendException("Not a plugin URL: " + uri);
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", "browse");
        params.put("uri", uri);
        String out = run(extensionId, params);
        if (out.isEmpty()) {
            return List.of();
        }
        try {
            List<DirectoryEntry> entries = GSON.fromJson(out, ENTRIES_TYPE);
            return entries == null ? List.of() : List.copyOf(entries);
        } catch (JsonParseException e) {
            throw new BackendException("Unreadable directory listing for " + uri, e);
        }
    }

    private String run(String extensionId, Map<String, String> params) {
        Path executable = installPaths.apply(extensionId)
                .map(path -> path.resolve(EXECUTABLE))
                .orElseThrow(() -> new BackendException("Extension " + extensionId + " is not installed"));
        if (!Files.isExecutable(executable)) {
            throw new BackendException("Extension " + extensionId + " has no executable " + EXECUTABLE);
        }

        ProcessBuilder pb = new ProcessBuilder();
        pb.command().add(executable.toAbsolutePath().toString());
        params.forEach((key, value) -> pb.command().add(key + "=" + value));
        pb.directory(executable.getParent().getParent().toFile());

        Path stdoutFile = null;
        Path stderrFile = null;
        Process p = null;
        try {
            stdoutFile = Files.createTempFile("streambridge_rpc_out", ".txt");
            stderrFile = Files.createTempFile("streambridge_rpc_err", ".txt");
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());

            p = pb.start();
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                throw new BackendException("Extension action timed out after " + timeout.toMillis() + " ms: "
                        + params.get("action"));
            }
            String out = Files.readString(stdoutFile, StandardCharsets.UTF_8).trim();
            String err = Files.readString(stderrFile, StandardCharsets.UTF_8).trim();
            int exitCode = p.exitValue();
            if (!err.isBlank()) {
                logger.debug("Extension action stderr ({}): {}", exitCode, err);
            }
            if (exitCode != 0) {
                throw new BackendException("Extension action " + params.get("action") + " failed with exit "
                        + exitCode + (err.isBlank() ? "" : ": " + err));
            }
            return out;
        } catch (IOException e) {
            throw new BackendException("Failed to run extension action " + params.get("action"), e);
        } catch (InterruptedException e) {
            if (p != null) {
                p.destroyForcibly();
            }
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while running extension action " + params.get("action"), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("Failed to delete {}: {}", file, e.getMessage());
        }
    }
}
