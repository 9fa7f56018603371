package org.endlesssource.streambridge.platform;

import org.endlesssource.streambridge.spi.ExtensionInfo;
import org.endlesssource.streambridge.spi.ExtensionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Stream;

/**
 * Extension registry over an extensions directory.
 * <p>
 * Each sub-directory holding an {@code extension.properties} file is one
 * installed extension:
 * <pre>
 * id=plugin.video.amazonvod
 * category=video-source
 * enabled=true
 * </pre>
 * {@code id} defaults to the directory name, {@code enabled} to true.
 * The directory is rescanned on every call.
 */
public final class DirectoryExtensionRegistry implements ExtensionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryExtensionRegistry.class);

    public static final String DESCRIPTOR_FILE = "extension.properties";

    private final Path root;

    public DirectoryExtensionRegistry(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public boolean exists(String extensionId) {
        return details(extensionId).isPresent();
    }

    @Override
    public List<ExtensionInfo> enumerate(String category) {
        return scan().stream()
                .map(Installed::info)
                .filter(info -> info.category().equals(category))
                .toList();
    }

    @Override
    public Optional<ExtensionInfo> details(String extensionId) {
        return find(extensionId).map(Installed::info);
    }

    /**
     * The directory an extension is installed in.
     */
    public Optional<Path> installPath(String extensionId) {
        return find(extensionId).map(Installed::directory);
    }

    private Optional<Installed> find(String extensionId) {
        Objects.requireNonNull(extensionId, "extensionId must not be null");
        return scan().stream()
                .filter(installed -> installed.info().id().equals(extensionId))
                .findFirst();
    }

    private List<Installed> scan() {
        if (!Files.isDirectory(root)) {
            logger.debug("Extensions directory {} does not exist", root);
            return List.of();
        }
        List<Path> directories;
        try (Stream<Path> children = Files.list(root)) {
            directories = children
                    .filter(Files::isDirectory)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            logger.warn("Failed to list extensions in {}: {}", root, e.getMessage());
            return List.of();
        }

        List<Installed> installed = new ArrayList<>();
        for (Path directory : directories) {
            Path descriptor = directory.resolve(DESCRIPTOR_FILE);
            if (!Files.isRegularFile(descriptor)) {
                continue;
            }
            Properties properties = new Properties();
            try (Reader reader = Files.newBufferedReader(descriptor, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Skipping extension with unreadable descriptor {}: {}", descriptor, e.getMessage());
                continue;
            }
            String id = properties.getProperty("id", directory.getFileName().toString()).trim();
            String category = properties.getProperty("category", "").trim();
            boolean enabled = Boolean.parseBoolean(properties.getProperty("enabled", "true").trim());
            installed.add(new Installed(new ExtensionInfo(id, category, enabled), directory));
        }
        return installed;
    }

    private record Installed(ExtensionInfo info, Path directory) {
    }
}
