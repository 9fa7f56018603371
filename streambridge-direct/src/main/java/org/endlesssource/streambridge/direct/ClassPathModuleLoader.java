package org.endlesssource.streambridge.direct;

import org.endlesssource.streambridge.spi.LoadedModule;
import org.endlesssource.streambridge.spi.ModuleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Loads extension code from its install directory.
 * <p>
 * A search path contributes itself as a class directory plus every jar found
 * directly in it or in its {@code lib} sub-directory. A module is a Java
 * package; it is importable when some search path or the parent class
 * loader holds that package's directory.
 */
public final class ClassPathModuleLoader implements ModuleLoader, Closeable {
    private static final Logger logger = LoggerFactory.getLogger(ClassPathModuleLoader.class);

    private final Function<String, Optional<Path>> installPaths;
    private final ClassLoader parent;
    private final Set<URL> urls = new LinkedHashSet<>();
    private final List<URLClassLoader> opened = new ArrayList<>();
    private URLClassLoader classLoader;

    /**
     * @param installPaths resolves an extension id to its install directory
     */
    public ClassPathModuleLoader(Function<String, Optional<Path>> installPaths) {
        this(installPaths, ClassPathModuleLoader.class.getClassLoader());
    }

    public ClassPathModuleLoader(Function<String, Optional<Path>> installPaths, ClassLoader parent) {
        this.installPaths = Objects.requireNonNull(installPaths, "installPaths must not be null");
        this.parent = parent;
    }

    @Override
    public Optional<Path> installPath(String extensionId) {
        return installPaths.apply(extensionId).filter(Files::isDirectory);
    }

    @Override
    public synchronized void addSearchPath(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        List<URL> added = new ArrayList<>();
        added.add(toUrl(path));
        added.addAll(jarsIn(path));
        added.addAll(jarsIn(path.resolve("lib")));
        if (urls.addAll(added)) {
            logger.debug("Module search path is now {}", urls);
            classLoader = null;
        }
    }

    @Override
    public synchronized Optional<LoadedModule> importModule(String moduleName) {
        Objects.requireNonNull(moduleName, "moduleName must not be null");
        ClassLoader loader = loader();
        String directory = moduleName.replace('.', '/') + "/";
        if (loader.getResource(directory) == null) {
            return Optional.empty();
        }
        return Optional.of(new PackageModule(moduleName, loader));
    }

    @Override
    public synchronized void close() throws IOException {
        IOException failure = null;
        for (URLClassLoader loader : opened) {
            try {
                loader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        opened.clear();
        classLoader = null;
        if (failure != null) {
            throw failure;
        }
    }

    private ClassLoader loader() {
        if (classLoader == null) {
            classLoader = new URLClassLoader(urls.toArray(new URL[0]), parent);
            opened.add(classLoader);
        }
        return classLoader;
    }

    private static List<URL> jarsIn(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(file -> file.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .map(ClassPathModuleLoader::toUrl)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }

    private static URL toUrl(Path path) {
        try {
            return path.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid search path: " + path, e);
        }
    }

    private record PackageModule(String name, ClassLoader loader) implements LoadedModule {
        @Override
        public Optional<Class<?>> findClass(String simpleName) {
            try {
                return Optional.of(Class.forName(name + "." + simpleName, true, loader));
            } catch (ClassNotFoundException e) {
                return Optional.empty();
            }
        }
    }
}
