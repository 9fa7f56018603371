package org.endlesssource.streambridge.direct;

import org.endlesssource.streambridge.spi.LoadedModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class ClassPathModuleLoaderTest {

    @TempDir
    Path extensions;

    @Test
    void installPath_onlyForExistingDirectories() throws IOException {
        Path installed = Files.createDirectories(extensions.resolve("plugin.video.amazonvod"));
        try (ClassPathModuleLoader loader = new ClassPathModuleLoader(id -> Optional.of(extensions.resolve(id)))) {
            assertEquals(Optional.of(installed), loader.installPath("plugin.video.amazonvod"));
            assertEquals(Optional.empty(), loader.installPath("plugin.video.other"));
        }
    }

    @Test
    void importModule_findsPackagesInClassDirectoryOfSearchPath() throws IOException {
        Path installed = extensions.resolve("plugin.video.amazonvod");
        Files.createDirectories(installed.resolve("resources/lib/backend"));

        try (ClassPathModuleLoader loader = new ClassPathModuleLoader(id -> Optional.of(installed))) {
            assertTrue(loader.importModule("resources.lib.backend").isEmpty());

            loader.addSearchPath(installed);

            Optional<LoadedModule> module = loader.importModule("resources.lib.backend");
            assertTrue(module.isPresent());
            assertEquals("resources.lib.backend", module.get().name());
            assertTrue(module.get().findClass("PrimeVideo").isEmpty());
            assertTrue(loader.importModule("resources.lib.absent").isEmpty());
        }
    }

    @Test
    void importModule_findsPackagesInJarsUnderLib() throws IOException {
        Path installed = extensions.resolve("plugin.video.amazonvod");
        Path lib = Files.createDirectories(installed.resolve("lib"));
        try (OutputStream out = Files.newOutputStream(lib.resolve("backend.jar"));
             JarOutputStream jar = new JarOutputStream(out)) {
            jar.putNextEntry(new JarEntry("com/example/vod/"));
            jar.closeEntry();
        }

        try (ClassPathModuleLoader loader = new ClassPathModuleLoader(id -> Optional.of(installed))) {
            loader.addSearchPath(installed);

            assertTrue(loader.importModule("com.example.vod").isPresent());
        }
    }

    @Test
    void importModule_resolvesClassesVisibleToParentLoader() throws IOException {
        try (ClassPathModuleLoader loader = new ClassPathModuleLoader(id -> Optional.empty())) {
            loader.addSearchPath(extensions);

            Optional<LoadedModule> module = loader.importModule("org.endlesssource.streambridge.direct.fixture");

            assertTrue(module.isPresent());
            assertTrue(module.get().findClass("FullCatalog").isPresent());
        }
    }
}
