package dev.directives.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ModuleSpecifierResolverTest {

    @TempDir
    Path root;

    private ModuleSpecifierResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        writePackage(root, "{\"name\": \"app\", \"version\": \"1.0.0\"}");
        resolver = new ModuleSpecifierResolver(root);
    }

    private static void writePackage(Path directory, String json) throws IOException {
        Files.createDirectories(directory);
        Files.writeString(directory.resolve("package.json"), json);
    }

    @Test
    void applicationFilesHaveNoSpecifier() {
        assertThat(resolver.resolve(root.resolve("src/jobs.js"))).isEmpty();
    }

    @Test
    void workspacePackagesUseTheirOwnManifest() throws IOException {
        writePackage(root.resolve("packages/shared"), "{\"name\": \"@acme/shared\", \"version\": \"2.0.0\"}");

        assertThat(resolver.resolve(root.resolve("packages/shared/src/steps.js"))).contains("@acme/shared@2.0.0");
    }

    @Test
    void dependenciesResolveUnderNodeModules() throws IOException {
        writePackage(root.resolve("node_modules/lib"), "{\"name\": \"lib\", \"version\": \"0.1.0\"}");

        assertThat(resolver.resolve(root.resolve("node_modules/lib/dist/index.js"))).contains("lib@0.1.0");
    }

    @Test
    void manifestsWithoutVersionAreSkipped() throws IOException {
        writePackage(root.resolve("packages/draft"), "{\"name\": \"draft\"}");

        assertThat(resolver.resolve(root.resolve("packages/draft/index.js"))).isEmpty();
    }

    @Test
    void unreadableManifestsAreSkipped() throws IOException {
        writePackage(root.resolve("packages/broken"), "{ not json");

        assertThat(resolver.resolve(root.resolve("packages/broken/index.js"))).isEmpty();
    }

    @Test
    void cacheCanBeCleared() throws IOException {
        assertThat(resolver.resolve(root.resolve("packages/late/index.js"))).isEmpty();
        writePackage(root.resolve("packages/late"), "{\"name\": \"late\", \"version\": \"3.0.0\"}");

        resolver.clearCache();

        assertThat(resolver.resolve(root.resolve("packages/late/index.js"))).contains("late@3.0.0");
    }

    @Test
    void detectsNodeModulesSegments() {
        assertThat(ModuleSpecifierResolver.isInNodeModules(Path.of("/x/node_modules/y/z.js"))).isTrue();
        assertThat(ModuleSpecifierResolver.isInNodeModules(Path.of("/x/my_node_modules/z.js"))).isFalse();
    }
}
