package dev.directives.engine;

import dev.directives.model.CompilationMode;
import dev.directives.model.TransformConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformConfigLoaderTest {

    @Test
    void loadsAllFields() throws Exception {
        TransformConfig config = TransformConfigLoader.loadFromString("""
            {"mode": "Workflow", "filename": "src\\\\jobs.ts", "moduleSpecifier": "jobs@1.2.0"}
            """);

        assertThat(config.mode()).isEqualTo(CompilationMode.WORKFLOW);
        assertThat(config.normalizedFilename()).isEqualTo("src/jobs.ts");
        assertThat(config.moduleSpecifier()).isEqualTo("jobs@1.2.0");
    }

    @Test
    void moduleSpecifierIsOptional() throws Exception {
        TransformConfig config = TransformConfigLoader.loadFromString("""
            {"mode": "client", "filename": "app.js"}
            """);

        assertThat(config.moduleSpecifier()).isNull();
    }

    @Test
    void requiresModeAndFilename() {
        assertThatThrownBy(() -> TransformConfigLoader.loadFromString("{\"filename\": \"a.js\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'mode'");
        assertThatThrownBy(() -> TransformConfigLoader.loadFromString("{\"mode\": \"step\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'filename'");
    }

    @Test
    void rejectsUnknownMode() {
        assertThatThrownBy(() -> TransformConfigLoader.loadFromString("{\"mode\": \"server\", \"filename\": \"a.js\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown compilation mode 'server'");
    }

    @Test
    void rejectsNonObjectJson() {
        assertThatThrownBy(() -> TransformConfigLoader.loadFromString("[]"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("transform.json");
        Files.writeString(file, "{\"mode\": \"step\", \"filename\": \"src/a.js\"}");

        TransformConfig config = TransformConfigLoader.loadFromFile(file);

        assertThat(config).isEqualTo(TransformConfig.of(CompilationMode.STEP, "src/a.js"));
    }
}
