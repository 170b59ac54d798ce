package dev.directives.engine;

import dev.directives.model.CompilationMode;
import dev.directives.model.IdentityKind;
import dev.directives.model.TransformConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityGeneratorTest {

    @Test
    void derivesModulePathFromFilename() {
        assertThat(IdentityGenerator.modulePath(null, "src/jobs.ts")).isEqualTo("./src/jobs");
        assertThat(IdentityGenerator.modulePath(null, "./src/jobs.mjs")).isEqualTo("./src/jobs");
        assertThat(IdentityGenerator.modulePath(null, "src\\win\\task.js")).isEqualTo("./src/win/task");
    }

    @Test
    void stripsLongestExtensionFirst() {
        assertThat(IdentityGenerator.stripExtension("types/api.d.ts")).isEqualTo("types/api");
        assertThat(IdentityGenerator.stripExtension("view.tsx")).isEqualTo("view");
        assertThat(IdentityGenerator.stripExtension("README")).isEqualTo("README");
    }

    @Test
    void prefersModuleSpecifier() {
        var config = new TransformConfig(CompilationMode.STEP, "node_modules/lib/index.js", "lib@1.2.0");

        var generator = IdentityGenerator.forModule(config);

        assertThat(generator.step("fetchUser")).isEqualTo("step//lib@1.2.0//fetchUser");
    }

    @Test
    void buildsIdentityPerKind() {
        var generator = IdentityGenerator.forModulePath("./src/jobs");

        assertThat(generator.step("run/scale")).isEqualTo("step//./src/jobs//run/scale");
        assertThat(generator.workflow("run")).isEqualTo("workflow//./src/jobs//run");
        assertThat(generator.classId("Point")).isEqualTo("class//./src/jobs//Point");
    }

    @Test
    void builtinsIgnoreModulePath() {
        assertThat(IdentityGenerator.identity(IdentityKind.STEP, "./src/jobs", "__builtin_response_json"))
            .isEqualTo("step//builtin//__builtin_response_json");
    }
}
