package dev.directives.engine;

import dev.directives.model.CompilationMode;
import dev.directives.model.ModuleManifest;
import dev.directives.model.TransformConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestExtractorTest {

    @Test
    void readsManifestFromTransformedCode() throws Exception {
        String code = WorkflowTransformer.transformSource("""
            export async function add(a, b) {
                "use step";
                return a + b;
            }
            """, TransformConfig.of(CompilationMode.WORKFLOW, "src/math.js")).code();

        ModuleManifest manifest = ManifestExtractor.extract(code).orElseThrow();

        assertThat(manifest.steps()).containsOnlyKeys("src/math.js");
        assertThat(manifest.steps().get("src/math.js")).containsEntry("add", "step//./src/math//add");
    }

    @Test
    void emptyWhenNoComment() throws Exception {
        assertThat(ManifestExtractor.extract("const a = 1;")).isEmpty();
    }

    @Test
    void rejectsUnterminatedComment() {
        assertThatThrownBy(() -> ManifestExtractor.extract("/**__internal_workflows{\"steps\":{}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unterminated");
    }

    @Test
    void rejectsEntriesWithoutId() {
        assertThatThrownBy(() -> ManifestExtractor.extract(
            "/**__internal_workflows{\"workflows\":{\"a.js\":{\"run\":{}}}}*/"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("has no workflowId");
    }
}
