package dev.directives.engine;

import dev.directives.ast.Program;
import dev.directives.ast.Statement;
import dev.directives.model.ModuleManifest;
import dev.directives.syntax.Parser;
import dev.directives.syntax.SourcePrinter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataEmitterTest {

    private static final ModuleManifest MANIFEST = ModuleManifest.builder()
        .workflow("src/a.js", "run", "workflow//./src/a//run")
        .step("src/a.js", "run/scale", "step//./src/a//run/scale")
        .build();

    @Test
    void rendersOnlyNonEmptySections() {
        assertThat(MetadataEmitter.render(MANIFEST)).isEqualTo(
            "{\"workflows\":{\"src/a.js\":{\"run\":{\"workflowId\":\"workflow//./src/a//run\"}}},"
                + "\"steps\":{\"src/a.js\":{\"run/scale\":{\"stepId\":\"step//./src/a//run/scale\"}}}}");
    }

    @Test
    void escapesCommentTerminator() {
        var manifest = ModuleManifest.builder().step("src/a.js", "odd*/name", "step//./src/a//odd*/name").build();

        assertThat(MetadataEmitter.render(manifest)).doesNotContain("*/").contains("odd*\\/name");
    }

    @Test
    void insertsCommentAfterLeadingImports() {
        List<Statement> body = Parser.parse("""
            import { a } from "a";
            const b = a;
            """).body();

        String code = SourcePrinter.print(Program.module(MetadataEmitter.insert(body, MANIFEST)));

        assertThat(code.lines().toList()).hasSize(3);
        assertThat(code.lines().toList().get(1)).startsWith("/**__internal_workflows{").endsWith("}*/;");
    }

    @Test
    void leavesBodyAloneWhenManifestIsEmpty() {
        List<Statement> body = Parser.parse("const b = 1;").body();

        assertThat(MetadataEmitter.insert(body, ModuleManifest.empty())).isSameAs(body);
    }

    @Test
    void manifestSurvivesEmbeddingAndExtraction() throws Exception {
        var manifest = ModuleManifest.builder()
            .step("src/a.js", "odd*/name", "step//./src/a//odd*/name")
            .classEntry("src/a.js", "Point", "class//./src/a//Point")
            .build();
        String code = SourcePrinter.print(Program.module(MetadataEmitter.insert(List.of(), manifest)));

        assertThat(ManifestExtractor.extract(code)).contains(manifest);
    }
}
