package dev.directives.engine;

import dev.directives.model.IdentityKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityParserTest {

    @Test
    void splitsNestedStepIdentity() {
        var parsed = IdentityParser.parse("step//./src/jobs//run/scale");

        assertThat(parsed.kind()).isEqualTo(IdentityKind.STEP);
        assertThat(parsed.modulePath()).isEqualTo("./src/jobs");
        assertThat(parsed.qualifiedName()).isEqualTo("run/scale");
        assertThat(parsed.shortName()).isEqualTo("scale");
    }

    @Test
    void defaultExportsTakeModuleName() {
        assertThat(IdentityParser.parse("workflow//./src/jobs//default").shortName()).isEqualTo("jobs");
        assertThat(IdentityParser.parse("workflow//@acme/shared@1.2.0//default").shortName()).isEqualTo("shared");
        assertThat(IdentityParser.parse("workflow//lib@0.1.0//__default").shortName()).isEqualTo("lib");
    }

    @Test
    void rejectsMalformedIdentities() {
        assertThatThrownBy(() -> IdentityParser.parse("nope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Malformed identity");
        assertThatThrownBy(() -> IdentityParser.parse("fn//./a//b"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown identity kind");
    }

    @Test
    void parsesWhatGeneratorBuilds() {
        String id = IdentityGenerator.forModulePath("./src/billing").classId("Invoice");

        var parsed = IdentityParser.parse(id);

        assertThat(parsed.kind()).isEqualTo(IdentityKind.CLASS);
        assertThat(parsed.qualifiedName()).isEqualTo("Invoice");
    }
}
