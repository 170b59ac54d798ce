package dev.directives.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilationModeTest {

    @Test
    void parsesCaseInsensitively() {
        assertThat(CompilationMode.parse(" Workflow ")).isEqualTo(CompilationMode.WORKFLOW);
        assertThat(CompilationMode.parse("client")).isEqualTo(CompilationMode.CLIENT);
    }

    @Test
    void rejectsUnknownValues() {
        assertThatThrownBy(() -> CompilationMode.parse("server"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expected one of step, workflow, client");
        assertThatThrownBy(() -> CompilationMode.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void onlyStepModeSkipsDeadCodeElimination() {
        assertThat(CompilationMode.STEP.eliminatesDeadCode()).isFalse();
        assertThat(CompilationMode.WORKFLOW.eliminatesDeadCode()).isTrue();
        assertThat(CompilationMode.CLIENT.eliminatesDeadCode()).isTrue();
    }
}
