package dev.directives.engine;

import dev.directives.model.CompilationMode;
import dev.directives.model.FunctionKind;
import dev.directives.model.Placement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StrategyTableTest {

    @Test
    void stepModeKeepsStepBodies() {
        assertThat(StrategyTable.select(FunctionKind.STEP, Placement.TOP_LEVEL, CompilationMode.STEP))
            .isEqualTo(Strategy.REGISTER_IN_PLACE);
        assertThat(StrategyTable.select(FunctionKind.STEP, Placement.NESTED, CompilationMode.STEP))
            .isEqualTo(Strategy.HOIST_AND_REFERENCE);
        assertThat(StrategyTable.select(FunctionKind.STEP, Placement.INSTANCE_METHOD, CompilationMode.STEP))
            .isEqualTo(Strategy.REGISTER_IN_PLACE);
        assertThat(StrategyTable.select(FunctionKind.WORKFLOW, Placement.TOP_LEVEL, CompilationMode.STEP))
            .isEqualTo(Strategy.THROW_STUB);
    }

    @Test
    void workflowModeProxiesSteps() {
        for (Placement placement : Placement.values()) {
            assertThat(StrategyTable.select(FunctionKind.STEP, placement, CompilationMode.WORKFLOW))
                .isEqualTo(Strategy.PROXY);
        }
        assertThat(StrategyTable.select(FunctionKind.WORKFLOW, Placement.STATIC_METHOD, CompilationMode.WORKFLOW))
            .isEqualTo(Strategy.REGISTER_WORKFLOW);
    }

    @Test
    void clientModeStripsAndStubs() {
        assertThat(StrategyTable.select(FunctionKind.STEP, Placement.NESTED, CompilationMode.CLIENT))
            .isEqualTo(Strategy.STRIP_DIRECTIVE);
        assertThat(StrategyTable.select(FunctionKind.WORKFLOW, Placement.TOP_LEVEL, CompilationMode.CLIENT))
            .isEqualTo(Strategy.THROW_STUB);
    }

    @Test
    void rejectsWorkflowsThatCannotExist() {
        assertThatThrownBy(() -> StrategyTable.select(FunctionKind.WORKFLOW, Placement.NESTED, CompilationMode.STEP))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(
            () -> StrategyTable.select(FunctionKind.WORKFLOW, Placement.INSTANCE_METHOD, CompilationMode.WORKFLOW))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
