package dev.directives.engine;

import dev.directives.model.CompilationMode;
import dev.directives.model.FunctionKind;
import dev.directives.model.Placement;

import java.util.Locale;

/**
 * Selects the rewrite for a function from its kind, its placement and the compilation mode.
 */
public final class StrategyTable {

    private StrategyTable() {}

    public static Strategy select(FunctionKind kind, Placement placement, CompilationMode mode) {
        if (kind == FunctionKind.STEP) {
            return switch (mode) {
                case STEP -> placement == Placement.NESTED ? Strategy.HOIST_AND_REFERENCE : Strategy.REGISTER_IN_PLACE;
                case WORKFLOW -> Strategy.PROXY;
                case CLIENT -> Strategy.STRIP_DIRECTIVE;
            };
        }
        if (placement == Placement.NESTED || placement == Placement.INSTANCE_METHOD) {
            throw new IllegalArgumentException("Workflows cannot be " + placement.name().toLowerCase(Locale.ROOT).replace('_', ' '));
        }
        return mode == CompilationMode.WORKFLOW ? Strategy.REGISTER_WORKFLOW : Strategy.THROW_STUB;
    }
}
