package dev.directives.model;

import dev.directives.ast.Program;

import java.util.List;

/**
 * Outcome of one transform: the rewritten program, every diagnostic raised, and the ids found.
 */
public record TransformResult(Program program, List<Diagnostic> diagnostics, ModuleManifest manifest) {

    public TransformResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
