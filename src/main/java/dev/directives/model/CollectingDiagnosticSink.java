package dev.directives.model;

import java.util.ArrayList;
import java.util.List;

public final class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public boolean has(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }
}
