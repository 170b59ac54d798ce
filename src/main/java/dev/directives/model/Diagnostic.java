package dev.directives.model;

import dev.directives.ast.Span;

/**
 * A problem found in the input program. Never fatal: the offending function or export is skipped
 * and the transform carries on.
 */
public record Diagnostic(DiagnosticKind kind, String message, Span span) {

    public static Diagnostic of(DiagnosticKind kind, Span span, Object... args) {
        return new Diagnostic(kind, kind.format(args), span);
    }

    /** One-line rendering, e.g. {@code input.js:3:5 error[WF001]: Functions marked with ...}. */
    public String render(String filename) {
        return "%s:%s error[%s]: %s".formatted(filename, span, kind.code(), message);
    }
}
