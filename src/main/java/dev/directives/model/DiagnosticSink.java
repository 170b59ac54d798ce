package dev.directives.model;

/**
 * Receives diagnostics as the transform finds them.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);
}
