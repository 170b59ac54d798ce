package dev.directives.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed source file. The body is mutated in place by the transform passes.
 */
public final class Program implements Node {

    public enum SourceType { SCRIPT, MODULE }

    private final List<Statement> body;
    private SourceType sourceType;
    private final Span span;

    public Program(List<Statement> body, SourceType sourceType, Span span) {
        this.body = new ArrayList<>(body);
        this.sourceType = sourceType;
        this.span = span;
    }

    public static Program module(List<Statement> body) {
        return new Program(body, SourceType.MODULE, Span.SYNTHETIC);
    }

    public List<Statement> body() {
        return List.copyOf(body);
    }

    public void replaceBody(List<Statement> statements) {
        body.clear();
        body.addAll(statements);
    }

    public SourceType sourceType() { return sourceType; }

    public boolean isModule() { return sourceType == SourceType.MODULE; }

    /** Generated import statements are only legal in module code. */
    public void upgradeToModule() {
        this.sourceType = SourceType.MODULE;
    }

    @Override
    public Span span() { return span; }
}
