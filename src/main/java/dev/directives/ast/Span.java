package dev.directives.ast;

/**
 * Source location of a node: character offsets plus the 1-based line and column of its start.
 */
public record Span(int start, int end, int line, int column) {

    /** Span carried by nodes the transformer generates. */
    public static final Span SYNTHETIC = new Span(-1, -1, 0, 0);

    public boolean isSynthetic() {
        return start < 0;
    }

    public Span to(Span other) {
        if (isSynthetic()) return other;
        if (other.isSynthetic()) return this;
        return new Span(start, other.end, line, column);
    }

    @Override
    public String toString() {
        return isSynthetic() ? "<generated>" : line + ":" + column;
    }
}
