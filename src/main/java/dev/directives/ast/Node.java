package dev.directives.ast;

/**
 * Any element of a program tree.
 */
public interface Node {
    Span span();
}
