package dev.directives.model;

/**
 * Syntactic form of a directive-bearing function; decides how a hoisted copy is re-emitted.
 */
public enum FunctionShape {
    DECLARATION,
    EXPRESSION,
    ARROW,
    OBJECT_PROPERTY,
    OBJECT_METHOD,
    STATIC_METHOD,
    INSTANCE_METHOD;

    public boolean isClassMethod() {
        return this == STATIC_METHOD || this == INSTANCE_METHOD;
    }
}
