package dev.directives.model;

/**
 * Where a directive-bearing function sits relative to the module. Together with the function kind and
 * the compilation mode this selects the rewrite strategy.
 */
public enum Placement {
    /** Declared at module level, directly or as the initializer of a module-level binding. */
    TOP_LEVEL,
    /** Inside another function, or inside an object literal. */
    NESTED,
    STATIC_METHOD,
    INSTANCE_METHOD
}
