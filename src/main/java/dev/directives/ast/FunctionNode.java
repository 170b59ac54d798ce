package dev.directives.ast;

import java.util.List;

/**
 * Common view over everything that has parameters and a body: {@link Function} (declarations,
 * expressions and methods) and arrow functions. Classification facts are keyed on the identity
 * of these nodes.
 */
public sealed interface FunctionNode extends Node permits Function, Expression.ArrowFunctionExpression {

    List<Pattern> params();

    boolean async();

    /** The block body, or {@code null} for an arrow with an expression body. */
    Statement.BlockStatement blockBody();
}
