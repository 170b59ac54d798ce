package dev.directives.model;

import dev.directives.ast.Span;

/**
 * A function classified as a workflow.
 *
 * @param exportKey     name the module exports it under ({@code "default"} for default exports); the
 *                      binding name when it is not exported
 * @param binding       identifier generated code uses to reach the function value, e.g.
 *                      {@code JobRunner.execute} for static methods or a synthesized name for anonymous
 *                      default exports
 * @param qualifiedName name used inside the identity string
 */
public record WorkflowFunction(
    String exportKey,
    String binding,
    String qualifiedName,
    String id,
    Span span,
    FunctionShape shape,
    Placement placement
) {}
