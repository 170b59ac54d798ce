package dev.directives.model;

import dev.directives.ast.Span;

import java.util.List;

/**
 * A function classified as a step.
 *
 * @param qualifiedName     {@code /}-joined name chain used in the identity and the metadata
 * @param closureVariables  sorted free variables that must be re-supplied once the function is relocated
 * @param enclosingWorkflow binding of the workflow this step is nested in, or null
 */
public record StepFunction(
    String qualifiedName,
    String id,
    List<String> closureVariables,
    Span span,
    FunctionShape shape,
    Placement placement,
    String enclosingWorkflow // nullable
) {

    public StepFunction {
        closureVariables = List.copyOf(closureVariables);
    }

    public boolean isNested() {
        return placement == Placement.NESTED;
    }

    public boolean hasClosure() {
        return !closureVariables.isEmpty();
    }
}
