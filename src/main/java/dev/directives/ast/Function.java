package dev.directives.ast;

import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Statement.BlockStatement;

import java.util.List;

/**
 * A non-arrow function. Shared by function declarations, function expressions, object-literal
 * methods and class methods.
 */
public record Function(
    Identifier id, // nullable for anonymous functions
    List<Pattern> params,
    BlockStatement body,
    boolean async,
    boolean generator,
    Span span
) implements FunctionNode {

    public Function {
        params = List.copyOf(params);
    }

    @Override
    public BlockStatement blockBody() {
        return body;
    }

    public Function withBody(BlockStatement newBody) {
        return new Function(id, params, newBody, async, generator, span);
    }

    public Function withId(Identifier newId) {
        return new Function(newId, params, body, async, generator, span);
    }

    public Function withParams(List<Pattern> newParams) {
        return new Function(id, newParams, body, async, generator, span);
    }
}
