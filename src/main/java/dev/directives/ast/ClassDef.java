package dev.directives.ast;

import dev.directives.ast.Expression.Identifier;

import java.util.List;

/**
 * Body of a class declaration or class expression.
 */
public record ClassDef(
    Identifier id, // nullable for anonymous classes
    Expression superClass, // nullable
    List<ClassMember> body,
    Span span
) implements Node {

    public ClassDef {
        body = List.copyOf(body);
    }

    public ClassDef withBody(List<ClassMember> members) {
        return new ClassDef(id, superClass, members, span);
    }
}
