package dev.directives.ast;

import java.util.List;

/**
 * Members of a class body.
 */
public sealed interface ClassMember extends Node {

    enum MethodKind { CONSTRUCTOR, METHOD, GET, SET }

    record MethodDefinition(Expression key, boolean computed, Function value, MethodKind kind, boolean isStatic,
                            Span span) implements ClassMember {

        public MethodDefinition withValue(Function function) {
            return new MethodDefinition(key, computed, function, kind, isStatic, span);
        }
    }

    record PropertyDefinition(Expression key, boolean computed, Expression value, boolean isStatic, Span span)
        implements ClassMember {}

    record StaticBlock(List<Statement> body, Span span) implements ClassMember {
        public StaticBlock {
            body = List.copyOf(body);
        }
    }
}
