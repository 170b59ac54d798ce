package dev.directives.engine;

import dev.directives.ast.Expression;
import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Expression.MemberExpression;
import dev.directives.ast.Expression.StringLiteral;
import dev.directives.syntax.Lexer;

/**
 * How generated code reaches a function value: a module-level binding, a static member of a class,
 * or a method on a class prototype.
 */
public sealed interface FunctionRef {

    Expression toExpression();

    /** Text used in error messages, e.g. {@code JobRunner.execute}. */
    String displayName();

    record Binding(String name) implements FunctionRef {
        @Override
        public Expression toExpression() {
            return Identifier.of(name);
        }

        @Override
        public String displayName() {
            return name;
        }
    }

    record StaticMember(String className, String member) implements FunctionRef {
        @Override
        public Expression toExpression() {
            return memberOf(Identifier.of(className), member);
        }

        @Override
        public String displayName() {
            return className + "." + member;
        }
    }

    /** Printed as {@code Cls.prototype["method"]}. */
    record PrototypeMember(String className, String member) implements FunctionRef {
        @Override
        public Expression toExpression() {
            return MemberExpression.index(MemberExpression.dot(Identifier.of(className), "prototype"),
                StringLiteral.of(member));
        }

        @Override
        public String displayName() {
            return className + "#" + member;
        }
    }

    private static Expression memberOf(Expression object, String member) {
        return isIdentifierName(member)
            ? MemberExpression.dot(object, member)
            : MemberExpression.index(object, StringLiteral.of(member));
    }

    static boolean isIdentifierName(String name) {
        if (name.isEmpty() || !Lexer.isIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Lexer.isIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
