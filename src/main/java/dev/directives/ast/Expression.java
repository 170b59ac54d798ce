package dev.directives.ast;

import dev.directives.ast.Statement.BlockStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expressions. {@link Identifier} and {@link MemberExpression} double as assignment targets.
 */
public sealed interface Expression extends Node {

    record Identifier(String name, Span span) implements Expression, Pattern {
        public static Identifier of(String name) {
            return new Identifier(name, Span.SYNTHETIC);
        }
    }

    record StringLiteral(String value, Span span) implements Expression {
        public static StringLiteral of(String value) {
            return new StringLiteral(value, Span.SYNTHETIC);
        }
    }

    /** Numeric and bigint literals keep their source text. */
    record NumberLiteral(String raw, Span span) implements Expression {}

    record BooleanLiteral(boolean value, Span span) implements Expression {}

    record NullLiteral(Span span) implements Expression {}

    record RegExpLiteral(String pattern, String flags, Span span) implements Expression {}

    /** {@code quasis} holds the raw text chunks; there is always one more quasi than expression. */
    record TemplateLiteral(List<String> quasis, List<Expression> expressions, Span span) implements Expression {
        public TemplateLiteral {
            quasis = List.copyOf(quasis);
            expressions = List.copyOf(expressions);
        }
    }

    record TaggedTemplateExpression(Expression tag, TemplateLiteral quasi, Span span) implements Expression {}

    record ThisExpression(Span span) implements Expression {}

    record SuperExpression(Span span) implements Expression {}

    /** Elements may contain {@code null} for holes. */
    record ArrayExpression(List<Expression> elements, Span span) implements Expression {
        public ArrayExpression {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }
    }

    record ObjectExpression(List<ObjectMember> properties, Span span) implements Expression {
        public ObjectExpression {
            properties = List.copyOf(properties);
        }
    }

    record FunctionExpression(Function function, Span span) implements Expression {}

    /** {@code body} is a {@link BlockStatement} or an {@link Expression}. */
    record ArrowFunctionExpression(List<Pattern> params, Node body, boolean async, Span span)
        implements Expression, FunctionNode {

        public ArrowFunctionExpression {
            params = List.copyOf(params);
        }

        @Override
        public BlockStatement blockBody() {
            return body instanceof BlockStatement block ? block : null;
        }

        public ArrowFunctionExpression withBody(Node newBody) {
            return new ArrowFunctionExpression(params, newBody, async, span);
        }
    }

    record ClassExpression(ClassDef definition, Span span) implements Expression {}

    record UnaryExpression(String operator, Expression argument, Span span) implements Expression {}

    record UpdateExpression(String operator, boolean prefix, Expression argument, Span span) implements Expression {}

    /** Arithmetic, comparison, bitwise and logical ({@code && || ??}) operators. */
    record BinaryExpression(String operator, Expression left, Expression right, Span span) implements Expression {}

    record AssignmentExpression(String operator, Pattern left, Expression right, Span span) implements Expression {}

    record ConditionalExpression(Expression test, Expression consequent, Expression alternate, Span span)
        implements Expression {}

    record CallExpression(Expression callee, List<Expression> arguments, boolean optional, Span span)
        implements Expression {
        public CallExpression {
            arguments = List.copyOf(arguments);
        }

        public static CallExpression of(Expression callee, Expression... arguments) {
            return new CallExpression(callee, List.of(arguments), false, Span.SYNTHETIC);
        }
    }

    record NewExpression(Expression callee, List<Expression> arguments, Span span) implements Expression {
        public NewExpression {
            arguments = List.copyOf(arguments);
        }
    }

    record MemberExpression(Expression object, Expression property, boolean computed, boolean optional, Span span)
        implements Expression, Pattern {

        public static MemberExpression dot(Expression object, String property) {
            return new MemberExpression(object, Identifier.of(property), false, false, Span.SYNTHETIC);
        }

        public static MemberExpression index(Expression object, Expression property) {
            return new MemberExpression(object, property, true, false, Span.SYNTHETIC);
        }
    }

    record SequenceExpression(List<Expression> expressions, Span span) implements Expression {
        public SequenceExpression {
            expressions = List.copyOf(expressions);
        }
    }

    record AwaitExpression(Expression argument, Span span) implements Expression {}

    record YieldExpression(Expression argument, boolean delegate, Span span) implements Expression {}

    record SpreadElement(Expression argument, Span span) implements Expression, ObjectMember {}

    /** {@code new.target} and {@code import.meta}. */
    record MetaProperty(String meta, String property, Span span) implements Expression {}

    /** Dynamic {@code import(source)}. */
    record ImportExpression(Expression source, Span span) implements Expression {}
}
