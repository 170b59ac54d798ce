package dev.directives.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binding and assignment targets.
 */
public sealed interface Pattern extends Node
    permits Expression.Identifier, Expression.MemberExpression,
            Pattern.ObjectPattern, Pattern.ArrayPattern, Pattern.AssignmentPattern, Pattern.RestElement {

    /** {@code rest} is null when the pattern has no trailing {@code ...rest}. */
    record ObjectPattern(List<PatternProperty> properties, RestElement rest, Span span) implements Pattern {
        public ObjectPattern {
            properties = List.copyOf(properties);
        }
    }

    record PatternProperty(Expression key, boolean computed, Pattern value, boolean shorthand, Span span) implements Node {}

    /** Elements may contain {@code null} for holes. */
    record ArrayPattern(List<Pattern> elements, Span span) implements Pattern {
        public ArrayPattern {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }
    }

    record AssignmentPattern(Pattern left, Expression right, Span span) implements Pattern {}

    record RestElement(Pattern argument, Span span) implements Pattern {}
}
