package dev.directives.ast;

/**
 * Members of an object literal.
 */
public sealed interface ObjectMember extends Node
    permits ObjectMember.Property, ObjectMember.MethodProperty, Expression.SpreadElement {

    record Property(Expression key, boolean computed, Expression value, boolean shorthand, Span span)
        implements ObjectMember {

        public Property withValue(Expression newValue) {
            return new Property(key, computed, newValue, false, span);
        }
    }

    /** Shorthand method, getter or setter: {@code name() {}}, {@code get name() {}}. */
    record MethodProperty(Expression key, boolean computed, Function value, ClassMember.MethodKind kind, Span span)
        implements ObjectMember {}
}
