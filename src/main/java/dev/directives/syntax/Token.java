package dev.directives.syntax;

import java.util.List;

/**
 * A lexical token. {@code value} is the decoded string for STRING tokens, the pattern text for
 * REGEX tokens (flags in {@code flags}), and the source text otherwise.
 */
public record Token(
    TokenType type,
    String value,
    int start,
    int end,
    int line,
    int column,
    boolean newlineBefore,
    String flags,
    List<String> quasis,
    List<TemplateSubstitution> substitutions
) {

    /** Source of one {@code ${...}} part of a template literal and where it starts. */
    public record TemplateSubstitution(String source, int offset, int line, int column) {}

    static Token simple(TokenType type, String value, int start, int end, int line, int column,
                        boolean newlineBefore) {
        return new Token(type, value, start, end, line, column, newlineBefore, null, List.of(), List.of());
    }

    public boolean is(String text) {
        return (type == TokenType.PUNCTUATOR || type == TokenType.IDENTIFIER) && value.equals(text);
    }

    public boolean isPunctuator(String text) {
        return type == TokenType.PUNCTUATOR && value.equals(text);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + value + "'";
    }
}
