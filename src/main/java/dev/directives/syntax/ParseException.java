package dev.directives.syntax;

/**
 * Syntax error raised by the reference lexer and parser.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super("%s (%d:%d)".formatted(message, line, column));
        this.line = line;
        this.column = column;
    }

    public int line() { return line; }

    public int column() { return column; }
}
