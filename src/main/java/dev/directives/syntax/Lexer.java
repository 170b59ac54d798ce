package dev.directives.syntax;

import dev.directives.syntax.Token.TemplateSubstitution;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for the JavaScript subset the transformer reads. Comments are skipped; each token
 * records whether a line terminator preceded it so the parser can apply automatic semicolon
 * insertion.
 */
public class Lexer {

    private static final String[] PUNCTUATORS = {
        ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
        "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=", "%=",
        "&=", "|=", "^=", "**", "<<", ">>",
        "{", "}", "(", ")", "[", "]", ";", ",", "<", ">", "+", "-", "*", "/", "%", "&", "|", "^", "!", "~",
        "?", ":", "=", ".", "@"
    };

    /** Keywords after which a slash starts a regular expression rather than a division. */
    private static final Set<String> REGEX_AFTER_KEYWORD = Set.of(
        "return", "typeof", "instanceof", "in", "of", "new", "delete", "void", "throw", "case", "do", "else",
        "yield", "await"
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line;
    private int col;
    private boolean newlineBefore;

    public Lexer(String source) {
        this(source, 0, 1, 1);
    }

    /** Lexes a fragment that starts at the given offset of an enclosing source, e.g. a template substitution. */
    Lexer(String source, int offset, int line, int column) {
        this.source = source;
        this.pos = offset;
        this.line = line;
        this.col = column;
    }

    public List<Token> tokenize() {
        return tokenize(source.length());
    }

    List<Token> tokenize(int limit) {
        if (pos == 0 && source.startsWith("#!")) {
            while (pos < limit && !isLineTerminator(source.charAt(pos))) {
                advance();
            }
        }
        while (true) {
            skipTrivia(limit);
            if (pos >= limit) {
                tokens.add(Token.simple(TokenType.EOF, "", pos, pos, line, col, true));
                return tokens;
            }
            tokens.add(nextToken(limit));
            newlineBefore = false;
        }
    }

    private Token nextToken(int limit) {
        char c = source.charAt(pos);
        int start = pos;
        int startLine = line;
        int startCol = col;

        if (isIdentifierStart(c)) {
            readIdentifierPart(limit);
            return Token.simple(TokenType.IDENTIFIER, source.substring(start, pos), start, pos, startLine, startCol,
                newlineBefore);
        }
        if (c == '#' && pos + 1 < limit && isIdentifierStart(source.charAt(pos + 1))) {
            advance();
            readIdentifierPart(limit);
            return Token.simple(TokenType.PRIVATE_NAME, source.substring(start, pos), start, pos, startLine, startCol,
                newlineBefore);
        }
        if (isDigit(c) || (c == '.' && pos + 1 < limit && isDigit(source.charAt(pos + 1)))) {
            readNumber(limit);
            return Token.simple(TokenType.NUMBER, source.substring(start, pos), start, pos, startLine, startCol,
                newlineBefore);
        }
        if (c == '"' || c == '\'') {
            String value = readString(c, limit);
            return Token.simple(TokenType.STRING, value, start, pos, startLine, startCol, newlineBefore);
        }
        if (c == '`') {
            return readTemplate(limit, start, startLine, startCol);
        }
        if (c == '/' && regexAllowed()) {
            return readRegex(limit, start, startLine, startCol);
        }
        for (String punctuator : PUNCTUATORS) {
            if (source.startsWith(punctuator, pos) && start + punctuator.length() <= limit) {
                // `a?.5:b` is a conditional, not optional chaining
                if (punctuator.equals("?.") && pos + 2 < limit && isDigit(source.charAt(pos + 2))) {
                    continue;
                }
                for (int i = 0; i < punctuator.length(); i++) {
                    advance();
                }
                return Token.simple(TokenType.PUNCTUATOR, punctuator, start, pos, startLine, startCol, newlineBefore);
            }
        }
        throw new ParseException("Unexpected character '" + c + "'", line, col);
    }

    private void skipTrivia(int limit) {
        while (pos < limit) {
            char c = source.charAt(pos);
            if (isLineTerminator(c)) {
                newlineBefore = true;
                advance();
            } else if (Character.isWhitespace(c) || c == '\u00a0' || c == '\ufeff') {
                advance();
            } else if (c == '/' && pos + 1 < limit && source.charAt(pos + 1) == '/') {
                while (pos < limit && !isLineTerminator(source.charAt(pos))) {
                    advance();
                }
            } else if (c == '/' && pos + 1 < limit && source.charAt(pos + 1) == '*') {
                int commentLine = line;
                int commentCol = col;
                advance();
                advance();
                while (pos < limit && !source.startsWith("*/", pos)) {
                    if (isLineTerminator(source.charAt(pos))) {
                        newlineBefore = true;
                    }
                    advance();
                }
                if (pos >= limit) {
                    throw new ParseException("Unterminated comment", commentLine, commentCol);
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private boolean regexAllowed() {
        if (tokens.isEmpty()) {
            return true;
        }
        Token previous = tokens.get(tokens.size() - 1);
        return switch (previous.type()) {
            case PUNCTUATOR -> !previous.value().equals(")") && !previous.value().equals("]")
                && !previous.value().equals("}");
            case IDENTIFIER -> REGEX_AFTER_KEYWORD.contains(previous.value());
            default -> false;
        };
    }

    private void readIdentifierPart(int limit) {
        while (pos < limit && isIdentifierPart(source.charAt(pos))) {
            advance();
        }
    }

    private void readNumber(int limit) {
        if (source.charAt(pos) == '0' && pos + 1 < limit && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            advance();
            advance();
            while (pos < limit && (Character.digit(source.charAt(pos), 16) >= 0 || source.charAt(pos) == '_')) {
                advance();
            }
        } else {
            readDigits(limit);
            if (pos < limit && source.charAt(pos) == '.') {
                advance();
                readDigits(limit);
            }
            if (pos < limit && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                advance();
                if (pos < limit && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    advance();
                }
                readDigits(limit);
            }
        }
        if (pos < limit && source.charAt(pos) == 'n') {
            advance();
        }
        if (pos < limit && isIdentifierStart(source.charAt(pos))) {
            throw new ParseException("Identifier directly after number", line, col);
        }
    }

    private void readDigits(int limit) {
        while (pos < limit && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            advance();
        }
    }

    private String readString(char quote, int limit) {
        int startLine = line;
        int startCol = col;
        advance();
        var value = new StringBuilder();
        while (true) {
            if (pos >= limit || isLineTerminator(source.charAt(pos))) {
                throw new ParseException("Unterminated string literal", startLine, startCol);
            }
            char c = source.charAt(pos);
            if (c == quote) {
                advance();
                return value.toString();
            }
            if (c == '\\') {
                advance();
                readEscape(value, limit);
            } else {
                value.append(c);
                advance();
            }
        }
    }

    private void readEscape(StringBuilder value, int limit) {
        if (pos >= limit) {
            throw new ParseException("Unterminated escape sequence", line, col);
        }
        char c = source.charAt(pos);
        advance();
        switch (c) {
            case 'n' -> value.append('\n');
            case 't' -> value.append('\t');
            case 'r' -> value.append('\r');
            case 'b' -> value.append('\b');
            case 'f' -> value.append('\f');
            case 'v' -> value.append('\u000b');
            case '0' -> value.append('\0');
            case 'x' -> value.append((char) hex(2));
            case 'u' -> {
                if (pos < limit && source.charAt(pos) == '{') {
                    advance();
                    int end = source.indexOf('}', pos);
                    if (end < 0 || end > limit) {
                        throw new ParseException("Invalid unicode escape", line, col);
                    }
                    int codePoint = hex(end - pos);
                    advance();
                    value.appendCodePoint(codePoint);
                } else {
                    value.append((char) hex(4));
                }
            }
            case '\r' -> {
                if (pos < limit && source.charAt(pos) == '\n') {
                    advance();
                }
            }
            case '\n', '\u2028', '\u2029' -> {
                // line continuation
            }
            default -> value.append(c);
        }
    }

    private int hex(int digits) {
        if (pos + digits > source.length()) {
            throw new ParseException("Invalid escape sequence", line, col);
        }
        try {
            int result = Integer.parseInt(source.substring(pos, pos + digits), 16);
            for (int i = 0; i < digits; i++) {
                advance();
            }
            return result;
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid escape sequence", line, col);
        }
    }

    private Token readTemplate(int limit, int start, int startLine, int startCol) {
        advance();
        var quasis = new ArrayList<String>();
        var substitutions = new ArrayList<TemplateSubstitution>();
        int chunkStart = pos;
        while (true) {
            if (pos >= limit) {
                throw new ParseException("Unterminated template literal", startLine, startCol);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                advance();
                if (pos < limit) {
                    advance();
                }
            } else if (c == '`') {
                quasis.add(source.substring(chunkStart, pos));
                advance();
                break;
            } else if (c == '$' && pos + 1 < limit && source.charAt(pos + 1) == '{') {
                quasis.add(source.substring(chunkStart, pos));
                advance();
                advance();
                int exprStart = pos;
                int exprLine = line;
                int exprCol = col;
                skipBalanced(limit);
                substitutions.add(new TemplateSubstitution(source.substring(exprStart, pos), exprStart, exprLine,
                    exprCol));
                advance(); // closing brace
                chunkStart = pos;
            } else {
                advance();
            }
        }
        return new Token(TokenType.TEMPLATE, source.substring(start, pos), start, pos, startLine, startCol,
            newlineBefore, null, List.copyOf(quasis), List.copyOf(substitutions));
    }

    /** Advances to the brace closing a template substitution, skipping nested strings, templates and comments. */
    private void skipBalanced(int limit) {
        boolean outerNewline = newlineBefore;
        int depth = 0;
        while (pos < limit) {
            char c = source.charAt(pos);
            if (c == '}' && depth == 0) {
                newlineBefore = outerNewline;
                return;
            }
            if (c == '{') {
                depth++;
                advance();
            } else if (c == '}') {
                depth--;
                advance();
            } else if (c == '"' || c == '\'') {
                readString(c, limit);
            } else if (c == '`') {
                readTemplate(limit, pos, line, col);
            } else if (c == '/' && pos + 1 < limit && (source.charAt(pos + 1) == '/' || source.charAt(pos + 1) == '*')) {
                skipTrivia(limit);
            } else {
                advance();
            }
        }
        throw new ParseException("Unterminated template substitution", line, col);
    }

    private Token readRegex(int limit, int start, int startLine, int startCol) {
        advance();
        boolean inClass = false;
        while (true) {
            if (pos >= limit || isLineTerminator(source.charAt(pos))) {
                throw new ParseException("Unterminated regular expression", startLine, startCol);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                advance();
                advance();
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                break;
            }
            advance();
        }
        String pattern = source.substring(start + 1, pos);
        advance();
        int flagsStart = pos;
        readIdentifierPart(limit);
        String flags = source.substring(flagsStart, pos);
        return new Token(TokenType.REGEX, pattern, start, pos, startLine, startCol, newlineBefore, flags,
            List.of(), List.of());
    }

    private void advance() {
        char c = source.charAt(pos++);
        if (c == '\n' || c == '\u2028' || c == '\u2029' || (c == '\r' && (pos >= source.length()
            || source.charAt(pos) != '\n'))) {
            line++;
            col = 1;
        } else {
            col++;
        }
    }

    public static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    public static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '\u200c' || c == '\u200d';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
    }
}
