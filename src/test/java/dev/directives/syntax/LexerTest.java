package dev.directives.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexerTest {

    @Test
    void tokenizesDeclaration() {
        List<Token> tokens = new Lexer("const x = 1;").tokenize();

        assertThat(tokens).extracting(Token::type).containsExactly(
            TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.PUNCTUATOR, TokenType.NUMBER,
            TokenType.PUNCTUATOR, TokenType.EOF);
        assertThat(tokens).extracting(Token::value).startsWith("const", "x", "=", "1", ";");
    }

    @Test
    void decodesStringEscapes() {
        List<Token> tokens = new Lexer("'it\\'s'").tokenize();

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).value()).isEqualTo("it's");
    }

    @Test
    void recordsLineAndNewlineBefore() {
        List<Token> tokens = new Lexer("a\n  b").tokenize();

        assertThat(tokens.get(0).line()).isEqualTo(1);
        assertThat(tokens.get(0).column()).isEqualTo(1);
        assertThat(tokens.get(1).line()).isEqualTo(2);
        assertThat(tokens.get(1).column()).isEqualTo(3);
        assertThat(tokens.get(1).newlineBefore()).isTrue();
    }

    @Test
    void skipsComments() {
        List<Token> tokens = new Lexer("// line\n/* block */ x").tokenize();

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).value()).isEqualTo("x");
    }

    @Test
    void readsRegexAfterAssignment() {
        List<Token> tokens = new Lexer("r = /ab+c/g").tokenize();

        Token regex = tokens.get(2);
        assertThat(regex.type()).isEqualTo(TokenType.REGEX);
        assertThat(regex.value()).isEqualTo("ab+c");
        assertThat(regex.flags()).isEqualTo("g");
    }

    @Test
    void prefersLongestPunctuator() {
        List<Token> tokens = new Lexer("a ??= b").tokenize();

        assertThat(tokens.get(1).value()).isEqualTo("??=");
    }

    @Test
    void splitsTemplateIntoQuasisAndSubstitutions() {
        Token template = new Lexer("`a${b}c`").tokenize().get(0);

        assertThat(template.type()).isEqualTo(TokenType.TEMPLATE);
        assertThat(template.quasis()).containsExactly("a", "c");
        assertThat(template.substitutions()).extracting(Token.TemplateSubstitution::source).containsExactly("b");
    }

    @Test
    void failsOnUnterminatedRegex() {
        assertThatThrownBy(() -> new Lexer("x = /abc\n").tokenize())
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("Unterminated regular expression");
    }
}
