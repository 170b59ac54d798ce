package dev.directives.syntax;

public enum TokenType {
    IDENTIFIER,      // also keywords; the parser decides by value
    PRIVATE_NAME,    // #field
    NUMBER,
    STRING,
    TEMPLATE,
    REGEX,
    PUNCTUATOR,
    EOF
}
