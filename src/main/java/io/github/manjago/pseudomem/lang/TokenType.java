package io.github.manjago.pseudomem.lang;

/**
 * Kinds of lexical tokens.
 */
public enum TokenType {
    KEYWORD,
    IDENTIFIER,
    NUMBER,
    STRING,
    OPERATOR,
    ASSIGNMENT,
    COMMA,
    COLON,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    NEWLINE,
    COMMENT,
    EOF
}
