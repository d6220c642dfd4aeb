package io.github.manjago.pseudomem.lang;

/**
 * Single lexical token with its 1-based source position.
 */
public record Token(TokenType type, String text, int line, int column) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && text.equals(operator);
    }

    @Override
    public String toString() {
        return String.format("%d:%d %s '%s'", line, column, type, text.replace("\n", "\\n"));
    }
}
