package io.github.manjago.pseudomem.lang;

/**
 * Tokenizer or parser failure. Always fatal to the parse attempt.
 */
public class SyntaxException extends Exception {

    private final int line;
    private final int column;

    public SyntaxException(String message, int line, int column) {
        super("Line " + line + ", column " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public SyntaxException(String message, Token token) {
        this(message, token.line(), token.column());
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
