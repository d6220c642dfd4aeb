package io.github.manjago.pseudomem.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts pseudocode source text into a flat token list.
 *
 * <p>Keywords are matched exactly (case-sensitive). The assignment arrow may be written
 * as {@code ←} or {@code <--}; both produce one {@link TokenType#ASSIGNMENT} token.
 * Comments run from {@code //} to the end of the line and are kept as
 * {@link TokenType#COMMENT} tokens for tooling; the parser drops them.
 */
public class Tokenizer {

    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    public static final Set<String> KEYWORDS = Set.of(
        "DECLARE", "CONSTANT", "IF", "THEN", "ELSE", "ENDIF", "WHILE", "DO", "ENDWHILE",
        "REPEAT", "UNTIL", "FOR", "TO", "STEP", "NEXT", "CASE", "OF", "OTHERWISE", "ENDCASE",
        "INTEGER", "REAL", "STRING", "CHAR", "BOOLEAN", "ARRAY", "INPUT", "OUTPUT",
        "PROCEDURE", "ENDPROCEDURE", "FUNCTION", "ENDFUNCTION", "RETURN", "RETURNS", "CALL",
        "BYVAL", "BYREF", "TRUE", "FALSE", "AND", "OR", "NOT", "DIV", "MOD",
        "OPENFILE", "CLOSEFILE", "READFILE", "WRITEFILE", "EOF", "READ", "WRITE", "APPEND",
        "MALLOC", "FREE", "SIZE_OF",
        "POINTER_TO_INTEGER", "POINTER_TO_REAL", "POINTER_TO_CHAR", "VOID_POINTER"
    );

    private static final String ARROW = "←";
    private static final String SINGLE_CHAR_OPERATORS = "+-*/=<>&";

    private String source;
    private int pos;
    private int line;
    private int column;
    private List<Token> tokens;

    /**
     * Tokenize the whole source. The result always ends with an EOF token.
     *
     * @throws SyntaxException on an unexpected character, unterminated string or bad hex literal
     */
    public List<Token> tokenize(String source) throws SyntaxException {
        this.source = source;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.tokens = new ArrayList<>();

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == ' ' || c == '\t' || c == '\r') {
                advance(1);
            } else if (c == '\n') {
                tokens.add(new Token(TokenType.NEWLINE, "\n", line, column));
                pos++;
                line++;
                column = 1;
            } else if (source.startsWith("//", pos)) {
                readComment();
            } else if (c == '"' || c == '\'') {
                readString(c);
            } else if (isDigit(c) || (c == '.' && pos + 1 < source.length()
                    && isDigit(source.charAt(pos + 1)))) {
                readNumber();
            } else if (source.startsWith(ARROW, pos)) {
                emit(TokenType.ASSIGNMENT, ARROW, 1);
            } else if (source.startsWith("<--", pos)) {
                emit(TokenType.ASSIGNMENT, "<--", 3);
            } else if (source.startsWith("<=", pos) || source.startsWith(">=", pos)
                    || source.startsWith("<>", pos)) {
                emit(TokenType.OPERATOR, source.substring(pos, pos + 2), 2);
            } else if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
                emit(TokenType.OPERATOR, String.valueOf(c), 1);
            } else if (c == ',') {
                emit(TokenType.COMMA, ",", 1);
            } else if (c == ':') {
                emit(TokenType.COLON, ":", 1);
            } else if (c == '(') {
                emit(TokenType.LPAREN, "(", 1);
            } else if (c == ')') {
                emit(TokenType.RPAREN, ")", 1);
            } else if (c == '[') {
                emit(TokenType.LBRACKET, "[", 1);
            } else if (c == ']') {
                emit(TokenType.RBRACKET, "]", 1);
            } else if (isIdentifierStart(c)) {
                readWord();
            } else {
                throw new SyntaxException("Unexpected character '" + c + "'", line, column);
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, column));
        log.debug("Tokenized {} lines into {} tokens", line, tokens.size());
        return tokens;
    }

    // ========== Readers ==========

    private void readComment() {
        int end = source.indexOf('\n', pos);
        if (end < 0) {
            end = source.length();
        }
        emit(TokenType.COMMENT, source.substring(pos, end), end - pos);
    }

    private void readString(char quote) throws SyntaxException {
        int startColumn = column;
        int end = pos + 1;
        while (end < source.length() && source.charAt(end) != quote) {
            if (source.charAt(end) == '\n') {
                throw new SyntaxException("Unterminated string literal", line, startColumn);
            }
            end++;
        }
        if (end >= source.length()) {
            throw new SyntaxException("Unterminated string literal", line, startColumn);
        }
        tokens.add(new Token(TokenType.STRING, source.substring(pos + 1, end), line, startColumn));
        advance(end + 1 - pos);
    }

    private void readNumber() throws SyntaxException {
        int startColumn = column;
        if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
            int end = pos + 2;
            while (end < source.length() && isHexDigit(source.charAt(end))) {
                end++;
            }
            if (end == pos + 2) {
                throw new SyntaxException("Invalid hex literal", line, startColumn);
            }
            emit(TokenType.NUMBER, source.substring(pos, end), end - pos);
            return;
        }

        int end = pos;
        int dots = 0;
        while (end < source.length()
                && (isDigit(source.charAt(end)) || source.charAt(end) == '.')) {
            if (source.charAt(end) == '.') {
                dots++;
            }
            end++;
        }
        String text = source.substring(pos, end);
        if (dots > 1 || text.endsWith(".")) {
            throw new SyntaxException("Malformed number '" + text + "'", line, startColumn);
        }
        emit(TokenType.NUMBER, text, end - pos);
    }

    private void readWord() {
        int end = pos;
        while (end < source.length() && isIdentifierPart(source.charAt(end))) {
            end++;
        }
        String word = source.substring(pos, end);
        TokenType type = KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        emit(type, word, end - pos);
    }

    // ========== Helpers ==========

    private void emit(TokenType type, String text, int length) {
        tokens.add(new Token(type, text, line, column));
        advance(length);
    }

    private void advance(int count) {
        pos += count;
        column += count;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
