package io.github.manjago.pseudomem.lang;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private Tokenizer tokenizer;

    @BeforeEach
    void setUp() {
        tokenizer = new Tokenizer();
    }

    private List<TokenType> types(String source) throws SyntaxException {
        return tokenizer.tokenize(source).stream().map(Token::type).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Basic tokens")
    class BasicTokens {

        @Test
        @DisplayName("Empty source yields only EOF")
        void emptySource() throws SyntaxException {
            List<Token> tokens = tokenizer.tokenize("");
            assertEquals(1, tokens.size());
            assertEquals(TokenType.EOF, tokens.get(0).type());
        }

        @Test
        @DisplayName("Declaration splits into keyword, identifier, colon, keyword")
        void declaration() throws SyntaxException {
            assertEquals(List.of(TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.COLON,
                    TokenType.KEYWORD, TokenType.EOF), types("DECLARE count : INTEGER"));
        }

        @Test
        @DisplayName("Both arrow forms are assignments")
        void arrows() throws SyntaxException {
            List<Token> unicode = tokenizer.tokenize("x ← 1");
            List<Token> ascii = tokenizer.tokenize("x <-- 1");
            assertEquals(TokenType.ASSIGNMENT, unicode.get(1).type());
            assertEquals(TokenType.ASSIGNMENT, ascii.get(1).type());
            assertEquals(TokenType.NUMBER, ascii.get(2).type());
        }

        @Test
        @DisplayName("Two-character operators win over single ones")
        void twoCharOperators() throws SyntaxException {
            List<Token> tokens = tokenizer.tokenize("a <= b <> c >= d < e");
            assertEquals("<=", tokens.get(1).text());
            assertEquals("<>", tokens.get(3).text());
            assertEquals(">=", tokens.get(5).text());
            assertEquals("<", tokens.get(7).text());
        }

        @Test
        @DisplayName("Keywords are case sensitive")
        void keywordCase() throws SyntaxException {
            List<Token> tokens = tokenizer.tokenize("declare DECLARE");
            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals(TokenType.KEYWORD, tokens.get(1).type());
        }

        @Test
        @DisplayName("Pointer types are single keywords")
        void pointerTypes() throws SyntaxException {
            Token token = tokenizer.tokenize("POINTER_TO_INTEGER").get(0);
            assertTrue(token.isKeyword("POINTER_TO_INTEGER"));
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("Strings drop their quotes, either kind")
        void strings() throws SyntaxException {
            List<Token> tokens = tokenizer.tokenize("\"hello world\" 'c'");
            assertEquals("hello world", tokens.get(0).text());
            assertEquals(TokenType.STRING, tokens.get(0).type());
            assertEquals("c", tokens.get(1).text());
        }

        @Test
        @DisplayName("Decimal and hex numbers")
        void numbers() throws SyntaxException {
            List<Token> tokens = tokenizer.tokenize("42 3.14 .5 0x1F");
            assertEquals("42", tokens.get(0).text());
            assertEquals("3.14", tokens.get(1).text());
            assertEquals(".5", tokens.get(2).text());
            assertEquals("0x1F", tokens.get(3).text());
            assertTrue(tokens.subList(0, 4).stream().allMatch(t -> t.is(TokenType.NUMBER)));
        }

        @Test
        @DisplayName("Comments are kept as tokens")
        void comments() throws SyntaxException {
            List<Token> tokens = tokenizer.tokenize("x <-- 1 // set x\ny <-- 2");
            Token comment = tokens.get(3);
            assertEquals(TokenType.COMMENT, comment.type());
            assertEquals("// set x", comment.text());
            assertEquals(TokenType.NEWLINE, tokens.get(4).type());
        }
    }

    @Nested
    @DisplayName("Positions")
    class Positions {

        @Test
        @DisplayName("Lines and columns are 1-based")
        void lineAndColumn() throws SyntaxException {
            List<Token> tokens = tokenizer.tokenize("x <-- 1\n  OUTPUT x");
            Token output = tokens.get(4);
            assertTrue(output.isKeyword("OUTPUT"));
            assertEquals(2, output.line());
            assertEquals(3, output.column());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Unterminated string reports its start")
        void unterminatedString() {
            SyntaxException e = assertThrows(SyntaxException.class,
                    () -> tokenizer.tokenize("OUTPUT \"oops"));
            assertEquals(1, e.getLine());
            assertEquals(8, e.getColumn());
            assertTrue(e.getMessage().contains("Unterminated string literal"));
        }

        @Test
        @DisplayName("Unexpected character")
        void unexpectedCharacter() {
            SyntaxException e = assertThrows(SyntaxException.class,
                    () -> tokenizer.tokenize("x <-- 1\ny <-- @"));
            assertEquals(2, e.getLine());
            assertEquals(7, e.getColumn());
            assertTrue(e.getMessage().contains("Unexpected character '@'"));
        }

        @Test
        @DisplayName("Bare hex prefix and double dots are rejected")
        void malformedNumbers() {
            assertThrows(SyntaxException.class, () -> tokenizer.tokenize("0x"));
            SyntaxException e = assertThrows(SyntaxException.class, () -> tokenizer.tokenize("1.2.3"));
            assertTrue(e.getMessage().contains("Malformed number '1.2.3'"));
        }
    }
}
