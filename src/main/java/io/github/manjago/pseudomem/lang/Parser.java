package io.github.manjago.pseudomem.lang;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser producing a {@link Program}.
 *
 * <h2>Layout</h2>
 * One statement per physical line. Blocks are parsed until one of a set of
 * terminator keywords is seen:
 * <pre>
 * IF cond THEN ... [ELSE IF cond THEN ...] [ELSE ...] ENDIF
 * WHILE cond DO ... ENDWHILE
 * REPEAT ... UNTIL cond
 * FOR i ← a TO b [STEP c] ... NEXT [i]
 * CASE OF expr
 *     value : stmt
 *     low TO high : stmt
 *     OTHERWISE : stmt
 * ENDCASE
 * </pre>
 *
 * <h2>Expression precedence (low to high)</h2>
 * OR, AND, NOT, comparison (non-chaining), {@code + - &}, {@code * / DIV MOD},
 * unary minus, primary. A leading {@code &} or {@code *} on a primary is address-of
 * or dereference.
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> COMPARISON_OPERATORS = Set.of("=", "<>", "<", ">", "<=", ">=");

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens.stream()
                .filter(t -> t.type() != TokenType.COMMENT)
                .toList();
        if (this.tokens.isEmpty() || !this.tokens.get(this.tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
    }

    /**
     * Tokenize and parse source text.
     */
    public static Program parse(String source) throws SyntaxException {
        return new Parser(new Tokenizer().tokenize(source)).parseProgram();
    }

    /**
     * Parse the whole token list.
     */
    public Program parseProgram() throws SyntaxException {
        List<Stmt> statements = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.EOF)) {
            parseStatementInto(statements);
            expectEndOfStatement();
            skipNewlines();
        }
        log.debug("Parsed {} top-level statements", statements.size());
        return new Program(statements);
    }

    // ========== Statements ==========

    private void parseStatementInto(List<Stmt> out) throws SyntaxException {
        Token token = peek();

        if (token.is(TokenType.KEYWORD)) {
            switch (token.text()) {
                case "DECLARE" -> parseDeclare(out);
                case "CONSTANT" -> out.add(parseConstant());
                case "OUTPUT" -> out.add(parseOutput());
                case "INPUT" -> out.add(parseInput());
                case "IF" -> out.add(parseIf());
                case "WHILE" -> out.add(parseWhile());
                case "REPEAT" -> out.add(parseRepeat());
                case "FOR" -> out.add(parseFor());
                case "CASE" -> out.add(parseCase());
                case "PROCEDURE" -> out.add(parseProcedure());
                case "FUNCTION" -> out.add(parseFunction());
                case "CALL" -> out.add(parseCall());
                case "RETURN" -> out.add(parseReturn());
                case "OPENFILE" -> out.add(parseOpenFile());
                case "CLOSEFILE" -> out.add(parseCloseFile());
                case "READFILE" -> out.add(parseReadFile());
                case "WRITEFILE" -> out.add(parseWriteFile());
                case "FREE" -> out.add(parseFree());
                default -> throw new SyntaxException("Unexpected keyword '" + token.text() + "'", token);
            }
        } else if (token.is(TokenType.IDENTIFIER) || token.isOperator("*")) {
            out.add(parseAssignment());
        } else {
            throw new SyntaxException("Unexpected token '" + token.text() + "'", token);
        }
    }

    private void parseDeclare(List<Stmt> out) throws SyntaxException {
        int line = advance().line();

        List<String> names = new ArrayList<>();
        names.add(expect(TokenType.IDENTIFIER, "Expected variable name").text());
        while (match(TokenType.COMMA)) {
            names.add(expect(TokenType.IDENTIFIER, "Expected variable name").text());
        }
        expect(TokenType.COLON, "Expected ':' after variable name");

        if (matchKeyword("ARRAY")) {
            List<ArrayBounds> dimensions = parseArrayBounds();
            expectKeyword("OF");
            DataType elementType = parseScalarType();
            for (String name : names) {
                out.add(new Stmt.Declare(name, DataType.ARRAY, dimensions, elementType, line));
            }
        } else {
            DataType type = parseScalarType();
            for (String name : names) {
                out.add(new Stmt.Declare(name, type, List.of(), null, line));
            }
        }
    }

    private List<ArrayBounds> parseArrayBounds() throws SyntaxException {
        expect(TokenType.LBRACKET, "Expected '[' after ARRAY");
        List<ArrayBounds> dimensions = new ArrayList<>();
        do {
            Token start = peek();
            int lower = parseIntegerLiteral();
            expect(TokenType.COLON, "Expected ':' between array bounds");
            int upper = parseIntegerLiteral();
            if (upper < lower) {
                throw new SyntaxException("Array upper bound " + upper + " is below lower bound " + lower, start);
            }
            dimensions.add(new ArrayBounds(lower, upper));
        } while (match(TokenType.COMMA));
        expect(TokenType.RBRACKET, "Expected ']' after array bounds");
        return dimensions;
    }

    private int parseIntegerLiteral() throws SyntaxException {
        Token start = peek();
        boolean negative = false;
        if (peek().isOperator("-")) {
            advance();
            negative = true;
        }
        Token token = peek();
        if (!token.is(TokenType.NUMBER)) {
            throw new SyntaxException("Array bounds must be integer literals", start);
        }
        advance();
        double value = numberValue(token);
        if (value != Math.floor(value)) {
            throw new SyntaxException("Array bounds must be integer literals", start);
        }
        double bound = negative ? -value : value;
        if (bound < Integer.MIN_VALUE || bound > Integer.MAX_VALUE) {
            throw new SyntaxException("Array bound " + token.text() + " is out of range", start);
        }
        return (int) bound;
    }

    private DataType parseScalarType() throws SyntaxException {
        Token token = peek();
        DataType type = token.is(TokenType.KEYWORD) ? DataType.fromKeyword(token.text()) : null;
        if (type == null || type == DataType.ARRAY) {
            throw new SyntaxException("Expected data type, found " + describe(token), token);
        }
        advance();
        return type;
    }

    private Stmt parseConstant() throws SyntaxException {
        int line = advance().line();
        String name = expect(TokenType.IDENTIFIER, "Expected constant name").text();
        if (!match(TokenType.ASSIGNMENT) && !matchOperator("=")) {
            throw new SyntaxException("Expected '=' after constant name", peek());
        }

        Token token = peek();
        Expr value;
        if (token.isOperator("-") && peekNext().is(TokenType.NUMBER)) {
            advance();
            value = new Expr.NumberLiteral(-numberValue(advance()), line);
        } else if (token.is(TokenType.NUMBER)) {
            value = new Expr.NumberLiteral(numberValue(advance()), line);
        } else if (token.is(TokenType.STRING)) {
            value = new Expr.StringLiteral(advance().text(), line);
        } else if (token.isKeyword("TRUE") || token.isKeyword("FALSE")) {
            value = new Expr.BooleanLiteral(advance().text().equals("TRUE"), line);
        } else {
            throw new SyntaxException("Constant value must be a literal", token);
        }
        return new Stmt.Constant(name, value, line);
    }

    private Stmt parseAssignment() throws SyntaxException {
        Token start = peek();
        Expr target;
        if (start.isOperator("*")) {
            advance();
            target = new Expr.Dereference(parsePrimary(), start.line());
        } else {
            target = parseVariableTarget();
        }
        expect(TokenType.ASSIGNMENT, "Expected assignment arrow");
        Expr value = parseExpression();
        return new Stmt.Assign(target, value, start.line());
    }

    /**
     * Identifier or array element, as used by INPUT, READFILE and assignment.
     */
    private Expr parseVariableTarget() throws SyntaxException {
        Token name = expect(TokenType.IDENTIFIER, "Expected variable name");
        if (check(TokenType.LBRACKET)) {
            return new Expr.ArrayAccess(name.text(), parseIndices(), name.line());
        }
        return new Expr.Identifier(name.text(), name.line());
    }

    private List<Expr> parseIndices() throws SyntaxException {
        expect(TokenType.LBRACKET, "Expected '['");
        List<Expr> indices = new ArrayList<>();
        do {
            indices.add(parseExpression());
        } while (match(TokenType.COMMA));
        expect(TokenType.RBRACKET, "Expected ']' after array index");
        return indices;
    }

    private Stmt parseOutput() throws SyntaxException {
        int line = advance().line();
        List<Expr> values = new ArrayList<>();
        do {
            values.add(parseExpression());
        } while (match(TokenType.COMMA));
        return new Stmt.Output(values, line);
    }

    private Stmt parseInput() throws SyntaxException {
        int line = advance().line();
        return new Stmt.Input(parseVariableTarget(), line);
    }

    private Stmt parseIf() throws SyntaxException {
        int line = advance().line();
        Expr condition = parseExpression();
        expectKeyword("THEN");
        List<Stmt> thenBranch = parseBlock("ELSE", "ENDIF");

        List<Stmt.ElseIf> elseIfs = new ArrayList<>();
        List<Stmt> elseBranch = null;
        while (matchKeyword("ELSE")) {
            if (matchKeyword("IF")) {
                Expr elseIfCondition = parseExpression();
                expectKeyword("THEN");
                elseIfs.add(new Stmt.ElseIf(elseIfCondition, parseBlock("ELSE", "ENDIF")));
            } else {
                elseBranch = parseBlock("ENDIF");
                break;
            }
        }
        expectKeyword("ENDIF");
        return new Stmt.If(condition, thenBranch, elseIfs, elseBranch, line);
    }

    private Stmt parseWhile() throws SyntaxException {
        int line = advance().line();
        Expr condition = parseExpression();
        expectKeyword("DO");
        List<Stmt> body = parseBlock("ENDWHILE");
        expectKeyword("ENDWHILE");
        return new Stmt.While(condition, body, line);
    }

    private Stmt parseRepeat() throws SyntaxException {
        int line = advance().line();
        List<Stmt> body = parseBlock("UNTIL");
        expectKeyword("UNTIL");
        Expr condition = parseExpression();
        return new Stmt.Repeat(body, condition, line);
    }

    private Stmt parseFor() throws SyntaxException {
        int line = advance().line();
        Token variable = expect(TokenType.IDENTIFIER, "Expected loop variable after FOR");
        expect(TokenType.ASSIGNMENT, "Expected assignment arrow after loop variable");
        Expr start = parseExpression();
        expectKeyword("TO");
        Expr end = parseExpression();
        Expr step = matchKeyword("STEP") ? parseExpression() : null;

        List<Stmt> body = parseBlock("NEXT");
        expectKeyword("NEXT");
        if (check(TokenType.IDENTIFIER)) {
            Token next = advance();
            if (!next.text().equals(variable.text())) {
                throw new SyntaxException("NEXT variable '" + next.text()
                        + "' does not match FOR variable '" + variable.text() + "'", next);
            }
        }
        return new Stmt.For(variable.text(), start, end, step, body, line);
    }

    private Stmt parseCase() throws SyntaxException {
        int line = advance().line();
        expectKeyword("OF");
        Expr subject = parseExpression();
        expectEndOfStatement();

        List<Stmt.CaseBranch> branches = new ArrayList<>();
        List<Stmt> otherwise = null;
        while (true) {
            skipNewlines();
            Token token = peek();
            if (token.isKeyword("ENDCASE")) {
                break;
            }
            if (token.is(TokenType.EOF)) {
                throw new SyntaxException("Expected ENDCASE", token);
            }
            if (token.isKeyword("OTHERWISE")) {
                advance();
                match(TokenType.COLON);
                otherwise = parseBlock("ENDCASE");
                break;
            }
            if (!isCaseLabelStart()) {
                throw new SyntaxException("Expected CASE value, OTHERWISE or ENDCASE", token);
            }
            Expr value = parseExpression();
            Expr rangeEnd = matchKeyword("TO") ? parseExpression() : null;
            expect(TokenType.COLON, "Expected ':' after CASE value");
            branches.add(new Stmt.CaseBranch(value, rangeEnd, parseCaseBody()));
        }
        expectKeyword("ENDCASE");
        return new Stmt.Case(subject, branches, otherwise, line);
    }

    /**
     * Statements of one CASE branch: up to the next label, OTHERWISE or ENDCASE.
     * The first statement may share the label's line.
     */
    private List<Stmt> parseCaseBody() throws SyntaxException {
        List<Stmt> body = new ArrayList<>();
        while (true) {
            skipNewlines();
            Token token = peek();
            if (token.isKeyword("ENDCASE") || token.isKeyword("OTHERWISE") || isCaseLabelStart()) {
                return body;
            }
            if (token.is(TokenType.EOF)) {
                throw new SyntaxException("Expected ENDCASE", token);
            }
            parseStatementInto(body);
            expectEndOfStatement();
        }
    }

    private boolean isCaseLabelStart() {
        Token token = peek();
        Token next = peekNext();
        return switch (token.type()) {
            case NUMBER, STRING -> true;
            case KEYWORD -> token.text().equals("TRUE") || token.text().equals("FALSE");
            case OPERATOR -> token.text().equals("-") && next.is(TokenType.NUMBER);
            case IDENTIFIER -> next.is(TokenType.COLON) || next.isKeyword("TO");
            default -> false;
        };
    }

    private Stmt parseProcedure() throws SyntaxException {
        int line = advance().line();
        String name = expect(TokenType.IDENTIFIER, "Expected procedure name").text();
        List<Parameter> parameters = check(TokenType.LPAREN) ? parseParameters() : List.of();
        List<Stmt> body = parseBlock("ENDPROCEDURE");
        expectKeyword("ENDPROCEDURE");
        return new Stmt.Procedure(name, parameters, body, line);
    }

    private Stmt parseFunction() throws SyntaxException {
        int line = advance().line();
        String name = expect(TokenType.IDENTIFIER, "Expected function name").text();
        List<Parameter> parameters = check(TokenType.LPAREN) ? parseParameters() : List.of();
        expectKeyword("RETURNS");
        DataType returnType = parseScalarType();
        List<Stmt> body = parseBlock("ENDFUNCTION");
        expectKeyword("ENDFUNCTION");
        return new Stmt.Function(name, parameters, returnType, body, line);
    }

    private List<Parameter> parseParameters() throws SyntaxException {
        expect(TokenType.LPAREN, "Expected '('");
        List<Parameter> parameters = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            return parameters;
        }
        do {
            boolean byRef = false;
            if (matchKeyword("BYREF")) {
                byRef = true;
            } else {
                matchKeyword("BYVAL");
            }
            String name = expect(TokenType.IDENTIFIER, "Expected parameter name").text();
            expect(TokenType.COLON, "Expected ':' after parameter name");
            if (matchKeyword("ARRAY")) {
                if (check(TokenType.LBRACKET)) {
                    parseArrayBounds();
                }
                expectKeyword("OF");
                parameters.add(new Parameter(name, DataType.ARRAY, parseScalarType(), byRef));
            } else {
                parameters.add(new Parameter(name, parseScalarType(), null, byRef));
            }
        } while (match(TokenType.COMMA));
        expect(TokenType.RPAREN, "Expected ')' after parameters");
        return parameters;
    }

    private Stmt parseCall() throws SyntaxException {
        int line = advance().line();
        String name = expect(TokenType.IDENTIFIER, "Expected procedure name after CALL").text();
        List<Expr> arguments = check(TokenType.LPAREN) ? parseArguments() : List.of();
        return new Stmt.Call(name, arguments, line);
    }

    private Stmt parseReturn() throws SyntaxException {
        int line = advance().line();
        return new Stmt.Return(parseExpression(), line);
    }

    private Stmt parseOpenFile() throws SyntaxException {
        int line = advance().line();
        Expr file = parseExpression();
        expectKeyword("FOR");
        Token modeToken = peek();
        FileMode mode;
        if (matchKeyword("READ")) {
            mode = FileMode.READ;
        } else if (matchKeyword("WRITE")) {
            mode = FileMode.WRITE;
        } else if (matchKeyword("APPEND")) {
            mode = FileMode.APPEND;
        } else {
            throw new SyntaxException("Expected READ, WRITE or APPEND", modeToken);
        }
        return new Stmt.OpenFile(file, mode, line);
    }

    private Stmt parseCloseFile() throws SyntaxException {
        int line = advance().line();
        return new Stmt.CloseFile(parseExpression(), line);
    }

    private Stmt parseReadFile() throws SyntaxException {
        int line = advance().line();
        Expr file = parseExpression();
        expect(TokenType.COMMA, "Expected ',' after file name");
        return new Stmt.ReadFile(file, parseVariableTarget(), line);
    }

    private Stmt parseWriteFile() throws SyntaxException {
        int line = advance().line();
        Expr file = parseExpression();
        expect(TokenType.COMMA, "Expected ',' after file name");
        return new Stmt.WriteFile(file, parseExpression(), line);
    }

    private Stmt parseFree() throws SyntaxException {
        int line = advance().line();
        return new Stmt.Free(parseExpression(), line);
    }

    /**
     * Parse statements until one of the terminator keywords (not consumed).
     */
    private List<Stmt> parseBlock(String... terminators) throws SyntaxException {
        List<Stmt> body = new ArrayList<>();
        while (true) {
            skipNewlines();
            Token token = peek();
            for (String terminator : terminators) {
                if (token.isKeyword(terminator)) {
                    return body;
                }
            }
            if (token.is(TokenType.EOF)) {
                throw new SyntaxException("Expected " + String.join(" or ", terminators), token);
            }
            parseStatementInto(body);
            expectEndOfStatement();
        }
    }

    // ========== Expressions ==========

    private Expr parseExpression() throws SyntaxException {
        return parseOr();
    }

    private Expr parseOr() throws SyntaxException {
        Expr left = parseAnd();
        while (peek().isKeyword("OR")) {
            int line = advance().line();
            left = new Expr.Binary(Expr.BinaryOperator.OR, left, parseAnd(), line);
        }
        return left;
    }

    private Expr parseAnd() throws SyntaxException {
        Expr left = parseNot();
        while (peek().isKeyword("AND")) {
            int line = advance().line();
            left = new Expr.Binary(Expr.BinaryOperator.AND, left, parseNot(), line);
        }
        return left;
    }

    private Expr parseNot() throws SyntaxException {
        if (peek().isKeyword("NOT")) {
            int line = advance().line();
            return new Expr.Unary(Expr.UnaryOperator.NOT, parseNot(), line);
        }
        return parseComparison();
    }

    private Expr parseComparison() throws SyntaxException {
        Expr left = parseAdditive();
        if (isComparisonOperator(peek())) {
            Token op = advance();
            Expr right = parseAdditive();
            if (isComparisonOperator(peek())) {
                throw new SyntaxException("Comparison operators cannot be chained", peek());
            }
            return new Expr.Binary(Expr.BinaryOperator.fromSymbol(op.text()), left, right, op.line());
        }
        return left;
    }

    private Expr parseAdditive() throws SyntaxException {
        Expr left = parseMultiplicative();
        while (peek().isOperator("+") || peek().isOperator("-") || peek().isOperator("&")) {
            Token op = advance();
            Expr right = parseMultiplicative();
            left = new Expr.Binary(Expr.BinaryOperator.fromSymbol(op.text()), left, right, op.line());
        }
        return left;
    }

    private Expr parseMultiplicative() throws SyntaxException {
        Expr left = parseUnary();
        while (peek().isOperator("*") || peek().isOperator("/")
                || peek().isKeyword("DIV") || peek().isKeyword("MOD")) {
            Token op = advance();
            Expr right = parseUnary();
            left = new Expr.Binary(Expr.BinaryOperator.fromSymbol(op.text()), left, right, op.line());
        }
        return left;
    }

    private Expr parseUnary() throws SyntaxException {
        if (peek().isOperator("-")) {
            int line = advance().line();
            return new Expr.Unary(Expr.UnaryOperator.NEGATE, parseUnary(), line);
        }
        return parsePrimary();
    }

    private Expr parsePrimary() throws SyntaxException {
        Token token = peek();

        switch (token.type()) {
            case OPERATOR -> {
                if (token.text().equals("&")) {
                    advance();
                    Expr target = parsePrimary();
                    if (!(target instanceof Expr.Identifier) && !(target instanceof Expr.ArrayAccess)) {
                        throw new SyntaxException("'&' requires a variable or array element", token);
                    }
                    return new Expr.AddressOf(target, token.line());
                }
                if (token.text().equals("*")) {
                    advance();
                    return new Expr.Dereference(parsePrimary(), token.line());
                }
            }
            case NUMBER -> {
                advance();
                return new Expr.NumberLiteral(numberValue(token), token.line());
            }
            case STRING -> {
                advance();
                return new Expr.StringLiteral(token.text(), token.line());
            }
            case LPAREN -> {
                advance();
                Expr inner = parseExpression();
                expect(TokenType.RPAREN, "Expected ')'");
                return inner;
            }
            case KEYWORD -> {
                return parseKeywordPrimary(token);
            }
            case IDENTIFIER -> {
                advance();
                if (check(TokenType.LPAREN)) {
                    return new Expr.FunctionCall(token.text(), parseArguments(), token.line());
                }
                if (check(TokenType.LBRACKET)) {
                    return new Expr.ArrayAccess(token.text(), parseIndices(), token.line());
                }
                return new Expr.Identifier(token.text(), token.line());
            }
            default -> {
                // falls through to the error below
            }
        }
        throw new SyntaxException("Unexpected token '" + token.text() + "' in expression", token);
    }

    private Expr parseKeywordPrimary(Token token) throws SyntaxException {
        switch (token.text()) {
            case "TRUE", "FALSE" -> {
                advance();
                return new Expr.BooleanLiteral(token.text().equals("TRUE"), token.line());
            }
            case "MALLOC" -> {
                advance();
                expect(TokenType.LPAREN, "Expected '(' after MALLOC");
                Expr size = parseExpression();
                if (check(TokenType.COMMA)) {
                    throw new SyntaxException("MALLOC takes exactly one argument", peek());
                }
                expect(TokenType.RPAREN, "Expected ')' after MALLOC size");
                return new Expr.Allocation(size, token.line());
            }
            case "SIZE_OF" -> {
                advance();
                expect(TokenType.LPAREN, "Expected '(' after SIZE_OF");
                Token typeToken = peek();
                DataType type = typeToken.is(TokenType.KEYWORD) ? DataType.fromKeyword(typeToken.text()) : null;
                if (type == null) {
                    throw new SyntaxException("SIZE_OF expects a type name", typeToken);
                }
                advance();
                expect(TokenType.RPAREN, "Expected ')' after SIZE_OF type");
                return new Expr.SizeOf(type, token.line());
            }
            case "REAL", "STRING", "EOF" -> {
                if (peekNext().is(TokenType.LPAREN)) {
                    advance();
                    return new Expr.FunctionCall(token.text(), parseArguments(), token.line());
                }
            }
            default -> {
                // not an expression keyword
            }
        }
        throw new SyntaxException("Unexpected keyword '" + token.text() + "' in expression", token);
    }

    private List<Expr> parseArguments() throws SyntaxException {
        expect(TokenType.LPAREN, "Expected '('");
        List<Expr> arguments = new ArrayList<>();
        if (match(TokenType.RPAREN)) {
            return arguments;
        }
        do {
            arguments.add(parseExpression());
        } while (match(TokenType.COMMA));
        expect(TokenType.RPAREN, "Expected ')' after arguments");
        return arguments;
    }

    // ========== Token helpers ==========

    private static double numberValue(Token token) throws SyntaxException {
        String text = token.text();
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                return new BigInteger(text.substring(2), 16).doubleValue();
            }
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new SyntaxException("Invalid number literal '" + text + "'", token);
        }
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case NEWLINE -> "end of line";
            case EOF -> "end of input";
            default -> "'" + token.text() + "'";
        };
    }

    private static boolean isComparisonOperator(Token token) {
        return token.is(TokenType.OPERATOR) && COMPARISON_OPERATORS.contains(token.text());
    }

    private void expectEndOfStatement() throws SyntaxException {
        if (check(TokenType.EOF)) {
            return;
        }
        if (!match(TokenType.NEWLINE)) {
            throw new SyntaxException("Expected end of line, found " + describe(peek()), peek());
        }
    }

    private void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            current++;
        }
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return tokens.get(Math.min(current + 1, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            current++;
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            current++;
            return true;
        }
        return false;
    }

    private boolean matchOperator(String operator) {
        if (peek().isOperator(operator)) {
            current++;
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String message) throws SyntaxException {
        if (!check(type)) {
            throw new SyntaxException(message + ", found " + describe(peek()), peek());
        }
        return advance();
    }

    private void expectKeyword(String keyword) throws SyntaxException {
        if (!matchKeyword(keyword)) {
            throw new SyntaxException("Expected " + keyword + ", found " + describe(peek()), peek());
        }
    }
}
