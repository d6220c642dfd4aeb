package io.github.manjago.pseudomem.lang;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static Stmt single(String source) throws SyntaxException {
        List<Stmt> statements = Parser.parse(source).statements();
        assertEquals(1, statements.size(), "expected a single statement");
        return statements.get(0);
    }

    private static Expr outputExpr(String expression) throws SyntaxException {
        Stmt.Output output = (Stmt.Output) single("OUTPUT " + expression);
        return output.values().get(0);
    }

    @Nested
    @DisplayName("Declarations")
    class Declarations {

        @Test
        @DisplayName("Identifier list expands to one declaration per name")
        void identifierList() throws SyntaxException {
            List<Stmt> statements = Parser.parse("DECLARE a, b, c : REAL").statements();
            assertEquals(3, statements.size());
            Stmt.Declare second = (Stmt.Declare) statements.get(1);
            assertEquals("b", second.name());
            assertEquals(DataType.REAL, second.type());
        }

        @Test
        @DisplayName("Two-dimensional array keeps bounds and element type")
        void arrayDeclaration() throws SyntaxException {
            Stmt.Declare declare = (Stmt.Declare) single("DECLARE grid : ARRAY[1:3, 0:4] OF INTEGER");
            assertEquals(DataType.ARRAY, declare.type());
            assertEquals(DataType.INTEGER, declare.elementType());
            assertEquals(2, declare.dimensions().size());
            assertEquals(1, declare.dimensions().get(0).lower());
            assertEquals(4, declare.dimensions().get(1).upper());
        }

        @Test
        @DisplayName("Array bounds must be literals")
        void boundsMustBeLiterals() {
            SyntaxException e = assertThrows(SyntaxException.class,
                    () -> Parser.parse("DECLARE a : ARRAY[1:n] OF INTEGER"));
            assertTrue(e.getMessage().contains("Array bounds must be integer literals"));
        }

        @Test
        @DisplayName("Array bound outside the int range is a syntax error")
        void boundOutOfRange() {
            SyntaxException e = assertThrows(SyntaxException.class,
                    () -> Parser.parse("DECLARE n : INTEGER\nDECLARE a : ARRAY[1:99999999999] OF INTEGER"));
            assertTrue(e.getMessage().contains("Array bound 99999999999 is out of range"));
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("Constant takes a literal value")
        void constant() throws SyntaxException {
            Stmt.Constant constant = (Stmt.Constant) single("CONSTANT Max = 10");
            assertEquals("Max", constant.name());
            assertInstanceOf(Expr.NumberLiteral.class, constant.value());
            assertThrows(SyntaxException.class, () -> Parser.parse("CONSTANT Max = 1 + 2"));
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void precedence() throws SyntaxException {
            Expr.Binary sum = (Expr.Binary) outputExpr("1 + 2 * 3");
            assertEquals(Expr.BinaryOperator.ADD, sum.operator());
            Expr.Binary product = (Expr.Binary) sum.right();
            assertEquals(Expr.BinaryOperator.MULTIPLY, product.operator());
        }

        @Test
        @DisplayName("NOT binds looser than comparison")
        void notOverComparison() throws SyntaxException {
            Expr.Unary not = (Expr.Unary) outputExpr("NOT a = b");
            assertEquals(Expr.UnaryOperator.NOT, not.operator());
            assertInstanceOf(Expr.Binary.class, not.operand());
        }

        @Test
        @DisplayName("Chained comparisons are rejected")
        void chainedComparison() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parser.parse("OUTPUT 1 < 2 < 3"));
            assertTrue(e.getMessage().contains("Comparison operators cannot be chained"));
        }

        @Test
        @DisplayName("Address-of, dereference and MALLOC")
        void pointerExpressions() throws SyntaxException {
            assertInstanceOf(Expr.AddressOf.class, outputExpr("&x"));
            assertInstanceOf(Expr.AddressOf.class, outputExpr("&a[2]"));
            Expr.Dereference deref = (Expr.Dereference) outputExpr("*(p + 1)");
            assertInstanceOf(Expr.Binary.class, deref.pointer());
            assertInstanceOf(Expr.Allocation.class, outputExpr("MALLOC(4)"));
            assertEquals(DataType.REAL, ((Expr.SizeOf) outputExpr("SIZE_OF(REAL)")).type());
        }

        @Test
        @DisplayName("MALLOC with two arguments is rejected")
        void mallocArity() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parser.parse("p <-- MALLOC(1, 2)"));
            assertTrue(e.getMessage().contains("MALLOC takes exactly one argument"));
        }

        @Test
        @DisplayName("Address-of needs a variable")
        void addressOfLiteral() {
            assertThrows(SyntaxException.class, () -> Parser.parse("p <-- &5"));
        }

        @Test
        @DisplayName("Hex literal value")
        void hexLiteral() throws SyntaxException {
            assertEquals(255.0, ((Expr.NumberLiteral) outputExpr("0xFF")).value());
        }

        @Test
        @DisplayName("Hex literal wider than 64 bits becomes a large number")
        void wideHexLiteral() throws SyntaxException {
            List<Stmt> statements = Parser.parse("DECLARE x : INTEGER\nx <-- 0xFFFFFFFFFFFFFFFFFF\n").statements();
            Stmt.Assign assign = (Stmt.Assign) statements.get(1);
            assertEquals(Math.pow(2, 72), ((Expr.NumberLiteral) assign.value()).value());
        }

        @Test
        @DisplayName("Type keywords used as conversion calls")
        void conversionCalls() throws SyntaxException {
            Expr.FunctionCall call = (Expr.FunctionCall) outputExpr("STRING(42)");
            assertEquals("STRING", call.name());
            assertEquals(1, call.arguments().size());
        }
    }

    @Nested
    @DisplayName("Control flow")
    class ControlFlow {

        @Test
        @DisplayName("IF with ELSE IF and ELSE")
        void ifChain() throws SyntaxException {
            Stmt.If stmt = (Stmt.If) single("""
                    IF x > 1 THEN
                        OUTPUT 1
                    ELSE IF x > 0 THEN
                        OUTPUT 2
                    ELSE
                        OUTPUT 3
                    ENDIF
                    """);
            assertEquals(1, stmt.thenBranch().size());
            assertEquals(1, stmt.elseIfs().size());
            assertNotNull(stmt.elseBranch());
        }

        @Test
        @DisplayName("FOR with STEP and matching NEXT")
        void forLoop() throws SyntaxException {
            Stmt.For loop = (Stmt.For) single("""
                    FOR i <-- 10 TO 1 STEP -2
                        OUTPUT i
                    NEXT i
                    """);
            assertEquals("i", loop.variable());
            assertNotNull(loop.step());
            assertEquals(1, loop.body().size());
        }

        @Test
        @DisplayName("NEXT must name the loop variable")
        void nextMismatch() {
            assertThrows(SyntaxException.class, () -> Parser.parse("""
                    FOR i <-- 1 TO 3
                        OUTPUT i
                    NEXT j
                    """));
        }

        @Test
        @DisplayName("CASE with ranges and OTHERWISE")
        void caseStatement() throws SyntaxException {
            Stmt.Case stmt = (Stmt.Case) single("""
                    CASE OF score
                        90 TO 100 : OUTPUT "A"
                        50 : OUTPUT "exactly fifty"
                        OTHERWISE : OUTPUT "other"
                    ENDCASE
                    """);
            assertEquals(2, stmt.branches().size());
            assertNotNull(stmt.branches().get(0).rangeEnd());
            assertNull(stmt.branches().get(1).rangeEnd());
            assertNotNull(stmt.otherwise());
        }

        @Test
        @DisplayName("Missing ENDIF reports the line")
        void missingEndIf() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> Parser.parse("""
                    IF TRUE THEN
                        OUTPUT 1
                    """));
            assertTrue(e.getLine() >= 2);
        }

        @Test
        @DisplayName("Comments are ignored")
        void comments() throws SyntaxException {
            List<Stmt> statements = Parser.parse("""
                    // heading
                    DECLARE x : INTEGER // trailing
                    x <-- 1
                    """).statements();
            assertEquals(2, statements.size());
            assertEquals(3, statements.get(1).line());
        }
    }

    @Nested
    @DisplayName("Procedures and functions")
    class Subroutines {

        @Test
        @DisplayName("Procedure with BYREF and BYVAL parameters")
        void procedure() throws SyntaxException {
            Stmt.Procedure procedure = (Stmt.Procedure) single("""
                    PROCEDURE Swap(BYREF a : INTEGER, BYVAL b : INTEGER)
                        a <-- b
                    ENDPROCEDURE
                    """);
            assertEquals("Swap", procedure.name());
            assertTrue(procedure.parameters().get(0).byRef());
            assertFalse(procedure.parameters().get(1).byRef());
        }

        @Test
        @DisplayName("Procedure and call without parentheses")
        void bareProcedure() throws SyntaxException {
            Program program = Parser.parse("""
                    PROCEDURE Greet
                        OUTPUT "hi"
                    ENDPROCEDURE
                    CALL Greet
                    """);
            assertEquals(1, program.procedures().size());
            Stmt.Call call = (Stmt.Call) program.statements().get(1);
            assertTrue(call.arguments().isEmpty());
        }

        @Test
        @DisplayName("Function with array parameter and return type")
        void function() throws SyntaxException {
            Stmt.Function function = (Stmt.Function) single("""
                    FUNCTION Total(values : ARRAY OF INTEGER) RETURNS INTEGER
                        RETURN 0
                    ENDFUNCTION
                    """);
            assertEquals(DataType.INTEGER, function.returnType());
            Parameter parameter = function.parameters().get(0);
            assertEquals(DataType.ARRAY, parameter.type());
            assertEquals(DataType.INTEGER, parameter.elementType());
        }
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("Assignment through a pointer")
        void dereferenceAssignment() throws SyntaxException {
            Stmt.Assign assign = (Stmt.Assign) single("*p <-- 5");
            assertInstanceOf(Expr.Dereference.class, assign.target());
        }

        @Test
        @DisplayName("File statements")
        void fileStatements() throws SyntaxException {
            List<Stmt> statements = Parser.parse("""
                    OPENFILE "out.txt" FOR APPEND
                    WRITEFILE "out.txt", "line"
                    READFILE "in.txt", text
                    CLOSEFILE "out.txt"
                    """).statements();
            assertEquals(FileMode.APPEND, ((Stmt.OpenFile) statements.get(0)).mode());
            assertInstanceOf(Stmt.WriteFile.class, statements.get(1));
            assertInstanceOf(Stmt.ReadFile.class, statements.get(2));
            assertInstanceOf(Stmt.CloseFile.class, statements.get(3));
        }

        @Test
        @DisplayName("Two statements on one line are rejected")
        void trailingTokens() {
            assertThrows(SyntaxException.class, () -> Parser.parse("OUTPUT 1 OUTPUT 2"));
        }
    }
}
