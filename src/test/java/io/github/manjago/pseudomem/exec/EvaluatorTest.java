package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.config.InterpreterConfig;
import io.github.manjago.pseudomem.core.MemoryFault;
import io.github.manjago.pseudomem.core.MemoryFaultException;
import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.lang.Parser;
import io.github.manjago.pseudomem.lang.SyntaxException;
import io.github.manjago.pseudomem.trace.TraceOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest {

    private InterpreterConfig config;
    private Evaluator evaluator;
    private ProgramRun lastRun;

    @BeforeEach
    void setUp() {
        config = InterpreterConfig.builder().randomSeed(42).build();
        evaluator = new Evaluator(config);
    }

    private List<String> run(String source, String... inputs) throws SyntaxException {
        return run(source, ExecutionOptions.builder(config).inputHandler(InputHandler.scripted(inputs)).build());
    }

    private List<String> run(String source, ExecutionOptions options) throws SyntaxException {
        lastRun = evaluator.executeProgram(Parser.parse(source), options);
        List<String> output = new ArrayList<>();
        lastRun.forEachRemaining(output::add);
        return output;
    }

    private ProgramException runFailing(String source) {
        return assertThrows(ProgramException.class, () -> run(source));
    }

    private void useConfig(InterpreterConfig newConfig) {
        config = newConfig;
        evaluator = new Evaluator(newConfig);
    }

    @Nested
    @DisplayName("FOR loops")
    class ForLoops {

        @Test
        @DisplayName("Counts up inclusively")
        void countsUp() throws SyntaxException {
            assertEquals(List.of("1", "2", "3", "4", "5"), run("""
                    FOR i <-- 1 TO 5 STEP 1
                        OUTPUT i
                    NEXT i
                    """));
        }

        @Test
        @DisplayName("Fractional negative step is floored")
        void negativeFractionalStep() throws SyntaxException {
            assertEquals(List.of("5", "3", "1"), run("""
                    FOR i <-- 5 TO 1 STEP -1.5
                        OUTPUT i
                    NEXT i
                    """));
        }

        @Test
        @DisplayName("Fractional positive step is floored")
        void positiveFractionalStep() throws SyntaxException {
            assertEquals(List.of("1", "2", "3", "4", "5"), run("""
                    FOR i <-- 1 TO 5 STEP 1.5
                        OUTPUT i
                    NEXT i
                    """));
        }

        @Test
        @DisplayName("Step below one never advances and hits the iteration budget")
        void stepBelowOne() {
            ProgramException e = runFailing("""
                    FOR i <-- 1 TO 5 STEP 0.5
                        OUTPUT i
                    NEXT i
                    """);
            assertTrue(e.getMessage().contains("Execution timeout"));
        }

        @Test
        @DisplayName("Zero step is an error")
        void zeroStep() {
            ProgramException e = runFailing("""
                    FOR i <-- 1 TO 5 STEP 0
                        OUTPUT i
                    NEXT i
                    """);
            assertTrue(e.getMessage().contains("FOR loop STEP cannot be zero"));
        }

        @Test
        @DisplayName("Bounds are evaluated once")
        void boundsEvaluatedOnce() throws SyntaxException {
            assertEquals(List.of("1", "2", "3"), run("""
                    DECLARE n : INTEGER
                    n <-- 3
                    FOR i <-- 1 TO n
                        n <-- 10
                        OUTPUT i
                    NEXT i
                    """));
        }

        @Test
        @DisplayName("Loop variable is declared on first use and keeps its final value")
        void loopVariableAfterLoop() throws SyntaxException {
            assertEquals(List.of("4"), run("""
                    FOR i <-- 1 TO 3
                    NEXT
                    OUTPUT i
                    """));
        }

        @Test
        @DisplayName("String loop variable is rejected")
        void stringLoopVariable() {
            ProgramException e = runFailing("""
                    DECLARE s : STRING
                    FOR s <-- 1 TO 3
                    NEXT s
                    """);
            assertTrue(e.getMessage().contains("must be INTEGER or REAL"));
        }
    }

    @Nested
    @DisplayName("Other control flow")
    class ControlFlow {

        @Test
        @DisplayName("WHILE checks before, REPEAT after")
        void whileAndRepeat() throws SyntaxException {
            assertEquals(List.of("0", "1", "2", "10"), run("""
                    DECLARE n : INTEGER
                    n <-- 0
                    WHILE n < 3 DO
                        OUTPUT n
                        n <-- n + 1
                    ENDWHILE
                    n <-- 10
                    REPEAT
                        OUTPUT n
                    UNTIL n >= 3
                    """));
        }

        @Test
        @DisplayName("ELSE IF picks the first true condition")
        void elseIf() throws SyntaxException {
            assertEquals(List.of("middle"), run("""
                    DECLARE x : INTEGER
                    x <-- 5
                    IF x > 10 THEN
                        OUTPUT "high"
                    ELSE IF x > 1 THEN
                        OUTPUT "middle"
                    ELSE
                        OUTPUT "low"
                    ENDIF
                    """));
        }

        @Test
        @DisplayName("Non-boolean condition is an error")
        void nonBooleanCondition() {
            ProgramException e = runFailing("""
                    IF 1 THEN
                        OUTPUT 1
                    ENDIF
                    """);
            assertTrue(e.getMessage().contains("IF condition must be a boolean"));
        }

        @ParameterizedTest(name = "score {0} -> {1}")
        @CsvSource({"50, C", "59, C", "60, B", "69, B", "49, other", "70, other"})
        @DisplayName("CASE ranges are inclusive at both ends")
        void caseRanges(int score, String grade) throws SyntaxException {
            assertEquals(List.of(grade), run("""
                    DECLARE m : INTEGER
                    m <-- %d
                    CASE OF m
                        50 TO 59 : OUTPUT "C"
                        60 TO 69 : OUTPUT "B"
                        OTHERWISE : OUTPUT "other"
                    ENDCASE
                    """.formatted(score)));
        }

        @Test
        @DisplayName("CASE on strings compares exactly")
        void caseOnStrings() throws SyntaxException {
            assertEquals(List.of("2"), run("""
                    DECLARE s : STRING
                    s <-- "b"
                    CASE OF s
                        "a" : OUTPUT 1
                        "b" : OUTPUT 2
                    ENDCASE
                    """));
        }

        @Test
        @DisplayName("Iteration budget counts every statement")
        void iterationBudget() throws SyntaxException {
            useConfig(config.toBuilder().maxIterations(3).build());
            assertEquals(List.of("1", "2", "3"), run("OUTPUT 1\nOUTPUT 2\nOUTPUT 3\n"));

            useConfig(config.toBuilder().maxIterations(3).build());
            ProgramException e = runFailing("OUTPUT 1\nOUTPUT 2\nOUTPUT 3\nOUTPUT 4\n");
            assertTrue(e.getMessage().contains("more than 3 iterations"));
            assertEquals(4, e.getLine());
        }

        @Test
        @DisplayName("Empty infinite loop times out")
        void emptyInfiniteLoop() {
            ProgramException e = runFailing("""
                    WHILE TRUE DO
                    ENDWHILE
                    """);
            assertTrue(e.getMessage().contains("Execution timeout"));
        }
    }

    @Nested
    @DisplayName("Pointers and heap")
    class Pointers {

        @Test
        @DisplayName("Copied pointer writes through to the original variable")
        void aliasing() throws SyntaxException {
            assertEquals(List.of("42", "42"), run("""
                    DECLARE x : INTEGER
                    DECLARE p : POINTER_TO_INTEGER
                    DECLARE q : POINTER_TO_INTEGER
                    x <-- 1
                    p <-- &x
                    q <-- p
                    *q <-- 42
                    OUTPUT x
                    OUTPUT *p
                    """));
            assertFalse(evaluator.getTrace().getVariableTrace("p").isEmpty());
            assertEquals(1, evaluator.getTrace().getStatistics().count(TraceOperation.ADDRESS_OF));
        }

        @Test
        @DisplayName("Pointer arithmetic walks array elements")
        void arrayPointerArithmetic() throws SyntaxException {
            assertEquals(List.of("30", "99"), run("""
                    DECLARE a : ARRAY[1:3] OF INTEGER
                    DECLARE p : POINTER_TO_INTEGER
                    a[1] <-- 10
                    a[2] <-- 20
                    a[3] <-- 30
                    p <-- &a[1]
                    OUTPUT *(p + 2)
                    *(p + 1) <-- 99
                    OUTPUT a[2]
                    """));
        }

        @Test
        @DisplayName("MALLOC block is usable until freed")
        void mallocAndFree() {
            List<String> output = new ArrayList<>();
            MemoryFaultException e = assertThrows(MemoryFaultException.class, () -> {
                ProgramRun run = evaluator.executeProgram(Parser.parse("""
                        DECLARE p : POINTER_TO_INTEGER
                        p <-- MALLOC(2)
                        *p <-- 5
                        *(p + 1) <-- 6
                        OUTPUT *p + *(p + 1)
                        FREE p
                        OUTPUT *p
                        """), ExecutionOptions.defaults(config));
                run.forEachRemaining(output::add);
            });
            assertEquals(List.of("11"), output);
            assertEquals(MemoryFault.NOT_ALLOCATED, e.getFault());
            assertEquals(7, e.getLine());
        }

        @Test
        @DisplayName("Double free is reported")
        void doubleFree() {
            ProgramException e = runFailing("""
                    DECLARE p : POINTER_TO_INTEGER
                    p <-- MALLOC(1)
                    FREE p
                    FREE p
                    """);
            assertInstanceOf(MemoryFaultException.class, e);
            assertEquals(MemoryFault.INVALID_FREE, ((MemoryFaultException) e).getFault());
        }

        @ParameterizedTest
        @CsvSource({"2147483647", "1000000000000"})
        @DisplayName("Oversized MALLOC is a memory fault")
        void oversizedMalloc(String size) {
            ProgramException e = runFailing("DECLARE p : POINTER_TO_INTEGER\np <-- MALLOC(" + size + ")\n");
            assertInstanceOf(MemoryFaultException.class, e);
            assertEquals(MemoryFault.EXHAUSTED, ((MemoryFaultException) e).getFault());
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("Array larger than memory is a memory fault at its declaration")
        void oversizedArray() {
            ProgramException e = runFailing("""
                    DECLARE n : INTEGER
                    DECLARE a : ARRAY[1:2147483000] OF INTEGER
                    """);
            assertInstanceOf(MemoryFaultException.class, e);
            assertEquals(MemoryFault.EXHAUSTED, ((MemoryFaultException) e).getFault());
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("Array whose element count overflows is rejected")
        void arrayCountOverflow() {
            ProgramException e = runFailing("DECLARE a : ARRAY[-2000000000:2000000000] OF INTEGER");
            assertTrue(e.getMessage().contains("Array 'a' is too large"));
        }

        @Test
        @DisplayName("Pointer arithmetic beyond the address range faults instead of wrapping")
        void pointerArithmeticOverflow() {
            ProgramException e = runFailing("""
                    DECLARE x : INTEGER
                    DECLARE p : POINTER_TO_INTEGER
                    p <-- &x
                    p <-- p + 2147483647
                    """);
            assertInstanceOf(MemoryFaultException.class, e);
            assertEquals(MemoryFault.OUT_OF_BOUNDS, ((MemoryFaultException) e).getFault());
            assertEquals(4, e.getLine());
            assertTrue(e.getMessage().contains("Pointer arithmetic out of range"));
        }

        @Test
        @DisplayName("Freeing a variable's storage makes the variable unusable")
        void freeVariableStorage() {
            ProgramException e = runFailing("""
                    DECLARE x : INTEGER
                    x <-- 1
                    FREE &x
                    OUTPUT x
                    """);
            assertInstanceOf(MemoryFaultException.class, e);
            assertEquals(4, e.getLine());
        }

        @Test
        @DisplayName("Pointer cannot hold a string")
        void pointerTypeMismatch() {
            ProgramException e = runFailing("""
                    DECLARE p : POINTER_TO_INTEGER
                    p <-- "abc"
                    """);
            assertTrue(e.getMessage().contains("Type mismatch"));
        }
    }

    @Nested
    @DisplayName("Procedures and functions")
    class Calls {

        @Test
        @DisplayName("BYREF changes the caller's variable, BYVAL does not")
        void byRefAndByVal() throws SyntaxException {
            assertEquals(List.of("2 1"), run("""
                    PROCEDURE Bump(BYREF n : INTEGER, BYVAL m : INTEGER)
                        n <-- n + 1
                        m <-- m + 1
                    ENDPROCEDURE
                    DECLARE a : INTEGER
                    DECLARE b : INTEGER
                    a <-- 1
                    b <-- 1
                    CALL Bump(a, b)
                    OUTPUT a, b
                    """));
        }

        @Test
        @DisplayName("BYREF argument must be a variable")
        void byRefNeedsVariable() {
            ProgramException e = runFailing("""
                    PROCEDURE Bump(BYREF n : INTEGER)
                        n <-- n + 1
                    ENDPROCEDURE
                    CALL Bump(1)
                    """);
            assertTrue(e.getMessage().contains("must be a variable name"));
        }

        @Test
        @DisplayName("Argument count is checked")
        void argumentCount() {
            ProgramException e = runFailing("""
                    PROCEDURE Two(a : INTEGER, b : INTEGER)
                        OUTPUT a
                    ENDPROCEDURE
                    CALL Two(1)
                    """);
            assertTrue(e.getMessage().contains(
                    "Incorrect number of arguments for procedure 'Two': expected 2, got 1"));
        }

        @Test
        @DisplayName("Array parameters receive a copy")
        void arrayCopy() throws SyntaxException {
            assertEquals(List.of("5"), run("""
                    PROCEDURE Zero(arr : ARRAY OF INTEGER)
                        arr[1] <-- 0
                    ENDPROCEDURE
                    DECLARE xs : ARRAY[1:2] OF INTEGER
                    xs[1] <-- 5
                    xs[2] <-- 6
                    CALL Zero(xs)
                    OUTPUT xs[1]
                    """));
        }

        @Test
        @DisplayName("Recursive function")
        void recursiveFunction() throws SyntaxException {
            assertEquals(List.of("120"), run("""
                    FUNCTION Fact(n : INTEGER) RETURNS INTEGER
                        IF n <= 1 THEN
                            RETURN 1
                        ENDIF
                        RETURN n * Fact(n - 1)
                    ENDFUNCTION
                    OUTPUT Fact(5)
                    """));
        }

        @Test
        @DisplayName("OUTPUT inside a function is an error")
        void outputInFunction() {
            ProgramException e = runFailing("""
                    FUNCTION Loud() RETURNS INTEGER
                        OUTPUT "hi"
                        RETURN 1
                    ENDFUNCTION
                    DECLARE x : INTEGER
                    x <-- Loud()
                    """);
            assertTrue(e.getMessage().contains("OUTPUT is not allowed inside function 'Loud'"));
        }

        @Test
        @DisplayName("Function that falls off the end")
        void missingReturn() {
            ProgramException e = runFailing("""
                    FUNCTION Nothing() RETURNS INTEGER
                        DECLARE x : INTEGER
                    ENDFUNCTION
                    OUTPUT Nothing()
                    """);
            assertTrue(e.getMessage().contains("Function 'Nothing' did not return a value"));
        }

        @Test
        @DisplayName("Return type is checked")
        void returnType() {
            ProgramException e = runFailing("""
                    FUNCTION Name() RETURNS STRING
                        RETURN 5
                    ENDFUNCTION
                    OUTPUT Name()
                    """);
            assertTrue(e.getMessage().contains("Function 'Name' must return STRING"));
        }

        @Test
        @DisplayName("RETURN in the main program is an error")
        void returnOutsideFunction() {
            ProgramException e = runFailing("RETURN 1\n");
            assertTrue(e.getMessage().contains("RETURN is only allowed inside a function"));
        }

        @Test
        @DisplayName("Unknown procedure")
        void unknownProcedure() {
            ProgramException e = runFailing("CALL Missing\n");
            assertTrue(e.getMessage().contains("Procedure 'Missing' not defined"));
        }

        @Test
        @DisplayName("Recursion stops exactly at the configured depth")
        void recursionCeiling() {
            useConfig(config.toBuilder().maxRecursionDepth(50).build());
            AtomicInteger deepest = new AtomicInteger();
            evaluator.setListener(new ExecutionListener() {
                @Override
                public void onCallEnter(CallStackFrame frame, int depth) {
                    deepest.accumulateAndGet(depth, Math::max);
                }
            });

            ProgramException e = runFailing("""
                    PROCEDURE Down(n : INTEGER)
                        CALL Down(n + 1)
                    ENDPROCEDURE
                    CALL Down(1)
                    """);
            assertTrue(e.getMessage().contains("Maximum recursion depth exceeded (50)"));
            assertEquals(50, deepest.get());
        }

        @Test
        @DisplayName("Locals are freed when a procedure returns")
        void localsReleased() throws SyntaxException {
            run("""
                    DECLARE g : INTEGER
                    PROCEDURE P
                        DECLARE local : INTEGER
                        local <-- 1
                    ENDPROCEDURE
                    CALL P
                    CALL P
                    """);
            assertEquals(1, evaluator.getMemory().getAllocations().size());
            assertEquals(2, evaluator.getTrace().getStatistics().frees());
        }

        @Test
        @DisplayName("Local declaration shadows a global")
        void shadowing() throws SyntaxException {
            assertEquals(List.of("local", "global"), run("""
                    DECLARE x : STRING
                    x <-- "global"
                    PROCEDURE Show
                        DECLARE x : STRING
                        x <-- "local"
                        OUTPUT x
                    ENDPROCEDURE
                    CALL Show
                    OUTPUT x
                    """));
        }
    }

    @Nested
    @DisplayName("Variables and types")
    class Variables {

        @Test
        @DisplayName("Reading before assignment is an error")
        void uninitialized() {
            ProgramException e = runFailing("""
                    DECLARE x : INTEGER
                    OUTPUT x
                    """);
            assertTrue(e.getMessage().contains("Variable 'x' used before assignment"));
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("Unassigned array element names its subscript")
        void uninitializedElement() {
            ProgramException e = runFailing("""
                    DECLARE a : ARRAY[1:3] OF INTEGER
                    a[1] <-- 1
                    OUTPUT a[2]
                    """);
            assertTrue(e.getMessage().contains("Array element a[2] accessed before assignment"));
        }

        @Test
        @DisplayName("Undeclared variable")
        void undeclared() {
            ProgramException e = runFailing("y <-- 1\n");
            assertTrue(e.getMessage().contains("Variable 'y' not declared"));
        }

        @Test
        @DisplayName("Array index out of bounds")
        void indexOutOfBounds() {
            ProgramException e = runFailing("""
                    DECLARE a : ARRAY[1:3] OF INTEGER
                    a[4] <-- 1
                    """);
            assertTrue(e.getMessage().contains("Array index out of bounds"));
        }

        @Test
        @DisplayName("Strict assignment typing")
        void typeMismatch() {
            ProgramException e = runFailing("""
                    DECLARE x : INTEGER
                    x <-- "hi"
                    """);
            assertTrue(e.getMessage().contains("Type mismatch"));
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("Constants cannot be reassigned")
        void constants() {
            List<String> output = new ArrayList<>();
            ProgramException e = assertThrows(ProgramException.class, () -> {
                ProgramRun run = evaluator.executeProgram(Parser.parse("""
                        CONSTANT Pi = 3.14
                        OUTPUT Pi
                        Pi <-- 3
                        """), ExecutionOptions.defaults(config));
                run.forEachRemaining(output::add);
            });
            assertEquals(List.of("3.14"), output);
            assertTrue(e.getMessage().contains("Cannot assign to constant 'Pi'"));
        }

        @Test
        @DisplayName("Redeclaration in the same scope")
        void redeclaration() {
            ProgramException e = runFailing("""
                    DECLARE x : INTEGER
                    DECLARE x : REAL
                    """);
            assertTrue(e.getMessage().contains("Variable 'x' already declared"));
        }

        @Test
        @DisplayName("Two-dimensional arrays")
        void twoDimensional() throws SyntaxException {
            assertEquals(List.of("7"), run("""
                    DECLARE grid : ARRAY[1:2, 1:3] OF INTEGER
                    grid[2, 3] <-- 7
                    OUTPUT grid[2, 3]
                    """));
        }
    }

    @Nested
    @DisplayName("Expressions and built-ins")
    class Expressions {

        @Test
        @DisplayName("Arithmetic operators")
        void arithmetic() throws SyntaxException {
            assertEquals(List.of("3 1 3.5 -6"), run("OUTPUT 7 DIV 2, 7 MOD 2, 7 / 2, -2 * 3\n"));
        }

        @Test
        @DisplayName("Division by zero carries the line")
        void divisionByZero() {
            ProgramException e = runFailing("""
                    DECLARE x : INTEGER
                    x <-- 0
                    OUTPUT 1 / x
                    """);
            assertTrue(e.getMessage().contains("Division by zero"));
            assertEquals(3, e.getLine());
            assertTrue(e.getMessage().startsWith("Runtime error at line 3"));
        }

        @Test
        @DisplayName("String built-ins and concatenation")
        void strings() throws SyntaxException {
            assertEquals(List.of("5 AB ell ab"), run(
                    "OUTPUT LENGTH(\"hello\"), UCASE(\"ab\"), SUBSTRING(\"hello\", 2, 3), \"a\" & \"b\"\n"));
        }

        @Test
        @DisplayName("Numeric conversions")
        void conversions() throws SyntaxException {
            assertEquals(List.of("3 3.14 2.5 42"), run(
                    "OUTPUT INT(3.7), ROUND(3.14159, 2), REAL(\"2.5\"), STRING(42)\n"));
        }

        @Test
        @DisplayName("Boolean logic")
        void logic() throws SyntaxException {
            assertEquals(List.of("TRUE FALSE TRUE"), run("OUTPUT TRUE OR FALSE, NOT TRUE, 1 < 2 AND 2 <= 2\n"));
        }

        @Test
        @DisplayName("Same seed gives the same RANDOM sequence")
        void seededRandom() throws SyntaxException {
            String source = "OUTPUT RANDOM()\nOUTPUT RANDOM()\n";
            List<String> first = run(source);
            useConfig(config);
            List<String> second = run(source);
            assertEquals(first, second);
            double value = Double.parseDouble(first.get(0));
            assertTrue(value >= 0 && value < 1);
            assertEquals(42, lastRun.getSession().getRandomSeed());
        }
    }

    @Nested
    @DisplayName("Input")
    class Input {

        @Test
        @DisplayName("Input is converted to the target type and echoed")
        void inputConversion() throws SyntaxException {
            assertEquals(List.of("21abc", "Ann", "42 Ann"), run("""
                    DECLARE n : INTEGER
                    DECLARE name : STRING
                    INPUT n
                    INPUT name
                    OUTPUT n * 2, name
                    """, "21abc", "Ann"));
        }

        @Test
        @DisplayName("Input into an array element")
        void inputElement() throws SyntaxException {
            assertEquals(List.of("7", "7"), run("""
                    DECLARE a : ARRAY[1:2] OF INTEGER
                    INPUT a[2]
                    OUTPUT a[2]
                    """, "7"));
        }

        @Test
        @DisplayName("Failing input handler fails the run")
        void handlerFailure() {
            ProgramException e = runFailing("""
                    DECLARE n : INTEGER
                    INPUT n
                    """);
            assertTrue(e.getMessage().contains("No input left for 'n'"));
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("Cancelled input stops the run quietly")
        void cancelledInput() throws SyntaxException {
            InputHandler cancelling = (name, type) -> {
                CompletableFuture<String> future = new CompletableFuture<>();
                future.cancel(true);
                return future;
            };
            List<String> output = run("""
                    DECLARE n : INTEGER
                    OUTPUT "before"
                    INPUT n
                    OUTPUT "after"
                    """, ExecutionOptions.builder(config).inputHandler(cancelling).build());
            assertEquals(List.of("before"), output);
            assertEquals(SessionState.CANCELLED, lastRun.getSession().getState());
        }
    }

    @Nested
    @DisplayName("Files")
    class Files {

        @Test
        @DisplayName("Writes are echoed and kept")
        void writeFile() throws SyntaxException {
            assertEquals(List.of(
                    "Opened file 'data.txt' in WRITE mode",
                    "[Write to data.txt] line1",
                    "[Write to data.txt] 42",
                    "Closed file 'data.txt' (2 lines written)"), run("""
                    OPENFILE "data.txt" FOR WRITE
                    WRITEFILE "data.txt", "line1"
                    WRITEFILE "data.txt", 42
                    CLOSEFILE "data.txt"
                    """));
            assertEquals(List.of("line1", "42"),
                    lastRun.getSession().getFiles().getWrittenFiles().get("data.txt"));
        }

        @Test
        @DisplayName("Echo can be switched off")
        void noEcho() throws SyntaxException {
            List<String> output = run("""
                    OPENFILE "data.txt" FOR WRITE
                    WRITEFILE "data.txt", "hidden"
                    CLOSEFILE "data.txt"
                    """, ExecutionOptions.builder(config).echoFileWrites(false).build());
            assertEquals(2, output.size());
            assertTrue(output.stream().noneMatch(line -> line.startsWith("[Write to")));
        }

        @Test
        @DisplayName("Append continues an earlier write")
        void append() throws SyntaxException {
            run("""
                    OPENFILE "log.txt" FOR WRITE
                    WRITEFILE "log.txt", "a"
                    CLOSEFILE "log.txt"
                    OPENFILE "log.txt" FOR APPEND
                    WRITEFILE "log.txt", "b"
                    CLOSEFILE "log.txt"
                    """);
            assertEquals(List.of("a", "b"), lastRun.getSession().getFiles().getWrittenFiles().get("log.txt"));
        }

        @Test
        @DisplayName("Reading lines until EOF")
        void readUntilEof() throws SyntaxException {
            FileReadHandler files = name -> CompletableFuture.completedFuture("a\nb\n");
            assertEquals(List.of("Opened file 'in.txt' in READ mode", "a", "b", "Closed file 'in.txt'"), run("""
                    DECLARE line : STRING
                    OPENFILE "in.txt" FOR READ
                    WHILE NOT EOF("in.txt") DO
                        READFILE "in.txt", line
                        OUTPUT line
                    ENDWHILE
                    CLOSEFILE "in.txt"
                    """, ExecutionOptions.builder(config).fileReadHandler(files).build()));
        }

        @Test
        @DisplayName("Reading without a file handler fails")
        void noFileHandler() {
            ProgramException e = runFailing("OPENFILE \"in.txt\" FOR READ\n");
            assertTrue(e.getMessage().contains("no file read handler"));
        }

        @Test
        @DisplayName("Writing to a file that is not open")
        void notOpen() {
            ProgramException e = runFailing("WRITEFILE \"x.txt\", 1\n");
            assertTrue(e.getMessage().contains("File 'x.txt' is not open"));
        }
    }

    @Test
    @DisplayName("An evaluator runs one program only")
    void singleUse() throws SyntaxException {
        run("OUTPUT 1\n");
        assertThrows(IllegalStateException.class, () -> evaluator.start(Parser.parse("OUTPUT 2\n")));
    }
}
