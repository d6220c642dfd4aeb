package io.github.manjago.pseudomem.cli;

import io.github.manjago.pseudomem.lang.Parser;
import io.github.manjago.pseudomem.lang.Program;
import io.github.manjago.pseudomem.lang.SyntaxException;
import io.github.manjago.pseudomem.lang.Token;
import io.github.manjago.pseudomem.lang.TokenType;
import io.github.manjago.pseudomem.lang.Tokenizer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: check
 *
 * Tokenizes and parses a program without running it.
 *
 * Usage:
 *   pseudomem check prog.pseudo
 *   pseudomem check prog.pseudo --tokens   (show the token stream)
 */
@Command(
    name = "check",
    description = "Parse a program and report syntax errors",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Program file")
    private Path programFile;

    @Option(names = {"-t", "--tokens"}, description = "Show tokens")
    private boolean showTokens;

    @Override
    public Integer call() {
        try {
            String source = CliSupport.readSource(programFile);
            System.out.println("Checking: " + programFile);

            if (showTokens) {
                List<Token> tokens = new Tokenizer().tokenize(source);
                System.out.println();
                System.out.println("=== Tokens ===");
                for (Token token : tokens) {
                    if (token.type() != TokenType.NEWLINE) {
                        System.out.printf("%4d:%-3d %-10s %s%n",
                            token.line(), token.column(), token.type(), token.text());
                    }
                }
                System.out.println();
            }

            Program program = Parser.parse(source);
            System.out.printf("✓ Parsed %d statements (%d procedures, %d functions)%n",
                program.statements().size(), program.procedures().size(), program.functions().size());
            return CliSupport.EXIT_OK;

        } catch (IOException e) {
            System.err.println("❌ Cannot read " + programFile + ": " + e.getMessage());
            return CliSupport.EXIT_IO;
        } catch (SyntaxException e) {
            System.err.println("❌ Syntax error: " + e.getMessage());
            return CliSupport.EXIT_SYNTAX;
        }
    }
}
