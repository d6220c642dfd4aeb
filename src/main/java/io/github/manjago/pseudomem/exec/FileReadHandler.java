package io.github.manjago.pseudomem.exec;

import java.util.concurrent.CompletionStage;

/**
 * Supplies file content for OPENFILE ... FOR READ.
 */
@FunctionalInterface
public interface FileReadHandler {

    CompletionStage<String> readFile(String filename);
}
