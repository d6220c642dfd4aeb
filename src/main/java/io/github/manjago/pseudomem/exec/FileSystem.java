package io.github.manjago.pseudomem.exec;

import io.github.manjago.pseudomem.core.ProgramException;
import io.github.manjago.pseudomem.lang.FileMode;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory files for OPENFILE, READFILE, WRITEFILE, CLOSEFILE and EOF.
 *
 * <p>Files are line buffers keyed by name. READ content is supplied up front by the
 * embedder; lines written in WRITE/APPEND mode stay available through
 * {@link #getWrittenFiles()} after the file is closed so the embedder can persist them.
 */
public class FileSystem {

    private static final Logger log = LoggerFactory.getLogger(FileSystem.class);

    private final Map<String, Handle> open = new HashMap<>();
    private final Map<String, List<String>> written = new LinkedHashMap<>();

    private static final class Handle {
        final FileMode mode;
        final List<String> lines;
        int position = 0;

        Handle(FileMode mode, List<String> lines) {
            this.mode = mode;
            this.lines = lines;
        }
    }

    /**
     * Open a file.
     *
     * @param content file content for READ mode, ignored otherwise
     * @return the status line to emit
     */
    String open(String name, FileMode mode, @Nullable String content, int line) {
        checkName(name, line);
        if (open.containsKey(name)) {
            throw new ProgramException("File '" + name + "' is already open", line);
        }

        List<String> lines = switch (mode) {
            case READ -> splitLines(content != null ? content : "");
            case WRITE -> new ArrayList<>();
            case APPEND -> new ArrayList<>(written.getOrDefault(name, List.of()));
        };
        open.put(name, new Handle(mode, lines));
        if (mode != FileMode.READ) {
            written.put(name, lines);
        }

        log.debug("Opened '{}' in {} mode ({} lines)", name, mode, lines.size());
        return "Opened file '" + name + "' in " + mode + " mode";
    }

    /**
     * Close a file.
     *
     * @return the status line to emit
     */
    String close(String name, int line) {
        checkName(name, line);
        Handle handle = open.remove(name);
        if (handle == null) {
            throw new ProgramException("File '" + name + "' is not open", line);
        }
        if (handle.mode == FileMode.READ) {
            return "Closed file '" + name + "'";
        }
        return "Closed file '" + name + "' (" + handle.lines.size() + " lines written)";
    }

    String readLine(String name, int line) {
        Handle handle = handle(name, line);
        if (handle.mode != FileMode.READ) {
            throw new ProgramException("File '" + name + "' not opened for reading", line);
        }
        if (handle.position >= handle.lines.size()) {
            throw new ProgramException("Attempt to read past end of file '" + name + "'", line);
        }
        return handle.lines.get(handle.position++);
    }

    void writeLine(String name, String data, int line) {
        Handle handle = handle(name, line);
        if (handle.mode == FileMode.READ) {
            throw new ProgramException("File '" + name + "' not opened for writing", line);
        }
        handle.lines.add(data);
    }

    boolean isAtEnd(String name, int line) {
        Handle handle = handle(name, line);
        if (handle.mode != FileMode.READ) {
            throw new ProgramException("EOF requires file '" + name + "' to be open for reading", line);
        }
        return handle.position >= handle.lines.size();
    }

    public boolean isOpen(String name) {
        return open.containsKey(name);
    }

    /**
     * Lines of every file opened for WRITE or APPEND, open or closed.
     */
    public Map<String, List<String>> getWrittenFiles() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        written.forEach((name, lines) -> copy.put(name, List.copyOf(lines)));
        return Collections.unmodifiableMap(copy);
    }

    private Handle handle(String name, int line) {
        checkName(name, line);
        Handle handle = open.get(name);
        if (handle == null) {
            throw new ProgramException("File '" + name + "' is not open", line);
        }
        return handle;
    }

    private static void checkName(String name, int line) {
        if (name.isEmpty()) {
            throw new ProgramException("File name cannot be empty", line);
        }
    }

    /**
     * Split on line breaks; a single trailing break does not start another line.
     */
    static List<String> splitLines(String content) {
        if (content.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(content.split("\\r?\\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
