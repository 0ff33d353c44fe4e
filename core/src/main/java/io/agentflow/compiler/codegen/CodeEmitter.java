package io.agentflow.compiler.codegen;

import io.agentflow.compiler.source.SourceSpan;
import io.agentflow.compiler.sourcemap.SourceMapRegistry;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented writer for generated Java. Tracks indentation and the current line number, and
 * records a source mapping for every line emitted with a DSL span. A mapped line is preceded by a
 * {@code // <file>:<line>} comment, which is mapped as well.
 *
 * <p>
 * Not thread-safe.
 */
final class CodeEmitter {

    private static final String INDENT = "    ";

    private final SourceMapRegistry sourceMap;
    private String fileId;
    private final List<String> lines = new ArrayList<>();
    private int depth;

    CodeEmitter(String fileId, SourceMapRegistry sourceMap) {
        this.fileId = fileId;
        this.sourceMap = sourceMap;
    }

    /** Sets the DSL file that subsequent mappings refer to. */
    void originFile(String file) {
        this.fileId = file;
    }

    void emit(String code) {
        lines.add(INDENT.repeat(depth) + code);
    }

    /**
     * Emits a line that originates from DSL source.
     *
     * @param origin the statement's span, or {@code null} for an unmapped line
     */
    void emit(String code, SourceSpan origin) {
        if (origin == null) {
            emit(code);
            return;
        }
        emit("// " + JavaNames.commentText(fileId) + ":" + origin.startLine());
        map(origin);
        emit(code);
        map(origin);
    }

    /** Emits a continuation line of the statement last emitted with {@link #emit(String, SourceSpan)}. */
    void emitMapped(String code, SourceSpan origin) {
        emit(code);
        if (origin != null) {
            map(origin);
        }
    }

    private void map(SourceSpan origin) {
        sourceMap.record(lines.size(), fileId, origin.startLine(), origin.startColumn());
    }

    void blank() {
        lines.add("");
    }

    void indent() {
        depth++;
    }

    void dedent() {
        if (depth > 0) {
            depth--;
        }
    }

    /** Emits {@code header}, indents, and returns so the caller can emit the block body. */
    void open(String header, SourceSpan origin) {
        emit(header + " {", origin);
        indent();
    }

    void open(String header) {
        open(header, null);
    }

    void close() {
        dedent();
        emit("}");
    }

    /** Closes a block and opens the next one on the same line, as in {@code } else {}. */
    void closeAndOpen(String header) {
        dedent();
        emit("} " + header + " {");
        indent();
    }

    int lineCount() {
        return lines.size();
    }

    String code() {
        return String.join("\n", lines) + "\n";
    }
}
