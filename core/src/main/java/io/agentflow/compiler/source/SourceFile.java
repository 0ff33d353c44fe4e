package io.agentflow.compiler.source;

import java.util.List;
import java.util.Objects;

/**
 * DSL source text together with the identifier it is reported under. Line access is used by the
 * diagnostic reporter to print excerpts.
 */
public final class SourceFile {

    private final String fileId;
    private final String text;
    private final List<String> lines;

    public SourceFile(String fileId, String text) {
        this.fileId = Objects.requireNonNull(fileId, "fileId must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.lines = List.of(text.split("\r?\n", -1));
    }

    public String fileId() {
        return fileId;
    }

    public String text() {
        return text;
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Returns one line without its terminator.
     *
     * @param line 1-based line number
     * @return the line, or an empty string when out of range
     */
    public String line(int line) {
        if (line < 1 || line > lines.size()) {
            return "";
        }
        return lines.get(line - 1);
    }
}
