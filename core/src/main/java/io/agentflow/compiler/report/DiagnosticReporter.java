package io.agentflow.compiler.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.model.CompilationResult;
import io.agentflow.compiler.model.CompilationStats;
import io.agentflow.compiler.source.SourceFile;
import io.agentflow.compiler.source.SourceSpan;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link CompilationResult} for people or for tools.
 *
 * <p>
 * Human output follows rustc: a {@code severity[code]: message} header, a {@code -->} location
 * with a 1-based column, the offending source line between context lines with a caret underline,
 * then help and notes for secondary labels. Every diagnostic is followed by one summary line for
 * the file. Output is deterministic and always uses {@code \n} line endings.
 *
 * <p>
 * Thread-safe: instances hold only configuration.
 */
public final class DiagnosticReporter {

    static final String JSON_VERSION = "1.0";

    private static final int GUTTER_WIDTH = 5;
    private static final String BLANK_GUTTER = " ".repeat(GUTTER_WIDTH) + "|";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER;

    static {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter);
        JSON_WRITER = MAPPER.writer(printer);
    }

    private final int contextLines;

    /** @param contextLines source lines shown before and after the offending line */
    public DiagnosticReporter(int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must not be negative: " + contextLines);
        }
        this.contextLines = contextLines;
    }

    public DiagnosticReporter() {
        this(1);
    }

    public String render(CompilationResult result, ReportFormat format) {
        switch (format) {
            case JSON:
                return json(result);
            case HUMAN:
            default:
                return human(result);
        }
    }

    // ── Human ──

    public String human(CompilationResult result) {
        StringBuilder out = new StringBuilder();
        List<Diagnostic> diagnostics = result.diagnostics();
        for (int i = 0; i < diagnostics.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(format(diagnostics.get(i), result));
        }
        if (!diagnostics.isEmpty()) {
            out.append('\n');
        }
        out.append(summary(result)).append('\n');
        return out.toString();
    }

    /** One diagnostic without the summary line. */
    public String format(Diagnostic diagnostic, CompilationResult result) {
        StringBuilder out = new StringBuilder();
        out.append(diagnostic.severity().label())
                .append('[').append(diagnostic.code().code()).append("]: ")
                .append(diagnostic.message()).append('\n');
        if (diagnostic.span() == null) {
            out.append("  --> ").append(diagnostic.file()).append('\n');
        } else {
            out.append("  --> ").append(location(diagnostic.file(), diagnostic.span())).append('\n');
            sourceContext(out, diagnostic.span(), result.source(diagnostic.file()).orElse(null));
        }
        if (diagnostic.help() != null) {
            out.append(" ".repeat(GUTTER_WIDTH)).append("= help: ").append(diagnostic.help()).append('\n');
        }
        for (Diagnostic.Label label : diagnostic.secondary()) {
            out.append("note: ").append(label.message()).append('\n');
            out.append("  --> ").append(location(diagnostic.file(), label.span())).append('\n');
        }
        return out.toString();
    }

    private static String location(String file, SourceSpan span) {
        return file + ":" + span.startLine() + ":" + (span.startColumn() + 1);
    }

    private void sourceContext(StringBuilder out, SourceSpan span, SourceFile source) {
        out.append(BLANK_GUTTER).append('\n');
        int line = span.startLine();
        if (source == null || line < 1 || line > source.lineCount()) {
            return;
        }
        int first = Math.max(1, line - contextLines);
        int last = Math.min(source.lineCount(), line + contextLines);
        for (int current = first; current <= last; current++) {
            String text = source.line(current);
            out.append(String.format(Locale.ROOT, "%" + (GUTTER_WIDTH - 1) + "d | ", current)).append(text).append('\n');
            if (current == line) {
                out.append(BLANK_GUTTER).append(' ').append(caret(span, text)).append('\n');
            }
        }
        out.append(BLANK_GUTTER).append('\n');
    }

    /** Underline of the span's first line; tabs before the column are kept so carets line up. */
    static String caret(SourceSpan span, String text) {
        int column = span.startColumn();
        int length;
        if (span.endLine() == span.startLine() && span.endColumn() > column) {
            length = span.endColumn() - column;
        } else {
            length = wordLength(text, column);
        }
        StringBuilder caret = new StringBuilder();
        for (int i = 0; i < column && i < text.length(); i++) {
            caret.append(text.charAt(i) == '\t' ? '\t' : ' ');
        }
        for (int i = text.length(); i < column; i++) {
            caret.append(' ');
        }
        return caret.append("^".repeat(length)).toString();
    }

    private static int wordLength(String text, int column) {
        int end = column;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        return Math.max(1, end - column);
    }

    /**
     * {@code Found 1 error and 0 warnings in flow.af} when there are errors, otherwise
     * {@code flow.af is valid (1 model, 1 agent)}.
     */
    public String summary(CompilationResult result) {
        int errors = result.errors().size();
        if (errors > 0) {
            return "Found " + count(errors, "error") + " and " + count(result.warnings().size(), "warning")
                    + " in " + result.fileId();
        }
        return result.fileId() + " is " + validity(result.stats());
    }

    /** {@code valid (1 model, 2 agents)}; only non-zero models, agents, flows and handlers appear. */
    static String validity(CompilationStats stats) {
        List<String> parts = new ArrayList<>();
        if (stats.models() > 0) {
            parts.add(count(stats.models(), "model"));
        }
        if (stats.agents() > 0) {
            parts.add(count(stats.agents(), "agent"));
        }
        if (stats.flows() > 0) {
            parts.add(count(stats.flows(), "flow"));
        }
        if (stats.handlers() > 0) {
            parts.add(count(stats.handlers(), "handler"));
        }
        return parts.isEmpty() ? "valid" : "valid (" + String.join(", ", parts) + ")";
    }

    private static String count(int n, String noun) {
        return n + " " + noun + (n == 1 ? "" : "s");
    }

    // ── JSON ──

    public String json(CompilationResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", JSON_VERSION);
        root.put("file", result.fileId());
        root.put("valid", result.isSuccess());
        ArrayNode errors = root.putArray("errors");
        ArrayNode warnings = root.putArray("warnings");
        for (Diagnostic diagnostic : result.diagnostics()) {
            (diagnostic.isError() ? errors : warnings).add(toJson(diagnostic));
        }
        CompilationStats stats = result.stats();
        ObjectNode counts = root.putObject("stats");
        counts.put("models", stats.models());
        counts.put("agents", stats.agents());
        counts.put("flows", stats.flows());
        counts.put("handlers", stats.handlers());
        counts.put("schemas", stats.schemas());
        counts.put("prompts", stats.prompts());
        counts.put("tools", stats.tools());
        try {
            return JSON_WRITER.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render diagnostics of " + result.fileId(), e);
        }
    }

    private static ObjectNode toJson(Diagnostic diagnostic) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("code", diagnostic.code().code());
        node.put("severity", diagnostic.severity().label());
        node.put("message", diagnostic.message());
        node.put("file", diagnostic.file());
        SourceSpan span = diagnostic.span();
        if (span == null) {
            node.putNull("line");
            node.putNull("column");
            node.putNull("end_line");
            node.putNull("end_column");
        } else {
            node.put("line", span.startLine());
            node.put("column", span.startColumn() + 1);
            node.put("end_line", span.endLine());
            node.put("end_column", span.endColumn() + 1);
        }
        if (diagnostic.help() == null) {
            node.putNull("help");
        } else {
            node.put("help", diagnostic.help());
        }
        if (diagnostic.isInternal()) {
            node.put("internal", true);
        }
        if (!diagnostic.secondary().isEmpty()) {
            ArrayNode related = node.putArray("related");
            for (Diagnostic.Label label : diagnostic.secondary()) {
                ObjectNode entry = related.addObject();
                entry.put("message", label.message());
                entry.put("line", label.span().startLine());
                entry.put("column", label.span().startColumn() + 1);
            }
        }
        return node;
    }
}
