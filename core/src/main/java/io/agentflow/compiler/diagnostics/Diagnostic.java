package io.agentflow.compiler.diagnostics;

import io.agentflow.compiler.source.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One compiler finding: a stable code, its severity, the primary message and location, optional
 * secondary locations and an optional help text.
 *
 * <p>
 * Thread-safe and immutable.
 *
 * @param code      the registry code
 * @param severity  severity (normally the code's own)
 * @param message   primary message
 * @param file      file id the span refers to
 * @param span      primary location, or {@code null} for file-level findings
 * @param secondary related locations such as the first of two duplicate definitions
 * @param help      suggestion text, or {@code null}
 */
public record Diagnostic(
        ErrorCode code,
        Severity severity,
        String message,
        String file,
        SourceSpan span,
        List<Label> secondary,
        String help) {

    public Diagnostic {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(file, "file must not be null");
        secondary = secondary == null ? List.of() : List.copyOf(secondary);
    }

    /** A secondary location with its own short message. */
    public record Label(SourceSpan span, String message) {

        public Label {
            Objects.requireNonNull(span, "span must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /**
     * Creates a diagnostic whose message is the code's template filled with {@code arguments}.
     */
    public static Diagnostic of(ErrorCode code, String file, SourceSpan span, Map<String, String> arguments) {
        return new Diagnostic(code, code.severity(), code.format(arguments), file, span, List.of(), null);
    }

    /** Creates a diagnostic with a literal message. */
    public static Diagnostic withMessage(ErrorCode code, String file, SourceSpan span, String message) {
        return new Diagnostic(code, code.severity(), message, file, span, List.of(), null);
    }

    public Diagnostic withHelp(String helpText) {
        return new Diagnostic(code, severity, message, file, span, secondary, helpText);
    }

    public Diagnostic withLabel(SourceSpan labelSpan, String labelMessage) {
        List<Label> labels = new ArrayList<>(secondary);
        labels.add(new Label(labelSpan, labelMessage));
        return new Diagnostic(code, severity, message, file, span, labels, help);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public boolean isInternal() {
        return code.isInternal();
    }

    /** 1-based line, or 0 when the diagnostic has no location. */
    public int line() {
        return span == null ? 0 : span.startLine();
    }

    /** 1-based column for display, or 0 when the diagnostic has no location. */
    public int column() {
        return span == null ? 0 : span.startColumn() + 1;
    }
}
