package io.agentflow.compiler.error;

import io.agentflow.compiler.diagnostics.Diagnostic;

/**
 * Abstract base for all exceptions raised by the compiler pipeline. Never thrown directly; use the
 * concrete subclasses. Every instance carries the {@link Diagnostic} that describes the fault so
 * the facade can report it without losing the location.
 */
public abstract class CompilerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        LEX,
        PARSE,
        TRANSFORM,
        ANALYZE,
        GENERATE,
        LOAD
    }

    private final transient Diagnostic diagnostic;
    private final Phase phase;

    protected CompilerException(Diagnostic diagnostic, Phase phase) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
        this.phase = phase;
    }

    protected CompilerException(Diagnostic diagnostic, Throwable cause, Phase phase) {
        super(diagnostic.message(), cause);
        this.diagnostic = diagnostic;
        this.phase = phase;
    }

    /** The diagnostic describing this fault. */
    public Diagnostic diagnostic() {
        return diagnostic;
    }

    /** The file being compiled. */
    public String fileId() {
        return diagnostic.file();
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
