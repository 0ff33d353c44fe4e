package io.agentflow.compiler.diagnostics;

/** Diagnostic severity. Only errors block code generation. */
public enum Severity {
    ERROR,
    WARNING;

    /** Lower-case label used in rendered output. */
    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
