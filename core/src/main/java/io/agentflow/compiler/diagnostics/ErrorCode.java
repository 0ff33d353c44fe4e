package io.agentflow.compiler.diagnostics;

import java.util.Map;

/**
 * Closed registry of diagnostic codes. A code always denotes the same condition; new conditions
 * get new codes.
 */
public enum ErrorCode {
    E0001("E0001", Severity.ERROR, Category.REFERENCE, "undefined reference to {kind} '{name}'"),
    E0002("E0002", Severity.ERROR, Category.REFERENCE, "variable '${name}' used before definition"),
    E0003("E0003", Severity.ERROR, Category.REFERENCE, "duplicate definition of {kind} '{name}'"),
    E0004("E0004", Severity.ERROR, Category.TYPE, "type mismatch: expected {expected}, found {found}"),
    E0005("E0005", Severity.ERROR, Category.IMPORT, "import file not found: {path}"),
    E0006("E0006", Severity.ERROR, Category.IMPORT, "circular import detected: {cycle}"),
    E0007("E0007", Severity.ERROR, Category.SYNTAX, "{detail}"),
    E0008("E0008", Severity.ERROR, Category.SYNTAX, "mismatched indentation: {detail}"),
    E0009("E0009", Severity.ERROR, Category.SEMANTIC, "invalid guardrail action '{action}' in {context} context"),
    E0010("E0010", Severity.ERROR, Category.SEMANTIC, "missing required property '{property}' in {kind}"),
    E0011("E0011", Severity.ERROR, Category.SEMANTIC, "circular reference detected: {cycle}"),
    E0012("E0012", Severity.ERROR, Category.SEMANTIC, "statement not allowed in parallel block: {statement}"),
    E0013("E0013", Severity.ERROR, Category.SEMANTIC, "'continue' outside of loop"),
    E9999("E9999", Severity.ERROR, Category.INTERNAL, "internal compiler error: {detail}"),
    W0001("W0001", Severity.WARNING, Category.SEMANTIC, "loop without bound has no exit path"),
    W0002("W0002", Severity.WARNING, Category.SEMANTIC, "agent '{name}' has both delegate and use");

    /** Broad grouping of codes, used by tooling to filter diagnostics. */
    public enum Category {
        REFERENCE,
        TYPE,
        IMPORT,
        SYNTAX,
        SEMANTIC,
        INTERNAL
    }

    private final String code;
    private final Severity severity;
    private final Category category;
    private final String template;

    ErrorCode(String code, Severity severity, Category category, String template) {
        this.code = code;
        this.severity = severity;
        this.category = category;
        this.template = template;
    }

    public String code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }

    public Category category() {
        return category;
    }

    public String template() {
        return template;
    }

    public boolean isInternal() {
        return category == Category.INTERNAL;
    }

    /**
     * Fills the message template. Placeholders without an argument are left as written.
     *
     * @param arguments placeholder name to value
     */
    public String format(Map<String, String> arguments) {
        String message = template;
        for (Map.Entry<String, String> argument : arguments.entrySet()) {
            message = message.replace("{" + argument.getKey() + "}", argument.getValue());
        }
        return message;
    }
}
