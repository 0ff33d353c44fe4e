package io.agentflow.compiler.semantic;

/** What a name in a {@link Scope} denotes. Each kind is its own namespace. */
public enum SymbolKind {
    MODEL("model"),
    TOOL("tool"),
    SCHEMA("schema"),
    PROMPT("prompt"),
    AGENT("agent"),
    FLOW("flow"),
    RETRY_POLICY("retry policy"),
    TIMEOUT_POLICY("timeout policy"),
    POLICY("policy"),
    VARIABLE("variable"),
    GUARDRAIL("guardrail");

    private final String label;

    SymbolKind(String label) {
        this.label = label;
    }

    /** Name used in diagnostics, e.g. {@code retry policy}. */
    public String label() {
        return label;
    }
}
