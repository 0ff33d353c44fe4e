package io.agentflow.runtime.error;

/** Raised when a workflow is asked for a flow, agent, prompt or function it does not define. */
public final class UnknownDefinitionException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String name;

    public UnknownDefinitionException(String kind, String name) {
        super("Unknown " + kind + ": '" + name + "'", null);
        this.kind = kind;
        this.name = name;
    }

    public String kind() {
        return kind;
    }

    public String name() {
        return name;
    }
}
