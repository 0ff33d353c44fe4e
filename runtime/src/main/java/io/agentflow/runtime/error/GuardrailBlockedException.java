package io.agentflow.runtime.error;

/**
 * Raised when a {@code block if} guardrail condition holds. The current message must not reach
 * the agent or the user.
 */
public final class GuardrailBlockedException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    public GuardrailBlockedException(String reason) {
        super("Blocked by guardrail: " + reason, null);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
