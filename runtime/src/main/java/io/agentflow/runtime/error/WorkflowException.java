package io.agentflow.runtime.error;

/**
 * Abstract base for all exceptions raised while a generated workflow executes. Never thrown
 * directly; use one of the concrete subclasses.
 */
public abstract class WorkflowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String workflowSource;

    protected WorkflowException(String message, String workflowSource) {
        super(message);
        this.workflowSource = workflowSource;
    }

    protected WorkflowException(String message, Throwable cause, String workflowSource) {
        super(message, cause);
        this.workflowSource = workflowSource;
    }

    /** The DSL file the running workflow was compiled from, or {@code null} if unknown. */
    public String workflowSource() {
        return workflowSource;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
