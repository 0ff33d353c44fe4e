package io.agentflow.runtime.error;

/** Raised by an {@code abort} statement or an {@code on escalate abort} handler. */
public final class WorkflowAbortedException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    public WorkflowAbortedException(String message) {
        super(message, null);
    }

    public WorkflowAbortedException(String message, String workflowSource) {
        super(message, workflowSource);
    }
}
