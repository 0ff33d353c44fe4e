package io.agentflow.compiler.error;

import io.agentflow.compiler.diagnostics.Diagnostic;

/** Raised when generated Java source cannot be compiled or instantiated in process. */
public final class WorkflowLoadException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public WorkflowLoadException(Diagnostic diagnostic) {
        super(diagnostic, Phase.LOAD);
    }

    public WorkflowLoadException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic, cause, Phase.LOAD);
    }
}
