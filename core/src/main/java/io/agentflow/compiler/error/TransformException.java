package io.agentflow.compiler.error;

import io.agentflow.compiler.diagnostics.Diagnostic;

/**
 * Raised when a well-formed parse tree holds a value the AST cannot represent, such as a
 * fractional loop bound or retry count.
 */
public final class TransformException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public TransformException(Diagnostic diagnostic) {
        super(diagnostic, Phase.TRANSFORM);
    }

    public TransformException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic, cause, Phase.TRANSFORM);
    }
}
