package io.agentflow.compiler.error;

import io.agentflow.compiler.diagnostics.Diagnostic;

/**
 * Raised when the compiler meets a state it was not built for, such as a parse tree shape the AST
 * transformer does not recognise. Always a defect in the compiler, never in the user's source.
 */
public final class InternalCompilerException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public InternalCompilerException(Diagnostic diagnostic, Phase phase) {
        super(diagnostic, phase);
    }

    public InternalCompilerException(Diagnostic diagnostic, Throwable cause, Phase phase) {
        super(diagnostic, cause, phase);
    }
}
