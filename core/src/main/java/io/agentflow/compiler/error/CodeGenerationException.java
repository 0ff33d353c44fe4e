package io.agentflow.compiler.error;

import io.agentflow.compiler.diagnostics.Diagnostic;

/**
 * Raised when a construct that passed semantic analysis cannot be generated, such as a non-agent
 * statement inside a {@code parallel} block.
 */
public final class CodeGenerationException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public CodeGenerationException(Diagnostic diagnostic) {
        super(diagnostic, Phase.GENERATE);
    }

    public CodeGenerationException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic, cause, Phase.GENERATE);
    }
}
