package io.agentflow.compiler.error;

import io.agentflow.compiler.diagnostics.Diagnostic;

/**
 * Raised by the lexer for invalid characters, unterminated literals or blocks, and mismatched
 * indentation. Lexing stops at the first such fault.
 */
public final class LexicalException extends CompilerException {

    private static final long serialVersionUID = 1L;

    public LexicalException(Diagnostic diagnostic) {
        super(diagnostic, Phase.LEX);
    }

    public LexicalException(Diagnostic diagnostic, Throwable cause) {
        super(diagnostic, cause, Phase.LEX);
    }
}
