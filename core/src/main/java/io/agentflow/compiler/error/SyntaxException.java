package io.agentflow.compiler.error;

import io.agentflow.compiler.diagnostics.Diagnostic;
import java.util.List;

/** Raised by the parser for the first token that cannot continue any viable parse. */
public final class SyntaxException extends CompilerException {

    private static final long serialVersionUID = 1L;

    private final List<String> expected;
    private final String found;

    public SyntaxException(Diagnostic diagnostic, List<String> expected, String found) {
        super(diagnostic, Phase.PARSE);
        this.expected = List.copyOf(expected);
        this.found = found;
    }

    /** Descriptions of the terminals that would have been accepted, sorted. */
    public List<String> expected() {
        return expected;
    }

    /** Description of the offending token. */
    public String found() {
        return found;
    }
}
