package io.agentflow.runtime.error;

import java.util.List;

/**
 * Raised when an agent or prompt result does not conform to the schema named by its
 * {@code expecting} clause.
 */
public final class SchemaViolationException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    private final String schemaName;
    private final List<String> violations;

    public SchemaViolationException(String schemaName, List<String> violations) {
        super("Output does not match schema '" + schemaName + "': " + String.join("; ", violations), null);
        this.schemaName = schemaName;
        this.violations = List.copyOf(violations);
    }

    public String schemaName() {
        return schemaName;
    }

    public List<String> violations() {
        return violations;
    }
}
