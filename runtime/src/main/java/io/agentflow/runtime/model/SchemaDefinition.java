package io.agentflow.runtime.model;

import java.util.List;
import java.util.Objects;

/** A typed output schema referenced by {@code expecting} clauses. */
public record SchemaDefinition(String name, List<FieldDefinition> fields) {

    public SchemaDefinition {
        Objects.requireNonNull(name, "name must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
