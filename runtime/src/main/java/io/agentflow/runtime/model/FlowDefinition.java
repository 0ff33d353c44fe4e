package io.agentflow.runtime.model;

import java.util.List;
import java.util.Objects;

/** A flow entry point and its positional parameters. */
public record FlowDefinition(String name, List<String> parameters) {

    public FlowDefinition {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
