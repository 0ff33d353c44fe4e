package io.agentflow.runtime.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/** One branch of a {@code parallel do} block. */
public record AgentInvocation(String agent, List<JsonNode> arguments) {

    public AgentInvocation {
        Objects.requireNonNull(agent, "agent must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
