package io.agentflow.runtime.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Result of an agent run together with its escalation flag.
 *
 * @param value     the agent's output, never {@code null}
 * @param escalated {@code true} if the output matched the prompt's escalation condition
 */
public record AgentOutcome(JsonNode value, boolean escalated) {

    public AgentOutcome {
        value = value == null ? NullNode.getInstance() : value;
    }

    public static AgentOutcome of(JsonNode value) {
        return new AgentOutcome(value, false);
    }

    public static AgentOutcome escalated(JsonNode value) {
        return new AgentOutcome(value, true);
    }
}
