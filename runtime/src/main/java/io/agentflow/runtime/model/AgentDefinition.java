package io.agentflow.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * An agent declaration with resolved composition lists.
 *
 * @param name           agent name ({@code default} for an unnamed {@code agent:} block)
 * @param instruction    system instruction prompt, or {@code null}
 * @param prompt         user prompt, or {@code null}
 * @param model          model override, or {@code null}
 * @param tools          tool names
 * @param delegates      sub-agents the conversation may be handed to
 * @param uses           agents invoked as tools
 * @param retryPolicy    retry policy name, or {@code null}
 * @param timeoutPolicy  timeout policy name, or {@code null}
 * @param timeoutSeconds literal timeout, or {@code null}
 * @param produces       variable receiving the agent's output, or {@code null}
 * @param description    free text, or {@code null}
 */
public record AgentDefinition(
        String name,
        String instruction,
        String prompt,
        String model,
        List<String> tools,
        List<String> delegates,
        List<String> uses,
        String retryPolicy,
        String timeoutPolicy,
        Long timeoutSeconds,
        String produces,
        String description) {

    public AgentDefinition {
        Objects.requireNonNull(name, "name must not be null");
        tools = tools == null ? List.of() : List.copyOf(tools);
        delegates = delegates == null ? List.of() : List.copyOf(delegates);
        uses = uses == null ? List.of() : List.copyOf(uses);
    }
}
