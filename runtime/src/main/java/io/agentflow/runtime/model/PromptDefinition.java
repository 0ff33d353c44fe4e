package io.agentflow.runtime.model;

import java.util.Objects;

/**
 * A prompt template. The body may reference variables and other prompts with {@code $name}.
 *
 * @param name          prompt name
 * @param body          raw template text
 * @param model         model override from {@code using model}, or {@code null}
 * @param schema        schema from {@code expecting}, or {@code null}
 * @param expectsList   {@code true} when the clause was {@code expecting Schema[]}
 * @param inherit       variable holding inherited conversation history, or {@code null}
 * @param escalation    escalation condition, or {@code null}
 */
public record PromptDefinition(
        String name,
        String body,
        String model,
        String schema,
        boolean expectsList,
        String inherit,
        Escalation escalation) {

    public PromptDefinition {
        Objects.requireNonNull(name, "name must not be null");
        body = body == null ? "" : body;
    }

    /**
     * Condition under which the prompt's result escalates ({@code escalate if ~ "DONE"}).
     *
     * @param operator one of {@code ~}, {@code ==}, {@code !=}, {@code contains}
     * @param value    the value compared against the result text
     */
    public record Escalation(String operator, String value) {

        public Escalation {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
