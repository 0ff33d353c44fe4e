package io.agentflow.runtime.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentflow.runtime.error.UnknownDefinitionException;
import io.agentflow.runtime.model.AgentDefinition;
import io.agentflow.runtime.model.PromptDefinition;
import java.util.List;

/**
 * Service Provider Interface for whatever actually executes agents and model calls behind an
 * {@link io.agentflow.runtime.InMemoryWorkflowContext}.
 *
 * <p>
 * Implementations must be thread-safe: parallel blocks invoke them from several threads.
 */
public interface ExecutionBackend {

    /**
     * Runs an agent.
     *
     * @param agent          the agent's definition
     * @param renderedPrompt the agent's instruction with variables substituted, may be empty
     * @param arguments      positional arguments from the {@code run agent} statement
     */
    JsonNode runAgent(AgentDefinition agent, String renderedPrompt, List<JsonNode> arguments);

    /**
     * Sends a rendered prompt to a model.
     *
     * @param model resolved model name, or {@code null}
     */
    JsonNode callLlm(PromptDefinition prompt, String renderedPrompt, String model, List<JsonNode> arguments);

    /** Calls a library function. The default rejects every function. */
    default JsonNode callFunction(String function, List<JsonNode> arguments) {
        throw new UnknownDefinitionException("function", function);
    }

    /** Evaluates a named guardrail check. The default reports no violation. */
    default boolean checkGuardrail(String name, JsonNode message) {
        return false;
    }
}
