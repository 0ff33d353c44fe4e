package io.agentflow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentflow.runtime.model.AgentInvocation;
import io.agentflow.runtime.model.AgentOutcome;
import java.util.List;

/**
 * Execution context handed to every generated flow and handler method. Generated code performs
 * all variable access and every side effect through this interface; the execution runtime
 * decides how agents, prompts and tools are actually run.
 *
 * <p>
 * A context owns one variable scope. {@link #fork()} creates a child scope that reads through to
 * its parent and keeps its own writes local.
 */
public interface WorkflowContext {

    /** Returns the value of a variable, searching parent scopes, or JSON null if unset. */
    JsonNode get(String name);

    /** Assigns a variable in this scope. */
    void set(String name, JsonNode value);

    /** Returns {@code true} if the variable is set in this scope or a parent scope. */
    boolean has(String name);

    /** Creates a child scope sharing this context's runtime. */
    WorkflowContext fork();

    /** Runs an agent and returns its output. */
    JsonNode runAgent(String agent, List<JsonNode> arguments);

    /** Runs an agent, reporting whether its output triggered the prompt's escalation condition. */
    AgentOutcome runAgentWithEscalation(String agent, List<JsonNode> arguments);

    /**
     * Runs independent agent invocations concurrently.
     *
     * @return outputs in invocation order
     */
    List<JsonNode> runParallel(List<AgentInvocation> invocations);

    /** Runs a flow that is not defined in the calling workflow (an imported flow). */
    JsonNode runFlow(String flow, List<JsonNode> arguments);

    /**
     * Sends a prompt directly to a model.
     *
     * @param model model override, or {@code null} for the prompt's or workflow's default
     */
    JsonNode callLlm(String prompt, List<JsonNode> arguments, String model);

    /** Calls a library function such as {@code lib.convert}. */
    JsonNode call(String function, List<JsonNode> arguments);

    /**
     * Substitutes {@code $name} references in message text with variable values or prompt
     * bodies, as {@link PromptTemplate#renderText} does.
     */
    String interpolate(String text);

    void escalateToHuman(String message);

    void log(String message);

    void notify(String message);

    /** Applies a masking guardrail ({@code mask pii}) to the current message. */
    void mask(String guardrail);

    /** Evaluates a named guardrail check such as {@code jailbreak} against the current message. */
    boolean guardrail(String name);

    /**
     * Blocks the current message.
     *
     * @throws io.agentflow.runtime.error.GuardrailBlockedException always
     */
    void block(String reason);

    void warn(String message);

    /** Asks the runtime to retry the current step with a replacement message. */
    void retryWith(JsonNode replacement);

    /** {@code false} once the run has been stopped; unbounded loops poll this. */
    boolean active();
}
