package io.agentflow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of every generated workflow. Subclasses expose one method per flow and per event
 * handler and dispatch to them by name.
 */
public abstract class Workflow {

    private final WorkflowDefinitions definitions;

    protected Workflow(WorkflowDefinitions definitions) {
        this.definitions = Objects.requireNonNull(definitions, "definitions must not be null");
    }

    /** The registry of models, tools, schemas, prompts, agents and policies. */
    public final WorkflowDefinitions definitions() {
        return definitions;
    }

    /** Names of the flows this workflow can run. */
    public final Set<String> flowNames() {
        return definitions.flows().keySet();
    }

    /**
     * Runs a flow. Positional flow parameters must already be set on the context.
     *
     * @throws io.agentflow.runtime.error.UnknownDefinitionException if the flow does not exist
     */
    public abstract JsonNode runFlow(String name, WorkflowContext ctx);

    /**
     * Runs the handler registered for an event.
     *
     * @param timing {@code on} or {@code after}
     * @param event  event name such as {@code input} or {@code tool-call}
     * @return the handler's result, or JSON null when no handler is registered
     */
    public abstract JsonNode handle(String timing, String event, WorkflowContext ctx);
}
