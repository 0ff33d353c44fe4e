package io.agentflow.runtime;

import io.agentflow.runtime.error.UnknownDefinitionException;
import io.agentflow.runtime.model.AgentDefinition;
import io.agentflow.runtime.model.FlowDefinition;
import io.agentflow.runtime.model.HandlerDefinition;
import io.agentflow.runtime.model.ModelDefinition;
import io.agentflow.runtime.model.PolicyDefinition;
import io.agentflow.runtime.model.PromptDefinition;
import io.agentflow.runtime.model.SchemaDefinition;
import io.agentflow.runtime.model.ToolDefinition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of everything a compiled workflow declares, keyed by name.
 *
 * <p>
 * Generated workflow classes build one instance in a static initializer through
 * {@link #builder(String)}. Iteration order of every map is declaration order.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class WorkflowDefinitions {

    private final String sourceFile;
    private final Map<String, ModelDefinition> models;
    private final Map<String, ToolDefinition> tools;
    private final Map<String, SchemaDefinition> schemas;
    private final Map<String, PromptDefinition> prompts;
    private final Map<String, AgentDefinition> agents;
    private final Map<String, PolicyDefinition> policies;
    private final Map<String, FlowDefinition> flows;
    private final Map<String, HandlerDefinition> handlers;
    private final List<String> imports;

    private WorkflowDefinitions(Builder builder) {
        this.sourceFile = builder.sourceFile;
        this.models = freeze(builder.models);
        this.tools = freeze(builder.tools);
        this.schemas = freeze(builder.schemas);
        this.prompts = freeze(builder.prompts);
        this.agents = freeze(builder.agents);
        this.policies = freeze(builder.policies);
        this.flows = freeze(builder.flows);
        this.handlers = freeze(builder.handlers);
        this.imports = List.copyOf(builder.imports);
    }

    private static <T> Map<String, T> freeze(Map<String, T> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Returns a new {@link Builder}.
     *
     * @param sourceFile the DSL file the workflow was compiled from
     */
    public static Builder builder(String sourceFile) {
        return new Builder(sourceFile);
    }

    public String sourceFile() {
        return sourceFile;
    }

    public Map<String, ModelDefinition> models() {
        return models;
    }

    public Map<String, ToolDefinition> tools() {
        return tools;
    }

    public Map<String, SchemaDefinition> schemas() {
        return schemas;
    }

    public Map<String, PromptDefinition> prompts() {
        return prompts;
    }

    public Map<String, AgentDefinition> agents() {
        return agents;
    }

    /** Policies keyed by {@link PolicyDefinition#key()}. */
    public Map<String, PolicyDefinition> policies() {
        return policies;
    }

    public Optional<PolicyDefinition> policy(PolicyDefinition.Kind kind, String name) {
        return Optional.ofNullable(policies.get(PolicyDefinition.key(kind, name)));
    }

    public Map<String, FlowDefinition> flows() {
        return flows;
    }

    /** Handlers keyed by {@link HandlerDefinition#key()}. */
    public Map<String, HandlerDefinition> handlers() {
        return handlers;
    }

    /** Import references as written, local paths and external {@code name from source} pairs. */
    public List<String> imports() {
        return imports;
    }

    public Optional<AgentDefinition> agent(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public Optional<PromptDefinition> prompt(String name) {
        return Optional.ofNullable(prompts.get(name));
    }

    /**
     * Looks up an agent, throwing if it is not declared.
     *
     * @throws UnknownDefinitionException if no agent has the given name
     */
    public AgentDefinition requireAgent(String name) {
        return agent(name).orElseThrow(() -> new UnknownDefinitionException("agent", name));
    }

    /**
     * Looks up a prompt, throwing if it is not declared.
     *
     * @throws UnknownDefinitionException if no prompt has the given name
     */
    public PromptDefinition requirePrompt(String name) {
        return prompt(name).orElseThrow(() -> new UnknownDefinitionException("prompt", name));
    }

    /** Builder used by generated code. Later registrations of the same name replace earlier ones. */
    public static final class Builder {

        private final String sourceFile;
        private final Map<String, ModelDefinition> models = new LinkedHashMap<>();
        private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();
        private final Map<String, SchemaDefinition> schemas = new LinkedHashMap<>();
        private final Map<String, PromptDefinition> prompts = new LinkedHashMap<>();
        private final Map<String, AgentDefinition> agents = new LinkedHashMap<>();
        private final Map<String, PolicyDefinition> policies = new LinkedHashMap<>();
        private final Map<String, FlowDefinition> flows = new LinkedHashMap<>();
        private final Map<String, HandlerDefinition> handlers = new LinkedHashMap<>();
        private final List<String> imports = new ArrayList<>();

        Builder(String sourceFile) {
            this.sourceFile = sourceFile;
        }

        public Builder model(ModelDefinition model) {
            models.put(model.name(), model);
            return this;
        }

        public Builder tool(ToolDefinition tool) {
            tools.put(tool.name(), tool);
            return this;
        }

        public Builder schema(SchemaDefinition schema) {
            schemas.put(schema.name(), schema);
            return this;
        }

        public Builder prompt(PromptDefinition prompt) {
            prompts.put(prompt.name(), prompt);
            return this;
        }

        public Builder agent(AgentDefinition agent) {
            agents.put(agent.name(), agent);
            return this;
        }

        public Builder policy(PolicyDefinition policy) {
            policies.put(policy.key(), policy);
            return this;
        }

        public Builder flow(FlowDefinition flow) {
            flows.put(flow.name(), flow);
            return this;
        }

        public Builder handler(HandlerDefinition handler) {
            handlers.put(handler.key(), handler);
            return this;
        }

        public Builder importRef(String reference) {
            imports.add(reference);
            return this;
        }

        public WorkflowDefinitions build() {
            return new WorkflowDefinitions(this);
        }
    }
}
