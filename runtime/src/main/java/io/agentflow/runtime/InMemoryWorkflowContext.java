package io.agentflow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentflow.runtime.error.GuardrailBlockedException;
import io.agentflow.runtime.error.UnknownDefinitionException;
import io.agentflow.runtime.model.AgentDefinition;
import io.agentflow.runtime.model.AgentInvocation;
import io.agentflow.runtime.model.AgentOutcome;
import io.agentflow.runtime.model.FlowDefinition;
import io.agentflow.runtime.model.PromptDefinition;
import io.agentflow.runtime.spi.ExecutionBackend;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link WorkflowContext} that keeps variables in memory and hands agent and model calls to an
 * {@link ExecutionBackend}. Used by tooling and tests to execute generated workflows without the
 * full agent runtime.
 *
 * <p>
 * Side effects that have no backend counterpart ({@code log}, {@code notify}, {@code warn},
 * {@code escalate to human}, {@code mask}, {@code retry with}) are recorded and can be inspected
 * after a run.
 */
public final class InMemoryWorkflowContext implements WorkflowContext {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryWorkflowContext.class);

    private final Shared shared;
    private final InMemoryWorkflowContext parent;
    private final Map<String, JsonNode> variables = new ConcurrentHashMap<>();

    /**
     * Creates a root context.
     *
     * @param workflow the workflow whose definitions and flows are used
     * @param backend  executes agents and model calls
     * @param executor runs the branches of parallel blocks
     */
    public InMemoryWorkflowContext(Workflow workflow, ExecutionBackend backend, Executor executor) {
        this.shared = new Shared(
                Objects.requireNonNull(workflow, "workflow must not be null"),
                Objects.requireNonNull(backend, "backend must not be null"),
                Objects.requireNonNull(executor, "executor must not be null"));
        this.parent = null;
    }

    public InMemoryWorkflowContext(Workflow workflow, ExecutionBackend backend) {
        this(workflow, backend, ForkJoinPool.commonPool());
    }

    private InMemoryWorkflowContext(Shared shared, InMemoryWorkflowContext parent) {
        this.shared = shared;
        this.parent = parent;
    }

    /**
     * Binds the flow's positional parameters on a fresh child scope and runs it.
     *
     * @throws UnknownDefinitionException if the workflow has no such flow
     */
    public JsonNode runFlow(String flow, JsonNode... arguments) {
        return runFlow(flow, List.of(arguments));
    }

    // ── Variables ──

    @Override
    public JsonNode get(String name) {
        for (InMemoryWorkflowContext scope = this; scope != null; scope = scope.parent) {
            JsonNode value = scope.variables.get(name);
            if (value != null) {
                return value;
            }
        }
        return Values.NULL;
    }

    @Override
    public void set(String name, JsonNode value) {
        variables.put(name, value == null ? Values.NULL : value);
    }

    @Override
    public boolean has(String name) {
        for (InMemoryWorkflowContext scope = this; scope != null; scope = scope.parent) {
            if (scope.variables.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public WorkflowContext fork() {
        return new InMemoryWorkflowContext(shared, this);
    }

    private InMemoryWorkflowContext root() {
        InMemoryWorkflowContext scope = this;
        while (scope.parent != null) {
            scope = scope.parent;
        }
        return scope;
    }

    // ── Agents, flows and prompts ──

    @Override
    public JsonNode runAgent(String agent, List<JsonNode> arguments) {
        return runAgentWithEscalation(agent, arguments).value();
    }

    @Override
    public AgentOutcome runAgentWithEscalation(String agent, List<JsonNode> arguments) {
        AgentDefinition definition = shared.workflow.definitions().requireAgent(agent);
        String promptName = definition.instruction() != null ? definition.instruction() : definition.prompt();
        String rendered = promptName == null ? "" : shared.templates.render(promptName, this::get);
        LOG.debug("Running agent: agent={}, arguments={}", agent, arguments.size());
        JsonNode result = shared.backend.runAgent(definition, rendered, arguments);
        if (definition.produces() != null) {
            root().set(definition.produces(), result);
        }
        PromptDefinition prompt =
                promptName == null ? null : shared.workflow.definitions().prompts().get(promptName);
        if (prompt != null && prompt.schema() != null) {
            shared.schemas.validate(prompt.schema(), prompt.expectsList(), result);
        }
        boolean escalated = prompt != null && prompt.escalation() != null && matches(prompt.escalation(), result);
        return new AgentOutcome(result, escalated);
    }

    private static boolean matches(PromptDefinition.Escalation escalation, JsonNode result) {
        JsonNode expected = Values.text(escalation.value());
        switch (escalation.operator()) {
            case "~":
                return Values.normalizedEquals(result, expected);
            case "==":
                return Values.eq(result, expected);
            case "!=":
                return !Values.eq(result, expected);
            case "contains":
                return Values.contains(result, expected);
            default:
                throw new IllegalArgumentException("Unsupported escalation operator: " + escalation.operator());
        }
    }

    @Override
    public List<JsonNode> runParallel(List<AgentInvocation> invocations) {
        List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
        for (AgentInvocation invocation : invocations) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> runAgent(invocation.agent(), invocation.arguments()), shared.executor));
        }
        List<JsonNode> results = new ArrayList<>();
        for (CompletableFuture<JsonNode> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    @Override
    public JsonNode runFlow(String flow, List<JsonNode> arguments) {
        FlowDefinition definition = shared.workflow.definitions().flows().get(flow);
        if (definition == null) {
            throw new UnknownDefinitionException("flow", flow);
        }
        WorkflowContext scope = root().fork();
        List<String> parameters = definition.parameters();
        for (int i = 0; i < parameters.size() && i < arguments.size(); i++) {
            scope.set(parameters.get(i), arguments.get(i));
        }
        return shared.workflow.runFlow(flow, scope);
    }

    @Override
    public JsonNode callLlm(String prompt, List<JsonNode> arguments, String model) {
        PromptDefinition definition = shared.workflow.definitions().requirePrompt(prompt);
        String rendered = shared.templates.render(prompt, this::get);
        String resolvedModel = model != null ? model : definition.model();
        JsonNode result = shared.backend.callLlm(definition, rendered, resolvedModel, arguments);
        if (definition.schema() != null) {
            shared.schemas.validate(definition.schema(), definition.expectsList(), result);
        }
        return result;
    }

    @Override
    public JsonNode call(String function, List<JsonNode> arguments) {
        return shared.backend.callFunction(function, arguments);
    }

    @Override
    public String interpolate(String text) {
        return shared.templates.renderText(text, this::get);
    }

    // ── Side effects ──

    @Override
    public void escalateToHuman(String message) {
        LOG.info("Escalated to human: message={}", message);
        shared.escalations.add(message);
    }

    @Override
    public void log(String message) {
        LOG.info("Workflow log: {}", message);
        shared.logs.add(message);
    }

    @Override
    public void notify(String message) {
        LOG.info("Workflow notification: {}", message);
        shared.notifications.add(message);
    }

    @Override
    public void mask(String guardrail) {
        shared.masks.add(guardrail);
    }

    @Override
    public boolean guardrail(String name) {
        return shared.backend.checkGuardrail(name, get("message"));
    }

    @Override
    public void block(String reason) {
        LOG.warn("Message blocked: reason={}", reason);
        throw new GuardrailBlockedException(reason);
    }

    @Override
    public void warn(String message) {
        LOG.warn("Workflow warning: {}", message);
        shared.warnings.add(message);
    }

    @Override
    public void retryWith(JsonNode replacement) {
        shared.retries.add(replacement);
    }

    @Override
    public boolean active() {
        return shared.active.get();
    }

    /** Stops unbounded loops of every scope sharing this context's run. */
    public void stop() {
        shared.active.set(false);
    }

    public List<String> logMessages() {
        return Collections.unmodifiableList(shared.logs);
    }

    public List<String> notifications() {
        return Collections.unmodifiableList(shared.notifications);
    }

    public List<String> escalations() {
        return Collections.unmodifiableList(shared.escalations);
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(shared.warnings);
    }

    public List<String> masks() {
        return Collections.unmodifiableList(shared.masks);
    }

    public List<JsonNode> retries() {
        return Collections.unmodifiableList(shared.retries);
    }

    /** State shared by a root context and all scopes forked from it. */
    private static final class Shared {

        private final Workflow workflow;
        private final ExecutionBackend backend;
        private final Executor executor;
        private final PromptTemplate templates;
        private final SchemaValidator schemas;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final List<String> logs = new CopyOnWriteArrayList<>();
        private final List<String> notifications = new CopyOnWriteArrayList<>();
        private final List<String> escalations = new CopyOnWriteArrayList<>();
        private final List<String> warnings = new CopyOnWriteArrayList<>();
        private final List<String> masks = new CopyOnWriteArrayList<>();
        private final List<JsonNode> retries = new CopyOnWriteArrayList<>();

        private Shared(Workflow workflow, ExecutionBackend backend, Executor executor) {
            this.workflow = workflow;
            this.backend = backend;
            this.executor = executor;
            this.templates = new PromptTemplate(workflow.definitions().prompts());
            this.schemas = new SchemaValidator(workflow.definitions().schemas());
        }
    }
}
