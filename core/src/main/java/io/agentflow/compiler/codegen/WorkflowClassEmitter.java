package io.agentflow.compiler.codegen;

import io.agentflow.compiler.ast.CompilationUnit;
import io.agentflow.compiler.ast.Declaration;
import io.agentflow.compiler.ast.Reference;
import io.agentflow.compiler.semantic.AnalysisResult;
import io.agentflow.compiler.source.SourceSpan;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lays out one generated workflow class: header, the static definitions registry, constructor,
 * the {@code runFlow} and {@code handle} dispatchers and one method per flow and handler.
 *
 * <p>
 * Declarations of imported units are merged in first; a local declaration replaces an imported
 * one of the same kind and name. Handlers are never imported.
 */
final class WorkflowClassEmitter {

    private static final List<String> IMPORTS = List.of(
            "com.fasterxml.jackson.databind.JsonNode",
            "io.agentflow.runtime.Values",
            "io.agentflow.runtime.Workflow",
            "io.agentflow.runtime.WorkflowContext",
            "io.agentflow.runtime.WorkflowDefinitions",
            "io.agentflow.runtime.error.UnknownDefinitionException",
            "io.agentflow.runtime.error.WorkflowAbortedException",
            "io.agentflow.runtime.model.AgentDefinition",
            "io.agentflow.runtime.model.AgentInvocation",
            "io.agentflow.runtime.model.AgentOutcome",
            "io.agentflow.runtime.model.FieldDefinition",
            "io.agentflow.runtime.model.FlowDefinition",
            "io.agentflow.runtime.model.HandlerDefinition",
            "io.agentflow.runtime.model.ModelDefinition",
            "io.agentflow.runtime.model.PolicyDefinition",
            "io.agentflow.runtime.model.PromptDefinition",
            "io.agentflow.runtime.model.SchemaDefinition",
            "io.agentflow.runtime.model.ToolDefinition",
            "java.util.List",
            "java.util.Map");

    private final String packageName;
    private final String className;
    private final CompilationUnit unit;
    private final CodeEmitter out;

    private final Map<String, Owned<Declaration>> declarations = new LinkedHashMap<>();
    private final Map<String, Owned<Declaration.FlowDef>> flows = new LinkedHashMap<>();
    private final Map<String, Declaration.PromptDef> prompts;
    private final AnalysisResult analysis;

    /** A declaration together with the file it was written in. */
    private record Owned<T extends Declaration>(String file, T declaration) {}

    WorkflowClassEmitter(
            String packageName,
            String className,
            CompilationUnit unit,
            List<CompilationUnit> imports,
            AnalysisResult analysis,
            CodeEmitter out) {
        this.packageName = packageName;
        this.className = className;
        this.unit = unit;
        this.prompts = analysis.prompts();
        this.analysis = analysis;
        this.out = out;
        for (CompilationUnit imported : imports) {
            collect(imported);
        }
        collect(unit);
    }

    private void collect(CompilationUnit source) {
        for (Declaration declaration : source.declarations()) {
            String key = key(declaration);
            if (key == null) {
                continue;
            }
            declarations.remove(key);
            declarations.put(key, new Owned<>(source.fileId(), declaration));
            if (declaration instanceof Declaration.FlowDef flow) {
                flows.remove(flow.name());
                flows.put(flow.name(), new Owned<>(source.fileId(), flow));
            }
        }
    }

    /** Registry key of a declaration, or {@code null} for those emitted separately. */
    private static String key(Declaration declaration) {
        if (declaration instanceof Declaration.ModelDef model) {
            return "model " + model.name();
        }
        if (declaration instanceof Declaration.ToolDef tool) {
            return "tool " + tool.name();
        }
        if (declaration instanceof Declaration.SchemaDef schema) {
            return "schema " + schema.name();
        }
        if (declaration instanceof Declaration.AgentDef agent) {
            return "agent " + agent.name();
        }
        if (declaration instanceof Declaration.RetryPolicyDef retry) {
            return "retry " + retry.name();
        }
        if (declaration instanceof Declaration.TimeoutPolicyDef timeout) {
            return "timeout " + timeout.name();
        }
        if (declaration instanceof Declaration.PolicyDef policy) {
            return "policy " + policy.name();
        }
        if (declaration instanceof Declaration.FlowDef flow) {
            return "flow " + flow.name();
        }
        return null;
    }

    void emit() {
        out.emit("// Generated by agentflow from " + JavaNames.commentText(unit.fileId()) + ". Do not edit.");
        if (!packageName.isEmpty()) {
            out.emit("package " + packageName + ";");
            out.blank();
        }
        for (String type : IMPORTS) {
            out.emit("import " + type + ";");
        }
        out.blank();
        out.open("public final class " + className + " extends Workflow");
        out.blank();
        out.emit("static final String SOURCE_FILE = " + JavaNames.literal(unit.fileId()) + ";");
        out.blank();
        definitions();
        out.blank();
        out.open("public " + className + "()");
        out.emit("super(DEFINITIONS);");
        out.close();
        out.blank();
        flowDispatcher();
        out.blank();
        handlerDispatcher();
        for (Owned<Declaration.FlowDef> flow : flows.values()) {
            out.blank();
            flowMethod(flow.file(), flow.declaration());
        }
        for (Declaration.HandlerDef handler : handlers()) {
            out.blank();
            handlerMethod(handler);
        }
        out.close();
    }

    /** Local handlers; for a repeated timing and event the first one wins. */
    private List<Declaration.HandlerDef> handlers() {
        Map<String, Declaration.HandlerDef> byKey = new LinkedHashMap<>();
        for (Declaration.HandlerDef handler : unit.handlers()) {
            byKey.putIfAbsent(handler.key(), handler);
        }
        return new ArrayList<>(byKey.values());
    }

    // ── Registry ──

    private void definitions() {
        out.emit("private static final WorkflowDefinitions DEFINITIONS = WorkflowDefinitions.builder(SOURCE_FILE)");
        out.indent();
        out.indent();
        registrations(Declaration.ModelDef.class);
        registrations(Declaration.ToolDef.class);
        registrations(Declaration.SchemaDef.class);
        for (Declaration.PromptDef prompt : prompts.values()) {
            registration(unit.fileId(), prompt.span(), ".prompt(" + prompt(prompt) + ")");
        }
        registrations(Declaration.AgentDef.class);
        registrations(Declaration.RetryPolicyDef.class);
        registrations(Declaration.TimeoutPolicyDef.class);
        registrations(Declaration.PolicyDef.class);
        for (Owned<Declaration.FlowDef> flow : flows.values()) {
            Declaration.FlowDef definition = flow.declaration();
            registration(
                    flow.file(),
                    definition.span(),
                    ".flow(new FlowDefinition(" + JavaNames.literal(definition.name()) + ", "
                            + strings(definition.parameters().stream().map(Reference::name).collect(Collectors.toList()))
                            + "))");
        }
        for (Declaration.HandlerDef handler : handlers()) {
            registration(
                    unit.fileId(),
                    handler.span(),
                    ".handler(new HandlerDefinition(" + JavaNames.literal(handler.timing()) + ", "
                            + JavaNames.literal(handler.event().name()) + "))");
        }
        for (Declaration.ImportStmt importStmt : unit.imports()) {
            registration(unit.fileId(), importStmt.span(), ".importRef(" + JavaNames.literal(importStmt.reference()) + ")");
        }
        out.emit(".build();");
        out.dedent();
        out.dedent();
    }

    private <T extends Declaration> void registrations(Class<T> type) {
        for (Owned<Declaration> owned : declarations.values()) {
            if (type.isInstance(owned.declaration())) {
                Declaration declaration = owned.declaration();
                registration(owned.file(), span(declaration), registration(declaration));
            }
        }
    }

    private void registration(String file, SourceSpan span, String code) {
        out.originFile(file);
        out.emitMapped(code, span);
        out.originFile(unit.fileId());
    }

    private static SourceSpan span(Declaration declaration) {
        if (declaration instanceof Declaration.ModelDef model) {
            return model.span();
        }
        if (declaration instanceof Declaration.ToolDef tool) {
            return tool.span();
        }
        if (declaration instanceof Declaration.SchemaDef schema) {
            return schema.span();
        }
        if (declaration instanceof Declaration.AgentDef agent) {
            return agent.span();
        }
        if (declaration instanceof Declaration.RetryPolicyDef retry) {
            return retry.span();
        }
        if (declaration instanceof Declaration.TimeoutPolicyDef timeout) {
            return timeout.span();
        }
        if (declaration instanceof Declaration.PolicyDef policy) {
            return policy.span();
        }
        return null;
    }

    private static String registration(Declaration declaration) {
        if (declaration instanceof Declaration.ModelDef model) {
            return ".model(new ModelDefinition(" + JavaNames.literal(model.name()) + ", "
                    + JavaNames.literal(model.identifier()) + ", " + map(model.properties()) + "))";
        }
        if (declaration instanceof Declaration.ToolDef tool) {
            return ".tool(new ToolDefinition(" + JavaNames.literal(tool.name()) + ", " + JavaNames.literal(tool.type())
                    + ", " + JavaNames.literal(tool.target()) + ", " + map(tool.properties()) + "))";
        }
        if (declaration instanceof Declaration.SchemaDef schema) {
            String fields = schema.fields().stream()
                    .map(field -> "new FieldDefinition(" + JavaNames.literal(field.name()) + ", "
                            + JavaNames.literal(field.type().name()) + ", " + field.list() + ", " + field.optional()
                            + ")")
                    .collect(Collectors.joining(", ", "List.of(", ")"));
            return ".schema(new SchemaDefinition(" + JavaNames.literal(schema.name()) + ", " + fields + "))";
        }
        if (declaration instanceof Declaration.AgentDef agent) {
            return ".agent(" + agent(agent) + ")";
        }
        if (declaration instanceof Declaration.RetryPolicyDef retry) {
            Map<String, String> properties = new LinkedHashMap<>();
            properties.put("times", Long.toString(retry.times()));
            if (retry.backoff() != null) {
                properties.put("backoff", retry.backoff());
            }
            return policy(retry.name(), "RETRY", properties);
        }
        if (declaration instanceof Declaration.TimeoutPolicyDef timeout) {
            return policy(timeout.name(), "TIMEOUT", Map.of("seconds", Long.toString(timeout.duration().seconds())));
        }
        if (declaration instanceof Declaration.PolicyDef policy) {
            return policy(policy.name(), "GENERIC", policy.properties());
        }
        throw new IllegalArgumentException("Not a registry declaration: " + declaration.getClass().getSimpleName());
    }

    private static String policy(String name, String kind, Map<String, String> properties) {
        return ".policy(new PolicyDefinition(" + JavaNames.literal(name) + ", PolicyDefinition.Kind." + kind + ", "
                + map(properties) + "))";
    }

    private static String prompt(Declaration.PromptDef prompt) {
        String escalation = prompt.escalation() == null
                ? "null"
                : "new PromptDefinition.Escalation(" + JavaNames.literal(prompt.escalation().operator()) + ", "
                        + JavaNames.literal(prompt.escalation().value()) + ")";
        return "new PromptDefinition(" + JavaNames.literal(prompt.name()) + ", " + JavaNames.literal(prompt.body())
                + ", " + name(prompt.model()) + ", " + name(prompt.schema()) + ", " + prompt.expectsList() + ", "
                + name(prompt.inherit()) + ", " + escalation + ")";
    }

    private static String agent(Declaration.AgentDef agent) {
        String timeout = agent.timeout() == null ? "null" : agent.timeout().seconds() + "L";
        return "new AgentDefinition(" + JavaNames.literal(agent.name()) + ", " + name(agent.instruction()) + ", "
                + name(agent.prompt()) + ", " + name(agent.model()) + ", " + names(agent.tools()) + ", "
                + names(agent.delegates()) + ", " + names(agent.uses()) + ", " + name(agent.retryPolicy()) + ", "
                + name(agent.timeoutPolicy()) + ", " + timeout + ", " + name(agent.produces()) + ", "
                + JavaNames.literal(agent.description()) + ")";
    }

    private static String name(Reference reference) {
        return reference == null ? "null" : JavaNames.literal(reference.name());
    }

    private static String names(List<Reference> references) {
        return strings(references.stream().map(Reference::name).collect(Collectors.toList()));
    }

    private static String strings(List<String> values) {
        return values.stream().map(JavaNames::literal).collect(Collectors.joining(", ", "List.of(", ")"));
    }

    private static String map(Map<String, String> properties) {
        if (properties.isEmpty()) {
            return "Map.of()";
        }
        return properties.entrySet().stream()
                .map(entry -> "Map.entry(" + JavaNames.literal(entry.getKey()) + ", "
                        + JavaNames.literal(entry.getValue()) + ")")
                .collect(Collectors.joining(", ", "Map.ofEntries(", ")"));
    }

    // ── Dispatchers and methods ──

    private void flowDispatcher() {
        out.emit("@Override");
        out.open("public JsonNode runFlow(String name, WorkflowContext ctx)");
        out.open("switch (name)");
        for (String flow : flows.keySet()) {
            out.emit("case " + JavaNames.literal(flow) + ":");
            out.indent();
            out.emit("return " + JavaNames.flowMethod(flow) + "(ctx);");
            out.dedent();
        }
        out.emit("default:");
        out.indent();
        out.emit("throw new UnknownDefinitionException(\"flow\", name);");
        out.dedent();
        out.close();
        out.close();
    }

    private void handlerDispatcher() {
        out.emit("@Override");
        out.open("public JsonNode handle(String timing, String event, WorkflowContext ctx)");
        out.open("switch (timing + \" \" + event)");
        for (Declaration.HandlerDef handler : handlers()) {
            out.emit("case " + JavaNames.literal(handler.key()) + ":");
            out.indent();
            out.emit("return " + JavaNames.handlerMethod(handler.timing(), handler.event().name()) + "(ctx);");
            out.dedent();
        }
        out.emit("default:");
        out.indent();
        out.emit("return Values.NULL;");
        out.dedent();
        out.close();
        out.close();
    }

    private void flowMethod(String file, Declaration.FlowDef flow) {
        out.originFile(file);
        out.open("private JsonNode " + JavaNames.flowMethod(flow.name()) + "(WorkflowContext ctx)", flow.span());
        new FlowBodyEmitter(file, out, analysis).body(flow.body());
        out.close();
        out.originFile(unit.fileId());
    }

    private void handlerMethod(Declaration.HandlerDef handler) {
        out.open(
                "private JsonNode " + JavaNames.handlerMethod(handler.timing(), handler.event().name())
                        + "(WorkflowContext ctx)",
                handler.span());
        new FlowBodyEmitter(unit.fileId(), out, analysis).body(handler.body());
        out.close();
    }
}
