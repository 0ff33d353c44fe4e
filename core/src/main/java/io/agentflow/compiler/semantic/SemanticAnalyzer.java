package io.agentflow.compiler.semantic;

import io.agentflow.compiler.ast.CompilationUnit;
import io.agentflow.compiler.ast.Declaration;
import io.agentflow.compiler.ast.Expression;
import io.agentflow.compiler.ast.Reference;
import io.agentflow.compiler.ast.Statement;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.source.SourceSpan;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only validation of a {@link CompilationUnit}. Runs, in order:
 *
 * <ol>
 * <li>global scope construction, reporting duplicate definitions (E0003);
 * <li>reference resolution for declarations, with nearest-name suggestions (E0001, E0010);
 * <li>flow and handler bodies: definition-before-use of variables (E0002), guardrail contexts
 * (E0009) and {@code continue} placement (E0013);
 * <li>cycle detection over the agent/flow reference graph (E0011);
 * <li>structural policy warnings (W0001, W0002).
 * </ol>
 *
 * All findings are collected; analysis never stops at the first error. The AST is not modified.
 *
 * <p>
 * Not thread-safe; create one per compilation.
 */
public final class SemanticAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private static final Comparator<Diagnostic> SOURCE_ORDER = Comparator.comparingInt(Diagnostic::line)
            .thenComparingInt(Diagnostic::column);

    private final String fileId;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, Declaration.PromptDef> prompts = new LinkedHashMap<>();
    private final Map<String, Declaration.AgentDef> agents = new LinkedHashMap<>();
    private final ReferenceGraph graph = new ReferenceGraph();
    private final Set<Expression> guardrailChecks = new HashSet<>();
    private Scope global;

    public SemanticAnalyzer(String fileId) {
        this.fileId = fileId;
    }

    public AnalysisResult analyze(CompilationUnit unit) {
        return analyze(unit, List.of());
    }

    /**
     * Analyzes a unit whose imports have already been parsed.
     *
     * @param imports successfully imported units; their definitions become visible globally
     */
    public AnalysisResult analyze(CompilationUnit unit, List<CompilationUnit> imports) {
        long started = System.nanoTime();
        global = Scope.global();
        Builtins.GLOBAL_VARIABLES.forEach(name -> global.define(Symbol.builtin(name, SymbolKind.VARIABLE)));
        Builtins.GUARDRAILS.forEach(name -> global.define(Symbol.builtin(name, SymbolKind.GUARDRAIL)));

        for (CompilationUnit imported : imports) {
            collect(imported, true);
        }
        collect(unit, false);
        resolveDeclarations(unit);
        checkBodies(unit);
        detectCycles();

        List<Diagnostic> ordered = new ArrayList<>(diagnostics);
        ordered.sort(SOURCE_ORDER);
        LOG.debug(
                "Analyzed unit: file={}, diagnostics={}, duration_us={}",
                fileId,
                ordered.size(),
                (System.nanoTime() - started) / 1_000);
        return new AnalysisResult(ordered, prompts, guardrailChecks);
    }

    // ── (a) Global scope ──

    private void collect(CompilationUnit unit, boolean imported) {
        Map<String, SourceSpan> handlers = new LinkedHashMap<>();
        for (Declaration declaration : unit.declarations()) {
            if (declaration instanceof Declaration.ModelDef model) {
                define(unit, model.name(), SymbolKind.MODEL, model.span(), imported);
            } else if (declaration instanceof Declaration.ToolDef tool) {
                define(unit, tool.name(), SymbolKind.TOOL, tool.span(), imported);
            } else if (declaration instanceof Declaration.SchemaDef schema) {
                define(unit, schema.name(), SymbolKind.SCHEMA, schema.span(), imported);
            } else if (declaration instanceof Declaration.PromptDef prompt) {
                collectPrompt(prompt, imported);
            } else if (declaration instanceof Declaration.AgentDef agent) {
                if (define(unit, agent.name(), SymbolKind.AGENT, agent.span(), imported)) {
                    agents.put(agent.name(), agent);
                    graph.addVertex(new ReferenceGraph.Vertex(SymbolKind.AGENT, agent.name()), agent.span());
                }
                if (agent.produces() != null) {
                    global.define(new Symbol(
                            agent.produces().name(), SymbolKind.VARIABLE, unit.fileId(), agent.produces().span()));
                }
            } else if (declaration instanceof Declaration.FlowDef flow) {
                if (define(unit, flow.name(), SymbolKind.FLOW, flow.span(), imported)) {
                    graph.addVertex(new ReferenceGraph.Vertex(SymbolKind.FLOW, flow.name()), flow.span());
                }
            } else if (declaration instanceof Declaration.RetryPolicyDef retry) {
                define(unit, retry.name(), SymbolKind.RETRY_POLICY, retry.span(), imported);
            } else if (declaration instanceof Declaration.TimeoutPolicyDef timeout) {
                define(unit, timeout.name(), SymbolKind.TIMEOUT_POLICY, timeout.span(), imported);
            } else if (declaration instanceof Declaration.PolicyDef policy) {
                define(unit, policy.name(), SymbolKind.POLICY, policy.span(), imported);
            } else if (declaration instanceof Declaration.HandlerDef handler && !imported) {
                SourceSpan first = handlers.putIfAbsent(handler.key(), handler.span());
                if (first != null) {
                    report(Diagnostic.of(
                                    ErrorCode.E0003,
                                    fileId,
                                    handler.span(),
                                    Map.of("kind", "handler", "name", handler.key()))
                            .withLabel(first, "first defined here"));
                }
            }
        }
    }

    /** @return {@code true} if the name was free */
    private boolean define(CompilationUnit unit, String name, SymbolKind kind, SourceSpan span, boolean imported) {
        Symbol existing = global.define(new Symbol(name, kind, unit.fileId(), span));
        if (existing == null) {
            return true;
        }
        if (!imported && Objects.equals(existing.file(), fileId)) {
            report(Diagnostic.of(ErrorCode.E0003, fileId, span, Map.of("kind", kind.label(), "name", name))
                    .withLabel(existing.span(), "first defined here"));
        }
        return false;
    }

    /** Repeated prompt declarations merge: a later body wins, later modifiers fill gaps. */
    private void collectPrompt(Declaration.PromptDef prompt, boolean imported) {
        Declaration.PromptDef existing = prompts.get(prompt.name());
        if (existing == null) {
            prompts.put(prompt.name(), prompt);
            global.define(new Symbol(prompt.name(), SymbolKind.PROMPT, imported ? null : fileId, prompt.span()));
            return;
        }
        if (conflicts(existing.model(), prompt.model()) || conflicts(existing.schema(), prompt.schema())
                || conflicts(existing.inherit(), prompt.inherit())
                || (existing.schema() != null && prompt.schema() != null
                        && existing.expectsList() != prompt.expectsList())) {
            if (!imported) {
                report(Diagnostic.of(
                                ErrorCode.E0003, fileId, prompt.span(), Map.of("kind", "prompt", "name", prompt.name()))
                        .withLabel(existing.span(), "first defined here")
                        .withHelp("repeated prompt declarations must not disagree on 'using model', 'expecting' or 'inherit'"));
            }
            return;
        }
        prompts.put(
                prompt.name(),
                new Declaration.PromptDef(
                        prompt.name(),
                        prompt.body().isEmpty() ? existing.body() : prompt.body(),
                        prompt.model() != null ? prompt.model() : existing.model(),
                        prompt.schema() != null ? prompt.schema() : existing.schema(),
                        prompt.schema() != null ? prompt.expectsList() : existing.expectsList(),
                        prompt.inherit() != null ? prompt.inherit() : existing.inherit(),
                        prompt.escalation() != null ? prompt.escalation() : existing.escalation(),
                        prompt.body().isEmpty() ? existing.span() : prompt.span()));
    }

    private static boolean conflicts(Reference first, Reference second) {
        return first != null && second != null && !first.name().equals(second.name());
    }

    // ── (b) Declaration references ──

    private void resolveDeclarations(CompilationUnit unit) {
        for (Declaration declaration : unit.declarations()) {
            if (declaration instanceof Declaration.SchemaDef schema) {
                for (Declaration.SchemaDef.Field field : schema.fields()) {
                    if (!Builtins.PRIMITIVE_TYPES.contains(field.type().name())) {
                        require(SymbolKind.SCHEMA, field.type());
                    }
                }
            } else if (declaration instanceof Declaration.PromptDef prompt) {
                requireOptional(SymbolKind.MODEL, prompt.model());
                requireOptional(SymbolKind.SCHEMA, prompt.schema());
            } else if (declaration instanceof Declaration.AgentDef agent) {
                resolveAgent(agent);
            } else if (declaration instanceof Declaration.HandlerDef handler) {
                if (!Builtins.EVENTS.contains(handler.event().name())) {
                    undefined("event", handler.event(), Builtins.EVENTS);
                }
            }
        }
    }

    private void resolveAgent(Declaration.AgentDef agent) {
        if (agent.instruction() == null && agent.prompt() == null) {
            report(Diagnostic.of(
                            ErrorCode.E0010,
                            fileId,
                            agent.span(),
                            Map.of("property", "instruction", "kind", "agent '" + agent.name() + "'"))
                    .withHelp("add 'instruction <prompt_name>' to specify the agent's instruction prompt"));
        }
        requireOptional(SymbolKind.PROMPT, agent.instruction());
        if (agent.prompt() != null
                && global.resolve(SymbolKind.PROMPT, agent.prompt().name()) == null
                && global.resolve(SymbolKind.VARIABLE, agent.prompt().name()) == null) {
            List<String> candidates = new ArrayList<>(global.visibleNames(SymbolKind.PROMPT));
            candidates.addAll(global.visibleNames(SymbolKind.VARIABLE));
            undefined("prompt or variable", agent.prompt(), candidates);
        }
        requireOptional(SymbolKind.MODEL, agent.model());
        agent.tools().forEach(tool -> require(SymbolKind.TOOL, tool));
        requireOptional(SymbolKind.RETRY_POLICY, agent.retryPolicy());
        requireOptional(SymbolKind.TIMEOUT_POLICY, agent.timeoutPolicy());
        if (agent.timeout() != null && !agent.timeout().isKnownUnit()) {
            report(Diagnostic.of(
                    ErrorCode.E0004,
                    fileId,
                    agent.timeout().span(),
                    Map.of("expected", "a time unit (seconds, minutes, hours)", "found", "'" + agent.timeout().unit() + "'")));
        }

        ReferenceGraph.Vertex self = new ReferenceGraph.Vertex(SymbolKind.AGENT, agent.name());
        for (Reference delegate : agent.delegates()) {
            require(SymbolKind.AGENT, delegate);
            graph.addEdge(self, new ReferenceGraph.Vertex(SymbolKind.AGENT, delegate.name()));
        }
        for (Reference use : agent.uses()) {
            require(SymbolKind.AGENT, use);
            if (!use.name().equals(agent.name())) {
                graph.addEdge(self, new ReferenceGraph.Vertex(SymbolKind.AGENT, use.name()));
            }
        }
        if (!agent.delegates().isEmpty() && !agent.uses().isEmpty()) {
            report(Diagnostic.of(ErrorCode.W0002, fileId, agent.span(), Map.of("name", agent.name()))
                    .withHelp("'delegate' hands the conversation over, 'use' calls the agent as a tool; pick one"));
        }
    }

    // ── (c) Bodies ──

    private void checkBodies(CompilationUnit unit) {
        List<Declaration.HandlerDef> handlers = unit.handlers();
        for (Declaration.HandlerDef handler : handlers) {
            if (isStartHandler(handler)) {
                new BodyChecker(global, handler.event().name(), null).statements(handler.body());
            }
        }
        for (Declaration declaration : unit.declarations()) {
            if (declaration instanceof Declaration.FlowDef flow) {
                Scope scope = global.child(Scope.Type.FLOW);
                for (Reference parameter : flow.parameters()) {
                    scope.define(new Symbol(parameter.name(), SymbolKind.VARIABLE, fileId, parameter.span()));
                }
                new BodyChecker(scope, "flow", new ReferenceGraph.Vertex(SymbolKind.FLOW, flow.name()))
                        .statements(flow.body());
            } else if (declaration instanceof Declaration.HandlerDef handler && !isStartHandler(handler)) {
                Scope scope = global.child(Scope.Type.HANDLER);
                Builtins.HANDLER_VARIABLES.forEach(name -> scope.define(Symbol.builtin(name, SymbolKind.VARIABLE)));
                new BodyChecker(scope, handler.event().name(), null).statements(handler.body());
            }
        }
    }

    private static boolean isStartHandler(Declaration.HandlerDef handler) {
        return handler.timing().equals("on") && handler.event().name().equals("start");
    }

    /** Walks one flow or handler body. */
    private final class BodyChecker implements Statement.Visitor<Void>, Expression.Visitor<Void> {

        private final String context;
        private final ReferenceGraph.Vertex owner;
        private Scope scope;
        private int loopDepth;
        private int filterDepth;

        /**
         * @param context {@code flow} or the handler's event name
         * @param owner   graph vertex of the enclosing flow, or {@code null} in handlers
         */
        BodyChecker(Scope scope, String context, ReferenceGraph.Vertex owner) {
            this.scope = scope;
            this.context = context;
            this.owner = owner;
        }

        void statements(List<Statement> statements) {
            for (Statement statement : statements) {
                statement.accept(this);
            }
        }

        private void nested(List<Statement> body, boolean loop) {
            Scope saved = scope;
            scope = scope.child(Scope.Type.BLOCK);
            if (loop) {
                loopDepth++;
            }
            try {
                statements(body);
            } finally {
                if (loop) {
                    loopDepth--;
                }
                scope = saved;
            }
        }

        private void assign(Reference target) {
            if (target != null) {
                scope.define(new Symbol(target.name(), SymbolKind.VARIABLE, fileId, target.span()));
            }
        }

        private void expression(Expression expression) {
            if (expression != null) {
                expression.accept(this);
            }
        }

        // ── Statements ──

        @Override
        public Void visitAssignment(Statement.Assignment statement) {
            expression(statement.value());
            assign(statement.target());
            return null;
        }

        @Override
        public Void visitPropertyAssignment(Statement.PropertyAssignment statement) {
            expression(statement.value());
            assign(statement.target());
            return null;
        }

        @Override
        public Void visitRun(Statement.RunStmt statement) {
            SymbolKind kind = statement.isAgent() ? SymbolKind.AGENT : SymbolKind.FLOW;
            require(kind, statement.callee());
            if (owner != null) {
                graph.addEdge(owner, new ReferenceGraph.Vertex(kind, statement.callee().name()));
            }
            statement.arguments().forEach(this::expression);
            Statement.EscalationHandler handler = statement.handler();
            if (handler != null) {
                expression(handler.value());
                if (handler.action() == Statement.EscalationHandler.Action.CONTINUE && loopDepth == 0) {
                    report(Diagnostic.of(ErrorCode.E0013, fileId, handler.span(), Map.of()));
                }
            }
            if (statement.target() != null) {
                assign(statement.target());
            } else if (statement.isAgent()) {
                Declaration.AgentDef agent = agents.get(statement.callee().name());
                if (agent != null && agent.produces() != null) {
                    assign(agent.produces());
                }
            }
            return null;
        }

        @Override
        public Void visitCall(Statement.CallStmt statement) {
            require(SymbolKind.PROMPT, statement.prompt());
            requireOptional(SymbolKind.MODEL, statement.model());
            statement.arguments().forEach(this::expression);
            assign(statement.target());
            return null;
        }

        @Override
        public Void visitFor(Statement.ForLoop statement) {
            expression(statement.iterable());
            Scope saved = scope;
            scope = scope.child(Scope.Type.BLOCK);
            assign(statement.variable());
            loopDepth++;
            try {
                statements(statement.body());
            } finally {
                loopDepth--;
                scope = saved;
            }
            return null;
        }

        /** Branches run concurrently: arguments see only what was defined before the block. */
        @Override
        public Void visitParallel(Statement.ParallelBlock statement) {
            List<Reference> targets = new ArrayList<>();
            for (Statement branch : statement.body()) {
                if (branch instanceof Statement.RunStmt run) {
                    Reference target = run.target();
                    Statement.RunStmt detached = new Statement.RunStmt(
                            null, run.kind(), run.callee(), run.arguments(), run.handler(), run.span());
                    visitRun(detached);
                    if (target != null) {
                        targets.add(target);
                    }
                } else {
                    branch.accept(this);
                }
            }
            targets.forEach(this::assign);
            return null;
        }

        @Override
        public Void visitLoop(Statement.LoopBlock statement) {
            nested(statement.body(), true);
            if (!statement.isBounded() && !hasExit(statement.body())) {
                report(Diagnostic.of(ErrorCode.W0001, fileId, statement.span(), Map.of())
                        .withHelp("add 'max N' or a 'return' or 'abort' inside the loop"));
            }
            return null;
        }

        @Override
        public Void visitIf(Statement.IfBlock statement) {
            expression(statement.condition());
            nested(statement.thenBody(), false);
            nested(statement.elseBody(), false);
            return null;
        }

        @Override
        public Void visitMatch(Statement.MatchBlock statement) {
            expression(statement.subject());
            for (Statement.WhenClause clause : statement.clauses()) {
                nested(List.of(clause.body()), false);
            }
            if (statement.otherwise() != null) {
                nested(List.of(statement.otherwise()), false);
            }
            return null;
        }

        @Override
        public Void visitReturn(Statement.ReturnStmt statement) {
            expression(statement.value());
            return null;
        }

        @Override
        public Void visitPush(Statement.PushStmt statement) {
            expression(statement.value());
            variable(statement.target().name(), statement.target().span());
            return null;
        }

        @Override
        public Void visitEscalate(Statement.EscalateStmt statement) {
            expression(statement.message());
            return null;
        }

        @Override
        public Void visitLog(Statement.LogStmt statement) {
            expression(statement.message());
            return null;
        }

        @Override
        public Void visitNotify(Statement.NotifyStmt statement) {
            expression(statement.message());
            return null;
        }

        @Override
        public Void visitContinue(Statement.ContinueStmt statement) {
            if (loopDepth == 0) {
                report(Diagnostic.of(ErrorCode.E0013, fileId, statement.span(), Map.of()));
            }
            return null;
        }

        @Override
        public Void visitAbort(Statement.AbortStmt statement) {
            expression(statement.message());
            return null;
        }

        @Override
        public Void visitMask(Statement.MaskAction statement) {
            guardrailContext("mask", statement.span(), false);
            require(SymbolKind.GUARDRAIL, statement.guardrail());
            return null;
        }

        @Override
        public Void visitBlock(Statement.BlockAction statement) {
            guardrailContext("block", statement.span(), false);
            guardrailCondition(statement.condition());
            return null;
        }

        @Override
        public Void visitWarn(Statement.WarnAction statement) {
            guardrailContext("warn", statement.span(), false);
            if (statement.condition() != null) {
                guardrailCondition(statement.condition());
            }
            return null;
        }

        @Override
        public Void visitRetry(Statement.RetryAction statement) {
            guardrailContext("retry", statement.span(), true);
            expression(statement.replacement());
            expression(statement.condition());
            return null;
        }

        private void guardrailContext(String action, SourceSpan span, boolean retry) {
            boolean allowed = retry
                    ? Builtins.RETRYABLE_EVENTS.contains(context)
                    : Builtins.GUARDED_EVENTS.contains(context);
            if (!allowed) {
                String allowedEvents = retry ? "output or tool-result" : "input, output, tool-call or tool-result";
                report(Diagnostic.of(ErrorCode.E0009, fileId, span, Map.of("action", action, "context", context))
                        .withHelp("'" + action + "' is only allowed in " + allowedEvents + " handlers"));
            }
        }

        /** A bare guardrail name is a guardrail check rather than a variable read. */
        private void guardrailCondition(Expression condition) {
            if (condition instanceof Expression.VarRef ref
                    && Builtins.isGuardrail(ref.name())
                    && scope.resolve(SymbolKind.VARIABLE, ref.name()) == null) {
                guardrailChecks.add(ref);
                return;
            }
            expression(condition);
        }

        // ── Expressions ──

        private void variable(String name, SourceSpan span) {
            if (scope.resolve(SymbolKind.VARIABLE, name) == null) {
                report(Diagnostic.of(ErrorCode.E0002, fileId, span, Map.of("name", name))
                        .withHelp(NameSuggester.help(name, scope.visibleNames(SymbolKind.VARIABLE))));
            }
        }

        @Override
        public Void visitVarRef(Expression.VarRef expression) {
            variable(expression.name(), expression.span());
            return null;
        }

        @Override
        public Void visitLiteral(Expression.Literal expression) {
            return null;
        }

        @Override
        public Void visitBinaryOp(Expression.BinaryOp expression) {
            expression(expression.left());
            expression(expression.right());
            return null;
        }

        @Override
        public Void visitUnaryOp(Expression.UnaryOp expression) {
            expression(expression.operand());
            return null;
        }

        @Override
        public Void visitPropertyAccess(Expression.PropertyAccess expression) {
            expression(expression.target());
            return null;
        }

        @Override
        public Void visitFunctionCall(Expression.FunctionCall expression) {
            if (expression.qualifiedName().isEmpty()) {
                report(Diagnostic.of(
                        ErrorCode.E0004,
                        fileId,
                        expression.callee().span(),
                        Map.of("expected", "a function name", "found", "an expression")));
            }
            expression.arguments().forEach(this::expression);
            return null;
        }

        @Override
        public Void visitListLiteral(Expression.ListLiteral expression) {
            expression.items().forEach(this::expression);
            return null;
        }

        @Override
        public Void visitObjectLiteral(Expression.ObjectLiteral expression) {
            expression.entries().forEach(entry -> expression(entry.value()));
            return null;
        }

        @Override
        public Void visitImplicitProperty(Expression.ImplicitProperty expression) {
            if (filterDepth == 0) {
                report(Diagnostic.of(
                        ErrorCode.E0004,
                        fileId,
                        expression.span(),
                        Map.of("expected", "an expression", "found", "implicit property '." + expression.property()
                                + "' outside of a filter condition")));
            }
            return null;
        }

        @Override
        public Void visitFilter(Expression.FilterExpr expression) {
            expression(expression.source());
            int saved = filterDepth;
            filterDepth = saved + 1;
            try {
                expression(expression.condition());
            } finally {
                filterDepth = saved;
            }
            return null;
        }
    }

    /** {@code true} if the body contains a statement that leaves the enclosing flow. */
    static boolean hasExit(List<Statement> body) {
        for (Statement statement : body) {
            if (statement instanceof Statement.ReturnStmt || statement instanceof Statement.AbortStmt) {
                return true;
            }
            if (statement instanceof Statement.RunStmt run && run.handler() != null && run.handler().exits()) {
                return true;
            }
            if (statement instanceof Statement.IfBlock block
                    && (hasExit(block.thenBody()) || hasExit(block.elseBody()))) {
                return true;
            }
            if (statement instanceof Statement.MatchBlock match) {
                for (Statement.WhenClause clause : match.clauses()) {
                    if (hasExit(List.of(clause.body()))) {
                        return true;
                    }
                }
                if (match.otherwise() != null && hasExit(List.of(match.otherwise()))) {
                    return true;
                }
            }
            if (statement instanceof Statement.ForLoop loop && hasExit(loop.body())) {
                return true;
            }
            if (statement instanceof Statement.LoopBlock loop && hasExit(loop.body())) {
                return true;
            }
            if (statement instanceof Statement.ParallelBlock parallel && hasExit(parallel.body())) {
                return true;
            }
        }
        return false;
    }

    // ── (d) Cycles ──

    private void detectCycles() {
        for (List<ReferenceGraph.Vertex> cycle : graph.cycles()) {
            ReferenceGraph.Vertex first = cycle.get(0);
            String path = cycle.stream().map(ReferenceGraph.Vertex::name).collect(Collectors.joining(" -> "));
            report(Diagnostic.of(ErrorCode.E0011, fileId, graph.span(first), Map.of("cycle", path)));
        }
    }

    // ── Helpers ──

    private void requireOptional(SymbolKind kind, Reference reference) {
        if (reference != null) {
            require(kind, reference);
        }
    }

    private void require(SymbolKind kind, Reference reference) {
        if (global.resolve(kind, reference.name()) == null) {
            undefined(kind.label(), reference, global.visibleNames(kind));
        }
    }

    private void undefined(String kind, Reference reference, List<String> candidates) {
        report(Diagnostic.of(ErrorCode.E0001, fileId, reference.span(), Map.of("kind", kind, "name", reference.name()))
                .withHelp(NameSuggester.help(reference.name(), candidates)));
    }

    private void report(Diagnostic diagnostic) {
        LOG.debug("Semantic finding: file={}, code={}, message={}", fileId, diagnostic.code().code(), diagnostic.message());
        diagnostics.add(diagnostic);
    }
}
