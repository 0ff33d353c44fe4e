package io.agentflow.compiler.codegen;

import io.agentflow.compiler.ast.Expression;
import io.agentflow.compiler.ast.Reference;
import io.agentflow.compiler.ast.Statement;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.CodeGenerationException;
import io.agentflow.compiler.semantic.AnalysisResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits the body of one flow or handler method. Each visit returns whether the statement can
 * complete normally; once a statement cannot, the rest of its block is unreachable in Java and is
 * skipped.
 *
 * <p>
 * Not thread-safe; one instance per generated method.
 */
final class FlowBodyEmitter implements Statement.Visitor<Boolean> {

    private static final Logger LOG = LoggerFactory.getLogger(FlowBodyEmitter.class);

    private final String fileId;
    private final CodeEmitter out;
    private final ExpressionEmitter expressions;
    private final AnalysisResult analysis;
    private final String ctx = ExpressionEmitter.CONTEXT;

    FlowBodyEmitter(String fileId, CodeEmitter out, AnalysisResult analysis) {
        this.fileId = fileId;
        this.out = out;
        this.analysis = analysis;
        this.expressions = new ExpressionEmitter(fileId);
    }

    /**
     * Emits a method body and, if its end is reachable, the trailing {@code return Values.NULL;}.
     */
    void body(List<Statement> statements) {
        if (block(statements)) {
            out.emit("return Values.NULL;");
        }
    }

    /** @return whether the block can complete normally */
    boolean block(List<Statement> statements) {
        for (int i = 0; i < statements.size(); i++) {
            if (!statements.get(i).accept(this)) {
                if (i + 1 < statements.size()) {
                    LOG.debug(
                            "Skipped unreachable statements: file={}, line={}, count={}",
                            fileId,
                            statements.get(i + 1).span() == null ? 0 : statements.get(i + 1).span().startLine(),
                            statements.size() - i - 1);
                }
                return false;
            }
        }
        return true;
    }

    private String variable(Reference reference) {
        return JavaNames.literal(reference.name());
    }

    private void assign(Reference target, String value, Statement origin) {
        out.emit(ctx + ".set(" + variable(target) + ", " + value + ");", origin.span());
    }

    /** Message text: string literals may interpolate {@code $name}; other values are displayed. */
    private String message(Expression expression) {
        if (expression == null) {
            return "\"\"";
        }
        if (expression instanceof Expression.Literal literal && literal.kind() == Expression.Literal.Kind.STRING) {
            return literal.value().indexOf('$') >= 0
                    ? ctx + ".interpolate(" + JavaNames.literal(literal.value()) + ")"
                    : JavaNames.literal(literal.value());
        }
        return "Values.display(" + expressions.value(expression) + ")";
    }

    // ── Assignments and calls ──

    @Override
    public Boolean visitAssignment(Statement.Assignment statement) {
        assign(statement.target(), expressions.value(statement.value()), statement);
        return true;
    }

    @Override
    public Boolean visitPropertyAssignment(Statement.PropertyAssignment statement) {
        StringBuilder path = new StringBuilder();
        for (String property : statement.path()) {
            path.append(", ").append(JavaNames.literal(property));
        }
        String target = variable(statement.target());
        assign(
                statement.target(),
                "Values.withPath(" + ctx + ".get(" + target + "), " + expressions.value(statement.value()) + path + ")",
                statement);
        return true;
    }

    @Override
    public Boolean visitRun(Statement.RunStmt statement) {
        String callee = JavaNames.literal(statement.callee().name());
        String arguments = expressions.arguments(statement.arguments());
        if (!statement.isAgent()) {
            String call = ctx + ".runFlow(" + callee + ", " + arguments + ")";
            emitResult(statement.target(), call, statement);
            return true;
        }
        Statement.EscalationHandler handler = statement.handler();
        if (handler == null) {
            emitResult(statement.target(), ctx + ".runAgent(" + callee + ", " + arguments + ")", statement);
            return true;
        }
        String outcome = expressions.fresh("outcome");
        out.emit(
                "AgentOutcome " + outcome + " = " + ctx + ".runAgentWithEscalation(" + callee + ", " + arguments + ");",
                statement.span());
        out.open("if (" + outcome + ".escalated())", handler.span());
        switch (handler.action()) {
            case RETURN:
                out.emit("return " + expressions.value(handler.value()) + ";", handler.span());
                break;
            case CONTINUE:
                out.emit("continue;", handler.span());
                break;
            case ABORT:
                out.emit(
                        "throw new WorkflowAbortedException("
                                + JavaNames.literal("agent '" + statement.callee().name() + "' escalated")
                                + ", SOURCE_FILE);",
                        handler.span());
                break;
            default:
                throw new IllegalStateException("Unknown escalation action: " + handler.action());
        }
        out.close();
        if (statement.target() != null) {
            assign(statement.target(), outcome + ".value()", statement);
        }
        return true;
    }

    private void emitResult(Reference target, String call, Statement origin) {
        if (target == null) {
            out.emit(call + ";", origin.span());
        } else {
            assign(target, call, origin);
        }
    }

    @Override
    public Boolean visitCall(Statement.CallStmt statement) {
        String model = statement.model() == null ? "null" : variable(statement.model());
        String call = ctx + ".callLlm(" + JavaNames.literal(statement.prompt().name()) + ", "
                + expressions.arguments(statement.arguments()) + ", " + model + ")";
        emitResult(statement.target(), call, statement);
        return true;
    }

    // ── Control flow ──

    @Override
    public Boolean visitFor(Statement.ForLoop statement) {
        String item = expressions.fresh("element");
        out.open(
                "for (JsonNode " + item + " : Values.iterate(" + expressions.value(statement.iterable()) + "))",
                statement.span());
        out.emit(ctx + ".set(" + variable(statement.variable()) + ", " + item + ");");
        block(statement.body());
        out.close();
        return true;
    }

    /** Branches become one {@code ctx.runParallel} call; results are assigned in branch order. */
    @Override
    public Boolean visitParallel(Statement.ParallelBlock statement) {
        List<Statement.RunStmt> runs = new ArrayList<>();
        for (Statement branch : statement.body()) {
            if (!(branch instanceof Statement.RunStmt run) || !run.isAgent() || run.handler() != null) {
                throw new CodeGenerationException(Diagnostic.of(
                                ErrorCode.E0012, fileId, branch.span(), Map.of("statement", describe(branch)))
                        .withHelp("only 'run agent' statements without an escalation handler may run in parallel"));
            }
            runs.add(run);
        }
        if (runs.isEmpty()) {
            return true;
        }
        String results = expressions.fresh("results");
        out.emit("List<JsonNode> " + results + " = " + ctx + ".runParallel(List.of(", statement.span());
        for (int i = 0; i < runs.size(); i++) {
            Statement.RunStmt run = runs.get(i);
            out.emitMapped(
                    "        new AgentInvocation(" + JavaNames.literal(run.callee().name()) + ", "
                            + expressions.arguments(run.arguments()) + ")" + (i + 1 < runs.size() ? "," : "));"),
                    run.span());
        }
        for (int i = 0; i < runs.size(); i++) {
            Statement.RunStmt run = runs.get(i);
            if (run.target() != null) {
                assign(run.target(), results + ".get(" + i + ")", run);
            }
        }
        return true;
    }

    private static String describe(Statement statement) {
        if (statement instanceof Statement.RunStmt run && run.isAgent()) {
            return "'run agent' with escalation handler";
        }
        return statement.describe();
    }

    @Override
    public Boolean visitLoop(Statement.LoopBlock statement) {
        if (statement.isBounded()) {
            String counter = expressions.fresh("iteration");
            out.open(
                    "for (long " + counter + " = 0; " + counter + " < " + statement.max() + "L; " + counter + "++)",
                    statement.span());
        } else {
            out.open("while (" + ctx + ".active())", statement.span());
        }
        block(statement.body());
        out.close();
        return true;
    }

    @Override
    public Boolean visitIf(Statement.IfBlock statement) {
        out.open("if (" + expressions.condition(statement.condition()) + ")", statement.span());
        boolean thenCompletes = block(statement.thenBody());
        if (!statement.hasElse()) {
            out.close();
            return true;
        }
        out.closeAndOpen("else");
        boolean elseCompletes = block(statement.elseBody());
        out.close();
        return thenCompletes || elseCompletes;
    }

    /** An if/else-if chain over the subject, evaluated once into a local. */
    @Override
    public Boolean visitMatch(Statement.MatchBlock statement) {
        String subject = expressions.fresh("subject");
        out.emit("JsonNode " + subject + " = " + expressions.value(statement.subject()) + ";", statement.span());
        if (statement.clauses().isEmpty()) {
            return statement.otherwise() == null || statement.otherwise().accept(this);
        }
        boolean completes = false;
        for (int i = 0; i < statement.clauses().size(); i++) {
            Statement.WhenClause clause = statement.clauses().get(i);
            String test = "Values.eq(" + subject + ", " + expressions.value(clause.value()) + ")";
            if (i == 0) {
                out.open("if (" + test + ")", clause.span());
            } else {
                out.closeAndOpen("else if (" + test + ")");
            }
            completes |= clause.body().accept(this);
        }
        if (statement.otherwise() == null) {
            out.close();
            return true;
        }
        out.closeAndOpen("else");
        completes |= statement.otherwise().accept(this);
        out.close();
        return completes;
    }

    @Override
    public Boolean visitReturn(Statement.ReturnStmt statement) {
        out.emit("return " + expressions.value(statement.value()) + ";", statement.span());
        return false;
    }

    @Override
    public Boolean visitPush(Statement.PushStmt statement) {
        String target = variable(statement.target());
        assign(
                statement.target(),
                "Values.append(" + ctx + ".get(" + target + "), " + expressions.value(statement.value()) + ")",
                statement);
        return true;
    }

    @Override
    public Boolean visitEscalate(Statement.EscalateStmt statement) {
        out.emit(ctx + ".escalateToHuman(" + message(statement.message()) + ");", statement.span());
        return true;
    }

    @Override
    public Boolean visitLog(Statement.LogStmt statement) {
        out.emit(ctx + ".log(" + message(statement.message()) + ");", statement.span());
        return true;
    }

    @Override
    public Boolean visitNotify(Statement.NotifyStmt statement) {
        out.emit(ctx + ".notify(" + message(statement.message()) + ");", statement.span());
        return true;
    }

    @Override
    public Boolean visitContinue(Statement.ContinueStmt statement) {
        out.emit("continue;", statement.span());
        return false;
    }

    @Override
    public Boolean visitAbort(Statement.AbortStmt statement) {
        String text = statement.message() == null ? JavaNames.literal("aborted") : message(statement.message());
        out.emit("throw new WorkflowAbortedException(" + text + ", SOURCE_FILE);", statement.span());
        return false;
    }

    // ── Guardrail actions ──

    @Override
    public Boolean visitMask(Statement.MaskAction statement) {
        out.emit(ctx + ".mask(" + variable(statement.guardrail()) + ");", statement.span());
        return true;
    }

    @Override
    public Boolean visitBlock(Statement.BlockAction statement) {
        out.open("if (" + guardrailCondition(statement.condition()) + ")", statement.span());
        out.emit(ctx + ".block(" + JavaNames.literal(reason(statement.condition(), statement)) + ");");
        out.close();
        return true;
    }

    @Override
    public Boolean visitWarn(Statement.WarnAction statement) {
        if (statement.condition() == null) {
            out.emit(ctx + ".warn(" + message(Expression.Literal.string(statement.message(), null)) + ");",
                    statement.span());
            return true;
        }
        out.open("if (" + guardrailCondition(statement.condition()) + ")", statement.span());
        out.emit(ctx + ".warn(" + JavaNames.literal(reason(statement.condition(), statement)) + ");");
        out.close();
        return true;
    }

    @Override
    public Boolean visitRetry(Statement.RetryAction statement) {
        String retry = ctx + ".retryWith(" + expressions.value(statement.replacement()) + ");";
        if (statement.condition() == null) {
            out.emit(retry, statement.span());
            return true;
        }
        out.open("if (" + expressions.condition(statement.condition()) + ")", statement.span());
        out.emit(retry);
        out.close();
        return true;
    }

    /**
     * A bare guardrail name checks the guardrail unless a variable of that name is in scope;
     * anything else is an ordinary condition.
     */
    private String guardrailCondition(Expression condition) {
        String guardrail = guardrailName(condition);
        if (guardrail != null) {
            return ctx + ".guardrail(" + JavaNames.literal(guardrail) + ")";
        }
        return expressions.condition(condition);
    }

    private String guardrailName(Expression condition) {
        if (condition instanceof Expression.VarRef ref && analysis.isGuardrailCheck(ref)) {
            return ref.name();
        }
        return null;
    }

    private String reason(Expression condition, Statement statement) {
        String guardrail = guardrailName(condition);
        if (guardrail != null) {
            return "guardrail '" + guardrail + "' triggered";
        }
        int line = statement.span() == null ? 0 : statement.span().startLine();
        return "condition at " + fileId + ":" + line + " matched";
    }
}
