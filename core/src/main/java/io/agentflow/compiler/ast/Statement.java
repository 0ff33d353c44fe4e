package io.agentflow.compiler.ast;

import io.agentflow.compiler.source.SourceSpan;
import java.util.List;
import java.util.Objects;

/**
 * Statement nodes of flow and handler bodies. The set of variants is closed; analysis and
 * generation dispatch through {@link Visitor}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Statement {

    SourceSpan span();

    <R> R accept(Visitor<R> visitor);

    /** Short human name used in diagnostics, e.g. {@code 'log'} or {@code assignment}. */
    String describe();

    /** One method per statement variant. */
    interface Visitor<R> {

        R visitAssignment(Assignment statement);

        R visitPropertyAssignment(PropertyAssignment statement);

        R visitRun(RunStmt statement);

        R visitCall(CallStmt statement);

        R visitFor(ForLoop statement);

        R visitParallel(ParallelBlock statement);

        R visitLoop(LoopBlock statement);

        R visitIf(IfBlock statement);

        R visitMatch(MatchBlock statement);

        R visitReturn(ReturnStmt statement);

        R visitPush(PushStmt statement);

        R visitEscalate(EscalateStmt statement);

        R visitLog(LogStmt statement);

        R visitNotify(NotifyStmt statement);

        R visitContinue(ContinueStmt statement);

        R visitAbort(AbortStmt statement);

        R visitMask(MaskAction statement);

        R visitBlock(BlockAction statement);

        R visitWarn(WarnAction statement);

        R visitRetry(RetryAction statement);
    }

    // ── Assignments ──

    record Assignment(Reference target, Expression value, SourceSpan span) implements Statement {
        public Assignment {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }

        @Override
        public String describe() {
            return "assignment";
        }
    }

    /** {@code $obj.a.b = value}. */
    record PropertyAssignment(Reference target, List<String> path, Expression value, SourceSpan span)
            implements Statement {
        public PropertyAssignment {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
            path = List.copyOf(path);
            if (path.isEmpty()) {
                throw new IllegalArgumentException("property path must not be empty");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPropertyAssignment(this);
        }

        @Override
        public String describe() {
            return "property assignment";
        }
    }

    // ── Invocations ──

    /**
     * {@code [$x =] run agent name args} or {@code [$x =] run [flow] name args}.
     *
     * @param target    variable receiving the result, or {@code null}
     * @param kind      whether an agent or a flow is run
     * @param callee    the agent or flow name
     * @param arguments positional arguments
     * @param handler   escalation handler, or {@code null}
     */
    record RunStmt(
            Reference target,
            Kind kind,
            Reference callee,
            List<Expression> arguments,
            EscalationHandler handler,
            SourceSpan span)
            implements Statement {

        /** What a run statement invokes. */
        public enum Kind {
            AGENT,
            FLOW
        }

        public RunStmt {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(callee, "callee must not be null");
            arguments = List.copyOf(arguments);
        }

        public boolean isAgent() {
            return kind == Kind.AGENT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRun(this);
        }

        @Override
        public String describe() {
            return isAgent() ? "'run agent'" : "'run' of flow '" + callee.name() + "'";
        }
    }

    /**
     * {@code , on escalate return <expr> | continue | abort}.
     *
     * @param value returned value for {@link Action#RETURN}, otherwise {@code null}
     */
    record EscalationHandler(Action action, Expression value, SourceSpan span) {

        /** What to do when the agent escalates. */
        public enum Action {
            RETURN,
            CONTINUE,
            ABORT
        }

        public EscalationHandler {
            Objects.requireNonNull(action, "action must not be null");
        }

        public boolean exits() {
            return action == Action.RETURN || action == Action.ABORT;
        }
    }

    /**
     * {@code [$x =] call llm prompt args [using model m]}.
     *
     * @param model model override, or {@code null}
     */
    record CallStmt(Reference target, Reference prompt, List<Expression> arguments, Reference model, SourceSpan span)
            implements Statement {
        public CallStmt {
            Objects.requireNonNull(prompt, "prompt must not be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String describe() {
            return "'call llm'";
        }
    }

    // ── Control flow ──

    record ForLoop(Reference variable, Expression iterable, List<Statement> body, SourceSpan span)
            implements Statement {
        public ForLoop {
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(iterable, "iterable must not be null");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }

        @Override
        public String describe() {
            return "'for'";
        }
    }

    record ParallelBlock(List<Statement> body, SourceSpan span) implements Statement {
        public ParallelBlock {
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParallel(this);
        }

        @Override
        public String describe() {
            return "'parallel'";
        }
    }

    /** {@code loop [max N] do ... end}; {@code max} is {@code null} for an unbounded loop. */
    record LoopBlock(Long max, List<Statement> body, SourceSpan span) implements Statement {
        public LoopBlock {
            body = List.copyOf(body);
        }

        public boolean isBounded() {
            return max != null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLoop(this);
        }

        @Override
        public String describe() {
            return "'loop'";
        }
    }

    /** {@code elseBody} is empty when there is no {@code else:} part. */
    record IfBlock(Expression condition, List<Statement> thenBody, List<Statement> elseBody, boolean hasElse, SourceSpan span)
            implements Statement {
        public IfBlock {
            Objects.requireNonNull(condition, "condition must not be null");
            thenBody = List.copyOf(thenBody);
            elseBody = List.copyOf(elseBody);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public String describe() {
            return "'if'";
        }
    }

    /** {@code otherwise} is {@code null} when there is no {@code else ->} clause. */
    record MatchBlock(Expression subject, List<WhenClause> clauses, Statement otherwise, SourceSpan span)
            implements Statement {
        public MatchBlock {
            Objects.requireNonNull(subject, "subject must not be null");
            clauses = List.copyOf(clauses);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatch(this);
        }

        @Override
        public String describe() {
            return "'match'";
        }
    }

    record WhenClause(Expression.Literal value, Statement body, SourceSpan span) {
        public WhenClause {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    // ── Simple statements ──

    record ReturnStmt(Expression value, SourceSpan span) implements Statement {
        public ReturnStmt {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public String describe() {
            return "'return'";
        }
    }

    /** {@code push value to $list}. */
    record PushStmt(Expression value, Reference target, SourceSpan span) implements Statement {
        public PushStmt {
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPush(this);
        }

        @Override
        public String describe() {
            return "'push'";
        }
    }

    /** {@code escalate [to human] [message]}. */
    record EscalateStmt(boolean toHuman, Expression message, SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEscalate(this);
        }

        @Override
        public String describe() {
            return "'escalate'";
        }
    }

    record LogStmt(Expression message, SourceSpan span) implements Statement {
        public LogStmt {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLog(this);
        }

        @Override
        public String describe() {
            return "'log'";
        }
    }

    record NotifyStmt(Expression message, SourceSpan span) implements Statement {
        public NotifyStmt {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNotify(this);
        }

        @Override
        public String describe() {
            return "'notify'";
        }
    }

    record ContinueStmt(SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }

        @Override
        public String describe() {
            return "'continue'";
        }
    }

    /** {@code abort [message]}. */
    record AbortStmt(Expression message, SourceSpan span) implements Statement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbort(this);
        }

        @Override
        public String describe() {
            return "'abort'";
        }
    }

    // ── Guardrail actions ──

    /** {@code mask pii}. */
    record MaskAction(Reference guardrail, SourceSpan span) implements Statement {
        public MaskAction {
            Objects.requireNonNull(guardrail, "guardrail must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMask(this);
        }

        @Override
        public String describe() {
            return "mask";
        }
    }

    /** {@code block if condition}. A bare guardrail name as condition runs that guardrail check. */
    record BlockAction(Expression condition, SourceSpan span) implements Statement {
        public BlockAction {
            Objects.requireNonNull(condition, "condition must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }

        @Override
        public String describe() {
            return "block";
        }
    }

    /** {@code warn if condition} or {@code warn "message"}; exactly one of the two is set. */
    record WarnAction(Expression condition, String message, SourceSpan span) implements Statement {
        public WarnAction {
            if ((condition == null) == (message == null)) {
                throw new IllegalArgumentException("warn requires either a condition or a message");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWarn(this);
        }

        @Override
        public String describe() {
            return "warn";
        }
    }

    /** {@code retry with replacement if condition}. */
    record RetryAction(Expression replacement, Expression condition, SourceSpan span) implements Statement {
        public RetryAction {
            Objects.requireNonNull(replacement, "replacement must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRetry(this);
        }

        @Override
        public String describe() {
            return "retry";
        }
    }
}
