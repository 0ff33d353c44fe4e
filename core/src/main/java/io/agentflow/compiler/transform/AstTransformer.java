package io.agentflow.compiler.transform;

import io.agentflow.compiler.ast.BinaryOperator;
import io.agentflow.compiler.ast.CompilationUnit;
import io.agentflow.compiler.ast.Declaration;
import io.agentflow.compiler.ast.Expression;
import io.agentflow.compiler.ast.Reference;
import io.agentflow.compiler.ast.Statement;
import io.agentflow.compiler.ast.UnaryOperator;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.CompilerException;
import io.agentflow.compiler.error.InternalCompilerException;
import io.agentflow.compiler.error.TransformException;
import io.agentflow.compiler.lexer.Token;
import io.agentflow.compiler.lexer.TokenKind;
import io.agentflow.compiler.parser.ParseNode;
import io.agentflow.compiler.parser.ParseNode.Branch;
import io.agentflow.compiler.parser.ParseNode.Leaf;
import io.agentflow.compiler.source.SourceSpan;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a parse tree onto the AST. The mapping is structural and does not validate: wrapper nodes
 * are collapsed, spans are carried over, {@code $name} and bare {@code name} become the same
 * {@link Expression.VarRef}, and operator chains fold to the left.
 *
 * <p>
 * A tree shape this class does not know is a compiler defect and is raised as an
 * {@link InternalCompilerException} (E9999), never as a user error. A count that is not a whole
 * number is a user error and is raised as a {@link TransformException} (E0004).
 *
 * <p>
 * Not thread-safe; create one per compilation.
 */
public final class AstTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(AstTransformer.class);

    private static final String EXPRESSION = "or_expr";

    private final String fileId;

    public AstTransformer(String fileId) {
        this.fileId = fileId;
    }

    /**
     * Transforms the tree of a whole file.
     *
     * @throws InternalCompilerException if the tree contains a node this transformer does not know
     * @throws TransformException if a loop bound or retry count is not a whole number
     */
    public CompilationUnit transform(Branch root) {
        if (!root.is("compilation_unit")) {
            throw unexpected(root, "file root");
        }
        try {
            String version = null;
            List<Declaration> declarations = new ArrayList<>();
            for (Branch child : root.branches()) {
                if (child.is("version_decl")) {
                    version = joined(child.tokens().subList(1, child.tokens().size()));
                } else {
                    declarations.add(declaration(child));
                }
            }
            LOG.debug("Transformed parse tree: file={}, declarations={}", fileId, declarations.size());
            return new CompilationUnit(fileId, version, declarations);
        } catch (CompilerException e) {
            throw e;
        } catch (RuntimeException e) {
            Diagnostic diagnostic = Diagnostic.of(
                    ErrorCode.E9999, fileId, root.span(), Map.of("detail", "malformed parse tree: " + e.getMessage()));
            throw new InternalCompilerException(diagnostic, e, CompilerException.Phase.TRANSFORM);
        }
    }

    // ── Declarations ──

    private Declaration declaration(Branch node) {
        switch (node.rule()) {
            case "import_stmt":
                return importStmt(node);
            case "model_def":
                return model(node);
            case "tool_def":
                return tool(node);
            case "schema_def":
                return schema(node);
            case "prompt_def":
                return prompt(node);
            case "agent_def":
                return agent(node);
            case "flow_def":
                return new Declaration.FlowDef(
                        word(node, 1), references(node.tokens(TokenKind.VARIABLE)), block(node.branch("block")), node.span());
            case "event_handler":
                return handler(node);
            case "retry_policy":
                return retryPolicy(node);
            case "timeout_policy":
                return new Declaration.TimeoutPolicyDef(word(node, 1), duration(node.branch("duration")), node.span());
            case "policy_def":
                return new Declaration.PolicyDef(word(node, 1), properties(node.branch("property_block")), node.span());
            default:
                throw unexpected(node, "declaration");
        }
    }

    private Declaration.ImportStmt importStmt(Branch node) {
        Branch external = node.branch("external_import");
        if (external != null) {
            String name = external.tokens(TokenKind.IDENT).get(0).text();
            return new Declaration.ImportStmt(null, name, joined(external.branch("source_ref")), node.span());
        }
        Branch local = node.branch("local_import");
        List<Token> strings = local.tokens(TokenKind.STRING);
        String path = strings.isEmpty() ? joined(local.branch("path_ref")) : strings.get(0).text();
        return new Declaration.ImportStmt(path, null, null, node.span());
    }

    private Declaration.ModelDef model(Branch node) {
        String name = word(node, 1);
        Branch shortForm = node.branch("model_short");
        if (shortForm == null) {
            return new Declaration.ModelDef(
                    name, null, properties(node.branch("model_long").branch("property_block")), node.span());
        }
        List<Token> strings = shortForm.tokens(TokenKind.STRING);
        String identifier = strings.isEmpty() ? joined(shortForm.branch("model_id")) : strings.get(0).text();
        return new Declaration.ModelDef(name, identifier, Map.of(), node.span());
    }

    private Declaration.ToolDef tool(Branch node) {
        String name = word(node, 1);
        Branch shortForm = node.branch("tool_short");
        if (shortForm == null) {
            Map<String, String> properties = properties(node.branch("tool_long").branch("property_block"));
            String type = properties.remove("type");
            String target = properties.remove("url");
            if (target == null) {
                target = properties.remove("module");
            }
            return new Declaration.ToolDef(name, type, target, properties, node.span());
        }
        String type = shortForm.tokens(TokenKind.IDENT).get(0).text();
        List<Token> strings = shortForm.tokens(TokenKind.STRING);
        String target = strings.isEmpty() ? dotted(shortForm.branch("dotted_name")) : strings.get(0).text();
        Map<String, String> properties = new LinkedHashMap<>();
        Branch auth = shortForm.branch("tool_auth");
        if (auth != null) {
            List<Token> tokens = auth.tokens();
            properties.put("auth.type", tokens.get(2).text());
            properties.put("auth.value", spelling(tokens.get(3)));
        }
        return new Declaration.ToolDef(name, type, target, properties, node.span());
    }

    private Declaration.SchemaDef schema(Branch node) {
        List<Declaration.SchemaDef.Field> fields = new ArrayList<>();
        for (Branch field : node.branches("schema_field")) {
            Branch type = field.branch("type_expr");
            List<Token> typeWords = type.tokens(TokenKind.IDENT);
            Token typeName = typeWords.get(typeWords.size() - 1);
            fields.add(new Declaration.SchemaDef.Field(
                    field.tokens(TokenKind.IDENT).get(0).text(),
                    reference(typeName),
                    !type.tokens(TokenKind.LBRACKET).isEmpty(),
                    !type.tokens(TokenKind.QUESTION).isEmpty(),
                    field.span()));
        }
        return new Declaration.SchemaDef(word(node, 1), fields, node.span());
    }

    private Declaration.PromptDef prompt(Branch node) {
        Reference model = null;
        Reference schema = null;
        boolean expectsList = false;
        Reference inherit = null;
        Declaration.PromptDef.Escalation escalation = null;
        for (Branch child : node.branches()) {
            switch (child.rule()) {
                case "prompt_using":
                    model = reference(last(child));
                    break;
                case "prompt_expecting":
                    schema = reference(child.tokens(TokenKind.IDENT).get(1));
                    expectsList = !child.tokens(TokenKind.LBRACKET).isEmpty();
                    break;
                case "prompt_inherit":
                    inherit = reference(last(child));
                    break;
                case "escalation_clause":
                    escalation = new Declaration.PromptDef.Escalation(
                            spelling(child.branch("escalation_op").tokens().get(0)), last(child).text(), child.span());
                    break;
                case "prompt_text":
                    break;
                default:
                    throw unexpected(child, "prompt");
            }
        }
        String body = node.branch("prompt_text").tokens().get(0).text().strip();
        return new Declaration.PromptDef(word(node, 1), body, model, schema, expectsList, inherit, escalation, node.span());
    }

    private Declaration.AgentDef agent(Branch node) {
        List<Token> header = node.tokens(TokenKind.IDENT);
        String name = header.size() > 1 ? header.get(1).text() : Declaration.AgentDef.DEFAULT_NAME;
        Reference instruction = null;
        Reference prompt = null;
        Reference model = null;
        List<Reference> tools = new ArrayList<>();
        List<Reference> delegates = new ArrayList<>();
        List<Reference> uses = new ArrayList<>();
        Reference retry = null;
        Reference timeoutPolicy = null;
        Declaration.Duration timeout = null;
        Reference produces = null;
        String description = null;
        for (Branch property : node.branches()) {
            switch (property.rule()) {
                case "agent_tools":
                    tools.addAll(names(property.branch("name_list")));
                    break;
                case "agent_instruction":
                    instruction = reference(last(property));
                    break;
                case "agent_prompt":
                    prompt = reference(last(property));
                    break;
                case "agent_produces":
                    produces = reference(last(property));
                    break;
                case "agent_model":
                    model = reference(last(property));
                    break;
                case "agent_retry":
                    retry = reference(last(property));
                    break;
                case "agent_timeout":
                    Branch duration = property.branch("duration");
                    if (duration != null) {
                        timeout = duration(duration);
                        timeoutPolicy = null;
                    } else {
                        timeoutPolicy = reference(last(property));
                        timeout = null;
                    }
                    break;
                case "agent_description":
                    description = last(property).text();
                    break;
                case "agent_delegate":
                    delegates.addAll(names(property.branch("name_list")));
                    break;
                case "agent_use":
                    uses.addAll(names(property.branch("name_list")));
                    break;
                default:
                    throw unexpected(property, "agent");
            }
        }
        return new Declaration.AgentDef(
                name,
                instruction,
                prompt,
                model,
                tools,
                delegates,
                uses,
                retry,
                timeoutPolicy,
                timeout,
                produces,
                description,
                node.span());
    }

    private Declaration.HandlerDef handler(Branch node) {
        Branch event = node.branch("event_name");
        List<String> parts = new ArrayList<>();
        for (Token token : event.tokens(TokenKind.IDENT)) {
            parts.add(token.text());
        }
        return new Declaration.HandlerDef(
                node.tokens().get(0).text(),
                new Reference(String.join("-", parts), event.span()),
                block(node.branch("block")),
                node.span());
    }

    private Declaration.RetryPolicyDef retryPolicy(Branch node) {
        long times = count(node.tokens(TokenKind.NUMBER).get(0), "retry count");
        String backoff = node.tokens(TokenKind.COMMA).isEmpty() ? null : word(node, 3);
        return new Declaration.RetryPolicyDef(word(node, 1), times, backoff, node.span());
    }

    private long count(Token number, String what) {
        try {
            return new BigDecimal(number.text()).longValueExact();
        } catch (ArithmeticException e) {
            throw new TransformException(
                    Diagnostic.of(
                            ErrorCode.E0004,
                            fileId,
                            number.span(),
                            Map.of("expected", "a whole number as " + what, "found", number.text())),
                    e);
        }
    }

    private Declaration.Duration duration(Branch node) {
        return new Declaration.Duration(
                node.tokens(TokenKind.NUMBER).get(0).text(), node.tokens(TokenKind.IDENT).get(0).text(), node.span());
    }

    private Map<String, String> properties(Branch block) {
        Map<String, String> properties = new LinkedHashMap<>();
        collectProperties(block, "", properties);
        return properties;
    }

    private void collectProperties(Branch block, String prefix, Map<String, String> into) {
        for (Branch property : block.branches("property")) {
            Branch keyNode = property.branch("property_key");
            String key = prefix + joined(keyNode);
            Branch nested = property.branch("property_block");
            if (nested != null) {
                collectProperties(nested, key + ".", into);
            } else {
                into.put(key, joined(property.branch("property_value")));
            }
        }
    }

    private List<Reference> names(Branch nameList) {
        List<Reference> names = new ArrayList<>();
        for (Branch dotted : nameList.branches("dotted_name")) {
            names.add(new Reference(dotted(dotted), dotted.span()));
        }
        return names;
    }

    // ── Statements ──

    private List<Statement> block(Branch block) {
        List<Statement> statements = new ArrayList<>();
        for (Branch child : block.branches()) {
            statements.add(statement(child));
        }
        return statements;
    }

    private Statement statement(Branch node) {
        SourceSpan span = node.span();
        switch (node.rule()) {
            case "assignment":
                return new Statement.Assignment(varName(node), expression(node), span);
            case "property_assignment":
                List<String> path = new ArrayList<>();
                for (Branch member : node.branches("member")) {
                    path.add(member.tokens(TokenKind.IDENT).get(0).text());
                }
                return new Statement.PropertyAssignment(varName(node), path, expression(node), span);
            case "run_stmt":
                return run(node);
            case "call_stmt":
                Branch callModel = node.branch("call_model");
                return new Statement.CallStmt(
                        optionalVarName(node),
                        reference(node.tokens(TokenKind.IDENT).get(2)),
                        arguments(node.branch("run_args")),
                        callModel == null ? null : reference(last(callModel)),
                        span);
            case "for_loop":
                return new Statement.ForLoop(varName(node), expression(node), block(node.branch("block")), span);
            case "parallel_block":
                return new Statement.ParallelBlock(block(node.branch("block")), span);
            case "loop_block":
                List<Token> max = node.tokens(TokenKind.NUMBER);
                Long bound = max.isEmpty() ? null : count(max.get(0), "loop bound");
                return new Statement.LoopBlock(bound, block(node.branch("block")), span);
            case "if_block":
                Branch elseBlock = node.branch("else_block");
                return new Statement.IfBlock(
                        expression(node),
                        block(node.branch("block")),
                        elseBlock == null ? List.of() : block(elseBlock.branch("block")),
                        elseBlock != null,
                        span);
            case "match_block":
                return match(node);
            case "return_stmt":
                return new Statement.ReturnStmt(expression(node), span);
            case "push_stmt":
                return new Statement.PushStmt(expression(node), varName(node), span);
            case "escalate_stmt":
                return new Statement.EscalateStmt(node.hasWord("to"), optionalExpression(node), span);
            case "log_stmt":
                return new Statement.LogStmt(expression(node), span);
            case "notify_stmt":
                return new Statement.NotifyStmt(expression(node), span);
            case "continue_stmt":
                return new Statement.ContinueStmt(span);
            case "abort_stmt":
                return new Statement.AbortStmt(optionalExpression(node), span);
            case "mask_action":
                return new Statement.MaskAction(reference(last(node)), span);
            case "block_action":
                return new Statement.BlockAction(expression(node), span);
            case "warn_action":
                Branch condition = node.branch(EXPRESSION);
                return condition != null
                        ? new Statement.WarnAction(expression(condition), null, span)
                        : new Statement.WarnAction(null, node.tokens(TokenKind.STRING).get(0).text(), span);
            case "retry_action":
                List<Branch> parts = node.branches(EXPRESSION);
                return new Statement.RetryAction(expression(parts.get(0)), expression(parts.get(1)), span);
            default:
                throw unexpected(node, "statement");
        }
    }

    private Statement.RunStmt run(Branch node) {
        Branch agent = node.branch("run_agent");
        Statement.RunStmt.Kind kind = agent != null ? Statement.RunStmt.Kind.AGENT : Statement.RunStmt.Kind.FLOW;
        Branch callee = agent != null ? agent : node.branch("run_flow");
        Statement.EscalationHandler handler = null;
        Branch escalation = node.branch("escalation_handler");
        if (escalation != null) {
            if (escalation.hasWord("return")) {
                handler = new Statement.EscalationHandler(
                        Statement.EscalationHandler.Action.RETURN, expression(escalation), escalation.span());
            } else if (escalation.hasWord("continue")) {
                handler = new Statement.EscalationHandler(
                        Statement.EscalationHandler.Action.CONTINUE, null, escalation.span());
            } else {
                handler = new Statement.EscalationHandler(
                        Statement.EscalationHandler.Action.ABORT, null, escalation.span());
            }
        }
        return new Statement.RunStmt(
                optionalVarName(node),
                kind,
                reference(last(callee)),
                arguments(node.branch("run_args")),
                handler,
                node.span());
    }

    private Statement.MatchBlock match(Branch node) {
        List<Statement.WhenClause> clauses = new ArrayList<>();
        for (Branch clause : node.branches("when_clause")) {
            Expression value = literal(clause.branch("literal"));
            clauses.add(new Statement.WhenClause(
                    (Expression.Literal) value, statement(clause.branches().get(1)), clause.span()));
        }
        Branch otherwise = node.branch("else_clause");
        return new Statement.MatchBlock(
                expression(node),
                clauses,
                otherwise == null ? null : statement(otherwise.branches().get(0)),
                node.span());
    }

    private List<Expression> arguments(Branch runArgs) {
        List<Expression> arguments = new ArrayList<>();
        if (runArgs == null) {
            return arguments;
        }
        if (runArgs.hasWord("with")) {
            arguments.add(expression(runArgs));
            return arguments;
        }
        for (Branch argument : runArgs.branches("argument")) {
            arguments.add(postfix(argument));
        }
        return arguments;
    }

    private Reference varName(Branch node) {
        return reference(node.branch("var_name").tokens().get(0));
    }

    private Reference optionalVarName(Branch node) {
        return node.branch("var_name") == null ? null : varName(node);
    }

    // ── Expressions ──

    /** The expression child of a statement node. */
    private Expression expression(Branch parent) {
        Branch expression = parent.is(EXPRESSION) ? parent : parent.branch(EXPRESSION);
        if (expression == null) {
            throw unexpected(parent, "expression position");
        }
        return expr(expression);
    }

    private Expression optionalExpression(Branch parent) {
        Branch expression = parent.branch(EXPRESSION);
        return expression == null ? null : expr(expression);
    }

    private Expression expr(Branch node) {
        switch (node.rule()) {
            case "or_expr":
            case "and_expr":
            case "additive":
            case "multiplicative":
            case "comparison":
                return fold(node);
            case "not_expr":
                if (node.children().get(0) instanceof Leaf) {
                    return new Expression.UnaryOp(UnaryOperator.NOT, expr(node.branches().get(0)), node.span());
                }
                return expr(node.branches().get(0));
            case "unary":
                if (node.children().get(0) instanceof Leaf) {
                    return new Expression.UnaryOp(UnaryOperator.NEGATE, expr(node.branches().get(0)), node.span());
                }
                return expr(node.branches().get(0));
            case "postfix":
            case "argument":
                return postfix(node);
            case "filter_expr":
                List<Branch> parts = node.branches();
                return new Expression.FilterExpr(expr(parts.get(0)), expr(parts.get(1)), node.span());
            case "literal":
                return literal(node);
            case "variable":
            case "name_ref":
                Token name = node.tokens().get(0);
                return new Expression.VarRef(name.text(), name.span());
            case "implicit_property":
                return new Expression.ImplicitProperty(node.tokens(TokenKind.IDENT).get(0).text(), node.span());
            case "list_literal":
                List<Expression> items = new ArrayList<>();
                for (Branch item : node.branches()) {
                    items.add(expr(item));
                }
                return new Expression.ListLiteral(items, node.span());
            case "object_literal":
                List<Expression.ObjectLiteral.Entry> entries = new ArrayList<>();
                for (Branch entry : node.branches("object_entry")) {
                    entries.add(new Expression.ObjectLiteral.Entry(
                            entry.tokens().get(0).text(), expr(entry.branches().get(0))));
                }
                return new Expression.ObjectLiteral(entries, node.span());
            case "group":
                return expr(node.branches().get(0));
            default:
                throw unexpected(node, "expression");
        }
    }

    /** Folds {@code operand (operator operand)*} to the left. */
    private Expression fold(Branch node) {
        List<ParseNode> children = node.children();
        Expression result = expr((Branch) children.get(0));
        int i = 1;
        while (i < children.size()) {
            ParseNode operatorNode = children.get(i);
            Token operator = operatorNode instanceof Leaf leaf
                    ? leaf.token()
                    : ((Branch) operatorNode).tokens().get(0);
            Expression right = expr((Branch) children.get(i + 1));
            result = new Expression.BinaryOp(
                    BinaryOperator.fromSymbol(spelling(operator)), result, right, result.span().to(right.span()));
            i += 2;
        }
        return result;
    }

    private Expression postfix(Branch node) {
        List<Branch> parts = node.branches();
        Expression result = expr(parts.get(0));
        for (Branch suffix : parts.subList(1, parts.size())) {
            if (suffix.is("member")) {
                result = new Expression.PropertyAccess(
                        result, suffix.tokens(TokenKind.IDENT).get(0).text(), result.span().to(suffix.span()));
            } else if (suffix.is("call_args")) {
                List<Expression> arguments = new ArrayList<>();
                for (Branch argument : suffix.branches()) {
                    arguments.add(expr(argument));
                }
                result = new Expression.FunctionCall(result, arguments, result.span().to(suffix.span()));
            } else {
                throw unexpected(suffix, "postfix expression");
            }
        }
        return result;
    }

    private Expression literal(Branch node) {
        Token token = node.tokens().get(0);
        switch (token.kind()) {
            case STRING:
            case RAW_STRING:
                return Expression.Literal.string(token.text(), token.span());
            case NUMBER:
                return new Expression.Literal(Expression.Literal.Kind.NUMBER, token.text(), token.span());
            case IDENT:
                if (token.isWord("null")) {
                    return new Expression.Literal(Expression.Literal.Kind.NULL, null, token.span());
                }
                return new Expression.Literal(Expression.Literal.Kind.BOOLEAN, token.text(), token.span());
            default:
                throw unexpected(node, "literal");
        }
    }

    // ── Tokens ──

    private static Reference reference(Token token) {
        return new Reference(token.text(), token.span());
    }

    private static List<Reference> references(List<Token> tokens) {
        List<Reference> references = new ArrayList<>();
        for (Token token : tokens) {
            references.add(reference(token));
        }
        return references;
    }

    /** The {@code index}-th identifier directly under {@code node}, keywords included. */
    private static String word(Branch node, int index) {
        return node.tokens(TokenKind.IDENT).get(index).text();
    }

    private static Token last(Branch node) {
        List<Token> tokens = node.tokens();
        return tokens.get(tokens.size() - 1);
    }

    private static String dotted(Branch dottedName) {
        List<String> parts = new ArrayList<>();
        for (Token token : dottedName.tokens(TokenKind.IDENT)) {
            parts.add(token.text());
        }
        return String.join(".", parts);
    }

    /** Source-like text of every token under {@code node}; adjacent tokens are not separated. */
    private static String joined(Branch node) {
        List<Token> tokens = new ArrayList<>();
        collectTokens(node, tokens);
        return joined(tokens);
    }

    private static String joined(List<Token> tokens) {
        StringBuilder text = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && !adjacent(previous, token)) {
                text.append(' ');
            }
            text.append(spelling(token));
            previous = token;
        }
        return text.toString();
    }

    private static boolean adjacent(Token left, Token right) {
        return left.span().endLine() == right.span().startLine()
                && left.span().endColumn() == right.span().startColumn();
    }

    private static void collectTokens(Branch node, List<Token> into) {
        for (ParseNode child : node.children()) {
            if (child instanceof Leaf leaf) {
                into.add(leaf.token());
            } else {
                collectTokens((Branch) child, into);
            }
        }
    }

    private static String spelling(Token token) {
        switch (token.kind()) {
            case IDENT:
            case NUMBER:
            case STRING:
            case RAW_STRING:
                return token.text();
            case VARIABLE:
                return "$" + token.text();
            default:
                String description = token.kind().description();
                return description.substring(1, description.length() - 1);
        }
    }

    private InternalCompilerException unexpected(Branch node, String context) {
        Diagnostic diagnostic = Diagnostic.of(
                ErrorCode.E9999,
                fileId,
                node.span(),
                Map.of("detail", "unexpected parse node '" + node.rule() + "' in " + context));
        return new InternalCompilerException(diagnostic, CompilerException.Phase.TRANSFORM);
    }
}
