package io.agentflow.compiler.grammar;

import static io.agentflow.compiler.grammar.Grammar.choice;
import static io.agentflow.compiler.grammar.Grammar.kw;
import static io.agentflow.compiler.grammar.Grammar.many;
import static io.agentflow.compiler.grammar.Grammar.many1;
import static io.agentflow.compiler.grammar.Grammar.not;
import static io.agentflow.compiler.grammar.Grammar.opt;
import static io.agentflow.compiler.grammar.Grammar.ref;
import static io.agentflow.compiler.grammar.Grammar.seq;
import static io.agentflow.compiler.grammar.Grammar.tok;

import io.agentflow.compiler.lexer.TokenKind;

/**
 * The grammar of the agentflow DSL.
 *
 * <p>
 * Every keyword is contextual: words such as {@code prompt}, {@code use} or {@code loop} are only
 * keywords in the slots listed here and remain ordinary identifiers everywhere else. A statement
 * keyword that is the target of an assignment ({@code log = 1}, {@code abort.reason = "x"}) is a
 * variable, and {@code run} or {@code call} on the right of an assignment only starts an agent
 * invocation when an agent or prompt name follows. Apart from those negative lookaheads the grammar
 * is LL(3): every choice, optional and repetition can be decided from at most three tokens.
 */
public final class AgentflowGrammar {

    public static final String START = "compilation_unit";

    private static final Grammar INSTANCE = create();

    private AgentflowGrammar() {}

    /** The shared grammar instance. */
    public static Grammar instance() {
        return INSTANCE;
    }

    private static Grammar create() {
        Element nl = tok(TokenKind.NEWLINE);
        Element indent = tok(TokenKind.INDENT);
        Element dedent = tok(TokenKind.DEDENT);
        Element ident = tok(TokenKind.IDENT);
        Element variable = tok(TokenKind.VARIABLE);
        Element string = tok(TokenKind.STRING);
        Element rawString = tok(TokenKind.RAW_STRING);
        Element number = tok(TokenKind.NUMBER);
        Element colon = tok(TokenKind.COLON);
        Element comma = tok(TokenKind.COMMA);
        Element dot = tok(TokenKind.DOT);
        Element slash = tok(TokenKind.SLASH);
        Element minus = tok(TokenKind.MINUS);
        Element assign = tok(TokenKind.ASSIGN);
        Element expression = ref("or_expr");
        Element doBlock = seq(kw("do"), nl, ref("block"), kw("end"), nl);
        Element notAssigned = not(many(ref("member")), assign);
        Element notInvocation = not(choice(seq(kw("run"), ident), seq(kw("call"), kw("llm"))));

        return Grammar.builder(START)
                .rule(START, seq(many(ref("top_level")), tok(TokenKind.EOF)))
                .inline(
                        "top_level",
                        choice(
                                ref("version_decl"),
                                ref("import_stmt"),
                                ref("model_def"),
                                ref("tool_def"),
                                ref("schema_def"),
                                ref("prompt_def"),
                                ref("agent_def"),
                                ref("flow_def"),
                                ref("event_handler"),
                                ref("retry_policy"),
                                ref("timeout_policy"),
                                ref("policy_def")))

                // ── Declarations ──
                .rule("version_decl", seq(kw("agentflow"), many1(choice(ident, number, dot)), nl))
                .rule("import_stmt", seq(kw("import"), choice(ref("external_import"), ref("local_import")), nl))
                .rule("external_import", seq(ident, kw("from"), ref("source_ref")))
                .rule("local_import", choice(string, ref("path_ref")))
                .rule("path_ref", seq(choice(dot, slash), many(choice(ident, number, dot, slash, minus))))
                .rule("source_ref", seq(ident, many(choice(ident, number, dot, slash, minus, colon))))
                .rule("model_def", seq(kw("model"), ident, choice(ref("model_short"), ref("model_long"))))
                .rule("model_short", seq(assign, choice(string, ref("model_id")), nl))
                .rule("model_id", seq(choice(ident, number), many(choice(ident, number, slash, minus, dot, colon))))
                .rule("model_long", seq(colon, nl, ref("property_block")))
                .rule("property_block", seq(indent, many1(ref("property")), dedent))
                .rule(
                        "property",
                        seq(
                                ref("property_key"),
                                colon,
                                choice(seq(nl, ref("property_block")), seq(ref("property_value"), nl))))
                .rule("property_key", choice(string, seq(choice(ident, number), many(minus, choice(ident, number)))))
                .rule(
                        "property_value",
                        many1(choice(string, rawString, ident, number, variable, dot, slash, minus, colon, comma)))
                .rule("tool_def", seq(kw("tool"), ident, choice(ref("tool_short"), ref("tool_long"))))
                .rule("tool_short", seq(assign, ident, choice(string, ref("dotted_name")), opt(ref("tool_auth")), nl))
                .rule("tool_auth", seq(kw("with"), kw("auth"), ident, choice(string, variable)))
                .rule("tool_long", seq(colon, nl, ref("property_block")))
                .rule("dotted_name", seq(ident, many(dot, ident)))
                .rule("schema_def", seq(kw("schema"), ident, colon, nl, indent, many1(ref("schema_field")), dedent))
                .rule("schema_field", seq(ident, colon, ref("type_expr"), nl))
                .rule(
                        "type_expr",
                        seq(
                                choice(
                                        seq(kw("list"), tok(TokenKind.LBRACKET), ident, tok(TokenKind.RBRACKET)),
                                        ident),
                                opt(tok(TokenKind.QUESTION))))
                .rule("prompt_def", seq(kw("prompt"), ident, many(ref("prompt_modifier")), colon, ref("prompt_body")))
                .inline(
                        "prompt_modifier",
                        choice(ref("prompt_using"), ref("prompt_expecting"), ref("prompt_inherit")))
                .rule("prompt_using", seq(kw("using"), kw("model"), choice(string, ident)))
                .rule(
                        "prompt_expecting",
                        seq(kw("expecting"), ident, opt(tok(TokenKind.LBRACKET), tok(TokenKind.RBRACKET))))
                .rule("prompt_inherit", seq(kw("inherit"), variable))
                .inline(
                        "prompt_body",
                        choice(
                                seq(ref("prompt_text"), nl, opt(indent, ref("escalation_clause"), dedent)),
                                seq(nl, indent, ref("prompt_text"), nl, opt(ref("escalation_clause")), dedent)))
                .rule("prompt_text", choice(rawString, string))
                .rule(
                        "escalation_clause",
                        seq(kw("escalate"), kw("if"), ref("escalation_op"), choice(string, number), nl))
                .rule(
                        "escalation_op",
                        choice(tok(TokenKind.TILDE), tok(TokenKind.EQ_EQ), tok(TokenKind.NOT_EQ), kw("contains")))
                .rule("agent_def", seq(kw("agent"), opt(ident), colon, nl, indent, many1(ref("agent_property")), dedent))
                .inline(
                        "agent_property",
                        choice(
                                ref("agent_tools"),
                                ref("agent_instruction"),
                                ref("agent_prompt"),
                                ref("agent_produces"),
                                ref("agent_model"),
                                ref("agent_retry"),
                                ref("agent_timeout"),
                                ref("agent_description"),
                                ref("agent_delegate"),
                                ref("agent_use")))
                .rule("agent_tools", seq(kw("tools"), ref("name_list"), nl))
                .rule("agent_instruction", seq(kw("instruction"), ident, nl))
                .rule("agent_prompt", seq(kw("prompt"), ident, nl))
                .rule("agent_produces", seq(kw("produces"), choice(variable, ident), nl))
                .rule("agent_model", seq(kw("model"), choice(string, ident), nl))
                .rule("agent_retry", seq(kw("retry"), ident, nl))
                .rule("agent_timeout", seq(kw("timeout"), choice(ref("duration"), ident), nl))
                .rule("agent_description", seq(kw("description"), choice(string, rawString), nl))
                .rule("agent_delegate", seq(kw("delegate"), ref("name_list"), nl))
                .rule("agent_use", seq(kw("use"), ref("name_list"), nl))
                .rule("name_list", seq(ref("dotted_name"), many(comma, ref("dotted_name"))))
                .rule("duration", seq(number, ident))
                .rule("flow_def", seq(kw("flow"), ident, many(variable), colon, nl, ref("block")))
                .rule("event_handler", seq(choice(kw("on"), kw("after")), ref("event_name"), doBlock))
                .rule("event_name", seq(ident, opt(minus, ident)))
                .rule(
                        "retry_policy",
                        seq(kw("retry"), ident, assign, number, kw("times"), opt(comma, ident, kw("backoff")), nl))
                .rule("timeout_policy", seq(kw("timeout"), ident, assign, ref("duration"), nl))
                .rule("policy_def", seq(kw("policy"), ident, colon, nl, ref("property_block")))

                // ── Statements ──
                .rule("block", seq(indent, many1(ref("statement")), dedent))
                .inline(
                        "statement",
                        choice(
                                ref("for_loop"),
                                ref("parallel_block"),
                                ref("loop_block"),
                                ref("if_block"),
                                ref("match_block"),
                                ref("mask_action"),
                                ref("block_action"),
                                ref("warn_action"),
                                ref("retry_action"),
                                ref("simple_statement")))
                .inline(
                        "simple_statement",
                        choice(
                                ref("return_stmt"),
                                ref("push_stmt"),
                                ref("escalate_stmt"),
                                ref("log_stmt"),
                                ref("notify_stmt"),
                                ref("continue_stmt"),
                                ref("abort_stmt"),
                                ref("property_assignment"),
                                ref("assignment"),
                                ref("run_stmt"),
                                ref("call_stmt")))
                .rule("for_loop", seq(kw("for"), ref("var_name"), kw("in"), expression, doBlock))
                .rule("parallel_block", seq(kw("parallel"), doBlock))
                .rule("loop_block", seq(kw("loop"), opt(kw("max"), number), doBlock))
                .rule("if_block", seq(kw("if"), notAssigned, expression, colon, nl, ref("block"), opt(ref("else_block"))))
                .rule("else_block", seq(kw("else"), colon, nl, ref("block")))
                .rule(
                        "match_block",
                        seq(
                                kw("match"),
                                notAssigned,
                                expression,
                                nl,
                                indent,
                                many1(ref("when_clause")),
                                opt(ref("else_clause")),
                                dedent,
                                kw("end"),
                                nl))
                .rule("when_clause", seq(kw("when"), ref("literal"), tok(TokenKind.ARROW), ref("simple_statement")))
                .rule("else_clause", seq(kw("else"), tok(TokenKind.ARROW), ref("simple_statement")))
                .rule("mask_action", seq(kw("mask"), ident, nl))
                .rule("block_action", seq(kw("block"), kw("if"), expression, nl))
                .rule("warn_action", seq(kw("warn"), choice(seq(kw("if"), expression), string), nl))
                .rule("retry_action", seq(kw("retry"), kw("with"), expression, kw("if"), expression, nl))
                .rule("return_stmt", seq(kw("return"), notAssigned, expression, nl))
                .rule("push_stmt", seq(kw("push"), notAssigned, expression, kw("to"), ref("var_name"), nl))
                .rule("escalate_stmt", seq(kw("escalate"), notAssigned, opt(kw("to"), kw("human")), opt(expression), nl))
                .rule("log_stmt", seq(kw("log"), notAssigned, expression, nl))
                .rule("notify_stmt", seq(kw("notify"), notAssigned, expression, nl))
                .rule("continue_stmt", seq(kw("continue"), nl))
                .rule("abort_stmt", seq(kw("abort"), notAssigned, opt(expression), nl))
                .rule(
                        "run_stmt",
                        seq(
                                opt(ref("var_name"), assign),
                                kw("run"),
                                choice(ref("run_agent"), ref("run_flow")),
                                opt(ref("run_args")),
                                opt(ref("escalation_handler")),
                                nl))
                .rule("run_agent", seq(kw("agent"), ident))
                .rule("run_flow", seq(opt(kw("flow")), ident))
                .rule("run_args", choice(seq(kw("with"), expression), many1(ref("argument"))))
                .rule(
                        "argument",
                        seq(
                                choice(
                                        ref("variable"),
                                        ref("literal"),
                                        ref("list_literal"),
                                        ref("object_literal"),
                                        ref("group")),
                                many(ref("member"))))
                .rule(
                        "escalation_handler",
                        seq(
                                comma,
                                kw("on"),
                                kw("escalate"),
                                choice(seq(kw("return"), expression), kw("continue"), kw("abort"))))
                .rule(
                        "call_stmt",
                        seq(
                                opt(ref("var_name"), assign),
                                kw("call"),
                                kw("llm"),
                                ident,
                                opt(ref("run_args")),
                                opt(ref("call_model")),
                                nl))
                .rule("call_model", seq(kw("using"), kw("model"), choice(string, ident)))
                .rule("property_assignment", seq(ref("var_name"), many1(ref("member")), assign, expression, nl))
                .rule("assignment", seq(ref("var_name"), assign, notInvocation, expression, nl))
                .rule("var_name", choice(variable, ident))

                // ── Expressions ──
                .rule("or_expr", seq(ref("and_expr"), many(kw("or"), ref("and_expr"))))
                .rule("and_expr", seq(ref("not_expr"), many(kw("and"), ref("not_expr"))))
                .rule("not_expr", choice(seq(kw("not"), ref("not_expr")), ref("comparison")))
                .rule("comparison", seq(ref("additive"), opt(ref("comp_op"), ref("additive"))))
                .rule(
                        "comp_op",
                        choice(
                                tok(TokenKind.EQ_EQ),
                                tok(TokenKind.NOT_EQ),
                                tok(TokenKind.LT_EQ),
                                tok(TokenKind.GT_EQ),
                                tok(TokenKind.LT),
                                tok(TokenKind.GT),
                                tok(TokenKind.TILDE),
                                kw("contains")))
                .rule(
                        "additive",
                        seq(ref("multiplicative"), many(choice(tok(TokenKind.PLUS), minus), ref("multiplicative"))))
                .rule(
                        "multiplicative",
                        seq(ref("unary"), many(choice(tok(TokenKind.STAR), tok(TokenKind.SLASH)), ref("unary"))))
                .rule("unary", choice(seq(minus, ref("unary")), ref("postfix")))
                .rule("postfix", seq(ref("primary"), many(choice(ref("member"), ref("call_args")))))
                .rule("member", seq(dot, ident))
                .rule("call_args", seq(tok(TokenKind.LPAREN), opt(expression, many(comma, expression)), tok(TokenKind.RPAREN)))
                .inline(
                        "primary",
                        choice(
                                ref("filter_expr"),
                                ref("literal"),
                                ref("variable"),
                                ref("implicit_property"),
                                ref("list_literal"),
                                ref("object_literal"),
                                ref("group"),
                                ref("name_ref")))
                .rule("filter_expr", seq(kw("filter"), ref("postfix"), kw("where"), expression))
                .rule("literal", choice(string, rawString, number, kw("true"), kw("false"), kw("null")))
                .rule("variable", variable)
                .rule("implicit_property", seq(dot, ident))
                .rule(
                        "list_literal",
                        seq(tok(TokenKind.LBRACKET), opt(expression, many(comma, expression)), tok(TokenKind.RBRACKET)))
                .rule(
                        "object_literal",
                        seq(
                                tok(TokenKind.LBRACE),
                                opt(ref("object_entry"), many(comma, ref("object_entry"))),
                                tok(TokenKind.RBRACE)))
                .rule("object_entry", seq(choice(ident, string), colon, expression))
                .rule("group", seq(tok(TokenKind.LPAREN), expression, tok(TokenKind.RPAREN)))
                .rule("name_ref", ident)
                .build();
    }
}
