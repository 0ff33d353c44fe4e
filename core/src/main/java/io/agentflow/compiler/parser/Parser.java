package io.agentflow.compiler.parser;

import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.SyntaxException;
import io.agentflow.compiler.grammar.AgentflowGrammar;
import io.agentflow.compiler.grammar.Element;
import io.agentflow.compiler.grammar.Grammar;
import io.agentflow.compiler.lexer.Token;
import io.agentflow.compiler.source.SourceSpan;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grammar interpreter producing a {@link ParseNode} tree from a token list.
 *
 * <p>
 * Both {@link ParseStrategy strategies} walk the same {@link Grammar}. The predictive strategy
 * checks whether the next {@code lookahead} tokens can start a candidate before committing to it;
 * the backtracking strategy tries candidates in order and memoizes every rule result per token
 * position. Negative lookaheads are matched in full by both strategies. In both cases the reported
 * syntax error is the farthest token any attempt reached, together with every terminal that would
 * have been accepted there.
 *
 * <p>
 * Thread-safe: a parser holds no per-parse state; each {@link #parse} call works on its own.
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final int SATURATED = 1 << 30;
    private static final int MAX_LOOKAHEAD = 8;
    private static final int MAX_EXPECTED_SHOWN = 8;

    private final Grammar grammar;
    private final ParseStrategy strategy;
    private final int lookahead;

    /**
     * @param lookahead number of tokens the predictive strategy may inspect (1 to 8)
     */
    public Parser(Grammar grammar, ParseStrategy strategy, int lookahead) {
        if (lookahead < 1 || lookahead > MAX_LOOKAHEAD) {
            throw new IllegalArgumentException("lookahead must be between 1 and " + MAX_LOOKAHEAD + ", got: " + lookahead);
        }
        this.grammar = grammar;
        this.strategy = strategy;
        this.lookahead = lookahead;
    }

    /** A parser for the agentflow grammar with three tokens of lookahead. */
    public Parser(ParseStrategy strategy) {
        this(AgentflowGrammar.instance(), strategy, 3);
    }

    public ParseStrategy strategy() {
        return strategy;
    }

    /**
     * Parses a complete token list, which must end with an EOF token.
     *
     * @return the tree of the grammar's start rule
     * @throws SyntaxException at the first unrecoverable token
     */
    public ParseNode.Branch parse(List<Token> tokens, String fileId) {
        long started = System.nanoTime();
        Run run = new Run(tokens);
        List<ParseNode> out = new ArrayList<>();
        Element start = new Element.RuleRef(grammar.start());
        boolean ok;
        if (strategy == ParseStrategy.PREDICTIVE) {
            try {
                run.predict(start, 0, out);
                ok = true;
            } catch (ParseAbort abort) {
                ok = false;
            }
        } else {
            ok = run.backtrack(start, 0, out) >= 0;
        }
        if (!ok) {
            throw run.syntaxError(fileId);
        }
        LOG.debug(
                "Parsed: file={}, strategy={}, tokens={}, duration_us={}",
                fileId,
                strategy,
                tokens.size(),
                (System.nanoTime() - started) / 1_000);
        return (ParseNode.Branch) out.get(0);
    }

    /** Control-flow signal for a failed predictive parse; carries no stack trace. */
    private static final class ParseAbort extends RuntimeException {

        private static final long serialVersionUID = 1L;
        private static final ParseAbort INSTANCE = new ParseAbort();

        private ParseAbort() {
            super("parse aborted", null, false, false);
        }
    }

    /** Result of a memoized rule match in backtracking mode. */
    private record Memo(int end, List<ParseNode> nodes) {}

    private static final Memo FAILED = new Memo(-1, List.of());

    /** State of one parse: the tokens, the farthest failure and the memo table. */
    private final class Run {

        private final List<Token> tokens;
        private final Map<String, Map<Integer, Memo>> memo = new HashMap<>();
        private final Set<String> expected = new TreeSet<>();
        private int farthest = -1;
        private int quiet;

        Run(List<Token> tokens) {
            if (tokens.isEmpty()) {
                throw new IllegalArgumentException("token list must end with EOF");
            }
            this.tokens = tokens;
        }

        // ── Predictive ──

        int predict(Element element, int pos, List<ParseNode> out) {
            if (element instanceof Element.Terminal terminal) {
                if (pos < tokens.size() && terminal.matches(tokens.get(pos))) {
                    if (terminal.kept()) {
                        out.add(new ParseNode.Leaf(tokens.get(pos)));
                    }
                    return pos + 1;
                }
                fail(pos, terminal);
                throw ParseAbort.INSTANCE;
            }
            if (element instanceof Element.Keyword keyword) {
                if (pos < tokens.size() && keyword.matches(tokens.get(pos))) {
                    out.add(new ParseNode.Leaf(tokens.get(pos)));
                    return pos + 1;
                }
                fail(pos, keyword);
                throw ParseAbort.INSTANCE;
            }
            if (element instanceof Element.Sequence sequence) {
                int current = pos;
                for (Element child : sequence.elements()) {
                    current = predict(child, current, out);
                }
                return current;
            }
            if (element instanceof Element.Choice choice) {
                for (Element alternative : choice.alternatives()) {
                    if (viable(alternative, pos)) {
                        return predict(alternative, pos, out);
                    }
                }
                throw ParseAbort.INSTANCE;
            }
            if (element instanceof Element.Optional optional) {
                return viable(optional.element(), pos) ? predict(optional.element(), pos, out) : pos;
            }
            if (element instanceof Element.Repeat repeat) {
                int current = pos;
                if (repeat.min() == 1) {
                    current = predict(repeat.element(), current, out);
                }
                while (viable(repeat.element(), current)) {
                    int next = predict(repeat.element(), current, out);
                    if (next == current) {
                        break;
                    }
                    current = next;
                }
                return current;
            }
            if (element instanceof Element.Not not) {
                if (present(not.element(), pos)) {
                    throw ParseAbort.INSTANCE;
                }
                return pos;
            }
            Grammar.Rule rule = grammar.rule(((Element.RuleRef) element).name());
            List<ParseNode> children = new ArrayList<>();
            int end = predict(rule.body(), pos, children);
            emit(rule, children, pos, out);
            return end;
        }

        private boolean viable(Element element, int pos) {
            return prefix(element, pos, 0) != 0;
        }

        /**
         * Bitmask of lookahead offsets at which {@code element} can end when started at
         * {@code base + offset}, with {@link #SATURATED} set when a path is still consistent after
         * the whole lookahead window.
         */
        private int prefix(Element element, int base, int offset) {
            if (offset >= lookahead) {
                return SATURATED;
            }
            int pos = base + offset;
            if (element instanceof Element.Terminal terminal) {
                if (pos < tokens.size() && terminal.matches(tokens.get(pos))) {
                    return bit(offset + 1);
                }
                fail(pos, terminal);
                return 0;
            }
            if (element instanceof Element.Keyword keyword) {
                if (pos < tokens.size() && keyword.matches(tokens.get(pos))) {
                    return bit(offset + 1);
                }
                fail(pos, keyword);
                return 0;
            }
            if (element instanceof Element.Sequence sequence) {
                int mask = bit(offset);
                for (Element child : sequence.elements()) {
                    int next = mask & SATURATED;
                    for (int o = 0; o < lookahead; o++) {
                        if ((mask & (1 << o)) != 0) {
                            next |= prefix(child, base, o);
                        }
                    }
                    mask = next;
                    if (mask == 0) {
                        return 0;
                    }
                }
                return mask;
            }
            if (element instanceof Element.Choice choice) {
                int mask = 0;
                for (Element alternative : choice.alternatives()) {
                    mask |= prefix(alternative, base, offset);
                }
                return mask;
            }
            if (element instanceof Element.Optional optional) {
                return bit(offset) | prefix(optional.element(), base, offset);
            }
            if (element instanceof Element.Repeat repeat) {
                int result = repeat.min() == 0 ? bit(offset) : 0;
                int seen = bit(offset);
                int frontier = bit(offset);
                while (frontier != 0) {
                    int next = 0;
                    for (int o = 0; o < lookahead; o++) {
                        if ((frontier & (1 << o)) != 0) {
                            next |= prefix(repeat.element(), base, o) & ~(1 << o);
                        }
                    }
                    result |= next;
                    frontier = next & ~seen & ~SATURATED;
                    seen |= next;
                }
                return result;
            }
            if (element instanceof Element.Not not) {
                return present(not.element(), pos) ? 0 : bit(offset);
            }
            return prefix(grammar.rule(((Element.RuleRef) element).name()).body(), base, offset);
        }

        private int bit(int offset) {
            return offset >= lookahead ? SATURATED : 1 << offset;
        }

        /**
         * Whether {@code element} matches in full at {@code pos}. Lookaheads are decided on their
         * own, not within the window of the enclosing decision, and leave no expected terminals
         * behind.
         */
        private boolean present(Element element, int pos) {
            quiet++;
            try {
                return backtrack(element, pos, new ArrayList<>()) >= 0;
            } finally {
                quiet--;
            }
        }

        // ── Backtracking ──

        int backtrack(Element element, int pos, List<ParseNode> out) {
            if (element instanceof Element.Terminal terminal) {
                if (pos < tokens.size() && terminal.matches(tokens.get(pos))) {
                    if (terminal.kept()) {
                        out.add(new ParseNode.Leaf(tokens.get(pos)));
                    }
                    return pos + 1;
                }
                fail(pos, terminal);
                return -1;
            }
            if (element instanceof Element.Keyword keyword) {
                if (pos < tokens.size() && keyword.matches(tokens.get(pos))) {
                    out.add(new ParseNode.Leaf(tokens.get(pos)));
                    return pos + 1;
                }
                fail(pos, keyword);
                return -1;
            }
            if (element instanceof Element.Not not) {
                return present(not.element(), pos) ? -1 : pos;
            }
            int mark = out.size();
            if (element instanceof Element.Sequence sequence) {
                int current = pos;
                for (Element child : sequence.elements()) {
                    current = backtrack(child, current, out);
                    if (current < 0) {
                        truncate(out, mark);
                        return -1;
                    }
                }
                return current;
            }
            if (element instanceof Element.Choice choice) {
                for (Element alternative : choice.alternatives()) {
                    int end = backtrack(alternative, pos, out);
                    if (end >= 0) {
                        return end;
                    }
                    truncate(out, mark);
                }
                return -1;
            }
            if (element instanceof Element.Optional optional) {
                int end = backtrack(optional.element(), pos, out);
                if (end < 0) {
                    truncate(out, mark);
                    return pos;
                }
                return end;
            }
            if (element instanceof Element.Repeat repeat) {
                int current = pos;
                int count = 0;
                while (true) {
                    int iterationMark = out.size();
                    int next = backtrack(repeat.element(), current, out);
                    if (next < 0 || next == current) {
                        truncate(out, iterationMark);
                        break;
                    }
                    current = next;
                    count++;
                }
                if (count < repeat.min()) {
                    truncate(out, mark);
                    return -1;
                }
                return current;
            }
            Grammar.Rule rule = grammar.rule(((Element.RuleRef) element).name());
            // lookahead results are not memoized: they were computed without recording failures
            Map<Integer, Memo> byPosition = quiet > 0
                    ? new HashMap<>()
                    : memo.computeIfAbsent(rule.name(), name -> new HashMap<>());
            Memo cached = byPosition.get(pos);
            if (cached == null) {
                List<ParseNode> children = new ArrayList<>();
                int end = backtrack(rule.body(), pos, children);
                if (end < 0) {
                    cached = FAILED;
                } else {
                    List<ParseNode> nodes = new ArrayList<>();
                    emit(rule, children, pos, nodes);
                    cached = new Memo(end, List.copyOf(nodes));
                }
                byPosition.put(pos, cached);
            }
            if (cached.end() >= 0) {
                out.addAll(cached.nodes());
            }
            return cached.end();
        }

        private void truncate(List<ParseNode> out, int size) {
            while (out.size() > size) {
                out.remove(out.size() - 1);
            }
        }

        // ── Shared ──

        private void emit(Grammar.Rule rule, List<ParseNode> children, int pos, List<ParseNode> out) {
            if (rule.inline()) {
                out.addAll(children);
                return;
            }
            out.add(new ParseNode.Branch(rule.name(), children, spanOf(children, pos)));
        }

        private SourceSpan spanOf(List<ParseNode> children, int pos) {
            if (children.isEmpty()) {
                SourceSpan next = tokens.get(Math.min(pos, tokens.size() - 1)).span();
                return SourceSpan.point(next.startLine(), next.startColumn());
            }
            return children.get(0).span().to(children.get(children.size() - 1).span());
        }

        private void fail(int pos, Element element) {
            if (quiet > 0) {
                return;
            }
            if (pos > farthest) {
                farthest = pos;
                expected.clear();
            }
            if (pos == farthest) {
                expected.add(element.toString());
            }
        }

        SyntaxException syntaxError(String fileId) {
            Token found = tokens.get(Math.max(0, Math.min(farthest, tokens.size() - 1)));
            List<String> expectations = new ArrayList<>(expected);
            String detail = "expected " + describe(expectations) + ", found " + found.describe();
            Diagnostic diagnostic = Diagnostic.of(ErrorCode.E0007, fileId, found.span(), Map.of("detail", detail));
            return new SyntaxException(diagnostic, expectations, found.describe());
        }

        private String describe(List<String> expectations) {
            if (expectations.isEmpty()) {
                return "end of input";
            }
            List<String> shown = expectations.size() > MAX_EXPECTED_SHOWN
                    ? expectations.subList(0, MAX_EXPECTED_SHOWN)
                    : expectations;
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < shown.size(); i++) {
                if (i > 0) {
                    text.append(i == shown.size() - 1 && shown.size() == expectations.size() ? " or " : ", ");
                }
                text.append(shown.get(i));
            }
            if (shown.size() < expectations.size()) {
                text.append(", ...");
            }
            return text.toString();
        }
    }
}
