package io.agentflow.compiler.lexer;

import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.LexicalException;
import io.agentflow.compiler.source.SourceFile;
import io.agentflow.compiler.source.SourceSpan;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Tokenizer with off-side rule handling. Every non-blank, non-comment line start is compared with
 * the indentation stack: a deeper line yields {@link TokenKind#INDENT}, a shallower one yields
 * one {@link TokenKind#DEDENT} per closed block. Line breaks inside brackets are ignored.
 *
 * <p>
 * {@link #iterator()} starts a fresh, lazy scan each time it is called, so the same lexer can be
 * iterated repeatedly. Each scan owns its indentation stack; lexers for different files never
 * share state. The first lexical fault raises a {@link LexicalException} and ends the scan.
 */
public final class Lexer implements Iterable<Token> {

    private static final int TAB_WIDTH = 8;

    private final SourceFile source;

    public Lexer(SourceFile source) {
        this.source = source;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner(source);
    }

    /**
     * Scans the whole file eagerly.
     *
     * @throws LexicalException on the first lexical fault
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    /** One pass over the source. */
    private static final class Scanner implements Iterator<Token> {

        private final String fileId;
        private final String text;
        private final Deque<Integer> indents = new ArrayDeque<>();
        private final Deque<Token> openBrackets = new ArrayDeque<>();
        private final Deque<Token> pending = new ArrayDeque<>();

        private int pos;
        private int line = 1;
        private int column;
        private boolean atLineStart = true;
        private boolean lineHasContent;
        private boolean finished;

        Scanner(SourceFile source) {
            this.fileId = source.fileId();
            this.text = source.text();
            this.indents.push(0);
        }

        @Override
        public boolean hasNext() {
            fill();
            return !pending.isEmpty();
        }

        @Override
        public Token next() {
            fill();
            if (pending.isEmpty()) {
                throw new NoSuchElementException("token stream exhausted");
            }
            return pending.poll();
        }

        private void fill() {
            while (pending.isEmpty() && !finished) {
                scan();
            }
        }

        private void scan() {
            if (atLineStart && openBrackets.isEmpty()) {
                indentation();
                return;
            }
            skipInlineWhitespace();
            if (pos >= text.length()) {
                endOfInput();
                return;
            }
            char c = text.charAt(pos);
            if (c == '#') {
                skipComment();
            } else if (c == '\n' || c == '\r') {
                lineBreak();
            } else if (c == '"') {
                if (text.startsWith("\"\"\"", pos)) {
                    rawString();
                } else {
                    string();
                }
            } else if (isDigit(c)) {
                number();
            } else if (isIdentStart(c)) {
                identifier();
            } else if (c == '$') {
                variable();
            } else {
                operator(c);
            }
        }

        // ── Lines and indentation ──

        private void indentation() {
            int width = 0;
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == ' ') {
                    width++;
                } else if (c == '\t') {
                    width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
                } else {
                    break;
                }
                pos++;
            }
            column += pos - start;
            if (pos >= text.length()) {
                atLineStart = false;
                return;
            }
            char c = text.charAt(pos);
            if (c == '\n' || c == '\r' || c == '#') {
                // blank or comment-only line
                if (c == '#') {
                    skipComment();
                }
                if (pos < text.length()) {
                    consumeLineBreak();
                }
                return;
            }
            atLineStart = false;
            int current = indents.peek();
            if (width > current) {
                indents.push(width);
                pending.add(new Token(TokenKind.INDENT, "", SourceSpan.point(line, column)));
            } else if (width < current) {
                while (indents.peek() > width) {
                    indents.pop();
                    pending.add(new Token(TokenKind.DEDENT, "", SourceSpan.point(line, column)));
                }
                if (indents.peek() != width) {
                    throw error(
                            ErrorCode.E0008,
                            SourceSpan.point(line, column),
                            "dedent to column " + (width + 1) + " does not match any enclosing block");
                }
            }
        }

        private void lineBreak() {
            if (openBrackets.isEmpty()) {
                if (lineHasContent) {
                    pending.add(new Token(TokenKind.NEWLINE, "", new SourceSpan(line, column, line, column + 1)));
                }
                lineHasContent = false;
                atLineStart = true;
            }
            consumeLineBreak();
        }

        private void consumeLineBreak() {
            if (text.charAt(pos) == '\r' && pos + 1 < text.length() && text.charAt(pos + 1) == '\n') {
                pos++;
            }
            pos++;
            line++;
            column = 0;
        }

        private void endOfInput() {
            if (!openBrackets.isEmpty()) {
                Token open = openBrackets.peek();
                throw error(
                        ErrorCode.E0007,
                        open.span(),
                        "unterminated block: " + open.describe() + " opened at line " + open.span().startLine()
                                + " is never closed");
            }
            SourceSpan end = SourceSpan.point(line, column);
            if (lineHasContent) {
                pending.add(new Token(TokenKind.NEWLINE, "", end));
                lineHasContent = false;
            }
            while (indents.peek() > 0) {
                indents.pop();
                pending.add(new Token(TokenKind.DEDENT, "", end));
            }
            pending.add(new Token(TokenKind.EOF, "", end));
            finished = true;
        }

        private void skipInlineWhitespace() {
            while (pos < text.length() && (text.charAt(pos) == ' ' || text.charAt(pos) == '\t')) {
                pos++;
                column++;
            }
        }

        private void skipComment() {
            while (pos < text.length() && text.charAt(pos) != '\n' && text.charAt(pos) != '\r') {
                pos++;
                column++;
            }
        }

        // ── Literals and words ──

        private void string() {
            int startLine = line;
            int startColumn = column;
            StringBuilder value = new StringBuilder();
            advance();
            while (true) {
                if (pos >= text.length() || text.charAt(pos) == '\n' || text.charAt(pos) == '\r') {
                    throw error(
                            ErrorCode.E0007,
                            new SourceSpan(startLine, startColumn, line, column),
                            "unterminated string literal");
                }
                char c = text.charAt(pos);
                if (c == '"') {
                    advance();
                    break;
                }
                if (c == '\\' && pos + 1 < text.length()) {
                    char escaped = text.charAt(pos + 1);
                    switch (escaped) {
                        case 'n' -> value.append('\n');
                        case 't' -> value.append('\t');
                        case '"' -> value.append('"');
                        case '\\' -> value.append('\\');
                        case '$' -> value.append('$');
                        default -> value.append('\\').append(escaped);
                    }
                    advance();
                    advance();
                    continue;
                }
                value.append(c);
                advance();
            }
            emit(TokenKind.STRING, value.toString(), new SourceSpan(startLine, startColumn, line, column));
        }

        private void rawString() {
            int startLine = line;
            int startColumn = column;
            int close = text.indexOf("\"\"\"", pos + 3);
            if (close < 0) {
                throw error(
                        ErrorCode.E0007,
                        SourceSpan.point(startLine, startColumn),
                        "unterminated triple-quoted string");
            }
            String body = text.substring(pos + 3, close);
            int end = close + 3;
            while (pos < end) {
                if (text.charAt(pos) == '\n') {
                    pos++;
                    line++;
                    column = 0;
                } else {
                    advance();
                }
            }
            emit(TokenKind.RAW_STRING, body, new SourceSpan(startLine, startColumn, line, column));
        }

        private void number() {
            int start = pos;
            int startColumn = column;
            while (pos < text.length() && isDigit(text.charAt(pos))) {
                advance();
            }
            if (pos + 1 < text.length() && text.charAt(pos) == '.' && isDigit(text.charAt(pos + 1))) {
                advance();
                while (pos < text.length() && isDigit(text.charAt(pos))) {
                    advance();
                }
            }
            emit(TokenKind.NUMBER, text.substring(start, pos), new SourceSpan(line, startColumn, line, column));
        }

        private void identifier() {
            int start = pos;
            int startColumn = column;
            while (pos < text.length() && isIdentPart(text.charAt(pos))) {
                advance();
            }
            emit(TokenKind.IDENT, text.substring(start, pos), new SourceSpan(line, startColumn, line, column));
        }

        private void variable() {
            int startColumn = column;
            if (pos + 1 >= text.length() || !isIdentStart(text.charAt(pos + 1))) {
                throw error(ErrorCode.E0007, new SourceSpan(line, column, line, column + 1), "invalid character '$'");
            }
            advance();
            int start = pos;
            while (pos < text.length() && isIdentPart(text.charAt(pos))) {
                advance();
            }
            emit(TokenKind.VARIABLE, text.substring(start, pos), new SourceSpan(line, startColumn, line, column));
        }

        private void operator(char c) {
            int startColumn = column;
            char next = pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
            TokenKind kind = twoCharOperator(c, next);
            if (kind != null) {
                advance();
                advance();
                emit(kind, text.substring(pos - 2, pos), new SourceSpan(line, startColumn, line, column));
                return;
            }
            kind = ONE_CHAR.get(c);
            if (kind == null) {
                throw error(
                        ErrorCode.E0007,
                        new SourceSpan(line, column, line, column + 1),
                        "invalid character '" + c + "'");
            }
            Token token = new Token(kind, String.valueOf(c), new SourceSpan(line, startColumn, line, startColumn + 1));
            advance();
            if (kind == TokenKind.LPAREN || kind == TokenKind.LBRACKET || kind == TokenKind.LBRACE) {
                openBrackets.push(token);
            } else if (kind == TokenKind.RPAREN || kind == TokenKind.RBRACKET || kind == TokenKind.RBRACE) {
                if (!openBrackets.isEmpty()) {
                    openBrackets.pop();
                }
            }
            pending.add(token);
            lineHasContent = true;
        }

        private static TokenKind twoCharOperator(char c, char next) {
            if (next == '=') {
                switch (c) {
                    case '=':
                        return TokenKind.EQ_EQ;
                    case '!':
                        return TokenKind.NOT_EQ;
                    case '<':
                        return TokenKind.LT_EQ;
                    case '>':
                        return TokenKind.GT_EQ;
                    default:
                        return null;
                }
            }
            if (c == '-' && next == '>') {
                return TokenKind.ARROW;
            }
            return null;
        }

        private void emit(TokenKind kind, String value, SourceSpan span) {
            pending.add(new Token(kind, value, span));
            lineHasContent = true;
        }

        private void advance() {
            pos++;
            column++;
        }

        private LexicalException error(ErrorCode code, SourceSpan span, String detail) {
            finished = true;
            pending.clear();
            return new LexicalException(Diagnostic.of(code, fileId, span, Map.of("detail", detail)));
        }
    }

    private static final Map<Character, TokenKind> ONE_CHAR = Map.ofEntries(
            Map.entry('=', TokenKind.ASSIGN),
            Map.entry('<', TokenKind.LT),
            Map.entry('>', TokenKind.GT),
            Map.entry('~', TokenKind.TILDE),
            Map.entry('+', TokenKind.PLUS),
            Map.entry('-', TokenKind.MINUS),
            Map.entry('*', TokenKind.STAR),
            Map.entry('/', TokenKind.SLASH),
            Map.entry('.', TokenKind.DOT),
            Map.entry(',', TokenKind.COMMA),
            Map.entry(':', TokenKind.COLON),
            Map.entry('?', TokenKind.QUESTION),
            Map.entry('|', TokenKind.PIPE),
            Map.entry('(', TokenKind.LPAREN),
            Map.entry(')', TokenKind.RPAREN),
            Map.entry('[', TokenKind.LBRACKET),
            Map.entry(']', TokenKind.RBRACKET),
            Map.entry('{', TokenKind.LBRACE),
            Map.entry('}', TokenKind.RBRACE));

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
