package io.agentflow.compiler.lexer;

import io.agentflow.compiler.source.SourceSpan;
import java.util.Objects;

/**
 * A lexical token. For strings {@code text} is the unescaped value, for variables the name
 * without {@code $}, for synthetic tokens the empty string.
 *
 * <p>
 * Thread-safe and immutable.
 */
public record Token(TokenKind kind, String text, SourceSpan span) {

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    /** {@code true} if this is an identifier spelled exactly {@code word}. */
    public boolean isWord(String word) {
        return kind == TokenKind.IDENT && text.equals(word);
    }

    /** Description used in syntax errors, e.g. {@code 'agent'} or {@code newline}. */
    public String describe() {
        switch (kind) {
            case IDENT:
            case NUMBER:
                return "'" + text + "'";
            case VARIABLE:
                return "'$" + text + "'";
            case STRING:
                return "string \"" + text + "\"";
            default:
                return kind.description();
        }
    }
}
