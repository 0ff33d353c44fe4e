package io.agentflow.compiler.semantic;

import io.agentflow.compiler.source.SourceSpan;
import java.util.Objects;

/**
 * A defined name.
 *
 * @param file file the definition was written in
 * @param span location of the definition, or {@code null} for built-ins
 */
public record Symbol(String name, SymbolKind kind, String file, SourceSpan span) {

    public Symbol {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static Symbol builtin(String name, SymbolKind kind) {
        return new Symbol(name, kind, null, null);
    }

    public boolean isBuiltin() {
        return span == null;
    }
}
