package io.agentflow.compiler.semantic;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A lexical scope: names per {@link SymbolKind} plus a link to the enclosing scope. A name is
 * defined at most once per kind in one scope; lookups walk outwards through the parents.
 *
 * <p>
 * Not thread-safe. Scopes live for one analysis run.
 */
public final class Scope {

    /** Where a scope was opened. */
    public enum Type {
        GLOBAL,
        FLOW,
        HANDLER,
        BLOCK
    }

    private final Type type;
    private final Scope parent;
    private final Map<SymbolKind, Map<String, Symbol>> symbols = new EnumMap<>(SymbolKind.class);

    private Scope(Type type, Scope parent) {
        this.type = type;
        this.parent = parent;
    }

    public static Scope global() {
        return new Scope(Type.GLOBAL, null);
    }

    /** Opens a nested scope whose lookups fall back to this one. */
    public Scope child(Type childType) {
        return new Scope(childType, this);
    }

    public Type type() {
        return type;
    }

    public Scope parent() {
        return parent;
    }

    /**
     * Defines a symbol unless this scope already has one of the same kind and name.
     *
     * @return the existing symbol when the name was already taken, otherwise {@code null}
     */
    public Symbol define(Symbol symbol) {
        Map<String, Symbol> names = symbols.computeIfAbsent(symbol.kind(), kind -> new LinkedHashMap<>());
        Symbol existing = names.get(symbol.name());
        if (existing != null) {
            return existing;
        }
        names.put(symbol.name(), symbol);
        return null;
    }

    /** Finds a symbol in this scope or an enclosing one, or {@code null}. */
    public Symbol resolve(SymbolKind kind, String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Symbol symbol = scope.resolveLocal(kind, name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    public Symbol resolveLocal(SymbolKind kind, String name) {
        Map<String, Symbol> names = symbols.get(kind);
        return names == null ? null : names.get(name);
    }

    /** Every visible name of one kind, innermost scope first. */
    public List<String> visibleNames(SymbolKind kind) {
        List<String> result = new ArrayList<>();
        for (Scope scope = this; scope != null; scope = scope.parent) {
            Map<String, Symbol> names = scope.symbols.get(kind);
            if (names != null) {
                for (String name : names.keySet()) {
                    if (!result.contains(name)) {
                        result.add(name);
                    }
                }
            }
        }
        return result;
    }
}
