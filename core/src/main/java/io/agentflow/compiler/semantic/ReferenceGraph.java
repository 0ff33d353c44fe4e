package io.agentflow.compiler.semantic;

import io.agentflow.compiler.source.SourceSpan;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed graph over agents and flows. Edges come from {@code delegate}, {@code use},
 * {@code run agent} and {@code run <flow>}. Vertices keep insertion order so that cycle reports
 * are deterministic.
 *
 * <p>
 * Not thread-safe.
 */
public final class ReferenceGraph {

    /** An agent or flow. */
    public record Vertex(SymbolKind kind, String name) {
        public Vertex {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private final Map<Vertex, SourceSpan> spans = new LinkedHashMap<>();
    private final Map<Vertex, Set<Vertex>> edges = new LinkedHashMap<>();

    /** Adds a vertex; the first span registered for a vertex is kept. */
    public void addVertex(Vertex vertex, SourceSpan span) {
        spans.putIfAbsent(vertex, span);
        edges.computeIfAbsent(vertex, v -> new LinkedHashSet<>());
    }

    /** Adds an edge. Edges to vertices that were never added are ignored during traversal. */
    public void addEdge(Vertex from, Vertex to) {
        edges.computeIfAbsent(from, v -> new LinkedHashSet<>()).add(to);
    }

    public Set<Vertex> successors(Vertex vertex) {
        return edges.getOrDefault(vertex, Set.of());
    }

    public SourceSpan span(Vertex vertex) {
        return spans.get(vertex);
    }

    /**
     * Finds every elementary cycle. Each is returned once as a closed path ({@code [a, b, a]})
     * that starts at its earliest-added vertex; cycles over the same vertices in a different order
     * are distinct. The search walks simple paths, so its cost grows with the number of cycles.
     */
    public List<List<Vertex>> cycles() {
        Map<Vertex, Integer> order = new HashMap<>();
        for (Vertex vertex : spans.keySet()) {
            order.put(vertex, order.size());
        }
        List<List<Vertex>> cycles = new ArrayList<>();
        for (Vertex start : spans.keySet()) {
            search(start, start, order, new LinkedHashSet<>(), cycles);
        }
        return cycles;
    }

    /** Extends {@code path} from {@code vertex} through vertices added after {@code start}. */
    private void search(
            Vertex start,
            Vertex vertex,
            Map<Vertex, Integer> order,
            LinkedHashSet<Vertex> path,
            List<List<Vertex>> cycles) {
        path.add(vertex);
        for (Vertex next : successors(vertex)) {
            Integer position = order.get(next);
            if (position == null) {
                continue;
            }
            if (next.equals(start)) {
                List<Vertex> cycle = new ArrayList<>(path);
                cycle.add(start);
                cycles.add(cycle);
            } else if (position > order.get(start) && !path.contains(next)) {
                search(start, next, order, path, cycles);
            }
        }
        path.remove(vertex);
    }
}
