package io.agentflow.compiler.semantic;

import static org.assertj.core.api.Assertions.assertThat;

import io.agentflow.compiler.source.SourceSpan;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReferenceGraph")
class ReferenceGraphTest {

    private static final ReferenceGraph.Vertex A = agent("a");
    private static final ReferenceGraph.Vertex B = agent("b");
    private static final ReferenceGraph.Vertex C = agent("c");

    private static ReferenceGraph.Vertex agent(String name) {
        return new ReferenceGraph.Vertex(SymbolKind.AGENT, name);
    }

    private static ReferenceGraph graph(ReferenceGraph.Vertex... vertices) {
        ReferenceGraph graph = new ReferenceGraph();
        for (int i = 0; i < vertices.length; i++) {
            graph.addVertex(vertices[i], SourceSpan.point(i + 1, 1));
        }
        return graph;
    }

    @Test
    @DisplayName("a cycle sharing vertices with an earlier one is still reported")
    void overlappingCycles() {
        ReferenceGraph graph = graph(A, B, C);
        graph.addEdge(A, B);
        graph.addEdge(B, C);
        graph.addEdge(C, A);
        graph.addEdge(A, C);

        assertThat(graph.cycles()).containsExactly(List.of(A, B, C, A), List.of(A, C, A));
    }

    @Test
    @DisplayName("a cycle is reported once, from its earliest vertex")
    void rotationsNotRepeated() {
        ReferenceGraph graph = graph(A, B, C);
        graph.addEdge(B, C);
        graph.addEdge(C, B);
        graph.addEdge(A, B);

        assertThat(graph.cycles()).containsExactly(List.of(B, C, B));
    }

    @Test
    void selfLoop() {
        ReferenceGraph graph = graph(A);
        graph.addEdge(A, A);

        assertThat(graph.cycles()).containsExactly(List.of(A, A));
    }

    @Test
    @DisplayName("edges to vertices that were never added are ignored")
    void danglingEdges() {
        ReferenceGraph graph = graph(A);
        graph.addEdge(A, B);
        graph.addEdge(B, A);

        assertThat(graph.cycles()).isEmpty();
    }
}
