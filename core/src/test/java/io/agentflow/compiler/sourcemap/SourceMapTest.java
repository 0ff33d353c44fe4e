package io.agentflow.compiler.sourcemap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Source maps")
class SourceMapTest {

    private SourceMapRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SourceMapRegistry();
        registry.record(10, "main.af", 3, 4);
        registry.record(11, "main.af", 3, 4);
        registry.record(14, "main.af", 5, 8);
        registry.record(20, "lib.af", 2, 0);
    }

    @Nested
    @DisplayName("registry")
    class Registry {

        @Test
        @DisplayName("the first mapping recorded for a line wins")
        void firstMappingWins() {
            registry.record(14, "main.af", 99, 0);

            assertThat(registry.size()).isEqualTo(4);
            assertThat(registry.resolve(14)).contains(new SourceMapEntry(14, "main.af", 5, 8));
        }

        @Test
        @DisplayName("lines between mappings resolve to the preceding mapping")
        void floorLookup() {
            assertThat(registry.resolve(12)).contains(new SourceMapEntry(11, "main.af", 3, 4));
            assertThat(registry.resolve(500)).map(SourceMapEntry::file).contains("lib.af");
            assertThat(registry.resolve(9)).isEmpty();
        }

        @Test
        void snapshotIsIndependent() {
            SourceMap snapshot = registry.toSourceMap();
            registry.record(30, "main.af", 9, 0);

            assertThat(snapshot.entries()).hasSize(4);
            assertThat(registry.toSourceMap().entries()).hasSize(5);
        }
    }

    @Nested
    @DisplayName("reverse lookup")
    class ReverseLookup {

        @Test
        @DisplayName("an exact position returns its lowest generated line")
        void exactPosition() {
            assertThat(registry.reverseLookup("main.af", 3, 4)).contains(10);
        }

        @Test
        @DisplayName("a position inside a statement maps to the closest preceding mapping")
        void insideStatement() {
            assertThat(registry.reverseLookup("main.af", 5, 20)).contains(14);
            assertThat(registry.reverseLookup("main.af", 4, 0)).contains(10);
        }

        @Test
        void otherFilesAreIgnored() {
            assertThat(registry.reverseLookup("lib.af", 9, 0)).contains(20);
            assertThat(registry.reverseLookup("main.af", 1, 0)).isEmpty();
            assertThat(registry.reverseLookup("unknown.af", 3, 4)).isEmpty();
        }
    }

    @Nested
    @DisplayName("serialization")
    class Serialization {

        @Test
        @DisplayName("JSON uses snake_case keys and a version field")
        void jsonShape() {
            String json = registry.toSourceMap().toJson();

            assertThat(json)
                    .startsWith("{\"version\":\"1.0\",\"mappings\":[")
                    .contains("{\"generated_line\":10,\"file\":\"main.af\",\"original_line\":3,\"original_column\":4}");
        }

        @Test
        void readsWhatItWrites() {
            SourceMap map = registry.toSourceMap();

            assertThat(SourceMap.fromJson(map.toJson())).isEqualTo(map);
        }

        @Test
        @DisplayName("entries come back sorted by generated line")
        void sortsOnRead() {
            SourceMap map = SourceMap.fromJson("""
                    {"version":"1.0","mappings":[
                      {"generated_line":7,"file":"a.af","original_line":2,"original_column":0},
                      {"generated_line":3,"file":"a.af","original_line":1,"original_column":0}]}
                    """);

            assertThat(map.entries()).extracting(SourceMapEntry::generatedLine).containsExactly(3, 7);
        }

        @Test
        void rejectsGarbage() {
            assertThatThrownBy(() -> SourceMap.fromJson("not json"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Invalid source map document");
        }

        @Test
        void emptyMap() {
            assertThat(SourceMap.empty().isEmpty()).isTrue();
            assertThat(SourceMap.fromJson("{\"version\":\"1.0\"}").isEmpty()).isTrue();
            assertThat(SourceMap.empty().resolve(1)).isEmpty();
        }
    }

    @Test
    @DisplayName("entries reject lines below one and negative columns")
    void entryValidation() {
        assertThatThrownBy(() -> new SourceMapEntry(0, "a.af", 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SourceMapEntry(1, "a.af", 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SourceMapEntry(1, "a.af", 1, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("originalColumn must be >= 0, got -1");
    }
}
