package io.agentflow.compiler.sourcemap;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Maps one line of generated Java to a position in DSL source.
 *
 * @param generatedLine  1-based line in the generated source
 * @param file           DSL file id
 * @param originalLine   1-based DSL line
 * @param originalColumn 0-based DSL column
 */
public record SourceMapEntry(
        @JsonProperty("generated_line") int generatedLine,
        @JsonProperty("file") String file,
        @JsonProperty("original_line") int originalLine,
        @JsonProperty("original_column") int originalColumn) {

    public SourceMapEntry {
        Objects.requireNonNull(file, "file must not be null");
        if (generatedLine < 1) {
            throw new IllegalArgumentException("generatedLine must be >= 1, got " + generatedLine);
        }
        if (originalLine < 1) {
            throw new IllegalArgumentException("originalLine must be >= 1, got " + originalLine);
        }
        if (originalColumn < 0) {
            throw new IllegalArgumentException("originalColumn must be >= 0, got " + originalColumn);
        }
    }
}
