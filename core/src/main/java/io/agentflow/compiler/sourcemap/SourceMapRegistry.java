package io.agentflow.compiler.sourcemap;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable collector of source mappings, filled by the code generator while it emits lines and
 * frozen with {@link #toSourceMap()} once generation is complete.
 *
 * <p>
 * Not thread-safe; one registry per compilation.
 */
public final class SourceMapRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SourceMapRegistry.class);

    private final TreeMap<Integer, SourceMapEntry> entries = new TreeMap<>();

    /**
     * Records a mapping. The first mapping recorded for a generated line is kept.
     *
     * @param generatedLine  1-based generated line
     * @param file           DSL file id
     * @param originalLine   1-based DSL line
     * @param originalColumn 0-based DSL column
     */
    public void record(int generatedLine, String file, int originalLine, int originalColumn) {
        SourceMapEntry entry = new SourceMapEntry(generatedLine, file, originalLine, originalColumn);
        if (entries.putIfAbsent(generatedLine, entry) != null) {
            LOG.trace("Generated line already mapped: line={}", generatedLine);
        }
    }

    /** The mapping at or before {@code generatedLine}, empty before the first one. */
    public Optional<SourceMapEntry> resolve(int generatedLine) {
        return Optional.ofNullable(entries.floorEntry(generatedLine)).map(Map.Entry::getValue);
    }

    /** See {@link SourceMap#reverseLookup(String, int, int)}. */
    public Optional<Integer> reverseLookup(String file, int line, int column) {
        return toSourceMap().reverseLookup(file, line, column);
    }

    public int size() {
        return entries.size();
    }

    public SourceMap toSourceMap() {
        return new SourceMap(new ArrayList<>(entries.values()));
    }
}
