package io.agentflow.compiler.sourcemap;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of the mappings from generated Java lines to DSL positions, sorted by
 * generated line. A generated line has at most one entry.
 *
 * <p>
 * Thread-safe.
 */
public final class SourceMap {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String VERSION = "1.0";

    private static final SourceMap EMPTY = new SourceMap(List.of());

    private final List<SourceMapEntry> entries;

    SourceMap(List<SourceMapEntry> entries) {
        List<SourceMapEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(SourceMapEntry::generatedLine));
        this.entries = List.copyOf(sorted);
    }

    public static SourceMap empty() {
        return EMPTY;
    }

    public List<SourceMapEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** The entry at or before {@code generatedLine}; empty before the first entry. */
    public Optional<SourceMapEntry> resolve(int generatedLine) {
        int low = 0;
        int high = entries.size() - 1;
        SourceMapEntry found = null;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            SourceMapEntry entry = entries.get(mid);
            if (entry.generatedLine() <= generatedLine) {
                found = entry;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Finds the first generated line for a DSL position: among the entries of {@code file} at or
     * before ({@code line}, {@code column}), the closest original position wins, and of its
     * entries the lowest generated line is returned.
     *
     * @param line   1-based DSL line
     * @param column 0-based DSL column
     */
    public Optional<Integer> reverseLookup(String file, int line, int column) {
        SourceMapEntry best = null;
        for (SourceMapEntry entry : entries) {
            if (!entry.file().equals(file) || !atOrBefore(entry, line, column)) {
                continue;
            }
            if (best == null
                    || entry.originalLine() > best.originalLine()
                    || (entry.originalLine() == best.originalLine()
                            && entry.originalColumn() > best.originalColumn())) {
                best = entry;
            }
        }
        return Optional.ofNullable(best).map(SourceMapEntry::generatedLine);
    }

    private static boolean atOrBefore(SourceMapEntry entry, int line, int column) {
        return entry.originalLine() < line || (entry.originalLine() == line && entry.originalColumn() <= column);
    }

    /** Serializes as {@code {"version":"1.0","mappings":[...]}}. */
    public String toJson() {
        try {
            return JSON.writeValueAsString(new Document(VERSION, entries));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize source map", e);
        }
    }

    /**
     * Reads a map written by {@link #toJson()}.
     *
     * @throws IllegalArgumentException if the text is not a source map document
     */
    public static SourceMap fromJson(String json) {
        try {
            Document document = JSON.readValue(json, Document.class);
            return new SourceMap(document.mappings() == null ? List.of() : document.mappings());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid source map document: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SourceMap map && entries.equals(map.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "SourceMap[entries=" + entries.size() + "]";
    }

    record Document(
            @JsonProperty("version") String version, @JsonProperty("mappings") List<SourceMapEntry> mappings) {}
}
