package io.agentflow.compiler.model;

import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.source.SourceFile;
import io.agentflow.compiler.sourcemap.SourceMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of compiling or validating one file. Immutable; instances may be shared through the
 * compilation cache.
 *
 * <ul>
 * <li>generated: no errors, {@link #javaSource()} holds the Java source of {@link #className()};
 * <li>validated: no errors, no source because generation was not requested;
 * <li>failed: at least one error diagnostic, no source.
 * </ul>
 *
 * <p>
 * The result keeps the text of every file its diagnostics point into, so it can be rendered
 * later without re-reading anything.
 */
public final class CompilationResult {

    private final String fileId;
    private final String className;
    private final String javaSource;
    private final SourceMap sourceMap;
    private final List<Diagnostic> diagnostics;
    private final CompilationStats stats;
    private final String contentHash;
    private final boolean fileError;
    private final Map<String, SourceFile> sources;

    private CompilationResult(Builder builder) {
        this.fileId = Objects.requireNonNull(builder.fileId, "fileId must not be null");
        this.className = builder.className;
        this.javaSource = builder.javaSource;
        this.sourceMap = builder.sourceMap == null ? SourceMap.empty() : builder.sourceMap;
        this.diagnostics = List.copyOf(builder.diagnostics);
        this.stats = builder.stats == null ? CompilationStats.empty() : builder.stats;
        this.contentHash = builder.contentHash;
        this.fileError = builder.fileError;
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sources));
        if (javaSource != null && !isSuccess()) {
            throw new IllegalStateException("a result with errors cannot carry generated source");
        }
    }

    public static Builder builder(String fileId) {
        return new Builder(fileId);
    }

    /** The file could not be read; exit status 2. */
    public static CompilationResult fileError(String fileId, Diagnostic diagnostic) {
        Builder builder = new Builder(fileId).diagnostic(diagnostic);
        builder.fileError = true;
        return builder.build();
    }

    public String fileId() {
        return fileId;
    }

    /** Fully qualified name of the generated class, if code was generated. */
    public Optional<String> className() {
        return Optional.ofNullable(className);
    }

    public Optional<String> javaSource() {
        return Optional.ofNullable(javaSource);
    }

    public SourceMap sourceMap() {
        return sourceMap;
    }

    /** All diagnostics in source order. */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toUnmodifiableList());
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).collect(Collectors.toUnmodifiableList());
    }

    public CompilationStats stats() {
        return stats;
    }

    /** Hex SHA-256 cache key of the compiled text, or {@code null} if the file was never read. */
    public String contentHash() {
        return contentHash;
    }

    /** Source text of the compiled file and of the imports its diagnostics refer to. */
    public Optional<SourceFile> source(String file) {
        return Optional.ofNullable(sources.get(file));
    }

    /** Every source file this result was compiled from, the compiled file first. */
    public Collection<SourceFile> sources() {
        return sources.values();
    }

    /** {@code true} when no error diagnostic was produced. */
    public boolean isSuccess() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    /** {@code true} when the file itself could not be read. */
    public boolean isFileError() {
        return fileError;
    }

    public boolean hasInternalError() {
        return diagnostics.stream().anyMatch(Diagnostic::isInternal);
    }

    @Override
    public String toString() {
        return "CompilationResult[file=" + fileId + ", success=" + isSuccess() + ", diagnostics=" + diagnostics.size()
                + (className != null ? ", class=" + className : "") + "]";
    }

    /** Builder for {@link CompilationResult}. */
    public static final class Builder {

        private final String fileId;
        private String className;
        private String javaSource;
        private SourceMap sourceMap;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private CompilationStats stats;
        private String contentHash;
        private boolean fileError;
        private final Map<String, SourceFile> sources = new LinkedHashMap<>();

        private Builder(String fileId) {
            this.fileId = fileId;
        }

        /**
         * Attaches generated code.
         *
         * @param qualifiedClassName fully qualified name of the generated class
         */
        public Builder generated(String qualifiedClassName, String source, SourceMap map) {
            this.className = Objects.requireNonNull(qualifiedClassName, "className must not be null");
            this.javaSource = Objects.requireNonNull(source, "javaSource must not be null");
            this.sourceMap = map;
            return this;
        }

        public Builder diagnostic(Diagnostic diagnostic) {
            diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic must not be null"));
            return this;
        }

        public Builder diagnostics(List<Diagnostic> list) {
            list.forEach(this::diagnostic);
            return this;
        }

        public Builder stats(CompilationStats value) {
            this.stats = value;
            return this;
        }

        public Builder contentHash(String value) {
            this.contentHash = value;
            return this;
        }

        public Builder source(SourceFile file) {
            sources.putIfAbsent(file.fileId(), file);
            return this;
        }

        public CompilationResult build() {
            return new CompilationResult(this);
        }
    }
}
