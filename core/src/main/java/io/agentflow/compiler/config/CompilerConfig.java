package io.agentflow.compiler.config;

import io.agentflow.compiler.parser.ParseStrategy;
import io.agentflow.compiler.report.ReportFormat;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Settings of an {@code AgentflowCompiler}. Use {@link #builder()} to start from the defaults.
 *
 * @param cacheCapacity    maximum number of cached compilations, at least 1 (default 100)
 * @param parseStrategy    parser strategy (default {@link ParseStrategy#PREDICTIVE})
 * @param lookahead        tokens of lookahead for the predictive parser, 1 to 8 (default 3)
 * @param outputFormat     format of rendered diagnostics (default {@link ReportFormat#HUMAN})
 * @param contextLines     source lines shown around a diagnostic, 0 or more (default 1)
 * @param generatedPackage Java package of generated classes, may be empty (default
 *                         {@code agentflow.generated})
 */
public record CompilerConfig(
        int cacheCapacity,
        ParseStrategy parseStrategy,
        int lookahead,
        ReportFormat outputFormat,
        int contextLines,
        String generatedPackage) {

    public static final int MAX_LOOKAHEAD = 8;

    private static final Pattern PACKAGE_NAME =
            Pattern.compile("([A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*)?");

    public CompilerConfig {
        Objects.requireNonNull(parseStrategy, "parseStrategy must not be null");
        Objects.requireNonNull(outputFormat, "outputFormat must not be null");
        Objects.requireNonNull(generatedPackage, "generatedPackage must not be null");
        if (cacheCapacity < 1) {
            throw new IllegalArgumentException("cacheCapacity must be at least 1, got: " + cacheCapacity);
        }
        if (lookahead < 1 || lookahead > MAX_LOOKAHEAD) {
            throw new IllegalArgumentException(
                    "lookahead must be between 1 and " + MAX_LOOKAHEAD + ", got: " + lookahead);
        }
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must not be negative, got: " + contextLines);
        }
        if (!PACKAGE_NAME.matcher(generatedPackage).matches()) {
            throw new IllegalArgumentException("generatedPackage is not a Java package name: '" + generatedPackage + "'");
        }
    }

    /** The defaults. */
    public static CompilerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CompilerConfig}, starting from the documented defaults. */
    public static final class Builder {
        private int cacheCapacity = 100;
        private ParseStrategy parseStrategy = ParseStrategy.PREDICTIVE;
        private int lookahead = 3;
        private ReportFormat outputFormat = ReportFormat.HUMAN;
        private int contextLines = 1;
        private String generatedPackage = "agentflow.generated";

        Builder() {}

        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder parseStrategy(ParseStrategy parseStrategy) {
            this.parseStrategy = parseStrategy;
            return this;
        }

        public Builder lookahead(int lookahead) {
            this.lookahead = lookahead;
            return this;
        }

        public Builder outputFormat(ReportFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder contextLines(int contextLines) {
            this.contextLines = contextLines;
            return this;
        }

        public Builder generatedPackage(String generatedPackage) {
            this.generatedPackage = generatedPackage;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public CompilerConfig build() {
            return new CompilerConfig(
                    cacheCapacity, parseStrategy, lookahead, outputFormat, contextLines, generatedPackage);
        }
    }
}
