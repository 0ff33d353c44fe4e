package io.agentflow.compiler.report;

import java.util.Locale;

/** Output format of rendered diagnostics. */
public enum ReportFormat {
    /** rustc-style text with source context and carets. */
    HUMAN,
    /** One JSON document per file, for tooling. */
    JSON;

    /**
     * Parses a configuration value such as {@code human} or {@code JSON}.
     *
     * @throws IllegalArgumentException if the value names no format
     */
    public static ReportFormat parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ReportFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format '" + value + "'; expected human or json");
    }
}
