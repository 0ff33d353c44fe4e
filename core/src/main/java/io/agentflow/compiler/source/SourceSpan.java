package io.agentflow.compiler.source;

/**
 * A region of DSL source text. Lines are 1-based, columns are 0-based; the end position is
 * exclusive on the end line.
 *
 * <p>
 * Thread-safe and immutable.
 */
public record SourceSpan(int startLine, int startColumn, int endLine, int endColumn) {

    public SourceSpan {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, got: " + startLine);
        }
        if (startColumn < 0 || endColumn < 0) {
            throw new IllegalArgumentException("columns must be >= 0");
        }
        if (endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
            throw new IllegalArgumentException("span end precedes start: " + startLine + ":" + startColumn + "-"
                    + endLine + ":" + endColumn);
        }
    }

    /** A zero-width span at one position. */
    public static SourceSpan point(int line, int column) {
        return new SourceSpan(line, column, line, column);
    }

    /** The smallest span covering this span and {@code other}. */
    public SourceSpan to(SourceSpan other) {
        if (other == null) {
            return this;
        }
        boolean thisStartsFirst = startLine < other.startLine
                || (startLine == other.startLine && startColumn <= other.startColumn);
        boolean thisEndsLast =
                endLine > other.endLine || (endLine == other.endLine && endColumn >= other.endColumn);
        return new SourceSpan(
                thisStartsFirst ? startLine : other.startLine,
                thisStartsFirst ? startColumn : other.startColumn,
                thisEndsLast ? endLine : other.endLine,
                thisEndsLast ? endColumn : other.endColumn);
    }

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
