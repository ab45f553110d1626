package me.christianrobert.pystyle.transformer.ast;

import java.util.Objects;

/**
 * Source position of a syntax node: start line/column to end line/column.
 *
 * <p>Lines are 1-based and columns 0-based, matching what the front-end parser reports.
 * {@link #UNKNOWN} is used for synthesized nodes that have no origin in the source text.</p>
 */
public class SourceSpan {

    public static final SourceSpan UNKNOWN = new SourceSpan(0, 0, 0, 0);

    private final int line;
    private final int column;
    private final int endLine;
    private final int endColumn;

    public SourceSpan(int line, int column, int endLine, int endColumn) {
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    /**
     * Creates a span for a single position (start equals end).
     */
    public static SourceSpan at(int line, int column) {
        return new SourceSpan(line, column, line, column);
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceSpan that = (SourceSpan) o;
        return line == that.line && column == that.column
                && endLine == that.endLine && endColumn == that.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, endLine, endColumn);
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return "unknown position";
        }
        if (line == endLine) {
            return "line " + line + ", col " + column + "-" + endColumn;
        }
        return "line " + line + ", col " + column + " to line " + endLine + ", col " + endColumn;
    }
}
