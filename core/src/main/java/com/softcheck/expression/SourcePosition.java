package com.softcheck.expression;

/**
 * Line and column of a node in the parsed source.
 *
 * <p>Positions are produced by the parser and merely threaded through analysis
 * into diagnostics. They never take part in structural equality of AST nodes.
 *
 * @param line 1-based line, or 0 when unknown
 * @param column 1-based column, or 0 when unknown
 */
public record SourcePosition(int line, int column) {

    /** Position of synthetic nodes that have no source location. */
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    public SourcePosition {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException(
                "line and column must not be negative: " + line + ":" + column);
        }
    }

    public static SourcePosition of(int line, int column) {
        return new SourcePosition(line, column);
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?:?";
    }
}
