package com.softcheck.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a constant value.
 *
 * <p>Examples:
 * <pre>
 *   42                -- INT
 *   3.14              -- FLOAT
 *   "abc"             -- STRING
 *   2016-01-01        -- DATE
 *   2016-01-01 10:00  -- TIMESTAMP
 *   TRUE              -- BOOLEAN
 * </pre>
 *
 * <p>The value is kept as the parser's source text for date and timestamp
 * literals; the analyzer only cares about the {@link Kind}.
 */
public final class Literal implements Expression {

    /**
     * Literal kinds.
     */
    public enum Kind {
        INT,
        FLOAT,
        STRING,
        DATE,
        TIMESTAMP,
        BOOLEAN
    }

    private final Kind kind;
    private final Object value;
    private final SourcePosition position;

    /**
     * Creates a literal.
     *
     * @param kind the literal kind
     * @param value the literal value
     * @param position the source position
     */
    public Literal(Kind kind, Object value, SourcePosition position) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public Kind kind() {
        return kind;
    }

    public Object value() {
        return value;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toSource() {
        return switch (kind) {
            case STRING -> "\"" + value.toString().replace("\"", "\\\"") + "\"";
            case BOOLEAN -> ((Boolean) value) ? "TRUE" : "FALSE";
            default -> value.toString();
        };
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    // ==================== Factory Methods ====================

    public static Literal ofInt(long value) {
        return new Literal(Kind.INT, value, SourcePosition.UNKNOWN);
    }

    public static Literal ofFloat(double value) {
        return new Literal(Kind.FLOAT, value, SourcePosition.UNKNOWN);
    }

    public static Literal ofString(String value) {
        return new Literal(Kind.STRING, value, SourcePosition.UNKNOWN);
    }

    public static Literal ofDate(String text) {
        return new Literal(Kind.DATE, text, SourcePosition.UNKNOWN);
    }

    public static Literal ofTimestamp(String text) {
        return new Literal(Kind.TIMESTAMP, text, SourcePosition.UNKNOWN);
    }

    public static Literal ofBoolean(boolean value) {
        return new Literal(Kind.BOOLEAN, value, SourcePosition.UNKNOWN);
    }
}
