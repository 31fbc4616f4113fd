package com.softcheck.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The {@code ROWID} pseudo-column: the 0-based position of the current row.
 *
 * <p>Always numeric, and only meaningful while evaluating a query over a table.
 */
public final class RowIdExpression implements Expression {

    private final SourcePosition position;

    public RowIdExpression(SourcePosition position) {
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public RowIdExpression() {
        this(SourcePosition.UNKNOWN);
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
        return "ROWID";
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof RowIdExpression;
    }

    @Override
    public int hashCode() {
        return RowIdExpression.class.hashCode();
    }
}
