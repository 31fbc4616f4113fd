package com.softcheck.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing the wildcard ({@code *}) in a projection.
 */
public final class StarExpression implements Expression {

    private final SourcePosition position;

    public StarExpression(SourcePosition position) {
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public StarExpression() {
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
        return "*";
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StarExpression;
    }

    @Override
    public int hashCode() {
        return StarExpression.class.hashCode();
    }
}
