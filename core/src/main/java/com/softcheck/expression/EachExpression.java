package com.softcheck.expression;

import java.util.List;
import java.util.Objects;

/**
 * Applies its inner expression to each element of a nested column
 * ({@code EACH(expr)}).
 *
 * <p>Typing is fully delegated to the inner expression.
 */
public final class EachExpression implements Expression {

    private final Expression inner;
    private final SourcePosition position;

    public EachExpression(Expression inner, SourcePosition position) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public EachExpression(Expression inner) {
        this(inner, SourcePosition.UNKNOWN);
    }

    public Expression inner() {
        return inner;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> children() {
        return List.of(inner);
    }

    @Override
    public String toSource() {
        return "EACH(" + inner.toSource() + ")";
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EachExpression)) return false;
        return Objects.equals(inner, ((EachExpression) obj).inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inner);
    }
}
