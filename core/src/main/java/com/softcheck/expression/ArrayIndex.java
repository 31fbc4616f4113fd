package com.softcheck.expression;

import java.util.List;
import java.util.Objects;

/**
 * Expression indexing into an array-valued expression, e.g. {@code prices[3]}.
 *
 * <p>The index is an arbitrary expression. Neither its type nor its bounds are
 * validated statically.
 */
public final class ArrayIndex implements Expression {

    private final Expression array;
    private final Expression index;
    private final SourcePosition position;

    public ArrayIndex(Expression array, Expression index, SourcePosition position) {
        this.array = Objects.requireNonNull(array, "array must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public ArrayIndex(Expression array, Expression index) {
        this(array, index, SourcePosition.UNKNOWN);
    }

    public Expression array() {
        return array;
    }

    public Expression index() {
        return index;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> children() {
        return List.of(array, index);
    }

    @Override
    public String toSource() {
        return array.toSource() + "[" + index.toSource() + "]";
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayIndex)) return false;
        ArrayIndex that = (ArrayIndex) obj;
        return Objects.equals(array, that.array) &&
               Objects.equals(index, that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(array, index);
    }
}
