package com.softcheck.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A bare name: an unqualified column, a local variable or a function parameter.
 *
 * <p>Its type is never known statically.
 */
public final class Identifier implements Expression {

    private final String name;
    private final SourcePosition position;

    public Identifier(String name, SourcePosition position) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public Identifier(String name) {
        this(name, SourcePosition.UNKNOWN);
    }

    public String name() {
        return name;
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
        return name;
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Identifier)) return false;
        return name.equals(((Identifier) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    public static Identifier of(String name) {
        return new Identifier(name);
    }
}
