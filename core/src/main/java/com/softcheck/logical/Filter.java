package com.softcheck.logical;

import com.softcheck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a filter (WHERE clause).
 *
 * <p>The WHERE clause is a list of predicates combined with AND; each must be boolean.
 *
 * <p>Example:
 * <pre>
 *   SELECT * FROM trades WHERE price > 10 AND ID = "S"
 * </pre>
 */
public final class Filter extends LogicalPlan {

    private final List<Expression> predicates;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param predicates the filter predicates
     */
    public Filter(LogicalPlan child, List<Expression> predicates) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.predicates = new ArrayList<>(Objects.requireNonNull(predicates, "predicates must not be null"));
    }

    public List<Expression> predicates() {
        return Collections.unmodifiableList(predicates);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<Expression> expressions() {
        return predicates();
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", predicates);
    }
}
