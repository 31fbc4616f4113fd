package com.softcheck.logical;

import com.softcheck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a projection (SELECT list).
 *
 * <p>Example:
 * <pre>
 *   SELECT ID, avgs(10, price) FROM trades
 * </pre>
 */
public final class Project extends LogicalPlan {

    private final List<Expression> projections;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projections the projected expressions
     */
    public Project(LogicalPlan child, List<Expression> projections) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.projections = new ArrayList<>(Objects.requireNonNull(projections, "projections must not be null"));
    }

    public List<Expression> projections() {
        return Collections.unmodifiableList(projections);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<Expression> expressions() {
        return projections();
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", projections);
    }
}
