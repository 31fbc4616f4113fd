package com.softcheck.logical;

import com.softcheck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all relational-algebra nodes of a query.
 *
 * <p>Each node has zero or more children and carries zero or more expressions.
 * The set of node kinds is closed so that analysis passes are total over it.
 */
public abstract sealed class LogicalPlan
    permits TableScan, Project, Filter, GroupBy, Join, Sort {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns every expression this node carries, in declaration order.
     *
     * @return an unmodifiable list, empty for nodes without expressions
     */
    public abstract List<Expression> expressions();

    /**
     * Returns a human-readable string representation of this plan node.
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
