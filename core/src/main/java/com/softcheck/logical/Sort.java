package com.softcheck.logical;

import com.softcheck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a sort (ASSUMING / ORDER BY clause).
 *
 * <p>Sort keys may only be bare column names or qualified column accesses.
 *
 * <p>Example:
 * <pre>
 *   SELECT * FROM trades ASSUMING ASC ts, DESC t.price
 * </pre>
 */
public final class Sort extends LogicalPlan {

    /**
     * Sort direction.
     */
    public enum SortDirection {
        ASCENDING,
        DESCENDING
    }

    /**
     * A single sort key.
     *
     * @param direction the direction
     * @param expression the key expression
     */
    public record SortOrder(SortDirection direction, Expression expression) {
        public SortOrder {
            Objects.requireNonNull(direction, "direction must not be null");
            Objects.requireNonNull(expression, "expression must not be null");
        }

        public static SortOrder asc(Expression expression) {
            return new SortOrder(SortDirection.ASCENDING, expression);
        }

        public static SortOrder desc(Expression expression) {
            return new SortOrder(SortDirection.DESCENDING, expression);
        }
    }

    private final List<SortOrder> sortOrders;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param sortOrders the sort orders
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.sortOrders = new ArrayList<>(Objects.requireNonNull(sortOrders, "sortOrders must not be null"));

        if (this.sortOrders.isEmpty()) {
            throw new IllegalArgumentException("sortOrders must not be empty");
        }
    }

    /**
     * Returns the sort orders.
     *
     * @return an unmodifiable list of sort orders
     */
    public List<SortOrder> sortOrders() {
        return Collections.unmodifiableList(sortOrders);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    public List<Expression> expressions() {
        return keys(sortOrders);
    }

    /**
     * Extracts the key expressions of a list of sort orders.
     *
     * @param orders the sort orders
     * @return the key expressions, in order
     */
    public static List<Expression> keys(List<SortOrder> orders) {
        List<Expression> keys = new ArrayList<>(orders.size());
        for (SortOrder order : orders) {
            keys.add(order.expression());
        }
        return Collections.unmodifiableList(keys);
    }

    @Override
    public String toString() {
        return String.format("Sort(%s)", sortOrders);
    }
}
