package com.softcheck.logical;

import com.softcheck.expression.Expression;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a GROUP BY with an optional HAVING clause.
 *
 * <p>Example:
 * <pre>
 *   SELECT ID, max(price) FROM trades GROUP BY ID HAVING max(price) > 100
 * </pre>
 */
public final class GroupBy extends LogicalPlan {

    private final List<Expression> groupings;
    private final List<Expression> having;

    /**
     * Creates a group-by node.
     *
     * @param child the child node
     * @param groupings the grouping expressions
     * @param having the HAVING predicates (empty when absent)
     */
    public GroupBy(LogicalPlan child, List<Expression> groupings, List<Expression> having) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.groupings = new ArrayList<>(Objects.requireNonNull(groupings, "groupings must not be null"));
        this.having = new ArrayList<>(Objects.requireNonNull(having, "having must not be null"));
    }

    public GroupBy(LogicalPlan child, List<Expression> groupings) {
        this(child, groupings, Collections.emptyList());
    }

    public List<Expression> groupings() {
        return Collections.unmodifiableList(groupings);
    }

    public List<Expression> having() {
        return Collections.unmodifiableList(having);
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    /**
     * Returns the grouping expressions followed by the HAVING predicates.
     */
    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(groupings);
        all.addAll(having);
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        return having.isEmpty()
            ? String.format("GroupBy(%s)", groupings)
            : String.format("GroupBy(%s, having=%s)", groupings, having);
    }
}
