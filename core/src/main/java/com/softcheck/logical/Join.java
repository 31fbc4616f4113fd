package com.softcheck.logical;

import com.softcheck.expression.Expression;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a join operation.
 *
 * <p>Examples:
 * <pre>
 *   FROM t1 INNER JOIN t2 ON t1.id = t2.id
 *   FROM t1, t2                                -- CROSS
 *   FROM t1 FULL OUTER JOIN t2 USING (id)
 * </pre>
 *
 * <p>Every join condition must be boolean. USING columns are carried as
 * identifiers, whose type is unknown.
 */
public final class Join extends LogicalPlan {

    /**
     * Join types.
     */
    public enum JoinType {
        INNER,
        CROSS,
        FULL_OUTER
    }

    private final LogicalPlan left;
    private final LogicalPlan right;
    private final JoinType joinType;
    private final List<Expression> conditions;

    /**
     * Creates a join node.
     *
     * @param left the left relation
     * @param right the right relation
     * @param joinType the join type
     * @param conditions the join conditions (empty for CROSS)
     */
    public Join(LogicalPlan left, LogicalPlan right, JoinType joinType, List<Expression> conditions) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.left = left;
        this.right = right;
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.conditions = new ArrayList<>(Objects.requireNonNull(conditions, "conditions must not be null"));

        if (joinType == JoinType.CROSS && !this.conditions.isEmpty()) {
            throw new IllegalArgumentException("conditions must be empty for CROSS join");
        }
    }

    public LogicalPlan left() {
        return left;
    }

    public LogicalPlan right() {
        return right;
    }

    public JoinType joinType() {
        return joinType;
    }

    public List<Expression> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    @Override
    public List<Expression> expressions() {
        return conditions();
    }

    @Override
    public String toString() {
        return String.format("Join(%s, %s)", joinType, conditions);
    }

    // ==================== Factory Methods ====================

    public static Join cross(LogicalPlan left, LogicalPlan right) {
        return new Join(left, right, JoinType.CROSS, Collections.emptyList());
    }

    public static Join inner(LogicalPlan left, LogicalPlan right, Expression... conditions) {
        return new Join(left, right, JoinType.INNER, List.of(conditions));
    }
}
