package com.softcheck.analysis;

import com.softcheck.analysis.AnalysisError.DuplicateTableName;
import com.softcheck.analysis.AnalysisError.IllegalExpression;
import com.softcheck.expression.ColumnAccess;
import com.softcheck.expression.Expression;
import com.softcheck.expression.ExpressionUtils;
import com.softcheck.logical.Filter;
import com.softcheck.logical.GroupBy;
import com.softcheck.logical.Join;
import com.softcheck.logical.LogicalPlan;
import com.softcheck.logical.Sort;
import com.softcheck.types.TypeLattice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Checks a relational-algebra tree.
 *
 * <p>Rules per node:
 * <ul>
 *   <li><b>Filter:</b> every predicate is boolean</li>
 *   <li><b>GroupBy:</b> HAVING predicates are boolean; all expressions are checked</li>
 *   <li><b>Join:</b> every condition is boolean</li>
 *   <li><b>Sort:</b> keys are bare columns or {@code table.column}</li>
 *   <li><b>Other nodes:</b> their expressions are checked for internal errors</li>
 * </ul>
 *
 * <p>Once per query, the scanned tables are checked for duplicate aliases and
 * duplicate names, and every qualified column access is resolved against them.
 */
public final class RelationalChecker {

    private final ExpressionChecker expressionChecker;

    public RelationalChecker(ExpressionChecker expressionChecker) {
        this.expressionChecker = Objects.requireNonNull(expressionChecker, "expressionChecker must not be null");
    }

    /**
     * Checks a whole query tree: node expressions first, then duplicate tables,
     * then column access resolution.
     *
     * @param plan the root of the query
     * @return all errors, in that order
     */
    public List<AnalysisError> check(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        List<AnalysisError> errors = new ArrayList<>(checkExpressions(plan));

        List<TableBinding> tables = TableBinding.collect(plan);
        List<TableBinding> aliased = new ArrayList<>();
        List<TableBinding> unaliased = new ArrayList<>();
        for (TableBinding table : tables) {
            (table.isAliased() ? aliased : unaliased).add(table);
        }
        errors.addAll(checkDuplicates(aliased, TableBinding::alias));
        // equal aliased bindings already collide on their alias
        errors.addAll(checkDuplicates(unaliased, TableBinding::fullName));

        errors.addAll(TableScope.of(tables).resolveAll(columnAccesses(plan)));
        return errors;
    }

    /**
     * Checks the expressions of a node, then of its children.
     *
     * @param plan the node
     * @return the errors, parent before children
     */
    public List<AnalysisError> checkExpressions(LogicalPlan plan) {
        List<AnalysisError> errors = new ArrayList<>();

        if (plan instanceof Filter || plan instanceof Join) {
            errors.addAll(expressionChecker.checkAll(TypeLattice.BOOL, plan.expressions()));
        } else if (plan instanceof GroupBy groupBy) {
            // HAVING goes through the generic pass as well and may report twice
            errors.addAll(expressionChecker.checkAll(TypeLattice.BOOL, groupBy.having()));
            errors.addAll(expressionChecker.errorsOf(groupBy.expressions()));
        } else if (plan instanceof Sort) {
            errors.addAll(checkSortKeys(plan.expressions()));
        } else {
            errors.addAll(expressionChecker.errorsOf(plan.expressions()));
        }

        for (LogicalPlan child : plan.children()) {
            errors.addAll(checkExpressions(child));
        }
        return errors;
    }

    /**
     * Reports every sort key that is not a bare column name or a qualified column access.
     *
     * @param keys the sort keys
     * @return one {@link IllegalExpression} per offending key
     */
    public static List<AnalysisError> checkSortKeys(List<Expression> keys) {
        List<AnalysisError> errors = new ArrayList<>();
        for (Expression key : keys) {
            if (!ExpressionUtils.isSimpleColumn(key)) {
                errors.add(new IllegalExpression(ExpressionUtils.toShallowSource(key), key.position()));
            }
        }
        return errors;
    }

    /**
     * Collects the distinct qualified column accesses of every node of a plan.
     *
     * @param plan the plan
     * @return accesses in pre-order of first appearance
     */
    public static Set<ColumnAccess> columnAccesses(LogicalPlan plan) {
        Set<ColumnAccess> accesses = new LinkedHashSet<>();
        collectColumnAccesses(plan, accesses);
        return accesses;
    }

    private static void collectColumnAccesses(LogicalPlan plan, Set<ColumnAccess> accesses) {
        for (Expression expr : plan.expressions()) {
            ExpressionUtils.collectColumnAccesses(expr, accesses);
        }
        for (LogicalPlan child : plan.children()) {
            collectColumnAccesses(child, accesses);
        }
    }

    /**
     * Groups bindings by key in first-appearance order and reports the first two
     * members of every group with more than one member.
     */
    private static List<AnalysisError> checkDuplicates(List<TableBinding> bindings,
                                                       Function<TableBinding, String> key) {
        Map<String, List<TableBinding>> groups = new LinkedHashMap<>();
        for (TableBinding binding : bindings) {
            groups.computeIfAbsent(key.apply(binding), k -> new ArrayList<>()).add(binding);
        }

        List<AnalysisError> errors = new ArrayList<>();
        for (List<TableBinding> group : groups.values()) {
            if (group.size() > 1) {
                TableBinding first = group.get(0);
                TableBinding second = group.get(1);
                errors.add(new DuplicateTableName(first.fullName(), second.fullName(),
                    first.position(), second.position()));
            }
        }
        return errors;
    }
}
