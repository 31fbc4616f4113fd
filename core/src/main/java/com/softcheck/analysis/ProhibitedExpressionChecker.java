package com.softcheck.analysis;

import com.softcheck.analysis.AnalysisError.IllegalExpression;
import com.softcheck.expression.ColumnAccess;
import com.softcheck.expression.Expression;
import com.softcheck.expression.ExpressionUtils;
import com.softcheck.expression.RowIdExpression;
import com.softcheck.expression.StarExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects query-only expressions outside of a query.
 *
 * <p>Wildcards, qualified column accesses and {@code ROWID} need the table-scoped
 * evaluation context of a query. Function bodies and INSERT value lists have none,
 * so every occurrence there is reported. The whole tree is scanned, including the
 * children of a rejected node.
 */
public final class ProhibitedExpressionChecker {

    private ProhibitedExpressionChecker() {
        // Utility class - prevent instantiation
    }

    /**
     * Reports every query-only expression in the tree.
     *
     * @param expr the expression to scan
     * @return one {@link IllegalExpression} per offending node, in pre-order
     */
    public static List<AnalysisError> check(Expression expr) {
        List<AnalysisError> errors = new ArrayList<>();
        collect(expr, errors);
        return errors;
    }

    /**
     * Returns true for expressions that are only meaningful inside a query.
     *
     * @param expr the expression
     * @return true if query-only
     */
    public static boolean isQueryOnly(Expression expr) {
        return expr instanceof StarExpression
            || expr instanceof ColumnAccess
            || expr instanceof RowIdExpression;
    }

    private static void collect(Expression expr, List<AnalysisError> errors) {
        if (isQueryOnly(expr)) {
            errors.add(new IllegalExpression(ExpressionUtils.toShallowSource(expr), expr.position()));
        }
        for (Expression child : expr.children()) {
            collect(child, errors);
        }
    }
}
