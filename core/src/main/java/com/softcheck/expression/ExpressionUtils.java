package com.softcheck.expression;

import com.softcheck.expression.CaseWhenExpression.WhenBranch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Utility methods for inspecting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Collects the distinct qualified column accesses of an expression tree.
     *
     * @param expr the expression to inspect
     * @return accesses in pre-order of first appearance
     */
    public static Set<ColumnAccess> columnAccesses(Expression expr) {
        Set<ColumnAccess> accesses = new LinkedHashSet<>();
        collectColumnAccesses(expr, accesses);
        return accesses;
    }

    /**
     * Collects the distinct qualified column accesses of several expression trees.
     *
     * @param exprs the expressions to inspect, in order
     * @return accesses in pre-order of first appearance
     */
    public static Set<ColumnAccess> columnAccesses(Collection<? extends Expression> exprs) {
        Set<ColumnAccess> accesses = new LinkedHashSet<>();
        for (Expression expr : exprs) {
            collectColumnAccesses(expr, accesses);
        }
        return accesses;
    }

    /**
     * Adds every column access below {@code expr} to {@code accesses}.
     *
     * <p>The first occurrence of a qualified name wins, so the reported position
     * is that of its earliest use.
     *
     * @param expr the expression
     * @param accesses the ordered set to collect into
     */
    public static void collectColumnAccesses(Expression expr, Set<ColumnAccess> accesses) {
        if (expr instanceof ColumnAccess access) {
            accesses.add(access);
            return;
        }
        for (Expression child : expr.children()) {
            collectColumnAccesses(child, accesses);
        }
    }

    /**
     * Returns true for expressions allowed as sort keys: a bare identifier or
     * a qualified column access.
     *
     * @param expr the expression
     * @return true if {@code expr} is a simple column reference
     */
    public static boolean isSimpleColumn(Expression expr) {
        return expr instanceof Identifier || expr instanceof ColumnAccess;
    }

    /**
     * Renders an expression one level deep for diagnostics.
     *
     * <p>Direct children that are leaves are rendered in full; deeper subtrees are
     * elided as {@code ...}. For example {@code ((a + 1) * b)} renders as
     * {@code (... * b)}.
     *
     * @param expr the expression
     * @return the shallow source fragment
     */
    public static String toShallowSource(Expression expr) {
        if (expr instanceof BinaryExpression binary) {
            return "(" + elide(binary.left()) + " " + binary.operator().symbol() + " "
                + elide(binary.right()) + ")";
        } else if (expr instanceof UnaryExpression unary) {
            String operand = elide(unary.operand());
            return unary.operator() == UnaryExpression.Operator.NOT
                ? "(NOT " + operand + ")"
                : "(" + unary.operator().symbol() + operand + ")";
        } else if (expr instanceof FunctionCall call) {
            List<String> args = new ArrayList<>();
            for (Expression argument : call.arguments()) {
                args.add(elide(argument));
            }
            return call.functionName() + "(" + String.join(", ", args) + ")";
        } else if (expr instanceof ArrayIndex index) {
            return elide(index.array()) + "[" + elide(index.index()) + "]";
        } else if (expr instanceof EachExpression each) {
            return "EACH(" + elide(each.inner()) + ")";
        } else if (expr instanceof CaseWhenExpression caseWhen) {
            StringBuilder source = new StringBuilder("CASE ");
            caseWhen.discriminant().ifPresent(d -> source.append(elide(d)).append(" "));
            for (WhenBranch branch : caseWhen.branches()) {
                source.append("WHEN ").append(elide(branch.condition()))
                      .append(" THEN ").append(elide(branch.result())).append(" ");
            }
            caseWhen.elseBranch().ifPresent(e -> source.append("ELSE ").append(elide(e)).append(" "));
            return source.append("END").toString();
        }
        return expr.toSource();
    }

    private static String elide(Expression child) {
        return child.children().isEmpty() ? child.toSource() : "...";
    }
}
