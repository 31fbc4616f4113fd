package com.softcheck.expression;

import java.util.List;

/**
 * Base interface for all expressions of the query language.
 *
 * <p>Expressions appear in:
 * <ul>
 *   <li>projections, WHERE, GROUP BY, HAVING and ORDER BY clauses of queries</li>
 *   <li>SET, WHERE and HAVING clauses of UPDATE and DELETE</li>
 *   <li>VALUES lists of INSERT</li>
 *   <li>bodies of user-defined functions</li>
 * </ul>
 *
 * <p>The family is closed: every checker performs a total case analysis over the
 * permitted implementations, so adding a variant is a compile-time change for
 * every consumer. All implementations are immutable and compare structurally,
 * ignoring their {@link SourcePosition}.
 */
public sealed interface Expression
    permits Literal, BinaryExpression, UnaryExpression, FunctionCall, ArrayIndex,
            CaseWhenExpression, Identifier, ColumnAccess, StarExpression,
            RowIdExpression, EachExpression {

    /**
     * Returns the source position of this expression.
     *
     * @return the position, {@link SourcePosition#UNKNOWN} for synthetic nodes
     */
    SourcePosition position();

    /**
     * Returns the direct sub-expressions of this expression, in source order.
     *
     * @return an unmodifiable list, empty for leaves
     */
    List<Expression> children();

    /**
     * Renders this expression back to source text, used in diagnostics.
     *
     * @return the source fragment
     */
    String toSource();
}
