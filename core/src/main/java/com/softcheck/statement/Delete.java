package com.softcheck.statement;

import com.softcheck.expression.Expression;
import com.softcheck.logical.Sort;
import com.softcheck.logical.Sort.SortOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * DELETE from a single table.
 *
 * <p>Two forms exist:
 * <pre>
 *   DELETE FROM trades WHERE price &lt; 0        -- delete rows matching predicates
 *   DELETE ID, price FROM trades              -- delete columns (empty list: every row)
 * </pre>
 *
 * <p>Use {@link #rows} and {@link #columns} to build each form.
 */
public final class Delete implements Statement {

    private final String tableName;
    private final List<Expression> where;
    private final List<String> columns;
    private final boolean predicate;
    private final List<SortOrder> orderBy;
    private final List<Expression> groupBy;
    private final List<Expression> having;

    private Delete(String tableName, List<Expression> where, List<String> columns, boolean predicate,
                   List<SortOrder> orderBy, List<Expression> groupBy, List<Expression> having) {
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.where = new ArrayList<>(Objects.requireNonNull(where, "where must not be null"));
        this.columns = new ArrayList<>(Objects.requireNonNull(columns, "columns must not be null"));
        this.predicate = predicate;
        this.orderBy = new ArrayList<>(Objects.requireNonNull(orderBy, "orderBy must not be null"));
        this.groupBy = new ArrayList<>(Objects.requireNonNull(groupBy, "groupBy must not be null"));
        this.having = new ArrayList<>(Objects.requireNonNull(having, "having must not be null"));
    }

    /**
     * Creates a row-deleting DELETE with a WHERE clause.
     */
    public static Delete rows(String tableName, List<Expression> where, List<SortOrder> orderBy,
                              List<Expression> groupBy, List<Expression> having) {
        return new Delete(tableName, where, Collections.emptyList(), true, orderBy, groupBy, having);
    }

    /**
     * Creates a column-deleting DELETE; an empty column list deletes the whole table.
     */
    public static Delete columns(String tableName, List<String> columns, List<SortOrder> orderBy,
                                 List<Expression> groupBy, List<Expression> having) {
        return new Delete(tableName, Collections.emptyList(), columns, false, orderBy, groupBy, having);
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Returns true for the WHERE form.
     */
    public boolean isPredicate() {
        return predicate;
    }

    public List<Expression> where() {
        return Collections.unmodifiableList(where);
    }

    public List<String> columns() {
        return Collections.unmodifiableList(columns);
    }

    public List<SortOrder> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public List<Expression> groupBy() {
        return Collections.unmodifiableList(groupBy);
    }

    public List<Expression> having() {
        return Collections.unmodifiableList(having);
    }

    /**
     * Returns every expression of the statement: where, sort keys, group-by and having.
     *
     * @return the expressions
     */
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(where);
        all.addAll(Sort.keys(orderBy));
        all.addAll(groupBy);
        all.addAll(having);
        return all;
    }

    @Override
    public String toString() {
        return predicate
            ? "Delete(" + tableName + ", where=" + where + ")"
            : "Delete(" + tableName + ", columns=" + columns + ")";
    }
}
