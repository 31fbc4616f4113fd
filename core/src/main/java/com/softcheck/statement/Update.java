package com.softcheck.statement;

import com.softcheck.expression.Expression;
import com.softcheck.logical.Sort;
import com.softcheck.logical.Sort.SortOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * UPDATE of a single table.
 *
 * <p>Example:
 * <pre>
 *   UPDATE trades SET price = price * 2 ASSUMING ASC ts WHERE ID = "S"
 * </pre>
 */
public final class Update implements Statement {

    /**
     * A single {@code column = value} assignment.
     *
     * @param column the assigned column
     * @param value the new value
     */
    public record ColumnAssignment(String column, Expression value) {
        public ColumnAssignment {
            Objects.requireNonNull(column, "column must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    private final String tableName;
    private final List<ColumnAssignment> assignments;
    private final List<SortOrder> orderBy;
    private final List<Expression> where;
    private final List<Expression> groupBy;
    private final List<Expression> having;

    public Update(String tableName, List<ColumnAssignment> assignments, List<SortOrder> orderBy,
                  List<Expression> where, List<Expression> groupBy, List<Expression> having) {
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.assignments = new ArrayList<>(Objects.requireNonNull(assignments, "assignments must not be null"));
        this.orderBy = new ArrayList<>(Objects.requireNonNull(orderBy, "orderBy must not be null"));
        this.where = new ArrayList<>(Objects.requireNonNull(where, "where must not be null"));
        this.groupBy = new ArrayList<>(Objects.requireNonNull(groupBy, "groupBy must not be null"));
        this.having = new ArrayList<>(Objects.requireNonNull(having, "having must not be null"));
    }

    public String tableName() {
        return tableName;
    }

    public List<ColumnAssignment> assignments() {
        return Collections.unmodifiableList(assignments);
    }

    public List<SortOrder> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public List<Expression> where() {
        return Collections.unmodifiableList(where);
    }

    public List<Expression> groupBy() {
        return Collections.unmodifiableList(groupBy);
    }

    public List<Expression> having() {
        return Collections.unmodifiableList(having);
    }

    /**
     * Returns every expression of the statement: assigned values, sort keys,
     * where, group-by and having, in that order.
     *
     * @return the expressions
     */
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>();
        for (ColumnAssignment assignment : assignments) {
            all.add(assignment.value());
        }
        all.addAll(Sort.keys(orderBy));
        all.addAll(where);
        all.addAll(groupBy);
        all.addAll(having);
        return all;
    }

    @Override
    public String toString() {
        return "Update(" + tableName + ", " + assignments.size() + " assignments)";
    }
}
