package com.softcheck.statement;

import com.softcheck.expression.Expression;
import com.softcheck.logical.Sort.SortOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * INSERT INTO a table, either from a list of values or from a query.
 *
 * <pre>
 *   INSERT INTO trades VALUES ("S", 10, 2016-01-01)
 *   INSERT INTO trades ASSUMING ASC ts SELECT * FROM staging
 * </pre>
 *
 * <p>The value form has no table context, so query-only expressions such as
 * column accesses or {@code ROWID} are not allowed in it.
 */
public final class Insert implements Statement {

    private final String tableName;
    private final List<SortOrder> orderBy;
    private final List<String> columns;
    private final List<Expression> values;
    private final Query query;

    private Insert(String tableName, List<SortOrder> orderBy, List<String> columns,
                   List<Expression> values, Query query) {
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.orderBy = new ArrayList<>(Objects.requireNonNull(orderBy, "orderBy must not be null"));
        this.columns = new ArrayList<>(Objects.requireNonNull(columns, "columns must not be null"));
        this.values = new ArrayList<>(values);
        this.query = query;
    }

    public static Insert values(String tableName, List<SortOrder> orderBy, List<String> columns,
                                List<Expression> values) {
        return new Insert(tableName, orderBy, columns,
            Objects.requireNonNull(values, "values must not be null"), null);
    }

    public static Insert fromQuery(String tableName, List<SortOrder> orderBy, List<String> columns,
                                   Query query) {
        return new Insert(tableName, orderBy, columns, Collections.emptyList(),
            Objects.requireNonNull(query, "query must not be null"));
    }

    public String tableName() {
        return tableName;
    }

    public List<SortOrder> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    /**
     * Returns the explicit target columns, empty when all columns are inserted.
     */
    public List<String> columns() {
        return Collections.unmodifiableList(columns);
    }

    public List<Expression> values() {
        return Collections.unmodifiableList(values);
    }

    /**
     * Returns the source query, empty for the value form.
     */
    public Optional<Query> query() {
        return Optional.ofNullable(query);
    }

    @Override
    public String toString() {
        return query != null
            ? "Insert(" + tableName + ", " + query + ")"
            : "Insert(" + tableName + ", " + values.size() + " values)";
    }
}
