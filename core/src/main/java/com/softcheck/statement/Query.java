package com.softcheck.statement;

import com.softcheck.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A full query: zero or more named local queries followed by the main query.
 *
 * <p>Example:
 * <pre>
 *   WITH
 *     recent(ID, price) AS (SELECT ID, price FROM trades WHERE ts > 2016-01-01)
 *   SELECT ID, avg(price) FROM recent GROUP BY ID
 * </pre>
 */
public final class Query implements Statement {

    /**
     * A named local query of the WITH clause.
     *
     * @param name the local table name
     * @param columnNames optional column renames (empty when absent)
     * @param plan the query plan
     */
    public record LocalQuery(String name, List<String> columnNames, LogicalPlan plan) {
        public LocalQuery {
            Objects.requireNonNull(name, "name must not be null");
            columnNames = List.copyOf(Objects.requireNonNull(columnNames, "columnNames must not be null"));
            Objects.requireNonNull(plan, "plan must not be null");
        }

        public LocalQuery(String name, LogicalPlan plan) {
            this(name, Collections.emptyList(), plan);
        }
    }

    private final List<LocalQuery> localQueries;
    private final LogicalPlan main;

    /**
     * Creates a query.
     *
     * @param localQueries the local queries, evaluated before {@code main}
     * @param main the main query plan
     */
    public Query(List<LocalQuery> localQueries, LogicalPlan main) {
        this.localQueries = new ArrayList<>(Objects.requireNonNull(localQueries, "localQueries must not be null"));
        this.main = Objects.requireNonNull(main, "main must not be null");
    }

    public Query(LogicalPlan main) {
        this(Collections.emptyList(), main);
    }

    public List<LocalQuery> localQueries() {
        return Collections.unmodifiableList(localQueries);
    }

    public LogicalPlan main() {
        return main;
    }

    @Override
    public String toString() {
        return "Query(" + localQueries.size() + " local, main=" + main + ")";
    }
}
