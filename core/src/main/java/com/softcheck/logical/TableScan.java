package com.softcheck.logical;

import com.softcheck.expression.Expression;
import com.softcheck.expression.SourcePosition;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Leaf node reading a named table, optionally under a correlation name.
 *
 * <p>Examples:
 * <pre>
 *   FROM trades                 -- TableScan("trades")
 *   FROM trades AS t            -- TableScan("trades", "t")
 * </pre>
 *
 * <p>Once aliased, the table may only be referenced through its alias for the
 * rest of the query.
 */
public final class TableScan extends LogicalPlan {

    private final String tableName;
    private final String alias;
    private final SourcePosition position;

    /**
     * Creates a table scan node.
     *
     * @param tableName the table name
     * @param alias the correlation name (may be null)
     * @param position the source position
     */
    public TableScan(String tableName, String alias, SourcePosition position) {
        super(); // No children
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.alias = alias;
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public TableScan(String tableName, String alias) {
        this(tableName, alias, SourcePosition.UNKNOWN);
    }

    public TableScan(String tableName) {
        this(tableName, null, SourcePosition.UNKNOWN);
    }

    public String tableName() {
        return tableName;
    }

    public Optional<String> alias() {
        return Optional.ofNullable(alias);
    }

    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> expressions() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return alias == null
            ? String.format("TableScan(%s)", tableName)
            : String.format("TableScan(%s AS %s)", tableName, alias);
    }
}
