package com.softcheck.analysis;

import com.softcheck.expression.SourcePosition;
import com.softcheck.logical.LogicalPlan;
import com.softcheck.logical.TableScan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A table made available to a query by a {@link TableScan}.
 *
 * @param name the table name
 * @param alias the correlation name, or null
 * @param position position of the scan
 */
public record TableBinding(String name, String alias, SourcePosition position) {

    public TableBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    public static TableBinding of(TableScan scan) {
        return new TableBinding(scan.tableName(), scan.alias().orElse(null), scan.position());
    }

    public boolean isAliased() {
        return alias != null;
    }

    public Optional<String> aliasName() {
        return Optional.ofNullable(alias);
    }

    /**
     * Returns the only name this table can be referenced by: its alias if it has one.
     */
    public String referenceName() {
        return alias != null ? alias : name;
    }

    /**
     * Renders the binding as {@code name} or {@code name as alias}.
     */
    public String fullName() {
        return alias != null ? name + " as " + alias : name;
    }

    /**
     * Collects the tables scanned anywhere in a plan, leaves in pre-order.
     *
     * @param plan the plan
     * @return the bindings, in order of appearance
     */
    public static List<TableBinding> collect(LogicalPlan plan) {
        List<TableBinding> bindings = new ArrayList<>();
        collect(plan, bindings);
        return bindings;
    }

    private static void collect(LogicalPlan plan, List<TableBinding> bindings) {
        if (plan instanceof TableScan scan) {
            bindings.add(of(scan));
            return;
        }
        for (LogicalPlan child : plan.children()) {
            collect(child, bindings);
        }
    }
}
