package com.softcheck.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a qualified column reference of the form {@code table.column}.
 *
 * <p>The qualifier must resolve to exactly one table binding of the enclosing
 * query: the table's alias when it has one, its name otherwise. Column accesses
 * are only meaningful inside a query's table-scoped evaluation context.
 *
 * <p>Two accesses are equal when qualifier and column match, whatever their
 * positions; resolution reports each distinct access once.
 */
public final class ColumnAccess implements Expression {

    private final String qualifier;
    private final String columnName;
    private final SourcePosition position;

    /**
     * Creates a qualified column access.
     *
     * @param qualifier the table name or correlation name
     * @param columnName the column name
     * @param position the source position
     */
    public ColumnAccess(String qualifier, String columnName, SourcePosition position) {
        this.qualifier = Objects.requireNonNull(qualifier, "qualifier must not be null");
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.position = Objects.requireNonNull(position, "position must not be null");
    }

    public ColumnAccess(String qualifier, String columnName) {
        this(qualifier, columnName, SourcePosition.UNKNOWN);
    }

    public String qualifier() {
        return qualifier;
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the fully qualified column name.
     *
     * @return the qualified name (e.g., "t.c")
     */
    public String qualifiedName() {
        return qualifier + "." + columnName;
    }

    @Override
    public SourcePosition position() {
        return position;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String toSource() {
        return qualifiedName();
    }

    @Override
    public String toString() {
        return toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnAccess)) return false;
        ColumnAccess that = (ColumnAccess) obj;
        return Objects.equals(qualifier, that.qualifier) &&
               Objects.equals(columnName, that.columnName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier, columnName);
    }

    // ==================== Factory Methods ====================

    public static ColumnAccess of(String qualifier, String columnName) {
        return new ColumnAccess(qualifier, columnName);
    }
}
