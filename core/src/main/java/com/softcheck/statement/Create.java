package com.softcheck.statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CREATE TABLE, either from an explicit column schema or from a query.
 *
 * <pre>
 *   CREATE TABLE trades (ID STRING, price FLOAT)
 *   CREATE TABLE cheap AS SELECT * FROM trades WHERE price &lt; 10
 * </pre>
 */
public final class Create implements Statement {

    /**
     * A declared column of the schema form.
     *
     * @param name the column name
     * @param typeName the declared type, as written
     */
    public record ColumnDefinition(String name, String typeName) {
        public ColumnDefinition {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(typeName, "typeName must not be null");
        }
    }

    private final String tableName;
    private final List<ColumnDefinition> schema;
    private final Query query;

    private Create(String tableName, List<ColumnDefinition> schema, Query query) {
        this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
        this.schema = new ArrayList<>(schema);
        this.query = query;
    }

    public static Create withSchema(String tableName, List<ColumnDefinition> schema) {
        return new Create(tableName, Objects.requireNonNull(schema, "schema must not be null"), null);
    }

    public static Create asQuery(String tableName, Query query) {
        return new Create(tableName, Collections.emptyList(), Objects.requireNonNull(query, "query must not be null"));
    }

    public String tableName() {
        return tableName;
    }

    public List<ColumnDefinition> schema() {
        return Collections.unmodifiableList(schema);
    }

    /**
     * Returns the source query, empty for the schema form.
     */
    public Optional<Query> query() {
        return Optional.ofNullable(query);
    }

    @Override
    public String toString() {
        return query != null
            ? "Create(" + tableName + ", " + query + ")"
            : "Create(" + tableName + ", " + schema.size() + " columns)";
    }
}
