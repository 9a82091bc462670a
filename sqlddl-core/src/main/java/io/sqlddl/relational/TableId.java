/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.Locale;
import java.util.Objects;

import io.sqlddl.annotation.Immutable;

/**
 * Unique identifier for a table: an optional schema and the table name, both as written without quotes.
 */
@Immutable
public final class TableId implements Comparable<TableId> {

    private final String schemaName;
    private final String tableName;
    private final String id;

    /**
     * Create a new table identifier.
     *
     * @param schemaName the name of the schema; may be null if not specified
     * @param tableName the name of the table; may not be null
     */
    public TableId(String schemaName, String tableName) {
        this.schemaName = schemaName;
        this.tableName = Objects.requireNonNull(tableName, "tableName");
        this.id = schemaName == null ? tableName : schemaName + "." + tableName;
    }

    /**
     * @return the name of the schema, or null if the table was not qualified
     */
    public String schema() {
        return schemaName;
    }

    /**
     * @return the name of the table; never null
     */
    public String table() {
        return tableName;
    }

    /**
     * The identifier used when tables are matched case-insensitively, such as by {@code ALTER TABLE} and
     * {@code CREATE INDEX} statements.
     *
     * @return the lower-cased table identifier; never null
     */
    public TableId toLowercase() {
        return new TableId(schemaName == null ? null : schemaName.toLowerCase(Locale.ROOT), tableName.toLowerCase(Locale.ROOT));
    }

    @Override
    public int compareTo(TableId that) {
        if (this == that) {
            return 0;
        }
        return this.id.compareTo(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof TableId) {
            return this.compareTo((TableId) obj) == 0;
        }
        return false;
    }

    @Override
    public String toString() {
        return id;
    }
}
