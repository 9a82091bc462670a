/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.Objects;

import io.sqlddl.annotation.Immutable;

/**
 * The target of a foreign key: a table, optionally a single column of it, and the referential actions.
 */
@Immutable
public final class ForeignKeyReference {

    private final TableId table;
    private final String column;
    private final String onDelete;
    private final String onUpdate;
    private final String deferrableInitially;

    public ForeignKeyReference(TableId table, String column, String onDelete, String onUpdate, String deferrableInitially) {
        this.table = Objects.requireNonNull(table, "table");
        this.column = column;
        this.onDelete = onDelete;
        this.onUpdate = onUpdate;
        this.deferrableInitially = deferrableInitially;
    }

    public TableId table() {
        return table;
    }

    /**
     * @return the referenced column, or null when the reference named no column list
     */
    public String column() {
        return column;
    }

    /**
     * @return the {@code ON DELETE} action such as {@code CASCADE} or {@code SET NULL}, or null
     */
    public String onDelete() {
        return onDelete;
    }

    public String onUpdate() {
        return onUpdate;
    }

    /**
     * @return {@code DEFERRED} or {@code IMMEDIATE} when an {@code INITIALLY} clause was given, or null
     */
    public String deferrableInitially() {
        return deferrableInitially;
    }

    public ForeignKeyReference withColumn(String column) {
        return new ForeignKeyReference(table, column, onDelete, onUpdate, deferrableInitially);
    }

    public ForeignKeyReference withDeferrableInitially(String deferrableInitially) {
        return new ForeignKeyReference(table, column, onDelete, onUpdate, deferrableInitially);
    }

    @Override
    public int hashCode() {
        return table.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ForeignKeyReference) {
            ForeignKeyReference that = (ForeignKeyReference) obj;
            return this.table.equals(that.table)
                    && Objects.equals(this.column, that.column)
                    && Objects.equals(this.onDelete, that.onDelete)
                    && Objects.equals(this.onUpdate, that.onUpdate)
                    && Objects.equals(this.deferrableInitially, that.deferrableInitially);
        }
        return false;
    }

    @Override
    public String toString() {
        return "REFERENCES " + table + (column != null ? "(" + column + ")" : "");
    }
}
