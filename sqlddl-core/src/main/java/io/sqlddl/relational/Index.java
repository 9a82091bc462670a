/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import io.sqlddl.annotation.Immutable;

/**
 * An index, from {@code CREATE [UNIQUE] INDEX} or from a MySQL {@code KEY}/{@code INDEX} table element.
 */
@Immutable
public final class Index implements Statement {

    /**
     * One indexed column with its ordering options.
     */
    @Immutable
    public static final class IndexColumn {
        private final String name;
        private final String order;
        private final String nulls;

        public IndexColumn(String name, String order, String nulls) {
            this.name = Objects.requireNonNull(name, "name");
            this.order = order != null ? order : "ASC";
            this.nulls = nulls != null ? nulls : "LAST";
        }

        public String name() {
            return name;
        }

        /**
         * @return {@code ASC} or {@code DESC}
         */
        public String order() {
            return order;
        }

        /**
         * @return {@code FIRST} or {@code LAST}
         */
        public String nulls() {
            return nulls;
        }

        @Override
        public String toString() {
            return name + " " + order + " NULLS " + nulls;
        }
    }

    private final TableId tableId;
    private final String name;
    private final boolean unique;
    private final List<IndexColumn> columns;
    private final String method;

    public Index(TableId tableId, String name, boolean unique, List<IndexColumn> columns, String method) {
        this.tableId = Objects.requireNonNull(tableId, "tableId");
        this.name = name;
        this.unique = unique;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.method = method;
    }

    @Override
    public Kind kind() {
        return Kind.CREATE_INDEX;
    }

    public TableId tableId() {
        return tableId;
    }

    /**
     * @return the index name, or null for an unnamed MySQL key
     */
    public String name() {
        return name;
    }

    public boolean isUnique() {
        return unique;
    }

    public List<IndexColumn> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(IndexColumn::name).collect(Collectors.toList());
    }

    /**
     * @return the access method of {@code USING method}, or null
     */
    public String method() {
        return method;
    }

    @Override
    public String toString() {
        return (unique ? "UNIQUE INDEX " : "INDEX ") + name + " ON " + tableId + " " + columns;
    }
}
