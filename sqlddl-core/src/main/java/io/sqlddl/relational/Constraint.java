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

import io.sqlddl.annotation.Immutable;

/**
 * A table-level constraint, declared in a {@code CREATE TABLE} element list or added by {@code ALTER TABLE}.
 */
@Immutable
public abstract class Constraint {

    public enum Kind {
        PRIMARY_KEY,
        UNIQUE,
        CHECK,
        FOREIGN_KEY
    }

    private final String name;

    protected Constraint(String name) {
        this.name = name;
    }

    /**
     * @return the name given with {@code CONSTRAINT name}, or null for an unnamed constraint
     */
    public String name() {
        return name;
    }

    public abstract Kind kind();

    protected static List<String> immutable(List<String> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * {@code PRIMARY KEY (col, ...)}.
     */
    public static final class PrimaryKey extends Constraint {
        private final List<String> columns;

        public PrimaryKey(String name, List<String> columns) {
            super(name);
            this.columns = immutable(columns);
        }

        public List<String> columns() {
            return columns;
        }

        @Override
        public Kind kind() {
            return Kind.PRIMARY_KEY;
        }

        @Override
        public String toString() {
            return "PRIMARY KEY " + columns;
        }
    }

    /**
     * {@code UNIQUE (col, ...)}.
     */
    public static final class Unique extends Constraint {
        private final List<String> columns;

        public Unique(String name, List<String> columns) {
            super(name);
            this.columns = immutable(columns);
        }

        public List<String> columns() {
            return columns;
        }

        @Override
        public Kind kind() {
            return Kind.UNIQUE;
        }

        @Override
        public String toString() {
            return "UNIQUE " + columns;
        }
    }

    /**
     * {@code CHECK (expression)}.
     */
    public static final class Check extends Constraint {
        private final String expression;

        public Check(String name, String expression) {
            super(name);
            this.expression = Objects.requireNonNull(expression, "expression");
        }

        /**
         * @return the expression text inside the parentheses; never null
         */
        public String expression() {
            return expression;
        }

        @Override
        public Kind kind() {
            return Kind.CHECK;
        }

        @Override
        public String toString() {
            return "CHECK (" + expression + ")";
        }
    }

    /**
     * {@code FOREIGN KEY (col, ...) REFERENCES table (col, ...)}.
     */
    public static final class ForeignKey extends Constraint {
        private final List<String> columns;
        private final List<String> referencedColumns;
        private final ForeignKeyReference reference;

        public ForeignKey(String name, List<String> columns, List<String> referencedColumns, ForeignKeyReference reference) {
            super(name);
            this.columns = immutable(columns);
            this.referencedColumns = immutable(referencedColumns);
            this.reference = Objects.requireNonNull(reference, "reference");
        }

        /**
         * @return the local columns; never null
         */
        public List<String> columns() {
            return columns;
        }

        /**
         * @return the referenced columns, possibly empty when the reference names none
         */
        public List<String> referencedColumns() {
            return referencedColumns;
        }

        /**
         * @return the reference shared by all columns, with a null {@link ForeignKeyReference#column() column}
         */
        public ForeignKeyReference reference() {
            return reference;
        }

        /**
         * The reference of one local column: the referenced column at the same position, or none if the reference lists
         * fewer columns.
         *
         * @param index the index of the local column
         * @return the reference; never null
         */
        public ForeignKeyReference referenceFor(int index) {
            return reference.withColumn(index < referencedColumns.size() ? referencedColumns.get(index) : null);
        }

        @Override
        public Kind kind() {
            return Kind.FOREIGN_KEY;
        }

        @Override
        public String toString() {
            return "FOREIGN KEY " + columns + " " + reference;
        }
    }
}
