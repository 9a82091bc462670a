/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import io.sqlddl.annotation.Immutable;

/**
 * An immutable definition of a table column.
 */
@Immutable
public interface Column extends Comparable<Column> {

    /**
     * Obtain a column definition editor that can be used to define a column.
     *
     * @return the editor; never null
     */
    static ColumnEditor editor() {
        return new ColumnEditorImpl();
    }

    /**
     * @return the name of the column as written, without quotes; never null
     */
    String name();

    /**
     * @return the 1-based position of the column within its table
     */
    int position();

    /**
     * @return the parsed type; never null
     */
    DataType dataType();

    /**
     * The type as it appears in records: the canonical type expression without the size, e.g. {@code VARCHAR} for
     * {@code VARCHAR(50)}, {@code INT[]} for {@code INT ARRAY}, or {@code STRUCT<a:STRING>}.
     *
     * @return the type name; never null
     */
    default String typeName() {
        return dataType().typeName();
    }

    /**
     * @return the length or precision, or null if the type has none
     */
    default Integer length() {
        return dataType().length();
    }

    /**
     * @return the scale, or null if the type has none
     */
    default Integer scale() {
        return dataType().scale();
    }

    /**
     * @return true unless a {@code NOT NULL} or {@code PRIMARY KEY} applies to the column
     */
    boolean isOptional();

    /**
     * @return the raw {@code DEFAULT} expression text, or null
     */
    String defaultValueExpression();

    /**
     * @return the raw expression text of a column-level {@code CHECK}, or null
     */
    String checkExpression();

    boolean isUnique();

    boolean isPrimaryKey();

    /**
     * @return the column-level foreign key, or null
     */
    ForeignKeyReference references();

    boolean isAutoIncremented();

    /**
     * @return the expression of a {@code GENERATED ALWAYS AS (...)} column, or null
     */
    String generatedAs();

    String comment();

    String collation();

    String charsetName();

    /**
     * @return the MySQL {@code ON UPDATE} expression, or null
     */
    String onUpdate();

    /**
     * Obtain an editor that contains a copy of the definition in this column.
     *
     * @return the column editor; never null
     */
    ColumnEditor edit();

    @Override
    default int compareTo(Column that) {
        if (this == that) {
            return 0;
        }
        return this.position() - that.position();
    }
}
