/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import io.sqlddl.annotation.NotThreadSafe;

/**
 * An editor for {@link Column} instances.
 */
@NotThreadSafe
public interface ColumnEditor {

    String name();

    DataType dataType();

    boolean isOptional();

    boolean isPrimaryKey();

    String defaultValueExpression();

    ForeignKeyReference references();

    ColumnEditor name(String name);

    ColumnEditor dataType(DataType type);

    ColumnEditor position(int position);

    ColumnEditor optional(boolean optional);

    ColumnEditor defaultValueExpression(String expression);

    ColumnEditor checkExpression(String expression);

    ColumnEditor unique(boolean unique);

    /**
     * Mark the column as (part of) the primary key. A primary key column is never optional.
     *
     * @param primaryKey whether the column is part of the primary key
     * @return this editor so methods can be chained together; never null
     */
    ColumnEditor primaryKey(boolean primaryKey);

    ColumnEditor references(ForeignKeyReference reference);

    ColumnEditor autoIncremented(boolean autoIncremented);

    ColumnEditor generatedAs(String expression);

    ColumnEditor comment(String comment);

    ColumnEditor collation(String collation);

    ColumnEditor charsetName(String charsetName);

    ColumnEditor onUpdate(String expression);

    /**
     * Obtain an immutable column definition representing the current state of this editor.
     *
     * @return the immutable column definition; never null
     * @throws IllegalStateException if the name or type has not been set
     */
    Column create();
}
