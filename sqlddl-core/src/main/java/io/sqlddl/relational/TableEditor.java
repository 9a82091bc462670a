/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.List;

import io.sqlddl.annotation.NotThreadSafe;

/**
 * An editor for {@link Table} instances, normally obtained from {@link Table#editor()}. The editor owns the defaults and
 * invariants of a table: every collection starts empty, column names are unique ignoring case, and primary key names
 * always refer to existing columns.
 */
@NotThreadSafe
public interface TableEditor {

    TableId tableId();

    TableEditor tableId(TableId tableId);

    /**
     * @return the current columns in position order; never null
     */
    List<Column> columns();

    Column columnWithName(String name);

    List<String> primaryKeyColumnNames();

    /**
     * Add a column at the end, or replace the column with the same name in place.
     *
     * @param column the column
     * @return this editor so methods can be chained together; never null
     */
    TableEditor addColumn(Column column);

    TableEditor addColumns(Iterable<Column> columns);

    /**
     * Replace the column with the same name, keeping its position.
     *
     * @param column the new definition
     * @return this editor so methods can be chained together; never null
     * @throws IllegalArgumentException if there is no column with that name
     */
    TableEditor updateColumn(Column column);

    /**
     * Remove the named column, if there is one.
     *
     * @param columnName the name of the column
     * @return this editor so methods can be chained together; never null
     */
    TableEditor removeColumn(String columnName);

    /**
     * Rename a column, keeping its position and its membership in the primary key.
     *
     * @param existingName the current name
     * @param newName the new name
     * @return this editor so methods can be chained together; never null
     * @throws IllegalArgumentException if there is no column with the existing name
     */
    TableEditor renameColumn(String existingName, String newName);

    /**
     * Set the primary key.
     *
     * @param pkColumnNames the names of the key columns in key order
     * @return this editor so methods can be chained together; never null
     * @throws IllegalArgumentException if a name does not match a column
     */
    TableEditor setPrimaryKeyNames(List<String> pkColumnNames);

    /**
     * Add a table-level constraint. A primary key sets the key columns, a check is also listed among the
     * {@link Table#checks() checks}, a single-column unique constraint marks that column unique, and a foreign key sets
     * the references of its local columns.
     *
     * @param constraint the constraint
     * @return this editor so methods can be chained together; never null
     * @throws IllegalArgumentException if a primary key names an unknown column
     */
    TableEditor addConstraint(Constraint constraint);

    TableEditor removeConstraint(String constraintName);

    TableEditor addIndex(Index index);

    TableEditor addAlteration(AlterAction action);

    TableEditor addPartitionedByColumn(Column column);

    TableEditor partitionBy(PartitionSpec partitionSpec);

    TableEditor tablespace(String tablespace);

    TableEditor comment(String comment);

    TableEditor like(TableId source);

    /**
     * @return the table this one copies its definition from, or null
     */
    TableId like();

    TableEditor ifNotExists(boolean ifNotExists);

    TableEditor replace(boolean replace);

    TableEditor temporary(boolean temporary);

    TableEditor tableOption(String name, String value);

    /**
     * @return the live builder of the Hive storage clauses of the table; never null
     */
    HqlProperties.Builder hql();

    /**
     * Obtain an immutable table definition representing the current state of this editor.
     *
     * @return the immutable table definition; never null
     * @throws IllegalStateException if the table identifier has not been set
     */
    Table create();
}
