/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.sqlddl.annotation.Immutable;

/**
 * An immutable definition of a table, from {@code CREATE TABLE} plus any {@code ALTER TABLE} and {@code CREATE INDEX}
 * statements that were merged into it.
 */
@Immutable
public interface Table extends Statement {

    /**
     * Obtain a new editor that can be used to define a table.
     *
     * @return the editor; never null
     */
    static TableEditor editor() {
        return new TableEditorImpl();
    }

    @Override
    default Kind kind() {
        return Kind.CREATE_TABLE;
    }

    TableId id();

    /**
     * @return the columns in the order they were defined; never null
     */
    List<Column> columns();

    /**
     * @param name the name of the column, matched case-insensitively
     * @return the column, or null if there is none with that name
     */
    Column columnWithName(String name);

    default List<String> columnNames() {
        return columns().stream().map(Column::name).collect(Collectors.toList());
    }

    /**
     * @return the names of the primary key columns in key order; never null but possibly empty
     */
    List<String> primaryKeyColumnNames();

    /**
     * @return the check constraints, named or not; never null
     */
    List<Constraint.Check> checks();

    /**
     * @return every table-level constraint in the order it was declared or added; never null
     */
    List<Constraint> constraints();

    List<Index> indexes();

    /**
     * @return the actions of {@code ALTER TABLE} statements merged into this table; never null
     */
    List<AlterAction> alterations();

    /**
     * @return the pseudo-columns of Hive's {@code PARTITIONED BY}; never null
     */
    List<Column> partitionedBy();

    /**
     * @return the {@code PARTITION BY} clause, or null
     */
    PartitionSpec partitionBy();

    String tablespace();

    String comment();

    /**
     * @return the source table of {@code LIKE t}, or null
     */
    TableId like();

    boolean ifNotExists();

    boolean replace();

    boolean temporary();

    /**
     * @return options such as MySQL's {@code ENGINE=InnoDB}, keyed by the upper-cased option name; never null
     */
    Map<String, String> tableOptions();

    /**
     * @return the Hive storage clauses; never null
     */
    HqlProperties hql();

    /**
     * Obtain an editor that contains the same information as this table definition.
     *
     * @return the editor; never null
     */
    TableEditor edit();
}
