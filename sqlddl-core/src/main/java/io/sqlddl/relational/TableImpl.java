/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class TableImpl implements Table {

    private final TableId id;
    private final List<Column> columnDefs;
    private final Map<String, Column> columnsByLowercaseName;
    private final List<String> pkColumnNames;
    private final List<Constraint.Check> checks;
    private final List<Constraint> constraints;
    private final List<Index> indexes;
    private final List<AlterAction> alterations;
    private final List<Column> partitionedBy;
    private final PartitionSpec partitionBy;
    private final String tablespace;
    private final String comment;
    private final TableId like;
    private final boolean ifNotExists;
    private final boolean replace;
    private final boolean temporary;
    private final Map<String, String> tableOptions;
    private final HqlProperties hql;

    TableImpl(TableEditorImpl editor, List<Column> sortedColumns) {
        this.id = editor.tableId();
        this.columnDefs = Collections.unmodifiableList(sortedColumns);
        Map<String, Column> defsByLowercaseName = new LinkedHashMap<>();
        for (Column def : this.columnDefs) {
            defsByLowercaseName.put(def.name().toLowerCase(Locale.ROOT), def);
        }
        this.columnsByLowercaseName = Collections.unmodifiableMap(defsByLowercaseName);
        this.pkColumnNames = copy(editor.primaryKeyColumnNames());
        this.checks = copy(editor.checks());
        this.constraints = copy(editor.constraints());
        this.indexes = copy(editor.indexes());
        this.alterations = copy(editor.alterations());
        this.partitionedBy = copy(editor.partitionedBy());
        this.partitionBy = editor.partitionBy();
        this.tablespace = editor.tablespace();
        this.comment = editor.comment();
        this.like = editor.like();
        this.ifNotExists = editor.ifNotExists();
        this.replace = editor.replace();
        this.temporary = editor.temporary();
        this.tableOptions = Collections.unmodifiableMap(new LinkedHashMap<>(editor.tableOptions()));
        this.hql = editor.hql().build();
    }

    private static <T> List<T> copy(List<T> values) {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public TableId id() {
        return id;
    }

    @Override
    public List<Column> columns() {
        return columnDefs;
    }

    @Override
    public Column columnWithName(String name) {
        return columnsByLowercaseName.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public List<String> primaryKeyColumnNames() {
        return pkColumnNames;
    }

    @Override
    public List<Constraint.Check> checks() {
        return checks;
    }

    @Override
    public List<Constraint> constraints() {
        return constraints;
    }

    @Override
    public List<Index> indexes() {
        return indexes;
    }

    @Override
    public List<AlterAction> alterations() {
        return alterations;
    }

    @Override
    public List<Column> partitionedBy() {
        return partitionedBy;
    }

    @Override
    public PartitionSpec partitionBy() {
        return partitionBy;
    }

    @Override
    public String tablespace() {
        return tablespace;
    }

    @Override
    public String comment() {
        return comment;
    }

    @Override
    public TableId like() {
        return like;
    }

    @Override
    public boolean ifNotExists() {
        return ifNotExists;
    }

    @Override
    public boolean replace() {
        return replace;
    }

    @Override
    public boolean temporary() {
        return temporary;
    }

    @Override
    public Map<String, String> tableOptions() {
        return tableOptions;
    }

    @Override
    public HqlProperties hql() {
        return hql;
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
        if (obj instanceof Table) {
            Table that = (Table) obj;
            return this.id().equals(that.id())
                    && this.columns().equals(that.columns())
                    && this.primaryKeyColumnNames().equals(that.primaryKeyColumnNames());
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        toString(sb, "");
        return sb.toString();
    }

    public void toString(StringBuilder sb, String prefix) {
        if (prefix == null) {
            prefix = "";
        }
        sb.append(prefix).append("columns: {").append(System.lineSeparator());
        for (Column defn : columnDefs) {
            sb.append(prefix).append("  ").append(defn).append(System.lineSeparator());
        }
        sb.append(prefix).append("}").append(System.lineSeparator());
        sb.append(prefix).append("primary key: ").append(primaryKeyColumnNames()).append(System.lineSeparator());
    }

    @Override
    public TableEditor edit() {
        return new TableEditorImpl(this);
    }
}
