/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

final class TableEditorImpl implements TableEditor {

    private TableId id;
    private LinkedHashMap<String, Column> sortedColumns = new LinkedHashMap<>();
    private final List<String> pkColumnNames = new ArrayList<>();
    private final List<Constraint.Check> checks = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final List<Index> indexes = new ArrayList<>();
    private final List<AlterAction> alterations = new ArrayList<>();
    private final List<Column> partitionedBy = new ArrayList<>();
    private final Map<String, String> tableOptions = new LinkedHashMap<>();
    private PartitionSpec partitionBy;
    private String tablespace;
    private String comment;
    private TableId like;
    private boolean ifNotExists;
    private boolean replace;
    private boolean temporary;
    private HqlProperties.Builder hql = new HqlProperties.Builder();

    TableEditorImpl() {
    }

    TableEditorImpl(Table table) {
        this.id = table.id();
        addColumns(table.columns());
        this.pkColumnNames.addAll(table.primaryKeyColumnNames());
        this.checks.addAll(table.checks());
        this.constraints.addAll(table.constraints());
        this.indexes.addAll(table.indexes());
        this.alterations.addAll(table.alterations());
        this.partitionedBy.addAll(table.partitionedBy());
        this.tableOptions.putAll(table.tableOptions());
        this.partitionBy = table.partitionBy();
        this.tablespace = table.tablespace();
        this.comment = table.comment();
        this.like = table.like();
        this.ifNotExists = table.ifNotExists();
        this.replace = table.replace();
        this.temporary = table.temporary();
        this.hql = new HqlProperties.Builder(table.hql());
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public TableId tableId() {
        return id;
    }

    @Override
    public TableEditor tableId(TableId id) {
        this.id = id;
        return this;
    }

    @Override
    public List<Column> columns() {
        return Collections.unmodifiableList(new ArrayList<>(sortedColumns.values()));
    }

    @Override
    public Column columnWithName(String name) {
        return sortedColumns.get(key(name));
    }

    protected boolean hasColumnWithName(String name) {
        return columnWithName(name) != null;
    }

    @Override
    public List<String> primaryKeyColumnNames() {
        return Collections.unmodifiableList(pkColumnNames);
    }

    @Override
    public TableEditor addColumn(Column column) {
        add(column);
        return this;
    }

    @Override
    public TableEditor addColumns(Iterable<Column> columns) {
        columns.forEach(this::add);
        assert positionsAreValid();
        return this;
    }

    protected void add(Column defn) {
        if (defn != null) {
            Column existing = columnWithName(defn.name());
            int position = existing != null ? existing.position() : sortedColumns.size() + 1;
            sortedColumns.put(key(defn.name()), defn.edit().position(position).create());
        }
        assert positionsAreValid();
    }

    @Override
    public TableEditor updateColumn(Column column) {
        if (!hasColumnWithName(column.name())) {
            throw new IllegalArgumentException("No column with name '" + column.name() + "'");
        }
        add(column);
        return this;
    }

    @Override
    public TableEditor removeColumn(String columnName) {
        Column existing = sortedColumns.remove(key(columnName));
        if (existing != null) {
            updatePositions();
            updatePrimaryKeys();
        }
        assert positionsAreValid();
        return this;
    }

    protected void updatePrimaryKeys() {
        Iterator<String> nameIter = pkColumnNames.iterator();
        while (nameIter.hasNext()) {
            if (!hasColumnWithName(nameIter.next())) {
                nameIter.remove();
            }
        }
    }

    @Override
    public TableEditor renameColumn(String existingName, String newName) {
        final Column existing = columnWithName(existingName);
        if (existing == null) {
            throw new IllegalArgumentException("No column with name '" + existingName + "'");
        }
        Column newColumn = existing.edit().name(newName).create();
        // Rebuild the map so the renamed column keeps its position
        LinkedHashMap<String, Column> newColumns = new LinkedHashMap<>();
        sortedColumns.forEach((k, defn) -> {
            if (defn == existing) {
                newColumns.put(key(newName), newColumn);
            }
            else {
                newColumns.put(k, defn);
            }
        });
        sortedColumns = newColumns;
        pkColumnNames.replaceAll(name -> name.equalsIgnoreCase(existingName) ? newName : name);
        return this;
    }

    @Override
    public TableEditor setPrimaryKeyNames(List<String> pkColumnNames) {
        for (String pkColumnName : pkColumnNames) {
            if (!hasColumnWithName(pkColumnName)) {
                throw new IllegalArgumentException("The primary key cannot reference a non-existent column '" + pkColumnName + "'");
            }
        }
        this.pkColumnNames.clear();
        this.pkColumnNames.addAll(pkColumnNames);
        return this;
    }

    @Override
    public TableEditor addConstraint(Constraint constraint) {
        switch (constraint.kind()) {
            case PRIMARY_KEY:
                setPrimaryKeyNames(((Constraint.PrimaryKey) constraint).columns());
                break;
            case CHECK:
                checks.add((Constraint.Check) constraint);
                break;
            case UNIQUE:
                List<String> uniqueColumns = ((Constraint.Unique) constraint).columns();
                if (uniqueColumns.size() == 1 && hasColumnWithName(uniqueColumns.get(0))) {
                    add(columnWithName(uniqueColumns.get(0)).edit().unique(true).create());
                }
                break;
            case FOREIGN_KEY:
                Constraint.ForeignKey foreignKey = (Constraint.ForeignKey) constraint;
                for (int i = 0; i != foreignKey.columns().size(); ++i) {
                    Column local = columnWithName(foreignKey.columns().get(i));
                    if (local != null) {
                        add(local.edit().references(foreignKey.referenceFor(i)).create());
                    }
                }
                break;
            default:
                break;
        }
        constraints.add(constraint);
        return this;
    }

    @Override
    public TableEditor removeConstraint(String constraintName) {
        constraints.removeIf(c -> constraintName.equalsIgnoreCase(c.name()));
        checks.removeIf(c -> constraintName.equalsIgnoreCase(c.name()));
        return this;
    }

    @Override
    public TableEditor addIndex(Index index) {
        indexes.add(index);
        return this;
    }

    @Override
    public TableEditor addAlteration(AlterAction action) {
        alterations.add(action);
        return this;
    }

    @Override
    public TableEditor addPartitionedByColumn(Column column) {
        partitionedBy.add(column.edit().position(partitionedBy.size() + 1).create());
        return this;
    }

    @Override
    public TableEditor partitionBy(PartitionSpec partitionSpec) {
        this.partitionBy = partitionSpec;
        return this;
    }

    @Override
    public TableEditor tablespace(String tablespace) {
        this.tablespace = tablespace;
        return this;
    }

    @Override
    public TableEditor comment(String comment) {
        this.comment = comment;
        return this;
    }

    @Override
    public TableEditor like(TableId source) {
        this.like = source;
        return this;
    }

    @Override
    public TableEditor ifNotExists(boolean ifNotExists) {
        this.ifNotExists = ifNotExists;
        return this;
    }

    @Override
    public TableEditor replace(boolean replace) {
        this.replace = replace;
        return this;
    }

    @Override
    public TableEditor temporary(boolean temporary) {
        this.temporary = temporary;
        return this;
    }

    @Override
    public TableEditor tableOption(String name, String value) {
        tableOptions.put(name.toUpperCase(Locale.ROOT), value);
        return this;
    }

    @Override
    public HqlProperties.Builder hql() {
        return hql;
    }

    List<Constraint.Check> checks() {
        return checks;
    }

    List<Constraint> constraints() {
        return constraints;
    }

    List<Index> indexes() {
        return indexes;
    }

    List<AlterAction> alterations() {
        return alterations;
    }

    List<Column> partitionedBy() {
        return partitionedBy;
    }

    PartitionSpec partitionBy() {
        return partitionBy;
    }

    String tablespace() {
        return tablespace;
    }

    String comment() {
        return comment;
    }

    @Override
    public TableId like() {
        return like;
    }

    boolean ifNotExists() {
        return ifNotExists;
    }

    boolean replace() {
        return replace;
    }

    boolean temporary() {
        return temporary;
    }

    Map<String, String> tableOptions() {
        return tableOptions;
    }

    protected void updatePositions() {
        AtomicInteger position = new AtomicInteger(1);
        sortedColumns.replaceAll((name, defn) -> {
            int nextPosition = position.getAndIncrement();
            if (defn.position() != nextPosition) {
                return defn.edit().position(nextPosition).create();
            }
            return defn;
        });
    }

    protected boolean positionsAreValid() {
        AtomicInteger position = new AtomicInteger(1);
        return sortedColumns.values().stream().allMatch(defn -> defn.position() == position.getAndIncrement());
    }

    @Override
    public String toString() {
        return create().toString();
    }

    @Override
    public Table create() {
        if (id == null) {
            throw new IllegalStateException("Unable to create a table from an editor that has no table ID");
        }
        List<Column> columns = new ArrayList<>();
        for (Column column : sortedColumns.values()) {
            boolean inKey = pkColumnNames.stream().anyMatch(name -> name.equalsIgnoreCase(column.name()));
            columns.add(inKey != column.isPrimaryKey() ? column.edit().primaryKey(inKey).create() : column);
        }
        return new TableImpl(this, columns);
    }
}
