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
import java.util.Map;
import java.util.function.Consumer;

import io.sqlddl.annotation.NotThreadSafe;

/**
 * The tables defined so far while parsing one input. Lookups ignore the case of the schema and table names.
 */
@NotThreadSafe
public final class Tables {

    private final Map<TableId, Table> tablesByTableId = new LinkedHashMap<>();

    /**
     * Get the number of tables that are in this object.
     *
     * @return the table count
     */
    public int size() {
        return tablesByTableId.size();
    }

    /**
     * Add or replace the definition of a table.
     *
     * @param table the definition; may not be null
     * @return the previous definition, or null if there was none
     */
    public Table overwriteTable(Table table) {
        return tablesByTableId.put(table.id().toLowercase(), table);
    }

    /**
     * Obtain the definition of the identified table.
     *
     * @param tableId the identifier of the table
     * @return the table definition, or null if there was no definition for the identified table
     */
    public Table forTable(TableId tableId) {
        return tablesByTableId.get(tableId.toLowercase());
    }

    /**
     * Edit the definition of an existing table and store the result.
     *
     * @param tableId the identifier of the table
     * @param changer the function that changes the definition; may not be null
     * @return the new definition, or null if there is no such table
     */
    public Table updateTable(TableId tableId, Consumer<TableEditor> changer) {
        Table existing = forTable(tableId);
        if (existing == null) {
            return null;
        }
        TableEditor editor = existing.edit();
        changer.accept(editor);
        Table updated = editor.create();
        overwriteTable(updated);
        return updated;
    }

    public List<Table> tables() {
        return Collections.unmodifiableList(new ArrayList<>(tablesByTableId.values()));
    }

    @Override
    public String toString() {
        return "Tables " + tablesByTableId.keySet();
    }
}
