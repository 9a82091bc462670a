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
 * An {@code ALTER TABLE} statement. When the target table was created earlier in the same input, the actions are merged
 * into that table and this statement is not reported on its own.
 */
@Immutable
public final class AlterTable implements Statement {

    private final TableId tableId;
    private final boolean ifExists;
    private final List<AlterAction> actions;

    public AlterTable(TableId tableId, boolean ifExists, List<AlterAction> actions) {
        this.tableId = Objects.requireNonNull(tableId, "tableId");
        this.ifExists = ifExists;
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    }

    @Override
    public Kind kind() {
        return Kind.ALTER_TABLE;
    }

    public TableId tableId() {
        return tableId;
    }

    public boolean ifExists() {
        return ifExists;
    }

    public List<AlterAction> actions() {
        return actions;
    }

    @Override
    public String toString() {
        return "ALTER TABLE " + tableId + " " + actions;
    }
}
