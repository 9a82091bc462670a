/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sqlddl.annotation.NotThreadSafe;
import io.sqlddl.relational.AlterAction;
import io.sqlddl.relational.AlterTable;
import io.sqlddl.relational.Index;
import io.sqlddl.relational.Statement;
import io.sqlddl.relational.Table;
import io.sqlddl.relational.TableId;
import io.sqlddl.relational.Tables;
import io.sqlddl.text.Position;

/**
 * The state of one parse call: the statements built so far, the tables they define, and the problems found. A context
 * is created for every call and never shared, so a parser holding no other state can be used from many threads.
 */
@NotThreadSafe
final class ParseContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParseContext.class);

    private final String input;
    private final Tables tables = new Tables();
    private final List<Statement> statements = new ArrayList<>();
    private final Map<TableId, Integer> statementIndexByTableId = new HashMap<>();
    private final List<DdlProblem> problems = new ArrayList<>();

    ParseContext(String input) {
        this.input = input;
    }

    String input() {
        return input;
    }

    List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    List<DdlProblem> problems() {
        return Collections.unmodifiableList(problems);
    }

    Tables tables() {
        return tables;
    }

    void addStatement(Statement statement) {
        statements.add(statement);
    }

    /**
     * Record a newly created table. A later table with the same name replaces the earlier one as the target of
     * {@code ALTER TABLE} and {@code CREATE INDEX}, but both are reported.
     */
    void addTable(Table table) {
        tables.overwriteTable(table);
        statementIndexByTableId.put(table.id().toLowercase(), statements.size());
        statements.add(table);
    }

    /**
     * Merge an {@code ALTER TABLE} into the table it names, or report it on its own when that table is unknown.
     *
     * @throws IllegalArgumentException if an action cannot be applied to the table; the table is then left unchanged
     */
    void alterTable(AlterTable alter, int statementIndex, Position position) {
        Table updated = tables.updateTable(alter.tableId(), editor -> {
            for (AlterAction action : alter.actions()) {
                action.applyTo(editor);
                editor.addAlteration(action);
            }
        });
        if (updated != null) {
            replaceTable(updated);
            return;
        }
        statements.add(alter);
        unresolved(statementIndex, position, "ALTER TABLE", alter.tableId());
    }

    /**
     * Merge a {@code CREATE INDEX} into the table it names, or report it on its own when that table is unknown.
     */
    void addIndex(Index index, int statementIndex, Position position) {
        Table updated = tables.updateTable(index.tableId(), editor -> editor.addIndex(index));
        if (updated != null) {
            replaceTable(updated);
            return;
        }
        statements.add(index);
        unresolved(statementIndex, position, "CREATE INDEX", index.tableId());
    }

    private void replaceTable(Table updated) {
        Integer index = statementIndexByTableId.get(updated.id().toLowercase());
        statements.set(index, updated);
    }

    private void unresolved(int statementIndex, Position position, String what, TableId tableId) {
        LOGGER.debug("{} in statement {} targets table '{}' which was not created earlier", what, statementIndex, tableId);
        problems.add(new DdlProblem(DdlProblem.Type.UNRESOLVED_ALTER_TARGET, statementIndex, position,
                what + " targets table '" + tableId + "' which was not created earlier in the input", tableId.toString()));
    }

    void unknownClause(int statementIndex, Position position, String text) {
        LOGGER.debug("Skipping unknown clause in statement {}: {}", statementIndex, text);
        problems.add(new DdlProblem(DdlProblem.Type.UNKNOWN_CLAUSE, statementIndex, position, "Skipped unknown clause", text));
    }

    void structuralError(int statementIndex, Position position, String message, String text) {
        problems.add(new DdlProblem(DdlProblem.Type.STRUCTURAL_ERROR, statementIndex, position, message, text));
    }

    void lexError(int statementIndex, Position position, String message, String text) {
        problems.add(new DdlProblem(DdlProblem.Type.LEX_ERROR, statementIndex, position, message, text));
    }
}
