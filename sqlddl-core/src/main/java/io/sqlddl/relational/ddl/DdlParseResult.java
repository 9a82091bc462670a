/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.config.OutputMode;
import io.sqlddl.relational.Statement;
import io.sqlddl.text.MultipleParsingExceptions;
import io.sqlddl.text.ParsingException;

/**
 * The outcome of one parse call: the statements in input order, the records the {@link OutputNormalizer} made of them,
 * and every problem found along the way. The records are a best effort even when the result is {@link #isFailed() failed}.
 */
@Immutable
public final class DdlParseResult {

    private final OutputMode outputMode;
    private final List<Statement> statements;
    private final List<Map<String, Object>> records;
    private final List<DdlProblem> problems;

    DdlParseResult(OutputMode outputMode, List<Statement> statements, List<Map<String, Object>> records, List<DdlProblem> problems) {
        this.outputMode = outputMode;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.problems = Collections.unmodifiableList(new ArrayList<>(problems));
    }

    public OutputMode outputMode() {
        return outputMode;
    }

    /**
     * @return the statements in input order; an {@code ALTER TABLE} or {@code CREATE INDEX} appears here only if its table
     *         was not created earlier in the input
     */
    public List<Statement> statements() {
        return statements;
    }

    /**
     * @return one record per {@link #statements() statement}; never null
     */
    public List<Map<String, Object>> records() {
        return records;
    }

    public List<DdlProblem> problems() {
        return problems;
    }

    public List<DdlProblem> warnings() {
        return problems.stream().filter(p -> !p.isFatal()).collect(Collectors.toList());
    }

    public List<DdlProblem> errors() {
        return problems.stream().filter(DdlProblem::isFatal).collect(Collectors.toList());
    }

    /**
     * Determine whether the call as a whole failed, i.e. whether any statement of the input has a fatal problem. The
     * statements that parsed cleanly are still in {@link #records()}; use {@link #isFailed(int)} to check one of them.
     *
     * @return true if there is at least one error
     */
    public boolean isFailed() {
        return problems.stream().anyMatch(DdlProblem::isFatal);
    }

    /**
     * Determine whether the statement at the given zero-based position in the input failed. A statement fails when it
     * has a fatal problem of its own, or when it begins at or after a lexical error and so was never parsed.
     *
     * @param statementIndex the zero-based index of the statement within the input, counting failed statements
     * @return true if that statement contributed no record because of an error
     */
    public boolean isFailed(int statementIndex) {
        return problems.stream().anyMatch(p -> p.isFatal()
                && (p.statementIndex() == statementIndex
                        || (p.type() == DdlProblem.Type.LEX_ERROR && p.statementIndex() < statementIndex)));
    }

    /**
     * Regroup the records by statement kind under the keys {@code tables}, {@code sequences}, {@code schemas},
     * {@code alters} and {@code indexes}. Every key is present, possibly with an empty list.
     *
     * @return the grouped records; never null
     */
    public Map<String, List<Map<String, Object>>> recordsGroupedByType() {
        Map<String, List<Map<String, Object>>> grouped = new LinkedHashMap<>();
        for (Statement.Kind kind : Statement.Kind.values()) {
            grouped.put(groupName(kind), new ArrayList<>());
        }
        for (int i = 0; i != statements.size(); ++i) {
            grouped.get(groupName(statements.get(i).kind())).add(records.get(i));
        }
        return grouped;
    }

    private static String groupName(Statement.Kind kind) {
        switch (kind) {
            case CREATE_TABLE:
                return "tables";
            case CREATE_SEQUENCE:
                return "sequences";
            case CREATE_SCHEMA:
                return "schemas";
            case ALTER_TABLE:
                return "alters";
            case CREATE_INDEX:
                return "indexes";
            default:
                throw new IllegalStateException("Unknown statement kind " + kind);
        }
    }

    /**
     * Throw if any fatal problem was found.
     *
     * @return this result, for chaining
     * @throws MultipleParsingExceptions with one exception per fatal problem
     */
    public DdlParseResult throwIfFailed() {
        if (isFailed()) {
            List<ParsingException> exceptions = errors().stream().map(DdlProblem::toException).collect(Collectors.toList());
            throw new MultipleParsingExceptions(exceptions);
        }
        return this;
    }

    @Override
    public String toString() {
        return "DdlParseResult{statements=" + statements.size() + ", problems=" + problems + "}";
    }
}
