/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.Objects;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.text.ParsingException;
import io.sqlddl.text.Position;

/**
 * A problem found while parsing DDL: an error that made a statement (or the whole input) unusable, or a warning about
 * something that was skipped or could not be resolved.
 */
@Immutable
public final class DdlProblem {

    public enum Type {
        /**
         * An unterminated quote, bracket identifier or block comment. Nothing after it can be tokenized, so the whole
         * parse fails.
         */
        LEX_ERROR(true),
        /**
         * A statement that cannot be classified or that lacks a required clause. Only that statement is lost.
         */
        STRUCTURAL_ERROR(true),
        /**
         * A clause that was not recognized and has been skipped.
         */
        UNKNOWN_CLAUSE(false),
        /**
         * An {@code ALTER TABLE} or {@code CREATE INDEX} naming a table not created earlier in the same input.
         */
        UNRESOLVED_ALTER_TARGET(false);

        private final boolean fatal;

        Type(boolean fatal) {
            this.fatal = fatal;
        }

        public boolean isFatal() {
            return fatal;
        }
    }

    private final Type type;
    private final int statementIndex;
    private final Position position;
    private final String message;
    private final String offendingText;

    public DdlProblem(Type type, int statementIndex, Position position, String message, String offendingText) {
        this.type = Objects.requireNonNull(type, "type");
        this.statementIndex = statementIndex;
        this.position = position != null ? position : Position.EMPTY_CONTENT_POSITION;
        this.message = message;
        this.offendingText = offendingText;
    }

    public Type type() {
        return type;
    }

    /**
     * @return the zero-based index of the statement within the input
     */
    public int statementIndex() {
        return statementIndex;
    }

    public Position position() {
        return position;
    }

    public String message() {
        return message;
    }

    /**
     * @return the text that caused the problem; may be null
     */
    public String offendingText() {
        return offendingText;
    }

    public boolean isFatal() {
        return type.isFatal();
    }

    /**
     * @return an exception describing this problem; never null
     */
    public ParsingException toException() {
        return new ParsingException(position, "Statement " + statementIndex + ": " + message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type).append(" in statement ").append(statementIndex).append(" at ").append(position.describe()).append(": ").append(message);
        if (offendingText != null) {
            sb.append(" [").append(offendingText).append(']');
        }
        return sb.toString();
    }
}
