/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.text;

import io.sqlddl.annotation.Immutable;

/**
 * The location of a character within DDL text, expressed both as an offset and as a line and column.
 */
@Immutable
public final class Position {

    /**
     * The position used when there is no content at all.
     */
    public static final Position EMPTY_CONTENT_POSITION = new Position(-1, 1, 0);

    private final int indexInContent;
    private final int line;
    private final int column;

    public Position(int indexInContent, int line, int column) {
        this.indexInContent = indexInContent < 0 ? -1 : indexInContent;
        this.line = line;
        this.column = column;
        assert this.line > 0;
        assert this.column >= 0;
    }

    /**
     * Get the 0-based offset of the character within the content.
     *
     * @return the offset; negative only for {@link #EMPTY_CONTENT_POSITION}
     */
    public int index() {
        return indexInContent;
    }

    /**
     * @return the 1-based line number
     */
    public int line() {
        return line;
    }

    /**
     * @return the 1-based column number
     */
    public int column() {
        return column;
    }

    @Override
    public int hashCode() {
        return indexInContent;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Position) {
            Position that = (Position) obj;
            return this.indexInContent == that.indexInContent && this.line == that.line && this.column == that.column;
        }
        return false;
    }

    /**
     * Human readable form used in diagnostics, e.g. {@code "line 3, column 14 (offset 52)"}.
     *
     * @return the description; never null
     */
    public String describe() {
        return "line " + line + ", column " + column + " (offset " + indexInContent + ")";
    }

    @Override
    public String toString() {
        return "" + indexInContent + ':' + line + ':' + column;
    }
}
