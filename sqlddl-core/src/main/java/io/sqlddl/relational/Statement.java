/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

/**
 * A parsed DDL statement.
 */
public interface Statement {

    /**
     * The kinds of statements the parser understands.
     */
    enum Kind {
        CREATE_TABLE,
        ALTER_TABLE,
        CREATE_INDEX,
        CREATE_SEQUENCE,
        CREATE_SCHEMA
    }

    Kind kind();
}
