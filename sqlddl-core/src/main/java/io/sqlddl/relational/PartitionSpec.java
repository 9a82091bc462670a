/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.sqlddl.annotation.Immutable;

/**
 * A {@code PARTITION BY type (columns)} clause of PostgreSQL or MySQL.
 */
@Immutable
public final class PartitionSpec {

    private final String type;
    private final List<String> columns;

    public PartitionSpec(String type, List<String> columns) {
        this.type = type;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    /**
     * @return the partitioning method such as {@code RANGE}, {@code LIST} or {@code HASH}; may be null
     */
    public String type() {
        return type;
    }

    public List<String> columns() {
        return columns;
    }

    @Override
    public String toString() {
        return "PARTITION BY " + type + " " + columns;
    }
}
