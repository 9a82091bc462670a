/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.sqlddl.annotation.Immutable;

/**
 * A schema from {@code CREATE SCHEMA} or {@code CREATE DATABASE}.
 */
@Immutable
public final class SchemaDefinition implements Statement {

    private final String name;
    private final boolean database;
    private final boolean ifNotExists;
    private final String authorization;
    private final Map<String, String> properties;

    public SchemaDefinition(String name, boolean database, boolean ifNotExists, String authorization, Map<String, String> properties) {
        this.name = Objects.requireNonNull(name, "name");
        this.database = database;
        this.ifNotExists = ifNotExists;
        this.authorization = authorization;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    @Override
    public Kind kind() {
        return Kind.CREATE_SCHEMA;
    }

    public String name() {
        return name;
    }

    /**
     * @return true if the statement was {@code CREATE DATABASE}
     */
    public boolean isDatabase() {
        return database;
    }

    public boolean ifNotExists() {
        return ifNotExists;
    }

    public String authorization() {
        return authorization;
    }

    /**
     * @return options such as MySQL's {@code CHARACTER SET} or Hive's {@code LOCATION}; never null
     */
    public Map<String, String> properties() {
        return properties;
    }

    @Override
    public String toString() {
        return (database ? "DATABASE " : "SCHEMA ") + name;
    }
}
