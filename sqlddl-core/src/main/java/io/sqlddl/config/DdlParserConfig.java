/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.config;

import io.sqlddl.annotation.Immutable;

/**
 * The configuration options of a DDL parser and their typed accessors.
 */
@Immutable
public class DdlParserConfig {

    public static final Field OUTPUT_MODE = Field.create("output.mode")
            .withDisplayName("Output mode")
            .withEnum(OutputMode.class, OutputMode.SQL)
            .withDescription("Which dialect-specific keys the produced records expose. "
                    + "'sql' (the default) omits the Hive-only keys; "
                    + "'hql' always includes them, using null when the clause was absent.");

    public static final Field GROUP_BY_TYPE = Field.create("group.by.type")
            .withDisplayName("Group records by type")
            .withDefault(false)
            .withValidation(Field::isBoolean)
            .withDescription("Whether records are regrouped into lists of tables, sequences, schemas and so on.");

    public static final Field FAIL_ON_ERROR = Field.create("fail.on.error")
            .withDisplayName("Fail on error")
            .withDefault(false)
            .withValidation(Field::isBoolean)
            .withDescription("Whether a parse call that found a lexical or structural error throws instead of "
                    + "returning a result marked as failed.");

    public static final Field.Set ALL_FIELDS = Field.setOf(OUTPUT_MODE, GROUP_BY_TYPE, FAIL_ON_ERROR);

    private final Configuration config;

    public DdlParserConfig(Configuration config) {
        this.config = config;
    }

    /**
     * @return the default configuration
     */
    public static DdlParserConfig defaults() {
        return new DdlParserConfig(Configuration.empty());
    }

    public OutputMode getOutputMode() {
        return OutputMode.parse(config.getString(OUTPUT_MODE), OUTPUT_MODE.defaultValueAsString());
    }

    public boolean isGroupByType() {
        return config.getBoolean(GROUP_BY_TYPE);
    }

    public boolean isFailOnError() {
        return config.getBoolean(FAIL_ON_ERROR);
    }

    public Configuration getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return config.toString();
    }
}
