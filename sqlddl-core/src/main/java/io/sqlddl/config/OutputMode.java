/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.config;

/**
 * The policy deciding which dialect-specific keys appear in the records produced by a parse call.
 */
public enum OutputMode implements EnumeratedValue {

    /**
     * Plain SQL output; Hive-only keys are omitted.
     */
    SQL("sql"),

    /**
     * Hive output; Hive-only keys are always present, defaulting to null when the clause was absent.
     */
    HQL("hql");

    private final String value;

    OutputMode(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * Determine if the supplied value is one of the predefined options.
     *
     * @param value the configuration property value; may be null
     * @return the matching option, or null if no match is found
     */
    public static OutputMode parse(String value) {
        if (value == null) {
            return null;
        }
        value = value.trim();
        for (OutputMode option : OutputMode.values()) {
            if (option.getValue().equalsIgnoreCase(value)) {
                return option;
            }
        }
        return null;
    }

    /**
     * Determine if the supplied value is one of the predefined options.
     *
     * @param value the configuration property value; may be null
     * @param defaultValue the default value; may be null
     * @return the matching option, or null if neither value matches
     */
    public static OutputMode parse(String value, String defaultValue) {
        OutputMode mode = parse(value);
        if (mode == null && defaultValue != null) {
            mode = parse(defaultValue);
        }
        return mode;
    }
}
