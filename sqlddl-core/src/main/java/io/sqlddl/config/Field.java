/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.util.Strings;

/**
 * An immutable definition of a field that may appear within a {@link Configuration} instance.
 */
@Immutable
public final class Field {

    /**
     * A functional interface that accepts validation results.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        /**
         * Accept a problem with the given value for the field.
         *
         * @param field the field; never null
         * @param value the value that is not valid
         * @param problemMessage the message describing the problem; never null
         */
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * A functional interface that can be used to validate field values.
     */
    @FunctionalInterface
    public interface Validator {
        /**
         * Validate the supplied value for the field, and report any problems to the designated consumer.
         *
         * @param config the configuration containing the field to be validated; may not be null
         * @param field the {@link Field} being validated; never null
         * @param problems the consumer to be called with each problem; never null
         * @return the number of problems that were found, or 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);
    }

    /**
     * An immutable set of {@link Field}s, iterated in the order they were added.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {
        private final Map<String, Field> fieldsByName;

        private Set(Iterable<Field> fields) {
            Map<String, Field> byName = new LinkedHashMap<>();
            fields.forEach(field -> byName.put(field.name(), field));
            this.fieldsByName = Collections.unmodifiableMap(byName);
        }

        public Field fieldWithName(String name) {
            return fieldsByName.get(name);
        }

        @Override
        public Iterator<Field> iterator() {
            return fieldsByName.values().iterator();
        }

        public java.util.Set<String> allFieldNames() {
            return fieldsByName.keySet();
        }
    }

    public static Set setOf(Field... fields) {
        return new Set(Arrays.asList(fields));
    }

    /**
     * Create an immutable {@link Field} instance with the given property name.
     *
     * @param name the name of the field; may not be null
     * @return the field; never null
     */
    public static Field create(String name) {
        return new Field(name, null, null, null, null);
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final String defaultValue;
    private final Validator validator;

    private Field(String name, String displayName, String description, String defaultValue, Validator validator) {
        Objects.requireNonNull(name, "The field name is required");
        this.name = name;
        this.displayName = displayName != null ? displayName : name;
        this.description = description != null ? description : "";
        this.defaultValue = defaultValue;
        this.validator = validator;
    }

    public String name() {
        return name;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    /**
     * @return the string form of the default value, or {@code null} if there is none
     */
    public String defaultValueAsString() {
        return defaultValue;
    }

    public Validator validator() {
        return validator;
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, description, defaultValue, validator);
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, description, defaultValue, validator);
    }

    public Field withDefault(String defaultValue) {
        return new Field(name, displayName, description, defaultValue, validator);
    }

    public Field withDefault(boolean defaultValue) {
        return withDefault(Boolean.toString(defaultValue));
    }

    /**
     * Restrict the values of this field to the constants of an enum, using the first constant as the default.
     *
     * @param enumType the enum type; may not be null
     * @return the new field; never null
     */
    public <T extends Enum<T> & EnumeratedValue> Field withEnum(Class<T> enumType) {
        T[] constants = enumType.getEnumConstants();
        return withEnum(enumType, constants[0]);
    }

    public <T extends Enum<T> & EnumeratedValue> Field withEnum(Class<T> enumType, T defaultOption) {
        String allowed = Arrays.stream(enumType.getEnumConstants()).map(EnumeratedValue::getValue).collect(Collectors.joining(", "));
        Validator enumValidator = (config, field, problems) -> {
            String value = config.getString(field);
            for (T option : enumType.getEnumConstants()) {
                if (option.getValue().equalsIgnoreCase(value.trim())) {
                    return 0;
                }
            }
            problems.accept(field, value, "Value must be one of " + allowed);
            return 1;
        };
        return withDefault(defaultOption.getValue()).withValidation(enumValidator);
    }

    /**
     * Add validators to this field, which run after any existing validator.
     *
     * @param validators the validators; may not be null
     * @return the new field; never null
     */
    public Field withValidation(Validator... validators) {
        Validator combined = validator;
        for (Validator next : validators) {
            Validator previous = combined;
            combined = previous == null ? next : (config, field, problems) -> previous.validate(config, field, problems)
                    + next.validate(config, field, problems);
        }
        return new Field(name, displayName, description, defaultValue, combined);
    }

    /**
     * Validate the value of this field in the supplied configuration.
     *
     * @param config the configuration; may not be null
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        return validator == null || validator.validate(config, this, problems) == 0;
    }

    /**
     * Validator accepting only {@code true} or {@code false}, ignoring case.
     */
    public static int isBoolean(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null || "true".equalsIgnoreCase(value.trim()) || "false".equalsIgnoreCase(value.trim())) {
            return 0;
        }
        problems.accept(field, value, "Either 'true' or 'false' is expected");
        return 1;
    }

    /**
     * Validator accepting any value that is non-blank.
     */
    public static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (!Strings.isNullOrBlank(value)) {
            return 0;
        }
        problems.accept(field, value, "A value is required");
        return 1;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            return this.name.equals(((Field) obj).name);
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}
