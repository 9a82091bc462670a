/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.util.Strings;

/**
 * An immutable representation of a configuration, keyed by {@link Field} names.
 */
@Immutable
public interface Configuration {

    /**
     * The basic interface for configuration builders.
     */
    interface Builder {

        /**
         * Associate the given value with the specified key.
         *
         * @param key the key
         * @param value the value
         * @return this builder object so methods can be chained together; never null
         */
        Builder with(String key, String value);

        default Builder with(Field field, String value) {
            return with(field.name(), value);
        }

        default Builder with(Field field, boolean value) {
            return with(field.name(), Boolean.toString(value));
        }

        default Builder with(Field field, EnumeratedValue value) {
            return with(field.name(), value.getValue());
        }

        /**
         * Add all of the fields in the supplied Configuration object.
         *
         * @param other the configuration whose fields should be added; may not be null
         * @return this builder object so methods can be chained together; never null
         */
        default Builder with(Configuration other) {
            other.keys().forEach(key -> with(key, other.getString(key)));
            return this;
        }

        /**
         * @return the immutable configuration; never null
         */
        Configuration build();
    }

    /**
     * Obtain a builder that will create a new immutable configuration.
     *
     * @return the new builder; never null
     */
    static Builder create() {
        Map<String, String> values = new HashMap<>();
        return new Builder() {
            @Override
            public Builder with(String key, String value) {
                if (value == null) {
                    values.remove(key);
                }
                else {
                    values.put(key, value);
                }
                return this;
            }

            @Override
            public Configuration build() {
                return from(values);
            }

            @Override
            public String toString() {
                return values.toString();
            }
        };
    }

    /**
     * Obtain an empty configuration.
     *
     * @return an empty configuration; never null
     */
    static Configuration empty() {
        return from(Collections.emptyMap());
    }

    /**
     * Obtain a configuration instance by copying the supplied map of string keys and string values.
     *
     * @param properties the properties; may not be null
     * @return the configuration; never null
     */
    static Configuration from(Map<String, String> properties) {
        Map<String, String> copy = Collections.unmodifiableMap(new HashMap<>(properties));
        return new Configuration() {
            @Override
            public String getString(String key) {
                return copy.get(key);
            }

            @Override
            public Set<String> keys() {
                return copy.keySet();
            }

            @Override
            public String toString() {
                return copy.toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object.
     *
     * @param properties the properties; may not be null
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        Map<String, String> values = new HashMap<>();
        properties.stringPropertyNames().forEach(key -> values.put(key, properties.getProperty(key)));
        return from(values);
    }

    /**
     * Read a configuration from a stream in {@link Properties} format.
     *
     * @param stream the stream; may not be null
     * @return the configuration; never null
     * @throws IOException if there is an error reading the stream
     */
    static Configuration load(InputStream stream) throws IOException {
        try {
            Properties properties = new Properties();
            properties.load(stream);
            return from(properties);
        }
        finally {
            stream.close();
        }
    }

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or there is no such key-value pair in the configuration
     */
    String getString(String key);

    /**
     * @return the keys of this configuration; never null
     */
    Set<String> keys();

    /**
     * Get the string value of the field, falling back to its default.
     *
     * @param field the field; may not be null
     * @return the value, or null if the field has no value and no default
     */
    default String getString(Field field) {
        String value = getString(field.name());
        return value != null ? value : field.defaultValueAsString();
    }

    default boolean getBoolean(Field field) {
        return Strings.asBoolean(getString(field), Boolean.parseBoolean(field.defaultValueAsString()));
    }

    default boolean hasKey(Field field) {
        return getString(field.name()) != null;
    }

    default Builder edit() {
        return create().with(this);
    }

    /**
     * Validate the supplied fields in this configuration.
     *
     * @param fields the fields; may not be null
     * @param problems the consumer called with each problem; never null
     * @return {@code true} if the value of every field is valid
     */
    default boolean validate(Iterable<Field> fields, Field.ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields, recording each problem as a message.
     *
     * @param fields the fields; may not be null
     * @param problems the consumer called with a message per problem; never null
     * @return {@code true} if the value of every field is valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (field, value, problemMessage) -> {
            if (value == null) {
                problems.accept("The '" + field.name() + "' value is invalid: " + problemMessage);
            }
            else {
                problems.accept("The '" + field.name() + "' value '" + value + "' is invalid: " + problemMessage);
            }
        });
    }
}
