/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.util.Strings;

/**
 * A data type as a tree: a (possibly multi-word) name with optional parameters such as length and scale, type arguments
 * such as those of {@code ARRAY<INT>} and {@code MAP<STRING,INT>}, the named fields of a {@code STRUCT}, a suffix such as
 * {@code WITH TIME ZONE}, and array dimensions.
 * <p>
 * The {@link #expression() canonical expression} contains no whitespace inside angle brackets and keeps the names and
 * casing as written, e.g. {@code struct<street:string,city:string>}.
 */
@Immutable
public final class DataType {

    /**
     * A named field of a {@code STRUCT} type.
     */
    @Immutable
    public static final class StructField {
        private final String name;
        private final DataType type;

        public StructField(String name, DataType type) {
            this.name = name;
            this.type = type;
        }

        public String name() {
            return name;
        }

        public DataType type() {
            return type;
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof StructField) {
                StructField that = (StructField) obj;
                return this.name.equals(that.name) && this.type.equals(that.type);
            }
            return false;
        }

        @Override
        public String toString() {
            return name + ":" + type.expression();
        }
    }

    private final String name;
    private final List<String> parameters;
    private final List<DataType> typeArguments;
    private final List<StructField> fields;
    private final String suffix;
    private final List<String> arrayDimensions;

    public DataType(String name, List<String> parameters, List<DataType> typeArguments, List<StructField> fields, String suffix,
                    List<String> arrayDimensions) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = immutable(parameters);
        this.typeArguments = immutable(typeArguments);
        this.fields = immutable(fields);
        this.suffix = Strings.isNullOrBlank(suffix) ? null : suffix;
        this.arrayDimensions = immutable(arrayDimensions);
    }

    /**
     * Create a simple type with a name only.
     *
     * @param name the name; may not be null
     * @return the type; never null
     */
    public static DataType named(String name) {
        return new DataType(name, null, null, null, null, null);
    }

    private static <T> List<T> immutable(List<T> values) {
        return values == null || values.isEmpty() ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public String name() {
        return name;
    }

    /**
     * @return the parameters in parentheses, e.g. {@code ["10", "2"]} for {@code DECIMAL(10,2)}; never null
     */
    public List<String> parameters() {
        return parameters;
    }

    public List<DataType> typeArguments() {
        return typeArguments;
    }

    public List<StructField> fields() {
        return fields;
    }

    /**
     * @return the words following the parameters, such as {@code WITH TIME ZONE} or {@code UNSIGNED}; may be null
     */
    public String suffix() {
        return suffix;
    }

    /**
     * @return one entry per array dimension, either empty or the declared cardinality; never null
     */
    public List<String> arrayDimensions() {
        return arrayDimensions;
    }

    public boolean isArray() {
        return !arrayDimensions.isEmpty();
    }

    /**
     * Whether the parameters are a length or a precision and scale. Array types never have one, because array
     * cardinality is not a length.
     * <p>
     * A parameter too large for an {@code int} is not a size; the type then keeps it in its {@link #typeName() name}.
     *
     * @return true if there are one or two parameters, all non-negative {@code int} values, and the type is not an array
     */
    public boolean hasSize() {
        if (isArray() || parameters.isEmpty() || parameters.size() > 2) {
            return false;
        }
        return parameters.stream().allMatch(DataType::isIntValue);
    }

    private static boolean isIntValue(String parameter) {
        if (!Strings.isNumeric(parameter)) {
            return false;
        }
        Long value = Strings.asLong(parameter);
        return value != null && value <= Integer.MAX_VALUE;
    }

    /**
     * @return the length or precision, or null if the type has no {@link #hasSize() size}
     */
    public Integer length() {
        return hasSize() ? Integer.valueOf(parameters.get(0)) : null;
    }

    /**
     * @return the scale, or null if the type has no {@link #hasSize() size} or only a length
     */
    public Integer scale() {
        return hasSize() && parameters.size() == 2 ? Integer.valueOf(parameters.get(1)) : null;
    }

    /**
     * @return the canonical expression of the complete type; never null
     */
    public String expression() {
        return render(true);
    }

    /**
     * @return the canonical expression without the size when the type has one, e.g. {@code VARCHAR} for
     *         {@code VARCHAR(50)}; otherwise the same as {@link #expression()}
     */
    public String typeName() {
        return render(!hasSize());
    }

    private String render(boolean withParameters) {
        StringBuilder sb = new StringBuilder(name);
        if (withParameters && !parameters.isEmpty()) {
            sb.append('(').append(String.join(",", parameters)).append(')');
        }
        if (!fields.isEmpty()) {
            sb.append('<').append(Strings.join(",", fields)).append('>');
        }
        else if (!typeArguments.isEmpty()) {
            sb.append('<').append(Strings.join(",", typeArguments, DataType::expression)).append('>');
        }
        if (suffix != null) {
            sb.append(' ').append(suffix);
        }
        for (String dimension : arrayDimensions) {
            sb.append('[').append(dimension).append(']');
        }
        return sb.toString();
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
        if (obj instanceof DataType) {
            DataType that = (DataType) obj;
            return this.name.equals(that.name)
                    && this.parameters.equals(that.parameters)
                    && this.typeArguments.equals(that.typeArguments)
                    && this.fields.equals(that.fields)
                    && Objects.equals(this.suffix, that.suffix)
                    && this.arrayDimensions.equals(that.arrayDimensions);
        }
        return false;
    }

    @Override
    public String toString() {
        return expression();
    }
}
