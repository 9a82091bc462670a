/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.util;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;

import io.sqlddl.annotation.ThreadSafe;

/**
 * String-related utility methods.
 */
@ThreadSafe
public final class Strings {

    private Strings() {
    }

    /**
     * Join the supplied values with the delimiter. {@code null} values are ignored.
     *
     * @param delimiter the delimiter that separates each element
     * @param values the values to join together
     * @return the joined string; never null
     */
    public static <T> String join(CharSequence delimiter, Iterable<T> values) {
        return join(delimiter, values, v -> v != null ? v.toString() : null);
    }

    /**
     * Join the converted values with the delimiter.
     *
     * @param delimiter the delimiter that separates each element
     * @param values the values to join together
     * @param conversion converts each value, returning {@code null} if the value is to be excluded
     * @return the joined string; never null
     */
    public static <T> String join(CharSequence delimiter, Iterable<T> values, Function<T, String> conversion) {
        Objects.requireNonNull(delimiter);
        Objects.requireNonNull(values);
        StringBuilder sb = new StringBuilder();
        Iterator<T> iter = values.iterator();
        boolean delimit = false;
        while (iter.hasNext()) {
            String next = conversion.apply(iter.next());
            if (next != null) {
                if (delimit) {
                    sb.append(delimiter);
                }
                sb.append(next);
                delimit = true;
            }
        }
        return sb.toString();
    }

    /**
     * Parse the supplied string as an integer value.
     *
     * @param value the string representation of an integer value
     * @param defaultValue the value to return if the string value is null or cannot be parsed as an int
     * @return the int value
     */
    public static int asInt(String value, int defaultValue) {
        Long result = asLong(value);
        return result != null && result >= Integer.MIN_VALUE && result <= Integer.MAX_VALUE ? result.intValue() : defaultValue;
    }

    /**
     * Parse the supplied string as a long value.
     *
     * @param value the string representation of a long value, optionally signed
     * @return the long value, or null if the string is null or not a long
     */
    public static Long asLong(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        }
        catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parse the supplied string as a boolean value.
     *
     * @param value the string representation of a boolean value
     * @param defaultValue the value to return if the string value is null or blank
     * @return the boolean value
     */
    public static boolean asBoolean(String value, boolean defaultValue) {
        if (isNullOrBlank(value)) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public static boolean isNullOrEmpty(String str) {
        return str == null || str.isEmpty();
    }

    public static boolean isNullOrBlank(String str) {
        return str == null || str.trim().isEmpty();
    }

    /**
     * Check if the string contains only digits.
     *
     * @param str the string to check
     * @return {@code true} if it is non-empty and only contains digits
     */
    public static boolean isNumeric(String str) {
        if (isNullOrEmpty(str)) {
            return false;
        }
        for (int i = 0; i < str.length(); i++) {
            if (!Character.isDigit(str.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
