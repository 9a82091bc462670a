/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.config;

/**
 * A configuration option with a fixed set of possible values, i.e. an enum. Implemented by every enum used as the value
 * of a {@link Field}.
 */
public interface EnumeratedValue {

    /**
     * @return the string representation of this value, as it appears in a {@link Configuration}
     */
    String getValue();
}
