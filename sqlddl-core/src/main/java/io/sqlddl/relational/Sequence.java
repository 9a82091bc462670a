/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.annotation.NotThreadSafe;

/**
 * A sequence from {@code CREATE SEQUENCE}. Every property is independently optional: a null value means the clause did
 * not appear in the source, never that it was zero.
 */
@Immutable
public final class Sequence implements Statement {

    /**
     * Builds a {@link Sequence} clause by clause.
     */
    @NotThreadSafe
    public static final class Builder {
        private String schema;
        private String name;
        private boolean ifNotExists;
        private Long increment;
        private Long start;
        private Long minValue;
        private Long maxValue;
        private Long cache;
        private Boolean cycle;
        private boolean noMinValue;
        private boolean noMaxValue;
        private String dataType;
        private String ownedBy;

        private Builder() {
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder ifNotExists(boolean ifNotExists) {
            this.ifNotExists = ifNotExists;
            return this;
        }

        public Builder increment(long increment) {
            this.increment = increment;
            return this;
        }

        public Builder start(long start) {
            this.start = start;
            return this;
        }

        public Builder minValue(long minValue) {
            this.minValue = minValue;
            this.noMinValue = false;
            return this;
        }

        public Builder noMinValue() {
            this.minValue = null;
            this.noMinValue = true;
            return this;
        }

        public Builder maxValue(long maxValue) {
            this.maxValue = maxValue;
            this.noMaxValue = false;
            return this;
        }

        public Builder noMaxValue() {
            this.maxValue = null;
            this.noMaxValue = true;
            return this;
        }

        public Builder cache(long cache) {
            this.cache = cache;
            return this;
        }

        public Builder cycle(boolean cycle) {
            this.cycle = cycle;
            return this;
        }

        public Builder dataType(String dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder ownedBy(String ownedBy) {
            this.ownedBy = ownedBy;
            return this;
        }

        public Sequence build() {
            if (name == null) {
                throw new IllegalStateException("Unable to create a sequence without a name");
            }
            return new Sequence(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private final String schema;
    private final String name;
    private final boolean ifNotExists;
    private final Long increment;
    private final Long start;
    private final Long minValue;
    private final Long maxValue;
    private final Long cache;
    private final Boolean cycle;
    private final boolean noMinValue;
    private final boolean noMaxValue;
    private final String dataType;
    private final String ownedBy;

    private Sequence(Builder builder) {
        this.schema = builder.schema;
        this.name = builder.name;
        this.ifNotExists = builder.ifNotExists;
        this.increment = builder.increment;
        this.start = builder.start;
        this.minValue = builder.minValue;
        this.maxValue = builder.maxValue;
        this.cache = builder.cache;
        this.cycle = builder.cycle;
        this.noMinValue = builder.noMinValue;
        this.noMaxValue = builder.noMaxValue;
        this.dataType = builder.dataType;
        this.ownedBy = builder.ownedBy;
    }

    @Override
    public Kind kind() {
        return Kind.CREATE_SEQUENCE;
    }

    public String schema() {
        return schema;
    }

    public String name() {
        return name;
    }

    public boolean ifNotExists() {
        return ifNotExists;
    }

    public Long increment() {
        return increment;
    }

    public Long start() {
        return start;
    }

    public Long minValue() {
        return minValue;
    }

    public Long maxValue() {
        return maxValue;
    }

    public Long cache() {
        return cache;
    }

    /**
     * @return true for {@code CYCLE}, false for {@code NO CYCLE}, null if neither appeared
     */
    public Boolean cycle() {
        return cycle;
    }

    public boolean noMinValue() {
        return noMinValue;
    }

    public boolean noMaxValue() {
        return noMaxValue;
    }

    /**
     * @return the type of {@code AS type}, or null
     */
    public String dataType() {
        return dataType;
    }

    /**
     * @return the column of {@code OWNED BY table.column}, or null
     */
    public String ownedBy() {
        return ownedBy;
    }

    @Override
    public String toString() {
        return "SEQUENCE " + (schema != null ? schema + "." : "") + name;
    }
}
