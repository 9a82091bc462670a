/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.annotation.NotThreadSafe;

/**
 * The storage clauses of a Hive table. A table parsed from another dialect has {@link #none() no} Hive properties.
 */
@Immutable
public final class HqlProperties {

    private static final HqlProperties NONE = new Builder().build();

    /**
     * Collects Hive clauses while a table is parsed.
     */
    @NotThreadSafe
    public static final class Builder {
        private boolean external;
        private String storedAs;
        private String location;
        private String rowFormat;
        private String serde;
        private String fieldsTerminatedBy;
        private String collectionItemsTerminatedBy;
        private String mapKeysTerminatedBy;
        private String linesTerminatedBy;
        private final Map<String, String> tblProperties = new LinkedHashMap<>();
        private final List<String> clusteredBy = new ArrayList<>();
        private Integer buckets;

        public Builder() {
        }

        public Builder(HqlProperties existing) {
            this.external = existing.external;
            this.storedAs = existing.storedAs;
            this.location = existing.location;
            this.rowFormat = existing.rowFormat;
            this.serde = existing.serde;
            this.fieldsTerminatedBy = existing.fieldsTerminatedBy;
            this.collectionItemsTerminatedBy = existing.collectionItemsTerminatedBy;
            this.mapKeysTerminatedBy = existing.mapKeysTerminatedBy;
            this.linesTerminatedBy = existing.linesTerminatedBy;
            this.tblProperties.putAll(existing.tblProperties);
            this.clusteredBy.addAll(existing.clusteredBy);
            this.buckets = existing.buckets;
        }

        public Builder external(boolean external) {
            this.external = external;
            return this;
        }

        public Builder storedAs(String storedAs) {
            this.storedAs = storedAs;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder rowFormat(String rowFormat) {
            this.rowFormat = rowFormat;
            return this;
        }

        public Builder serde(String serde) {
            this.serde = serde;
            return this;
        }

        public Builder fieldsTerminatedBy(String terminator) {
            this.fieldsTerminatedBy = terminator;
            return this;
        }

        public Builder collectionItemsTerminatedBy(String terminator) {
            this.collectionItemsTerminatedBy = terminator;
            return this;
        }

        public Builder mapKeysTerminatedBy(String terminator) {
            this.mapKeysTerminatedBy = terminator;
            return this;
        }

        public Builder linesTerminatedBy(String terminator) {
            this.linesTerminatedBy = terminator;
            return this;
        }

        public Builder tblProperty(String key, String value) {
            this.tblProperties.put(key, value);
            return this;
        }

        public Builder clusteredBy(List<String> columns) {
            this.clusteredBy.clear();
            this.clusteredBy.addAll(columns);
            return this;
        }

        public Builder buckets(int buckets) {
            this.buckets = buckets;
            return this;
        }

        public HqlProperties build() {
            return new HqlProperties(this);
        }
    }

    /**
     * @return the properties of a table without any Hive clause; never null
     */
    public static HqlProperties none() {
        return NONE;
    }

    private final boolean external;
    private final String storedAs;
    private final String location;
    private final String rowFormat;
    private final String serde;
    private final String fieldsTerminatedBy;
    private final String collectionItemsTerminatedBy;
    private final String mapKeysTerminatedBy;
    private final String linesTerminatedBy;
    private final Map<String, String> tblProperties;
    private final List<String> clusteredBy;
    private final Integer buckets;

    private HqlProperties(Builder builder) {
        this.external = builder.external;
        this.storedAs = builder.storedAs;
        this.location = builder.location;
        this.rowFormat = builder.rowFormat;
        this.serde = builder.serde;
        this.fieldsTerminatedBy = builder.fieldsTerminatedBy;
        this.collectionItemsTerminatedBy = builder.collectionItemsTerminatedBy;
        this.mapKeysTerminatedBy = builder.mapKeysTerminatedBy;
        this.linesTerminatedBy = builder.linesTerminatedBy;
        this.tblProperties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tblProperties));
        this.clusteredBy = Collections.unmodifiableList(new ArrayList<>(builder.clusteredBy));
        this.buckets = builder.buckets;
    }

    public boolean isExternal() {
        return external;
    }

    public String storedAs() {
        return storedAs;
    }

    public String location() {
        return location;
    }

    /**
     * @return {@code DELIMITED}, {@code SERDE} or null
     */
    public String rowFormat() {
        return rowFormat;
    }

    /**
     * @return the class of {@code ROW FORMAT SERDE 'class'}, or null
     */
    public String serde() {
        return serde;
    }

    public String fieldsTerminatedBy() {
        return fieldsTerminatedBy;
    }

    public String collectionItemsTerminatedBy() {
        return collectionItemsTerminatedBy;
    }

    public String mapKeysTerminatedBy() {
        return mapKeysTerminatedBy;
    }

    public String linesTerminatedBy() {
        return linesTerminatedBy;
    }

    public Map<String, String> tblProperties() {
        return tblProperties;
    }

    public List<String> clusteredBy() {
        return clusteredBy;
    }

    /**
     * @return the count of {@code INTO n BUCKETS}, or null
     */
    public Integer buckets() {
        return buckets;
    }

    @Override
    public String toString() {
        return "HqlProperties{external=" + external + ", storedAs=" + storedAs + ", location=" + location + ", rowFormat=" + rowFormat + "}";
    }
}
