/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import io.sqlddl.annotation.Immutable;

/**
 * The static classification of words shared by the tokenizer and the grammar reducer of every dialect. Supporting a new
 * dialect word means adding it here; the parser's control flow does not change.
 */
@Immutable
public final class DialectKeywords {

    /**
     * The category of a word.
     */
    public enum Category {
        /**
         * Words that introduce or structure ANSI statements and clauses, e.g. {@code CREATE}, {@code PRIMARY}.
         */
        RESERVED_WORD,
        /**
         * Names of built-in data types, e.g. {@code VARCHAR}, {@code STRUCT}.
         */
        TYPE_NAME,
        /**
         * Words that only introduce clauses of a particular dialect, e.g. Hive's {@code STORED} or MySQL's {@code ENGINE}.
         */
        DIALECT_CLAUSE_WORD,
        /**
         * Anything else, usually an identifier.
         */
        NONE
    }

    private static final Map<String, Category> CATEGORIES;

    static {
        Map<String, Category> categories = new HashMap<>();
        register(categories, Category.RESERVED_WORD,
                "CREATE", "TABLE", "ALTER", "INDEX", "SEQUENCE", "SCHEMA", "DATABASE", "UNIQUE", "PRIMARY", "KEY",
                "FOREIGN", "REFERENCES", "CONSTRAINT", "CHECK", "DEFAULT", "NOT", "NULL", "ON", "DELETE", "UPDATE",
                "CASCADE", "RESTRICT", "SET", "NO", "ACTION", "DEFERRABLE", "INITIALLY", "DEFERRED", "IMMEDIATE", "IF",
                "EXISTS", "OR", "REPLACE", "TEMPORARY", "TEMP", "GLOBAL", "LOCAL", "ADD", "DROP", "COLUMN", "RENAME",
                "TO", "MODIFY", "CHANGE", "LIKE", "AS", "BY", "WITH", "WITHOUT", "USING", "ASC", "DESC", "INCREMENT",
                "START", "MINVALUE", "MAXVALUE", "CACHE", "CYCLE", "OWNED", "COLLATE", "CHARACTER", "GENERATED",
                "ALWAYS", "IDENTITY", "COMMENT", "FOR", "ONLY", "NULLS", "FIRST", "LAST", "AUTHORIZATION",
                "TABLESPACE", "PARTITION", "STORED", "VIRTUAL", "DATA", "TYPE", "MATCH", "FULL", "PARTIAL", "SIMPLE");
        register(categories, Category.TYPE_NAME,
                "INT", "INTEGER", "SMALLINT", "BIGINT", "TINYINT", "MEDIUMINT", "INT2", "INT4", "INT8", "SERIAL",
                "BIGSERIAL", "SMALLSERIAL", "DECIMAL", "DEC", "NUMERIC", "NUMBER", "REAL", "FLOAT", "FLOAT4", "FLOAT8",
                "DOUBLE", "PRECISION", "BOOLEAN", "BOOL", "BIT", "CHAR", "VARCHAR", "VARCHAR2", "NCHAR", "NVARCHAR",
                "NVARCHAR2", "VARYING", "TEXT", "TINYTEXT", "MEDIUMTEXT", "LONGTEXT", "STRING", "CLOB", "NCLOB", "BLOB",
                "TINYBLOB", "MEDIUMBLOB", "LONGBLOB", "BYTEA", "BINARY", "VARBINARY", "DATE", "TIME", "TIMESTAMP",
                "TIMESTAMPTZ", "TIMETZ", "DATETIME", "DATETIME2", "INTERVAL", "YEAR", "UUID", "JSON", "JSONB", "XML",
                "ARRAY", "STRUCT", "MAP", "UNIONTYPE", "ENUM", "MONEY", "INET", "CIDR", "MACADDR", "GEOMETRY",
                "POINT", "UNSIGNED", "ZEROFILL");
        register(categories, Category.DIALECT_CLAUSE_WORD,
                "EXTERNAL", "PARTITIONED", "LOCATION", "ROW", "FORMAT", "DELIMITED", "FIELDS", "COLLECTION", "ITEMS",
                "KEYS", "LINES", "TERMINATED", "SERDE", "SERDEPROPERTIES", "INPUTFORMAT", "OUTPUTFORMAT",
                "TBLPROPERTIES", "CLUSTERED", "SORTED", "BUCKETS", "INTO", "ENGINE", "CHARSET", "AUTO_INCREMENT",
                "AUTOINCREMENT", "ESCAPED");
        CATEGORIES = Collections.unmodifiableMap(categories);
    }

    private static void register(Map<String, Category> categories, Category category, String... words) {
        for (String word : words) {
            categories.put(word, category);
        }
    }

    private DialectKeywords() {
    }

    /**
     * Classify a word.
     *
     * @param word the word in any case; may be null
     * @return the category; never null
     */
    public static Category categoryOf(String word) {
        if (word == null) {
            return Category.NONE;
        }
        return CATEGORIES.getOrDefault(word.toUpperCase(Locale.ROOT), Category.NONE);
    }

    public static boolean isReservedWord(String word) {
        return categoryOf(word) == Category.RESERVED_WORD;
    }

    public static boolean isTypeName(String word) {
        return categoryOf(word) == Category.TYPE_NAME;
    }

    public static boolean isDialectClauseWord(String word) {
        return categoryOf(word) == Category.DIALECT_CLAUSE_WORD;
    }

    /**
     * The retyping function used by {@link DdlTokenizer}: words in any category other than {@link Category#NONE} become
     * {@link DdlTokenizer#KEYWORD keywords}.
     *
     * @param type the type assigned by the tokenizer
     * @param upperCaseValue the upper-cased token text
     * @return the possibly changed type
     */
    public static int typeOf(int type, String upperCaseValue) {
        if (type == DdlTokenizer.IDENTIFIER && CATEGORIES.containsKey(upperCaseValue)) {
            return DdlTokenizer.KEYWORD;
        }
        return type;
    }
}
