/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Before;
import org.junit.Test;

import io.sqlddl.config.Configuration;
import io.sqlddl.config.DdlParserConfig;
import io.sqlddl.config.OutputMode;
import io.sqlddl.text.MultipleParsingExceptions;
import io.sqlddl.util.Testing;

public class StandardDdlParserTest {

    private DdlParser parser;

    @Before
    public void beforeEach() {
        parser = new StandardDdlParser();
    }

    @Test
    public void shouldParseEmployeesTable() {
        DdlParseResult result = parser.parse(Testing.Files.readResourceAsString("ddl/employees.sql"));
        assertThat(result.problems()).isEmpty();
        assertThat(result.isFailed()).isFalse();
        assertThat(result.records()).hasSize(1);

        Map<String, Object> table = result.records().get(0);
        assertThat(table.get("table_name")).isEqualTo("employees");
        assertThat(table.get("schema")).isNull();
        assertThat(table.get("primary_key")).isEqualTo(Arrays.asList("id"));
        assertThat(columnNames(table)).containsExactly("id", "first_name", "last_name", "salary", "hired_on", "manager_id");

        Map<String, Object> id = column(table, "id");
        assertThat(id.get("type")).isEqualTo("SERIAL");
        assertThat(id.get("nullable")).isEqualTo(false);

        Map<String, Object> firstName = column(table, "first_name");
        assertThat(firstName.get("type")).isEqualTo("VARCHAR");
        assertThat(firstName.get("size")).isEqualTo(50);
        assertThat(firstName.get("nullable")).isEqualTo(true);
        assertThat(firstName.get("default")).isNull();

        assertThat(column(table, "last_name").get("nullable")).isEqualTo(false);
        assertThat(column(table, "salary").get("size")).isEqualTo(Arrays.asList(10, 2));
        assertThat(column(table, "salary").get("default")).isEqualTo("0");
        assertThat(column(table, "hired_on").get("default")).isEqualTo("CURRENT_DATE");

        Map<String, Object> references = map(column(table, "manager_id").get("references"));
        assertThat(references.get("table")).isEqualTo("employees");
        assertThat(references.get("column")).isEqualTo("id");
        assertThat(references.get("on_delete")).isEqualTo("SET NULL");
        assertThat(references.get("on_update")).isNull();
    }

    @Test
    public void shouldProduceSameRecordForColumnAndTableLevelPrimaryKey() {
        DdlParseResult inline = parser.parse("CREATE TABLE t (id INT PRIMARY KEY, name TEXT);");
        DdlParseResult separate = parser.parse("CREATE TABLE t (id INT, name TEXT, PRIMARY KEY (id));");
        assertThat(inline.records()).isEqualTo(separate.records());
        assertThat(inline.records().get(0).get("primary_key")).isEqualTo(Arrays.asList("id"));
        assertThat(column(inline.records().get(0), "id").get("nullable")).isEqualTo(false);
    }

    @Test
    public void shouldIgnoreAllCommentStyles() {
        String plain = "CREATE TABLE t (id INT NOT NULL, name VARCHAR(10));";
        String commented = "-- leading comment\n"
                + "CREATE TABLE t ( /* block\n comment */ id INT NOT NULL, # hash comment\n"
                + "  name VARCHAR(10) -- trailing\n);";
        assertThat(parser.parse(commented).records()).isEqualTo(parser.parse(plain).records());
    }

    @Test
    public void shouldNotTreatCommentMarkersInsideQuotesAsComments() {
        DdlParseResult result = parser.parse("CREATE TABLE \"a--b\" (\"x#y\" TEXT DEFAULT '-- not /* a */ comment');");
        assertThat(result.problems()).isEmpty();
        Map<String, Object> table = result.records().get(0);
        assertThat(table.get("table_name")).isEqualTo("a--b");
        assertThat(column(table, "x#y").get("default")).isEqualTo("'-- not /* a */ comment'");
    }

    @Test
    public void shouldMatchKeywordsRegardlessOfCase() {
        String upper = "CREATE TABLE t (id INT NOT NULL PRIMARY KEY, v VARCHAR(5) DEFAULT 'x' UNIQUE);";
        String lower = "create table t (id INT not null primary key, v VARCHAR(5) default 'x' unique);";
        String mixed = "Create Table t (id INT Not Null Primary Key, v VARCHAR(5) Default 'x' Unique);";
        List<Map<String, Object>> expected = parser.parse(upper).records();
        assertThat(parser.parse(lower).records()).isEqualTo(expected);
        assertThat(parser.parse(mixed).records()).isEqualTo(expected);
    }

    @Test
    public void shouldAlwaysEmitTheSameTableAndColumnKeys() {
        Map<String, Object> table = parser.parse("CREATE TABLE t (a INT);").records().get(0);
        assertThat(table.keySet()).containsExactly("table_name", "schema", "primary_key", "columns", "alter", "checks", "index",
                "partitioned_by", "tablespace");
        assertThat(column(table, "a").keySet()).containsExactly("name", "type", "size", "references", "unique", "nullable",
                "default", "check");
    }

    @Test
    public void shouldEmitHqlKeysOnlyInHqlMode() {
        String ddl = "CREATE TABLE t (a INT);";
        Map<String, Object> sql = parser.parse(ddl, OutputMode.SQL).records().get(0);
        Map<String, Object> hql = parser.parse(ddl, OutputMode.HQL).records().get(0);
        assertThat(sql).doesNotContainKeys("external", "stored_as", "location", "row_format");
        assertThat(hql).containsEntry("external", false);
        assertThat(hql).containsEntry("stored_as", null);
        assertThat(hql).containsEntry("location", null);
        assertThat(hql).containsEntry("tblproperties", null);
    }

    @Test
    public void shouldOnlyEmitSequenceOptionsThatWerePresent() {
        DdlParseResult result = parser.parse("CREATE SEQUENCE s START 1;");
        assertThat(result.problems()).isEmpty();
        Map<String, Object> sequence = result.records().get(0);
        assertThat(sequence.keySet()).containsExactly("schema", "sequence_name", "start");
        assertThat(sequence.get("sequence_name")).isEqualTo("s");
        assertThat(sequence.get("start")).isEqualTo(1L);
    }

    @Test
    public void shouldParsePostgresMigration() {
        DdlParseResult result = parser.parse(Testing.Files.readResourceAsString("ddl/postgres-migration.sql"));
        assertThat(result.problems()).isEmpty();
        assertThat(result.records()).hasSize(3);

        Map<String, Object> schema = result.records().get(0);
        assertThat(schema).containsEntry("schema_name", "billing")
                .containsEntry("authorization", "admin")
                .containsEntry("if_not_exists", true);

        Map<String, Object> sequence = result.records().get(1);
        assertThat(sequence).containsEntry("schema", "billing")
                .containsEntry("sequence_name", "invoice_seq")
                .containsEntry("increment", 1L)
                .containsEntry("start", 1000L)
                .containsEntry("maxvalue", 999999L)
                .containsEntry("cache", 20L)
                .containsEntry("cycle", false)
                .containsEntry("no_minvalue", true)
                .doesNotContainKeys("minvalue", "no_maxvalue");

        Map<String, Object> table = result.records().get(2);
        assertThat(table.get("schema")).isEqualTo("billing");
        assertThat(table.get("table_name")).isEqualTo("invoices");
        assertThat(table.get("primary_key")).isEqualTo(Arrays.asList("id"));
        assertThat(columnNames(table)).containsExactly("id", "number", "amount", "issued_at", "tags", "customer_id");
        assertThat(column(table, "id").get("default")).isEqualTo("nextval('billing.invoice_seq'::regclass)");
        assertThat(column(table, "number").get("default")).isEqualTo("'N/A'");
        assertThat(column(table, "amount").get("check")).isEqualTo("amount >= 0");
        assertThat(column(table, "amount").get("size")).isEqualTo(Arrays.asList(12, 2));
        assertThat(column(table, "issued_at").get("type")).isEqualTo("TIMESTAMP WITH TIME ZONE");
        assertThat(column(table, "issued_at").get("default")).isEqualTo("now()");
        assertThat(column(table, "tags").get("type")).isEqualTo("TEXT[]");

        Map<String, Object> references = map(column(table, "customer_id").get("references"));
        assertThat(references).containsEntry("table", "customers")
                .containsEntry("schema", "billing")
                .containsEntry("column", "id")
                .containsEntry("on_delete", "CASCADE");

        Map<String, Object> alter = map(table.get("alter"));
        assertThat(alter.keySet()).containsExactly("columns", "defaults");
        List<Map<String, Object>> alteredColumns = list(alter.get("columns"));
        assertThat(alteredColumns).hasSize(2);
        assertThat(alteredColumns.get(0).get("name")).isEqualTo("customer_id");
        assertThat(alteredColumns.get(1)).containsEntry("name", "customer_id")
                .containsEntry("constraint_name", "invoices_customer_fk");
        Map<String, Object> setDefault = list(alter.get("defaults")).get(0);
        assertThat(setDefault).containsEntry("columns", Arrays.asList("number")).containsEntry("value", "'N/A'");

        List<Map<String, Object>> indexes = list(table.get("index"));
        assertThat(indexes).hasSize(1);
        assertThat(indexes.get(0)).containsEntry("index_name", "invoices_number_idx")
                .containsEntry("unique", true)
                .containsEntry("columns", Arrays.asList("number"));
        Map<String, Object> detail = list(indexes.get(0).get("detailed_columns")).get(0);
        assertThat(detail).containsEntry("name", "number").containsEntry("order", "DESC").containsEntry("nulls", "LAST");
    }

    @Test
    public void shouldParseMySqlDump() {
        DdlParseResult result = parser.parse(Testing.Files.readResourceAsString("ddl/mysql-shop.sql"));
        assertThat(result.problems()).isEmpty();
        assertThat(result.records()).hasSize(2);

        Map<String, Object> customers = result.records().get(0);
        assertThat(customers.get("table_name")).isEqualTo("customers");
        assertThat(customers.get("primary_key")).isEqualTo(Arrays.asList("id"));
        assertThat(customers.get("comment")).isEqualTo("shop customers");
        assertThat(map(customers.get("table_properties"))).containsEntry("ENGINE", "InnoDB")
                .containsEntry("DEFAULT CHARSET", "utf8mb4");
        assertThat(column(customers, "id")).containsEntry("autoincrement", true).containsEntry("size", 11);
        assertThat(column(customers, "email")).containsEntry("unique", true).containsEntry("comment", "login name");
        assertThat(column(customers, "created_at")).containsEntry("default", "CURRENT_TIMESTAMP")
                .containsEntry("on_update", "CURRENT_TIMESTAMP");

        List<Map<String, Object>> indexes = list(customers.get("index"));
        assertThat(indexes).hasSize(1);
        assertThat(indexes.get(0)).containsEntry("index_name", "idx_created").containsEntry("unique", false);

        Map<String, Object> uniques = list(map(customers.get("constraints")).get("uniques")).get(0);
        assertThat(uniques).containsEntry("constraint_name", "uk_email").containsEntry("columns", Arrays.asList("email"));

        Map<String, Object> orders = result.records().get(1);
        assertThat(map(column(orders, "customer_id").get("references"))).containsEntry("table", "customers")
                .containsEntry("column", "id")
                .containsEntry("on_delete", "CASCADE");
        Map<String, Object> foreignKey = list(map(orders.get("constraints")).get("references")).get(0);
        assertThat(foreignKey).containsEntry("constraint_name", "fk_orders_customer")
                .containsEntry("columns", Arrays.asList("customer_id"))
                .containsEntry("referenced_columns", Arrays.asList("id"));
    }

    @Test
    public void shouldParseHiveTableInHqlMode() {
        DdlParseResult result = parser.parse(Testing.Files.readResourceAsString("ddl/hive-events.hql"), OutputMode.HQL);
        assertThat(result.problems()).isEmpty();
        Map<String, Object> table = result.records().get(0);
        assertThat(table).containsEntry("schema", "analytics")
                .containsEntry("table_name", "events")
                .containsEntry("external", true)
                .containsEntry("if_not_exists", true)
                .containsEntry("comment", "raw events")
                .containsEntry("stored_as", "PARQUET")
                .containsEntry("location", "s3://bucket/events")
                .containsEntry("row_format", "DELIMITED")
                .containsEntry("fields_terminated_by", ",")
                .containsEntry("collection_items_terminated_by", "|")
                .containsEntry("map_keys_terminated_by", ":")
                .containsEntry("clustered_by", Arrays.asList("event_id"))
                .containsEntry("into_buckets", 16);
        assertThat(map(table.get("tblproperties"))).containsEntry("parquet.compression", "SNAPPY");

        List<Map<String, Object>> partitionedBy = list(table.get("partitioned_by"));
        assertThat(partitionedBy).hasSize(1);
        assertThat(partitionedBy.get(0)).containsEntry("name", "dt").containsEntry("type", "STRING");

        assertThat(column(table, "event_id").get("comment")).isEqualTo("unique id");
        assertThat(column(table, "tags").get("type")).isEqualTo("ARRAY<STRING>");
        assertThat(column(table, "attributes").get("type")).isEqualTo("MAP<STRING,STRING>");
        assertThat(column(table, "device").get("type")).isEqualTo("STRUCT<os:STRING,version:INT>");
    }

    @Test
    public void shouldApplyAlterationsInOrder() {
        DdlParseResult result = parser.parse("CREATE TABLE t (a INT, b INT, c INT);\n"
                + "ALTER TABLE t RENAME COLUMN a TO x;\n"
                + "ALTER TABLE t DROP COLUMN b;\n"
                + "ALTER TABLE t MODIFY c BIGINT NOT NULL;\n"
                + "ALTER TABLE t ADD CONSTRAINT t_pk PRIMARY KEY (x), ADD CONSTRAINT c_positive CHECK (c > 0);");
        assertThat(result.problems()).isEmpty();
        assertThat(result.records()).hasSize(1);

        Map<String, Object> table = result.records().get(0);
        assertThat(columnNames(table)).containsExactly("x", "c");
        assertThat(column(table, "c")).containsEntry("type", "BIGINT").containsEntry("nullable", false);
        assertThat(table.get("primary_key")).isEqualTo(Arrays.asList("x"));
        assertThat(list(table.get("checks")).get(0)).containsEntry("constraint_name", "c_positive")
                .containsEntry("statement", "c > 0");

        Map<String, Object> alter = map(table.get("alter"));
        assertThat(list(alter.get("renamed_columns")).get(0)).containsEntry("from", "a").containsEntry("to", "x");
        assertThat(alter.get("dropped_columns")).isEqualTo(Arrays.asList("b"));
        assertThat(list(alter.get("modified_columns"))).hasSize(1);
        assertThat(list(alter.get("primary_keys")).get(0)).containsEntry("constraint_name", "t_pk");
        assertThat(list(alter.get("checks"))).hasSize(1);
    }

    @Test
    public void shouldRenameAndRetypeWithMySqlChange() {
        DdlParseResult result = parser.parse("CREATE TABLE t (a INT);\nALTER TABLE t CHANGE COLUMN a b VARCHAR(20) NOT NULL;");
        assertThat(result.problems()).isEmpty();
        Map<String, Object> table = result.records().get(0);
        assertThat(columnNames(table)).containsExactly("b");
        assertThat(column(table, "b")).containsEntry("type", "VARCHAR").containsEntry("size", 20).containsEntry("nullable", false);
    }

    @Test
    public void shouldReportUnresolvedAlterAsWarning() {
        DdlParseResult result = parser.parse("ALTER TABLE missing ADD COLUMN x INT;");
        assertThat(result.isFailed()).isFalse();
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0).type()).isEqualTo(DdlProblem.Type.UNRESOLVED_ALTER_TARGET);

        Map<String, Object> record = result.records().get(0);
        assertThat(record).containsEntry("table_name", "missing").containsEntry("unresolved", true);
        assertThat(list(map(record.get("alter")).get("columns")).get(0)).containsEntry("name", "x");
    }

    @Test
    public void shouldReportIndexOnUnknownTableAsUnresolved() {
        DdlParseResult result = parser.parse("CREATE INDEX idx_a ON s.other (a);");
        assertThat(result.warnings()).extracting(DdlProblem::type).containsExactly(DdlProblem.Type.UNRESOLVED_ALTER_TARGET);
        assertThat(result.records().get(0)).containsEntry("table_name", "other")
                .containsEntry("schema", "s")
                .containsEntry("index_name", "idx_a")
                .containsEntry("unresolved", true);
    }

    @Test
    public void shouldParseColumnsNamedKeyAndIndex() {
        DdlParseResult result = parser.parse("CREATE TABLE t (key ENUM('a','b'), index INT, x INT, KEY idx_x (x));");
        assertThat(result.problems()).isEmpty();

        Map<String, Object> table = result.records().get(0);
        assertThat(columnNames(table)).containsExactly("key", "index", "x");
        assertThat(column(table, "key").get("type")).isEqualTo("ENUM('a','b')");
        assertThat(column(table, "index").get("type")).isEqualTo("INT");

        List<Map<String, Object>> indexes = list(table.get("index"));
        assertThat(indexes).hasSize(1);
        assertThat(indexes.get(0)).containsEntry("index_name", "idx_x").containsEntry("columns", Arrays.asList("x"));
    }

    @Test
    public void shouldNotTruncateOversizedColumnLength() {
        DdlParseResult result = parser.parse("CREATE TABLE t (a VARCHAR(99999999999), b VARCHAR(10));");
        assertThat(result.problems()).isEmpty();
        Map<String, Object> table = result.records().get(0);
        assertThat(column(table, "a").get("type")).isEqualTo("VARCHAR(99999999999)");
        assertThat(column(table, "a").get("size")).isNull();
        assertThat(column(table, "b").get("size")).isEqualTo(10);
    }

    @Test
    public void shouldRejectBucketCountOutOfRange() {
        DdlParseResult result = parser.parse("CREATE TABLE t (a INT) CLUSTERED BY (a) INTO 99999999999 BUCKETS;", OutputMode.HQL);
        assertThat(result.records()).isEmpty();
        assertThat(result.errors()).extracting(DdlProblem::type).containsExactly(DdlProblem.Type.STRUCTURAL_ERROR);
        assertThat(result.errors().get(0).message()).contains("99999999999");
    }

    @Test
    public void shouldReportLexicalErrorAndKeepCompleteStatements() {
        DdlParseResult result = parser.parse("CREATE TABLE a (x INT);\nCREATE TABLE b (y VARCHAR(10) DEFAULT 'oops);");
        assertThat(result.isFailed()).isTrue();
        assertThat(result.errors()).hasSize(1);
        DdlProblem error = result.errors().get(0);
        assertThat(error.type()).isEqualTo(DdlProblem.Type.LEX_ERROR);
        assertThat(error.statementIndex()).isEqualTo(1);
        assertThat(error.position().line()).isEqualTo(2);
        assertThat(result.records()).hasSize(1);
        assertThat(result.records().get(0).get("table_name")).isEqualTo("a");
    }

    @Test
    public void shouldReportUnterminatedBlockComment() {
        DdlParseResult result = parser.parse("CREATE TABLE a (x INT); /* never closed");
        assertThat(result.isFailed()).isTrue();
        assertThat(result.errors().get(0).type()).isEqualTo(DdlProblem.Type.LEX_ERROR);
        assertThat(result.records()).hasSize(1);
    }

    @Test
    public void shouldReportStructuralErrorAndContinueWithNextStatement() {
        DdlParseResult result = parser.parse("CREATE TABLE broken;\nCREATE INDEX idx (a);\nDROP TABLE x;\nCREATE TABLE ok (id INT);");
        assertThat(result.isFailed()).isTrue();
        assertThat(result.errors()).extracting(DdlProblem::statementIndex).containsExactly(0, 1, 2);
        assertThat(result.errors()).extracting(DdlProblem::type).containsOnly(DdlProblem.Type.STRUCTURAL_ERROR);
        assertThat(result.records()).hasSize(1);
        assertThat(result.records().get(0).get("table_name")).isEqualTo("ok");
    }

    @Test
    public void shouldTellWhichStatementsFailed() {
        DdlParseResult result = parser.parse("CREATE TABLE a (x INT);\nCREATE TABLE broken;\nCREATE TABLE c (z INT);");
        assertThat(result.isFailed()).isTrue();
        assertThat(result.isFailed(0)).isFalse();
        assertThat(result.isFailed(1)).isTrue();
        assertThat(result.isFailed(2)).isFalse();
        assertThat(result.records()).extracting(r -> r.get("table_name")).containsExactly("a", "c");

        result = parser.parse("CREATE TABLE a (x INT);\nCREATE TABLE b (y CHAR(1) DEFAULT 'oops);\nCREATE TABLE c (z INT);");
        assertThat(result.isFailed(0)).isFalse();
        assertThat(result.isFailed(1)).isTrue();
        assertThat(result.isFailed(2)).isTrue();
    }

    @Test
    public void shouldReportAlterOfUnknownColumnAsStructuralError() {
        DdlParseResult result = parser.parse("CREATE TABLE t (a INT);\nALTER TABLE t RENAME COLUMN nope TO x;");
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).statementIndex()).isEqualTo(1);
        assertThat(columnNames(result.records().get(0))).containsExactly("a");
        assertThat(map(result.records().get(0).get("alter"))).isEmpty();
    }

    @Test
    public void shouldSkipUnknownClausesWithWarning() {
        DdlParseResult result = parser.parse("CREATE TABLE t (id INT SPARSE NOT NULL) FOOBAR BAZ;");
        assertThat(result.isFailed()).isFalse();
        assertThat(result.warnings()).extracting(DdlProblem::type)
                .containsExactly(DdlProblem.Type.UNKNOWN_CLAUSE, DdlProblem.Type.UNKNOWN_CLAUSE);
        assertThat(result.warnings()).extracting(DdlProblem::offendingText).containsExactly("SPARSE", "FOOBAR BAZ");
        assertThat(column(result.records().get(0), "id").get("nullable")).isEqualTo(false);
    }

    @Test
    public void shouldSplitStatementsWithoutTerminators() {
        DdlParseResult result = parser.parse("CREATE TABLE a (x INT)\nCREATE TABLE b (y INT)\nALTER TABLE a ADD z INT");
        assertThat(result.problems()).isEmpty();
        assertThat(result.records()).extracting(r -> r.get("table_name")).containsExactly("a", "b");
        assertThat(columnNames(result.records().get(0))).containsExactly("x", "z");
    }

    @Test
    public void shouldParseTableVariants() {
        DdlParseResult result = parser.parse("CREATE OR REPLACE TEMPORARY TABLE IF NOT EXISTS t (\n"
                + "  id INT GENERATED ALWAYS AS IDENTITY,\n"
                + "  created DATE\n"
                + ") PARTITION BY RANGE (created) TABLESPACE fast;\n"
                + "CREATE TABLE copy LIKE s.orig;");
        assertThat(result.problems()).isEmpty();
        Map<String, Object> table = result.records().get(0);
        assertThat(table).containsEntry("replace", true)
                .containsEntry("temp", true)
                .containsEntry("if_not_exists", true)
                .containsEntry("tablespace", "fast");
        assertThat(map(table.get("partition_by"))).containsEntry("type", "RANGE")
                .containsEntry("columns", Arrays.asList("created"));
        assertThat(column(table, "id")).containsEntry("autoincrement", true).containsEntry("nullable", false);

        Map<String, Object> copy = result.records().get(1);
        assertThat(list(copy.get("columns"))).isEmpty();
        assertThat(map(copy.get("like"))).containsEntry("schema", "s").containsEntry("table_name", "orig");
    }

    @Test
    public void shouldParseCreateDatabase() {
        Map<String, Object> record = parser.parse("CREATE DATABASE IF NOT EXISTS shop DEFAULT CHARACTER SET utf8mb4;").records().get(0);
        assertThat(record).containsEntry("database_name", "shop").containsEntry("if_not_exists", true);
        assertThat(map(record.get("properties"))).containsEntry("CHARACTER SET", "utf8mb4");
    }

    @Test
    public void shouldGroupRecordsByType() {
        DdlParseResult result = parser.parse("CREATE SCHEMA s; CREATE TABLE s.t (a INT); CREATE SEQUENCE s.q;");
        Map<String, List<Map<String, Object>>> grouped = result.recordsGroupedByType();
        assertThat(grouped.keySet()).containsExactlyInAnyOrder("tables", "sequences", "schemas", "alters", "indexes");
        assertThat(grouped.get("tables")).hasSize(1);
        assertThat(grouped.get("sequences")).hasSize(1);
        assertThat(grouped.get("schemas")).hasSize(1);
        assertThat(grouped.get("alters")).isEmpty();
    }

    @Test
    public void shouldThrowWhenConfiguredToFailOnError() {
        DdlParser failing = new StandardDdlParser(new DdlParserConfig(Configuration.create()
                .with(DdlParserConfig.FAIL_ON_ERROR, true)
                .build()));
        assertThatThrownBy(() -> failing.parse("CREATE TABLE broken;"))
                .isInstanceOfSatisfying(MultipleParsingExceptions.class, e -> assertThat(e.getErrors()).hasSize(1));
        assertThat(failing.parse("CREATE TABLE fine (a INT);").isFailed()).isFalse();
    }

    @Test
    public void shouldReturnEmptyResultForEmptyInput() {
        DdlParseResult result = parser.parse("  -- nothing here\n ;; ");
        assertThat(result.records()).isEmpty();
        assertThat(result.problems()).isEmpty();
    }

    @Test
    public void shouldAllowConcurrentParsesWithSharedParser() throws Exception {
        String ddl = Testing.Files.readResourceAsString("ddl/postgres-migration.sql");
        List<Map<String, Object>> expected = parser.parse(ddl).records();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<Map<String, Object>>>> futures = new ArrayList<>();
            for (int i = 0; i != 64; ++i) {
                futures.add(executor.submit(() -> parser.parse(ddl).records()));
            }
            for (Future<List<Map<String, Object>>> future : futures) {
                assertThat(future.get()).isEqualTo(expected);
            }
        }
        finally {
            executor.shutdownNow();
        }
    }

    private static List<String> columnNames(Map<String, Object> table) {
        List<String> names = new ArrayList<>();
        for (Map<String, Object> column : list(table.get("columns"))) {
            names.add((String) column.get("name"));
        }
        return names;
    }

    private static Map<String, Object> column(Map<String, Object> table, String name) {
        for (Map<String, Object> column : list(table.get("columns"))) {
            if (name.equals(column.get("name"))) {
                return column;
            }
        }
        throw new AssertionError("No column '" + name + "' in " + table);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value) {
        assertThat(value).isInstanceOf(Map.class);
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Object value) {
        assertThat(value).isInstanceOf(List.class);
        return (List<Map<String, Object>>) value;
    }
}
