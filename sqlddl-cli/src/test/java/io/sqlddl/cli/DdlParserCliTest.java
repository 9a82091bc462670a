/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

public class DdlParserCliTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ObjectMapper mapper = new ObjectMapper();
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private DdlParserCli cli;
    private Path input;
    private Path target;

    @Before
    public void beforeEach() throws IOException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new DdlParserCli(new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
        input = folder.newFolder("input").toPath();
        target = folder.getRoot().toPath().resolve("schemas");
    }

    @Test
    public void shouldDumpRecordsOfEachFile() throws IOException {
        Path employees = write("employees.sql", "CREATE TABLE employees (\n"
                + "    id SERIAL PRIMARY KEY,\n"
                + "    first_name VARCHAR(50),\n"
                + "    manager_id INT REFERENCES employees (id)\n"
                + ");\n");

        assertThat(cli.run(new String[]{ "-t", target.toString(), employees.toString() })).isEqualTo(DdlParserCli.EXIT_OK);

        Path dumped = target.resolve("employees" + SchemaDumper.FILE_SUFFIX);
        assertThat(dumped).exists();
        List<Map<String, Object>> records = mapper.readValue(dumped.toFile(), new TypeReference<List<Map<String, Object>>>() {
        });
        assertThat(records).hasSize(1);
        assertThat(records.get(0).get("table_name")).isEqualTo("employees");
        assertThat(out.toString("UTF-8")).isEmpty();
    }

    @Test
    public void shouldProcessEveryFileOfDirectory() throws IOException {
        write("a.sql", "CREATE TABLE a (id INT);");
        write("b.hql", "CREATE EXTERNAL TABLE b (id INT) STORED AS ORC;");

        int status = cli.run(new String[]{ "--target", target.toString(), "-o", "hql", input.toString() });

        assertThat(status).isEqualTo(DdlParserCli.EXIT_OK);
        assertThat(target.resolve("a_schema.json")).exists();
        List<Map<String, Object>> records = mapper.readValue(target.resolve("b_schema.json").toFile(),
                new TypeReference<List<Map<String, Object>>>() {
                });
        assertThat(records.get(0).get("external")).isEqualTo(true);
        assertThat(records.get(0).get("stored_as")).isEqualTo("ORC");
    }

    @Test
    public void shouldPrintRecordsWithoutDumpingWhenVerbose() throws IOException {
        Path file = write("seq.sql", "CREATE SEQUENCE seq START WITH 5;");

        int status = cli.run(new String[]{ "-v", "--no-dump", "--group-by-type", "-t", target.toString(), file.toString() });

        assertThat(status).isEqualTo(DdlParserCli.EXIT_OK);
        assertThat(target).doesNotExist();
        Map<String, List<Map<String, Object>>> grouped = mapper.readValue(out.toString("UTF-8"),
                new TypeReference<Map<String, List<Map<String, Object>>>>() {
                });
        assertThat(grouped.get("tables")).isEmpty();
        assertThat(grouped.get("sequences")).hasSize(1);
        assertThat(grouped.get("sequences").get(0).get("sequence_name")).isEqualTo("seq");
    }

    @Test
    public void shouldFailButStillDumpWhenInputHasLexicalError() throws IOException {
        Path file = write("broken.sql", "CREATE TABLE ok (id INT);\nCREATE TABLE t (name VARCHAR(10) DEFAULT 'oops);");

        int status = cli.run(new String[]{ "-t", target.toString(), file.toString() });

        assertThat(status).isEqualTo(DdlParserCli.EXIT_FAILED);
        assertThat(target.resolve("broken_schema.json")).exists();
        assertThat(err.toString("UTF-8")).contains("broken.sql");
    }

    @Test
    public void shouldFailForMissingInput() throws IOException {
        File missing = new File(folder.getRoot(), "nope.sql");

        int status = cli.run(new String[]{ "-t", target.toString(), missing.getPath() });

        assertThat(status).isEqualTo(DdlParserCli.EXIT_FAILED);
        assertThat(err.toString("UTF-8")).contains("nope.sql");
    }

    @Test
    public void shouldReportUsageErrors() throws IOException {
        assertThat(cli.run(new String[0])).isEqualTo(DdlParserCli.EXIT_USAGE);
        assertThat(cli.run(new String[]{ "--bogus", "a.sql" })).isEqualTo(DdlParserCli.EXIT_USAGE);
        assertThat(cli.run(new String[]{ "-o", "xml", "a.sql" })).isEqualTo(DdlParserCli.EXIT_USAGE);
        assertThat(err.toString("UTF-8")).contains("Usage:").contains("'--bogus'").contains("'xml'");
    }

    @Test
    public void shouldPrintHelp() throws IOException {
        assertThat(cli.run(new String[]{ "--help" })).isEqualTo(DdlParserCli.EXIT_OK);
        assertThat(out.toString("UTF-8")).startsWith("Usage:");
    }

    @Test
    public void shouldStripExtensionFromBaseName() {
        assertThat(DdlParserCli.baseName(new File("dir/orders.sql").toPath())).isEqualTo("orders");
        assertThat(DdlParserCli.baseName(new File(".hidden").toPath())).isEqualTo(".hidden");
        assertThat(DdlParserCli.baseName(new File("README").toPath())).isEqualTo("README");
    }

    private Path write(String name, String content) throws IOException {
        return Files.write(input.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }
}
