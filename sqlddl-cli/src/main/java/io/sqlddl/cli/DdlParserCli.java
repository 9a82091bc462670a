/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sqlddl.config.Configuration;
import io.sqlddl.config.DdlParserConfig;
import io.sqlddl.config.OutputMode;
import io.sqlddl.relational.ddl.DdlParseResult;
import io.sqlddl.relational.ddl.DdlParser;
import io.sqlddl.relational.ddl.DdlProblem;
import io.sqlddl.relational.ddl.StandardDdlParser;

/**
 * Parses DDL files and writes the records of each file to {@code <target>/<file name>_schema.json}.
 *
 * <pre>
 * ddl-parser [-t|--target DIR] [-o|--output-mode sql|hql] [--group-by-type] [-v|--verbose] [--no-dump] FILE_OR_DIR...
 * </pre>
 */
public class DdlParserCli {

    public static final String DEFAULT_TARGET = "schemas";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: ddl-parser [-t|--target DIR] [-o|--output-mode sql|hql] [--group-by-type] "
            + "[-v|--verbose] [--no-dump] FILE_OR_DIR...";

    private static final Logger LOGGER = LoggerFactory.getLogger(DdlParserCli.class);

    public static void main(String[] args) {
        System.exit(new DdlParserCli(System.out, System.err).run(args));
    }

    private final PrintStream out;
    private final PrintStream err;
    private final SchemaDumper dumper = new SchemaDumper();

    public DdlParserCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * Run the command.
     *
     * @param args the command line arguments
     * @return the exit status: 0 if every file was parsed and written, 1 if any failed, 2 for a usage error
     */
    public int run(String[] args) {
        CommandLineOptions options = CommandLineOptions.parse(args, "-v", "--verbose", "--no-dump", "--group-by-type", "-h", "--help");
        if (options.hasOption("-h", "--help")) {
            out.println(USAGE);
            return EXIT_OK;
        }
        Path target = Paths.get(options.getOption("-t", "--target", DEFAULT_TARGET));
        boolean verbose = options.getOption("-v", "--verbose", false);
        boolean noDump = options.getOption("--no-dump", null, false);
        boolean groupByType = options.getOption("--group-by-type", null, false);
        String mode = options.getOption("-o", "--output-mode", OutputMode.SQL.getValue());
        if (options.hasUnknowns()) {
            return usageError("Unknown option '" + options.getFirstUnknownOptionName() + "'");
        }
        if (OutputMode.parse(mode) == null) {
            return usageError("Unknown output mode '" + mode + "'; expected 'sql' or 'hql'");
        }
        if (options.getParameters().isEmpty()) {
            return usageError("No input files");
        }

        DdlParserConfig config = new DdlParserConfig(Configuration.create()
                .with(DdlParserConfig.OUTPUT_MODE, OutputMode.parse(mode))
                .with(DdlParserConfig.GROUP_BY_TYPE, groupByType)
                .build());
        DdlParser parser = new StandardDdlParser(config);

        int failures = 0;
        for (String parameter : options.getParameters()) {
            List<Path> files;
            try {
                files = inputFiles(Paths.get(parameter));
            }
            catch (IOException e) {
                LOGGER.error("Unable to read '{}'", parameter, e);
                err.println("Unable to read '" + parameter + "': " + e.getMessage());
                failures++;
                continue;
            }
            for (Path file : files) {
                if (!process(file, parser, config, target, verbose, noDump)) {
                    failures++;
                }
            }
        }
        return failures == 0 ? EXIT_OK : EXIT_FAILED;
    }

    private boolean process(Path file, DdlParser parser, DdlParserConfig config, Path target, boolean verbose, boolean noDump) {
        try {
            String ddl = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            DdlParseResult result = parser.parse(ddl);
            for (DdlProblem problem : result.problems()) {
                if (problem.isFatal()) {
                    LOGGER.error("{}: {}", file, problem);
                }
                else {
                    LOGGER.warn("{}: {}", file, problem);
                }
            }
            Object records = config.isGroupByType() ? result.recordsGroupedByType() : result.records();
            if (verbose) {
                out.println(dumper.toJson(records));
            }
            if (!noDump) {
                Path written = dumper.dump(baseName(file), target, records);
                LOGGER.info("Wrote {} record(s) parsed from {} to {}", result.records().size(), file, written);
            }
            if (result.isFailed()) {
                err.println(file + ": " + result.errors().get(0));
                return false;
            }
            return true;
        }
        catch (IOException e) {
            LOGGER.error("Unable to process '{}'", file, e);
            err.println("Unable to process '" + file + "': " + e.getMessage());
            return false;
        }
    }

    /**
     * @return the file itself, or the regular files directly inside the directory sorted by name
     */
    static List<Path> inputFiles(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            if (!Files.isRegularFile(path)) {
                throw new IOException("No such file or directory");
            }
            List<Path> single = new ArrayList<>();
            single.add(path);
            return single;
        }
        try (Stream<Path> children = Files.list(path)) {
            return children.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private int usageError(String message) {
        err.println(message);
        err.println(USAGE);
        return EXIT_USAGE;
    }
}
