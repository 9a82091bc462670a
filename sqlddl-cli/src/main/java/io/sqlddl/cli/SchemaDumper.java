/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import io.sqlddl.annotation.ThreadSafe;

/**
 * Writes parse records as indented JSON.
 */
@ThreadSafe
public class SchemaDumper {

    public static final String FILE_SUFFIX = "_schema.json";

    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaDumper.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(Object records) throws JsonProcessingException {
        return mapper.writeValueAsString(records);
    }

    /**
     * Write the records to {@code <directory>/<name>_schema.json}, creating the directory if needed.
     *
     * @param name the base name of the file, usually the input file name without its extension
     * @param directory the target directory
     * @param records the records or grouped records to write
     * @return the file that was written; never null
     * @throws IOException if the directory cannot be created or the file cannot be written
     */
    public Path dump(String name, Path directory, Object records) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(name + FILE_SUFFIX);
        mapper.writeValue(file.toFile(), records);
        LOGGER.debug("Wrote {}", file);
        return file;
    }
}
