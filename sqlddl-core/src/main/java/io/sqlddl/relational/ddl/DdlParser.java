/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import io.sqlddl.config.OutputMode;

/**
 * A parser interface for DDL statements.
 */
public interface DdlParser {

    /**
     * Parse the supplied DDL using the parser's configured output mode.
     *
     * @param ddlContent the DDL statements; may not be null
     * @return the result, which may carry problems and may be {@link DdlParseResult#isFailed() failed}; never null
     */
    DdlParseResult parse(String ddlContent);

    /**
     * Parse the supplied DDL.
     *
     * @param ddlContent the DDL statements; may not be null
     * @param outputMode the policy deciding which dialect-specific keys appear in the records; may not be null
     * @return the result, which may carry problems and may be {@link DdlParseResult#isFailed() failed}; never null
     */
    DdlParseResult parse(String ddlContent, OutputMode outputMode);
}
