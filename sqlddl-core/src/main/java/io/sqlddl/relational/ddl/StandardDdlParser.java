/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sqlddl.annotation.ThreadSafe;
import io.sqlddl.config.DdlParserConfig;
import io.sqlddl.config.OutputMode;
import io.sqlddl.text.ParsingException;
import io.sqlddl.text.TokenStream;
import io.sqlddl.text.TokenStream.Token;

/**
 * A {@link DdlParser} that understands the union of the ANSI, PostgreSQL, MySQL and HiveQL forms of {@code CREATE TABLE},
 * {@code ALTER TABLE}, {@code CREATE INDEX}, {@code CREATE SEQUENCE} and {@code CREATE SCHEMA|DATABASE}.
 * <p>
 * The input is tokenized once and split into statements at top-level semicolons, and also before a top-level
 * {@code CREATE} or {@code ALTER TABLE} so that scripts without terminators still parse. Each statement is then reduced
 * independently: a statement that fails contributes nothing but does not stop the statements after it. A lexical error,
 * such as an unterminated string, fails the whole call; the statements that were complete before the error are still
 * reported.
 * <p>
 * All state of a call lives in a context created for that call, so one instance can be shared by many threads.
 */
@ThreadSafe
public class StandardDdlParser implements DdlParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(StandardDdlParser.class);

    private final DdlParserConfig config;
    private final DdlTokenizer tokenizer = new DdlTokenizer();

    public StandardDdlParser() {
        this(DdlParserConfig.defaults());
    }

    public StandardDdlParser(DdlParserConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        if (!config.getConfig().validateAndRecord(DdlParserConfig.ALL_FIELDS, LOGGER::error)) {
            throw new IllegalArgumentException("Error configuring an instance of " + getClass().getSimpleName()
                    + "; check the logs for details");
        }
    }

    public DdlParserConfig config() {
        return config;
    }

    @Override
    public DdlParseResult parse(String ddl) {
        return parse(ddl, config.getOutputMode());
    }

    @Override
    public DdlParseResult parse(String ddl, OutputMode outputMode) {
        Objects.requireNonNull(ddl, "ddl");
        Objects.requireNonNull(outputMode, "outputMode");
        ParseContext context = new ParseContext(ddl);
        try {
            TokenStream stream = new TokenStream(ddl, tokenizer).start();
            parseStatements(context, stream, splitStatements(stream));
        }
        catch (ParsingException e) {
            parseBeforeLexError(context, ddl, e);
        }

        List<Map<String, Object>> records = new OutputNormalizer(outputMode).normalize(context.statements());
        DdlParseResult result = new DdlParseResult(outputMode, context.statements(), records, context.problems());
        LOGGER.debug("Parsed {} statement(s) into {} record(s) with {} warning(s) and {} error(s)",
                context.statements().size(), records.size(), result.warnings().size(), result.errors().size());
        if (config.isFailOnError()) {
            result.throwIfFailed();
        }
        return result;
    }

    /**
     * Report the lexical error, then parse the statements that were complete before it.
     */
    private void parseBeforeLexError(ParseContext context, String ddl, ParsingException error) {
        int errorOffset = Math.max(0, Math.min(error.getPosition().index(), ddl.length()));
        TokenStream prefix = new TokenStream(ddl.substring(0, errorOffset), tokenizer).start();
        List<Span> spans = splitStatements(prefix);
        int errorStatement = spans.size();
        if (!spans.isEmpty() && !spans.get(spans.size() - 1).terminated) {
            // The unterminated span is the statement the error occurred in
            spans.remove(spans.size() - 1);
            errorStatement = spans.size();
        }
        LOGGER.debug("Lexical error in statement {}: {}", errorStatement, error.getMessage());
        context.lexError(errorStatement, error.getPosition(), error.getMessage(), excerpt(ddl, errorOffset));
        parseStatements(context, prefix, spans);
    }

    private void parseStatements(ParseContext context, TokenStream stream, List<Span> spans) {
        for (int i = 0; i != spans.size(); ++i) {
            Span span = spans.get(i);
            new DdlStatementParser(context, stream.slice(span.from, span.to), i).parse();
        }
    }

    /**
     * Split the tokens into statement spans. Terminators are not part of any span and empty statements are dropped.
     */
    static List<Span> splitStatements(TokenStream stream) {
        List<Span> spans = new ArrayList<>();
        List<Token> tokens = stream.tokens();
        int depth = 0;
        int spanStart = 0;
        for (int i = 0; i != tokens.size(); ++i) {
            Token token = tokens.get(i);
            if (token.matches("(")) {
                depth++;
            }
            else if (token.matches(")")) {
                depth = Math.max(0, depth - 1);
            }
            else if (depth == 0 && token.matches(DdlTokenizer.STATEMENT_TERMINATOR)) {
                addSpan(spans, spanStart, i, true);
                spanStart = i + 1;
            }
            else if (depth == 0 && i > spanStart && startsStatement(tokens, i)) {
                addSpan(spans, spanStart, i, true);
                spanStart = i;
            }
        }
        addSpan(spans, spanStart, tokens.size(), false);
        return spans;
    }

    private static boolean startsStatement(List<Token> tokens, int index) {
        Token token = tokens.get(index);
        if (token.matches("CREATE")) {
            return true;
        }
        return token.matches("ALTER") && index + 1 < tokens.size() && tokens.get(index + 1).matches("TABLE");
    }

    private static void addSpan(List<Span> spans, int from, int to, boolean terminated) {
        if (to > from) {
            spans.add(new Span(from, to, terminated));
        }
    }

    private static String excerpt(String ddl, int offset) {
        int end = ddl.indexOf('\n', offset);
        return ddl.substring(offset, end < 0 ? ddl.length() : end).trim();
    }

    static final class Span {
        final int from;
        final int to;
        final boolean terminated;

        Span(int from, int to, boolean terminated) {
            this.from = from;
            this.to = to;
            this.terminated = terminated;
        }
    }
}
