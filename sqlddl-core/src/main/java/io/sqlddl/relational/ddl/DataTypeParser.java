/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.ArrayList;
import java.util.List;

import io.sqlddl.annotation.ThreadSafe;
import io.sqlddl.relational.DataType;
import io.sqlddl.relational.DataType.StructField;
import io.sqlddl.text.ParsingException;
import io.sqlddl.text.TokenStream;

/**
 * A recursive descent parser for data types, including the nested types {@code ARRAY<...>}, {@code MAP<K,V>} and
 * {@code STRUCT<name:type,...>} as well as the array forms {@code T ARRAY}, {@code T ARRAY[n]}, {@code T[]} and
 * {@code T[n]}.
 * <p>
 * The parser is stateless; all state lives in the {@link TokenStream} it is given.
 */
@ThreadSafe
public final class DataTypeParser {

    private static final DdlTokenizer TOKENIZER = new DdlTokenizer();

    /**
     * Parse a complete type expression, such as a canonical type string produced by {@link DataType#expression()}.
     *
     * @param expression the type expression; may not be null
     * @return the type; never null
     * @throws ParsingException if the expression is not a single valid type
     */
    public static DataType parseExpression(String expression) {
        TokenStream stream = new TokenStream(expression, TOKENIZER).start();
        DataType type = new DataTypeParser().parse(stream);
        if (stream.hasNext()) {
            throw new ParsingException(stream.nextPosition(), "Unexpected '" + stream.peek() + "' after type '" + type + "'");
        }
        return type;
    }

    /**
     * Parse one type starting at the current token, leaving the stream positioned after the type.
     *
     * @param stream the token stream; may not be null
     * @return the type; never null
     * @throws ParsingException if there is no valid type at the current position
     */
    public DataType parse(TokenStream stream) {
        if (!stream.hasNext()) {
            throw new ParsingException(stream.previousPosition(), "Expected a data type but found the end of the statement");
        }
        if (stream.matchesAnyOf(",", ")", "(", ";") || stream.matches("<") || stream.matches(">")) {
            throw new ParsingException(stream.nextPosition(), "Expected a data type but found '" + stream.peek() + "'");
        }
        String name = parseName(stream);
        List<String> parameters = null;
        if (stream.matches("(")) {
            parameters = parseParameters(stream);
        }
        List<DataType> typeArguments = null;
        List<StructField> fields = null;
        if (stream.matches("<")) {
            stream.consume("<");
            if (name.equalsIgnoreCase("STRUCT")) {
                fields = parseFields(stream);
            }
            else {
                typeArguments = parseArguments(stream);
            }
            stream.consume(">");
        }
        String suffix = parseSuffix(stream);
        List<String> dimensions = parseArrayDimensions(stream);
        return new DataType(name, parameters, typeArguments, fields, suffix, dimensions);
    }

    private String parseName(TokenStream stream) {
        String name = stream.consume();
        // Multi-word type names
        if (name.equalsIgnoreCase("DOUBLE") && stream.matches("PRECISION")) {
            return name + " " + stream.consume();
        }
        boolean national = name.equalsIgnoreCase("NATIONAL") && stream.matchesAnyOf("CHARACTER", "CHAR");
        if (national) {
            name = name + " " + stream.consume();
        }
        if ((national || name.equalsIgnoreCase("CHARACTER") || name.equalsIgnoreCase("CHAR")) && stream.matches("VARYING")) {
            return name + " " + stream.consume();
        }
        if (name.equalsIgnoreCase("LONG") && stream.matchesAnyOf("VARCHAR", "VARBINARY", "RAW")) {
            return name + " " + stream.consume();
        }
        // User-defined types qualified with a schema
        while (stream.matches(".") && isWord(stream.peekToken(1))) {
            stream.consume(".");
            name = name + "." + stream.consume();
        }
        return name;
    }

    private static boolean isWord(TokenStream.Token token) {
        return token != null && token.matches(DdlTokenizer.IDENTIFIER | DdlTokenizer.KEYWORD | DdlTokenizer.QUOTED_IDENTIFIER);
    }

    /**
     * Read the parenthesized parameters. Each parameter is the source text between top-level commas, so
     * {@code ENUM('a','b')} yields {@code 'a'} and {@code 'b'}.
     */
    private List<String> parseParameters(TokenStream stream) {
        List<String> parameters = new ArrayList<>();
        stream.consume("(");
        if (stream.canConsume(")")) {
            return parameters;
        }
        while (true) {
            int start = stream.index();
            int depth = 0;
            while (stream.hasNext() && !(depth == 0 && stream.matchesAnyOf(",", ")"))) {
                if (stream.matches("(")) {
                    depth++;
                }
                else if (stream.matches(")")) {
                    depth--;
                }
                stream.consume();
            }
            parameters.add(ExpressionText.from(stream, start));
            if (stream.canConsume(",")) {
                continue;
            }
            stream.consume(")");
            return parameters;
        }
    }

    private List<DataType> parseArguments(TokenStream stream) {
        List<DataType> arguments = new ArrayList<>();
        do {
            arguments.add(parse(stream));
        } while (stream.canConsume(","));
        return arguments;
    }

    private List<StructField> parseFields(TokenStream stream) {
        List<StructField> fields = new ArrayList<>();
        do {
            String fieldName = stream.consume();
            stream.canConsume(":");
            fields.add(new StructField(fieldName, parse(stream)));
        } while (stream.canConsume(","));
        return fields;
    }

    private String parseSuffix(TokenStream stream) {
        StringBuilder suffix = new StringBuilder();
        while (true) {
            if (stream.matches("WITH", "TIME", "ZONE") || stream.matches("WITHOUT", "TIME", "ZONE")) {
                append(suffix, stream.consume() + " " + stream.consume() + " " + stream.consume());
            }
            else if (stream.matches("WITH", "LOCAL", "TIME", "ZONE")) {
                append(suffix, stream.consume() + " " + stream.consume() + " " + stream.consume() + " " + stream.consume());
            }
            else if (stream.matchesAnyOf("UNSIGNED", "SIGNED", "ZEROFILL")) {
                append(suffix, stream.consume());
            }
            else {
                return suffix.toString();
            }
        }
    }

    private static void append(StringBuilder sb, String words) {
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(words);
    }

    private List<String> parseArrayDimensions(TokenStream stream) {
        List<String> dimensions = new ArrayList<>();
        while (true) {
            if (stream.matches("ARRAY") && !stream.matches("ARRAY", "<")) {
                stream.consume("ARRAY");
                dimensions.add(stream.matches("[") ? parseDimension(stream) : "");
            }
            else if (stream.matches("[")) {
                dimensions.add(parseDimension(stream));
            }
            else {
                return dimensions;
            }
        }
    }

    private String parseDimension(TokenStream stream) {
        stream.consume("[");
        if (stream.canConsume("]")) {
            return "";
        }
        String cardinality = stream.consume(DdlTokenizer.NUMBER_LITERAL);
        stream.consume("]");
        return cardinality;
    }
}
