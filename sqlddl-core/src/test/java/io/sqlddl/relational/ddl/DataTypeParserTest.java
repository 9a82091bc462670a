/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

import io.sqlddl.relational.DataType;
import io.sqlddl.text.ParsingException;
import io.sqlddl.text.TokenStream;

public class DataTypeParserTest {

    @Test
    public void shouldParseSimpleTypeWithLength() {
        DataType type = DataTypeParser.parseExpression("VARCHAR(50)");
        assertThat(type.name()).isEqualTo("VARCHAR");
        assertThat(type.parameters()).containsExactly("50");
        assertThat(type.length()).isEqualTo(50);
        assertThat(type.scale()).isNull();
        assertThat(type.typeName()).isEqualTo("VARCHAR");
        assertThat(type.expression()).isEqualTo("VARCHAR(50)");
    }

    @Test
    public void shouldParsePrecisionAndScale() {
        DataType type = DataTypeParser.parseExpression("numeric(12, 2)");
        assertThat(type.length()).isEqualTo(12);
        assertThat(type.scale()).isEqualTo(2);
        assertThat(type.expression()).isEqualTo("numeric(12,2)");
    }

    @Test
    public void shouldKeepNonNumericParametersAsText() {
        DataType type = DataTypeParser.parseExpression("ENUM('a', 'b,c')");
        assertThat(type.parameters()).containsExactly("'a'", "'b,c'");
        assertThat(type.hasSize()).isFalse();
        assertThat(type.typeName()).isEqualTo("ENUM('a','b,c')");
    }

    @Test
    public void shouldKeepLengthTooLargeForIntInTypeName() {
        DataType type = DataTypeParser.parseExpression("VARCHAR(99999999999)");
        assertThat(type.hasSize()).isFalse();
        assertThat(type.length()).isNull();
        assertThat(type.typeName()).isEqualTo("VARCHAR(99999999999)");

        type = DataTypeParser.parseExpression("DECIMAL(2147483647, 99999999999)");
        assertThat(type.scale()).isNull();
        assertThat(type.typeName()).isEqualTo("DECIMAL(2147483647,99999999999)");

        assertThat(DataTypeParser.parseExpression("VARCHAR(2147483647)").length()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    public void shouldParseMultiWordNames() {
        assertThat(DataTypeParser.parseExpression("DOUBLE PRECISION").name()).isEqualTo("DOUBLE PRECISION");
        assertThat(DataTypeParser.parseExpression("CHARACTER VARYING(20)").name()).isEqualTo("CHARACTER VARYING");
        assertThat(DataTypeParser.parseExpression("NATIONAL CHAR VARYING(5)").name()).isEqualTo("NATIONAL CHAR VARYING");
        assertThat(DataTypeParser.parseExpression("public.my_type").name()).isEqualTo("public.my_type");
    }

    @Test
    public void shouldParseSuffixes() {
        assertThat(DataTypeParser.parseExpression("TIMESTAMP(3) WITH TIME ZONE").expression()).isEqualTo("TIMESTAMP(3) WITH TIME ZONE");
        assertThat(DataTypeParser.parseExpression("TIMESTAMP(3) WITH TIME ZONE").typeName()).isEqualTo("TIMESTAMP WITH TIME ZONE");
        assertThat(DataTypeParser.parseExpression("int(10) unsigned zerofill").suffix()).isEqualTo("unsigned zerofill");
    }

    @Test
    public void shouldParseArrays() {
        DataType type = DataTypeParser.parseExpression("INT[][3]");
        assertThat(type.isArray()).isTrue();
        assertThat(type.arrayDimensions()).containsExactly("", "3");
        assertThat(type.hasSize()).isFalse();
        assertThat(type.expression()).isEqualTo("INT[][3]");
        assertThat(DataTypeParser.parseExpression("TEXT ARRAY").arrayDimensions()).containsExactly("");
    }

    @Test
    public void shouldParseNestedTypeArguments() {
        DataType type = DataTypeParser.parseExpression("MAP<STRING, ARRAY<STRUCT<a:INT, b:DECIMAL(5,2)>>>");
        assertThat(type.typeArguments()).hasSize(2);
        DataType array = type.typeArguments().get(1);
        assertThat(array.name()).isEqualTo("ARRAY");
        DataType struct = array.typeArguments().get(0);
        assertThat(struct.fields()).extracting(DataType.StructField::name).containsExactly("a", "b");
        assertThat(struct.fields().get(1).type().scale()).isEqualTo(2);
        assertThat(type.expression()).isEqualTo("MAP<STRING,ARRAY<STRUCT<a:INT,b:DECIMAL(5,2)>>>");
    }

    @Test
    public void shouldRoundTripCanonicalExpression() {
        DataType type = DataTypeParser.parseExpression("STRUCT<name:VARCHAR(10), tags:ARRAY<STRING>>");
        assertThat(DataTypeParser.parseExpression(type.expression())).isEqualTo(type);
    }

    @Test
    public void shouldStopAtTheEndOfTheType() {
        TokenStream stream = new TokenStream("BIGINT UNSIGNED NOT NULL", new DdlTokenizer()).start();
        DataType type = new DataTypeParser().parse(stream);
        assertThat(type.expression()).isEqualTo("BIGINT UNSIGNED");
        assertThat(stream.peek()).isEqualTo("NOT");
    }

    @Test(expected = ParsingException.class)
    public void shouldFailOnUnbalancedAngleBrackets() {
        DataTypeParser.parseExpression("ARRAY<INT");
    }

    @Test(expected = ParsingException.class)
    public void shouldFailOnMissingType() {
        DataTypeParser.parseExpression("(10)");
    }

    @Test(expected = ParsingException.class)
    public void shouldFailOnTrailingTokens() {
        DataTypeParser.parseExpression("INT INT");
    }
}
