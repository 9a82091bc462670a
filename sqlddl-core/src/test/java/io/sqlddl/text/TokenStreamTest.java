/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Before;
import org.junit.Test;

import io.sqlddl.relational.ddl.DdlTokenizer;
import io.sqlddl.text.TokenStream.Marker;

public class TokenStreamTest {

    private String content;
    private TokenStream tokens;

    @Before
    public void beforeEach() {
        content = "Select all columns from this table";
        start();
    }

    private void start() {
        tokens = new TokenStream(content, new DdlTokenizer()).start();
    }

    @Test(expected = IllegalStateException.class)
    public void shouldNotAllowConsumeBeforeStartIsCalled() {
        tokens = new TokenStream(content, new DdlTokenizer());
        tokens.consume("Select");
    }

    @Test(expected = IllegalStateException.class)
    public void shouldNotAllowMatchesBeforeStartIsCalled() {
        tokens = new TokenStream(content, new DdlTokenizer());
        tokens.matches("Select");
    }

    @Test
    public void shouldConsumeInCaseInsensitiveMannerWithExpectedValues() {
        tokens.consume("SELECT");
        tokens.consume("ALL");
        tokens.consume("columns");
        tokens.consume("From", "this", "TABLE");
        assertThat(tokens.hasNext()).isFalse();
    }

    @Test
    public void shouldConsumeTokenInOriginalCase() {
        assertThat(tokens.consume()).isEqualTo("Select");
    }

    @Test(expected = ParsingException.class)
    public void shouldFailToConsumeUnexpectedValue() {
        tokens.consume("Select");
        tokens.consume("none");
    }

    @Test(expected = ParsingException.class)
    public void shouldFailToConsumePastTheEnd() {
        tokens.consume("Select", "all", "columns", "from", "this", "table");
        tokens.consume();
    }

    @Test
    public void shouldMatchSequenceWithoutConsuming() {
        assertThat(tokens.matches("select", "all", "columns")).isTrue();
        assertThat(tokens.matches("select", TokenStream.ANY_VALUE, "columns")).isTrue();
        assertThat(tokens.matches("select", "columns")).isFalse();
        assertThat(tokens.index()).isEqualTo(0);
    }

    @Test
    public void shouldOnlyConsumeWhenAllTokensMatch() {
        assertThat(tokens.canConsume("select", "none")).isFalse();
        assertThat(tokens.index()).isEqualTo(0);
        assertThat(tokens.canConsume("select", "all")).isTrue();
        assertThat(tokens.index()).isEqualTo(2);
        assertThat(tokens.canConsumeAnyOf("rows", "columns")).isTrue();
        assertThat(tokens.matchesAnyOf("from", "into")).isTrue();
    }

    @Test
    public void shouldMarkPositionOfCurrentToken() {
        tokens.consume("select");
        Marker marker = tokens.mark();
        assertThat(marker.position().line()).isEqualTo(1);
        assertThat(marker.position().column()).isEqualTo(8);
        tokens.consume("all", "columns", "from", "this", "table");
        assertThat(tokens.mark().position()).isNull();
    }

    @Test
    public void shouldPeekAhead() {
        assertThat(tokens.peekToken(2).value()).isEqualTo("columns");
        assertThat(tokens.peekToken(6)).isNull();
        tokens.consume();
        assertThat(tokens.peekToken(0).value()).isEqualTo("all");
    }

    @Test
    public void shouldConsumeUntilWithoutConsumingTheExpectedToken() {
        content = "(x (y) z) w";
        start();
        tokens.consume("(");
        tokens.consumeUntil(")", "(");
        assertThat(tokens.peek()).isEqualTo(")");
        assertThat(tokens.index()).isEqualTo(6);
    }

    @Test
    public void shouldSliceTokensIntoIndependentStream() {
        content = "CREATE TABLE a (x INT); CREATE TABLE b (y INT);";
        start();
        TokenStream slice = tokens.slice(8, 15);
        assertThat(slice.consume()).isEqualTo("CREATE");
        assertThat(slice.consume("TABLE").consume()).isEqualTo("b");
        assertThat(slice.getInputString()).isEqualTo(content);
        assertThat(tokens.index()).isEqualTo(0);
    }

    @Test
    public void shouldNotMatchQuotedTokensByValue() {
        content = "\"select\" select";
        start();
        assertThat(tokens.matches("select")).isFalse();
        assertThat(tokens.matches(DdlTokenizer.QUOTED_IDENTIFIER)).isTrue();
        tokens.consume();
        assertThat(tokens.matches("select")).isTrue();
    }

    @Test
    public void shouldReportPositionsOfTokens() {
        content = "a\n  b";
        start();
        tokens.consume();
        Position position = tokens.nextPosition();
        assertThat(position.line()).isEqualTo(2);
        assertThat(position.column()).isEqualTo(3);
        assertThat(position.index()).isEqualTo(4);
    }
}
