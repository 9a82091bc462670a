/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.List;

import io.sqlddl.text.TokenStream;
import io.sqlddl.text.TokenStream.Token;

/**
 * Rebuilds the text of an expression from its tokens. Each token contributes its source text, quotes included, and any
 * whitespace or comment between two tokens becomes a single space.
 */
final class ExpressionText {

    private ExpressionText() {
    }

    /**
     * @param stream the stream
     * @param fromIndex the index of the first token of the expression
     * @return the text of the tokens from {@code fromIndex} up to the last consumed token; empty if there are none
     */
    static String from(TokenStream stream, int fromIndex) {
        return of(stream.tokens().subList(fromIndex, stream.index()), stream.getInputString());
    }

    static String of(List<Token> tokens, String input) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && previous.endIndex() < token.startIndex()) {
                sb.append(' ');
            }
            sb.append(input, token.startIndex(), token.endIndex());
            previous = token;
        }
        return sb.toString();
    }
}
