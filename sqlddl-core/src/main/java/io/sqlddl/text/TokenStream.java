/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;

import io.sqlddl.annotation.Immutable;
import io.sqlddl.annotation.NotThreadSafe;

/**
 * A foundation for recursive-descent parsers: the content is broken into {@link Token tokens} by a pluggable
 * {@link Tokenizer}, and the parser walks the tokens with the {@code consume}, {@code canConsume} and {@code matches}
 * families of methods.
 * <p>
 * Token values are compared case-insensitively. Tokens produced from quoted text ({@link Token#isQuoted()}) never match a
 * literal expected value, so a quoted identifier such as {@code "table"} is never mistaken for the keyword {@code TABLE};
 * such tokens can only be matched by type or with {@link #ANY_VALUE}.
 * <p>
 * A {@link #slice(int, int) slice} of the tokens can be walked as an independent stream without re-tokenizing the
 * content, and {@link #peekToken(int)} looks ahead any number of tokens without consuming them.
 */
@NotThreadSafe
public class TokenStream {

    /**
     * An opaque marker for a position within the token stream.
     *
     * @see TokenStream#mark()
     */
    @Immutable
    public static final class Marker implements Comparable<Marker> {
        protected final int tokenIndex;
        protected final Position position;

        protected Marker(Position position, int index) {
            this.position = position;
            this.tokenIndex = index;
        }

        /**
         * Get the position of this marker, or null if this is at the end of the token stream.
         *
         * @return the position
         */
        public Position position() {
            return position;
        }

        @Override
        public int compareTo(Marker that) {
            return this.tokenIndex - that.tokenIndex;
        }

        @Override
        public String toString() {
            return Integer.toString(tokenIndex);
        }
    }

    /**
     * Wildcard accepted by the {@code matches}, {@code consume} and {@code canConsume} methods. This exact instance must be
     * used; an equal string will not work.
     */
    public static final String ANY_VALUE = "any value";

    /**
     * Wildcard for the token type.
     */
    public static final int ANY_TYPE = Integer.MIN_VALUE;

    protected final String inputString;
    private final Tokenizer tokenizer;
    private List<Token> tokens;
    private int cursor = -1;

    public TokenStream(String content, Tokenizer tokenizer) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(tokenizer, "tokenizer");
        this.inputString = content;
        this.tokenizer = tokenizer;
    }

    private TokenStream(String content, List<Token> tokens) {
        this.inputString = content;
        this.tokenizer = null;
        this.tokens = tokens;
        this.cursor = 0;
    }

    /**
     * Begin the token stream, tokenizing the content if that has not been done yet.
     *
     * @return this object for method chaining; never null
     * @throws ParsingException if the content cannot be tokenized
     */
    public TokenStream start() throws ParsingException {
        if (tokens == null) {
            TokenFactory factory = new TokenFactory();
            tokenizer.tokenize(new CharacterArrayStream(inputString.toCharArray()), factory);
            tokens = Collections.unmodifiableList(factory.getTokens());
        }
        cursor = 0;
        return this;
    }

    /**
     * Record the current position, e.g. to report where a statement started.
     *
     * @return the marker; never null
     */
    public Marker mark() {
        checkStarted();
        return new Marker(hasNext() ? currentToken().position() : null, cursor);
    }

    /**
     * @return the index of the next token within {@link #tokens()}
     */
    public int index() {
        return cursor;
    }

    /**
     * @return all tokens of this stream, unmodifiable; never null
     */
    public List<Token> tokens() {
        checkStarted();
        return tokens;
    }

    /**
     * Create an independent, already started stream over a range of this stream's tokens. Content extraction on the slice
     * still refers to the full input string.
     *
     * @param fromIndex the index of the first token, inclusive
     * @param toIndex the index of the last token, exclusive
     * @return the new stream; never null
     */
    public TokenStream slice(int fromIndex, int toIndex) {
        checkStarted();
        return new TokenStream(inputString, tokens.subList(fromIndex, toIndex));
    }

    public boolean hasNext() {
        checkStarted();
        return cursor < tokens.size();
    }

    /**
     * @return the position of the next token; never null
     * @throws NoSuchElementException if there are no more tokens
     */
    public Position nextPosition() {
        return currentToken().position();
    }

    /**
     * @return the position of the most recently consumed token, or of the first token if none was consumed
     */
    public Position previousPosition() {
        checkStarted();
        if (tokens.isEmpty()) {
            return Position.EMPTY_CONTENT_POSITION;
        }
        return tokens.get(Math.max(0, cursor - 1)).position();
    }

    /**
     * Return the value of the current token and move to the next token.
     *
     * @return the value of the consumed token
     * @throws ParsingException if there is no such token
     */
    public String consume() throws ParsingException {
        return consumeToken().value();
    }

    /**
     * Return the current token and move to the next one.
     *
     * @return the consumed token; never null
     * @throws ParsingException if there is no such token
     */
    public Token consumeToken() throws ParsingException {
        if (!hasNext()) {
            throwNoMoreContent(null);
        }
        return tokens.get(cursor++);
    }

    /**
     * Consume the current token if it matches the expected value, or throw an exception otherwise.
     *
     * @param expected the expected value, or {@link #ANY_VALUE}
     * @return this stream for method chaining
     * @throws ParsingException if the current token does not match
     */
    public TokenStream consume(String expected) throws ParsingException {
        if (!hasNext()) {
            throwNoMoreContent(expected);
        }
        Token current = currentToken();
        if (expected != ANY_VALUE && !current.matches(expected)) {
            throw unexpected(current, expected);
        }
        cursor++;
        return this;
    }

    /**
     * Consume a sequence of tokens, each of which must match the corresponding expected value.
     *
     * @param expected the expected value of the current token
     * @param expectedForNextTokens the expected values of the tokens that follow
     * @return this stream for method chaining
     * @throws ParsingException if any of the tokens does not match
     */
    public TokenStream consume(String expected, String... expectedForNextTokens) throws ParsingException {
        consume(expected);
        for (String next : expectedForNextTokens) {
            consume(next);
        }
        return this;
    }

    /**
     * Consume the current token if it has the expected type, or throw an exception otherwise.
     *
     * @param expectedType the expected type mask
     * @return the value of the consumed token
     * @throws ParsingException if the current token has another type
     */
    public String consume(int expectedType) throws ParsingException {
        if (!hasNext()) {
            throwNoMoreContent("a token of type " + expectedType);
        }
        Token current = currentToken();
        if (!current.matches(expectedType)) {
            throw unexpected(current, "a token of type " + expectedType);
        }
        cursor++;
        return current.value();
    }

    /**
     * Consume the current token if it matches any of the options, or throw an exception otherwise.
     *
     * @param options the permitted values
     * @return the value of the consumed token
     * @throws ParsingException if the current token matches none of the options
     */
    public String consumeAnyOf(String... options) throws ParsingException {
        if (!hasNext()) {
            throwNoMoreContent(String.join("|", options));
        }
        Token current = currentToken();
        for (String option : options) {
            if (option == ANY_VALUE || current.matches(option)) {
                cursor++;
                return current.value();
            }
        }
        throw unexpected(current, "one of " + String.join(", ", options));
    }

    /**
     * Consume tokens until (but not including) the expected one at nesting depth zero.
     *
     * @param expected the token at which to stop
     * @param skipMatchingTokens the opening token that nests; may be null
     * @return this stream for method chaining
     */
    public TokenStream consumeUntil(String expected, String skipMatchingTokens) {
        int depth = 0;
        while (hasNext()) {
            Token token = currentToken();
            if (depth == 0 && token.matches(expected)) {
                break;
            }
            if (skipMatchingTokens != null && token.matches(skipMatchingTokens)) {
                ++depth;
            }
            else if (token.matches(expected)) {
                --depth;
            }
            cursor++;
        }
        return this;
    }

    public boolean canConsume(String expected) {
        if (matches(expected)) {
            cursor++;
            return true;
        }
        return false;
    }

    /**
     * Consume the sequence of tokens only if all of them match.
     *
     * @param currentExpected the expected value of the current token
     * @param expectedForNextTokens the expected values of the tokens that follow
     * @return true if the tokens were consumed
     */
    public boolean canConsume(String currentExpected, String... expectedForNextTokens) {
        if (!matches(currentExpected, expectedForNextTokens)) {
            return false;
        }
        cursor += 1 + expectedForNextTokens.length;
        return true;
    }

    public boolean canConsumeAnyOf(String firstOption, String... additionalOptions) {
        if (matchesAnyOf(firstOption, additionalOptions)) {
            cursor++;
            return true;
        }
        return false;
    }

    public boolean matches(String expected) {
        return hasNext() && (expected == ANY_VALUE || currentToken().matches(expected));
    }

    /**
     * Determine whether the current and following tokens match the supplied values, without consuming anything.
     *
     * @param currentExpected the expected value of the current token
     * @param expectedForNextTokens the expected values of the tokens that follow
     * @return true if all of the tokens match
     */
    public boolean matches(String currentExpected, String... expectedForNextTokens) {
        if (!matches(currentExpected)) {
            return false;
        }
        for (int i = 0; i != expectedForNextTokens.length; ++i) {
            Token token = peekToken(i + 1);
            String expected = expectedForNextTokens[i];
            if (token == null || (expected != ANY_VALUE && !token.matches(expected))) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(int expectedType) {
        return hasNext() && currentToken().matches(expectedType);
    }

    public boolean matchesAnyOf(String firstOption, String... additionalOptions) {
        if (matches(firstOption)) {
            return true;
        }
        for (String option : additionalOptions) {
            if (matches(option)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Return the value of the current token without consuming it.
     *
     * @return the value; never null
     * @throws ParsingException if there are no more tokens
     */
    public String peek() throws ParsingException {
        if (!hasNext()) {
            throwNoMoreContent(null);
        }
        return currentToken().value();
    }

    /**
     * Look ahead without consuming anything.
     *
     * @param lookahead 0 for the current token, 1 for the one after it, and so on
     * @return the token, or null if the stream ends first
     */
    public Token peekToken(int lookahead) {
        checkStarted();
        int index = cursor + lookahead;
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * @return the complete content this stream was created from
     */
    public String getInputString() {
        return inputString;
    }

    final Token currentToken() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more content");
        }
        return tokens.get(cursor);
    }

    private void checkStarted() {
        if (tokens == null) {
            throw new IllegalStateException("start() method must be called before consuming or matching");
        }
    }

    protected void throwNoMoreContent(String expected) throws ParsingException {
        Position pos = tokens.isEmpty() ? Position.EMPTY_CONTENT_POSITION : tokens.get(tokens.size() - 1).position();
        String msg = expected == null ? "No more content" : "No more content but was expecting " + expected;
        throw new ParsingException(pos, msg);
    }

    private ParsingException unexpected(Token found, String expected) {
        Position pos = found.position();
        String msg = "Expecting " + expected + " at line " + pos.line() + ", column " + pos.column() + " but found '"
                + found.value() + "': " + generateFragment(inputString, found.startIndex(), 20, " ===>> ");
        return new ParsingException(pos, msg);
    }

    /**
     * Produce a fragment of the content around a problem point, with a marker at that point.
     *
     * @param content the content; may not be null
     * @param indexOfProblem the offset of the problem point
     * @param charactersToIncludeBeforeAndAfter how much context to include on either side
     * @param highlightText the marker text inserted at the problem point; may be null
     * @return the fragment; never null
     */
    public static String generateFragment(String content, int indexOfProblem, int charactersToIncludeBeforeAndAfter,
                                          String highlightText) {
        int index = Math.max(0, Math.min(indexOfProblem, content.length()));
        int beforeStart = Math.max(0, index - charactersToIncludeBeforeAndAfter);
        int afterEnd = Math.min(index + charactersToIncludeBeforeAndAfter, content.length());
        return content.substring(beforeStart, index) + (highlightText != null ? highlightText : "")
                + content.substring(index, afterEnd);
    }

    @Override
    public String toString() {
        if (tokens == null) {
            return "<not started>";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = cursor; i < tokens.size() && i < cursor + 20; ++i) {
            if (sb.length() > 0) {
                sb.append("  ");
            }
            sb.append(tokens.get(i));
        }
        return sb.toString();
    }

    /**
     * Converts the characters of a {@link CharacterStream} into tokens.
     */
    public interface Tokenizer {
        /**
         * Process the supplied characters and record the tokens.
         *
         * @param input the character input stream; never null
         * @param tokens the sink for the tokens, in order; never null
         * @throws ParsingException if the characters cannot be tokenized, e.g. a quote is never closed
         */
        void tokenize(CharacterStream input, Tokens tokens) throws ParsingException;
    }

    /**
     * Character-level cursor used by a {@link Tokenizer}.
     */
    public interface CharacterStream {

        boolean hasNext();

        /**
         * @return the index of the character most recently returned by {@link #next()}, or -1 before the first call
         */
        int index();

        /**
         * @param startIndex the index of the character
         * @return the position of that character, which must be the one most recently returned by {@link #next()}
         */
        Position position(int startIndex);

        String substring(int startIndex, int endIndex);

        char next();

        boolean isNext(char c);

        boolean isNext(char nextChar1, char nextChar2);

        boolean isNextAnyOf(String characters);

        boolean isNextWhitespace();

        /**
         * Look ahead without consuming anything.
         *
         * @param lookahead 1 for the character following the most recently returned one, 2 for the one after that
         * @return the character, or 0 beyond the end of the content
         */
        char peek(int lookahead);

        /**
         * @return the character before the most recently returned one; 0 at the start
         */
        char previous();
    }

    /**
     * The sink into which a {@link Tokenizer} records tokens.
     */
    @FunctionalInterface
    public interface Tokens {

        /**
         * Record a token whose value is the content between the indexes.
         *
         * @param position the position of the first character
         * @param startIndex the index of the first character
         * @param endIndex the index after the last character
         * @param type the type mask of the token
         */
        default void addToken(Position position, int startIndex, int endIndex, int type) {
            addToken(position, startIndex, endIndex, type, null);
        }

        /**
         * Record a token whose value differs from the content between the indexes, such as a quoted identifier whose value
         * excludes the quotes. Such tokens are {@link Token#isQuoted() quoted}.
         *
         * @param position the position of the first character
         * @param startIndex the index of the first character, including any quote
         * @param endIndex the index after the last character, including any quote
         * @param type the type mask of the token
         * @param value the value of the token, or null if it is simply the content between the indexes
         */
        void addToken(Position position, int startIndex, int endIndex, int type, String value);
    }

    /**
     * A token of the content.
     */
    public interface Token {

        /**
         * @return the value, which for quoted tokens excludes the quotes and resolves escapes; never null
         */
        String value();

        /**
         * @return the upper-cased value used for keyword comparison; never null
         */
        String normalizedValue();

        boolean matches(String expected);

        boolean matches(char expected);

        /**
         * @param expectedType a type mask, or {@link TokenStream#ANY_TYPE}
         * @return true if this token's type has any of the bits of the mask
         */
        boolean matches(int expectedType);

        int type();

        /**
         * @return the index of the first character of the token in the content, including any quote
         */
        int startIndex();

        /**
         * @return the index after the last character of the token in the content, including any quote
         */
        int endIndex();

        Position position();

        boolean isQuoted();
    }

    @Immutable
    protected static final class BasicToken implements Token {
        private final int startIndex;
        private final int endIndex;
        private final int type;
        private final String value;
        private final String normalizedValue;
        private final boolean quoted;
        private final Position position;

        protected BasicToken(int startIndex, int endIndex, int type, String value, boolean quoted, Position position) {
            this.startIndex = startIndex;
            this.endIndex = endIndex;
            this.type = type;
            this.value = value;
            this.normalizedValue = value.toUpperCase(Locale.ROOT);
            this.quoted = quoted;
            this.position = position;
        }

        @Override
        public int type() {
            return type;
        }

        @Override
        public int startIndex() {
            return startIndex;
        }

        @Override
        public int endIndex() {
            return endIndex;
        }

        @Override
        public boolean matches(char expected) {
            return !quoted && value.length() == 1 && value.charAt(0) == expected;
        }

        @Override
        public boolean matches(String expected) {
            return !quoted && normalizedValue.equalsIgnoreCase(expected);
        }

        @Override
        public boolean matches(int expectedType) {
            return expectedType == ANY_TYPE || (type & expectedType) != 0;
        }

        @Override
        public String value() {
            return value;
        }

        @Override
        public String normalizedValue() {
            return normalizedValue;
        }

        @Override
        public boolean isQuoted() {
            return quoted;
        }

        @Override
        public Position position() {
            return position;
        }

        @Override
        public String toString() {
            return value + " (" + type + ")";
        }
    }

    protected final class TokenFactory implements Tokens {
        private final List<Token> tokens = new ArrayList<>();

        @Override
        public void addToken(Position position, int startIndex, int endIndex, int type, String value) {
            boolean quoted = value != null;
            String tokenValue = quoted ? value : inputString.substring(startIndex, endIndex);
            tokens.add(new BasicToken(startIndex, endIndex, type, tokenValue, quoted, position));
        }

        public List<Token> getTokens() {
            return tokens;
        }
    }

    /**
     * A {@link CharacterStream} over a character array that tracks line and column numbers.
     */
    public static final class CharacterArrayStream implements CharacterStream {
        private final char[] content;
        private int lastIndex = -1;
        private final int maxIndex;
        private int lineNumber = 1;
        private int columnNumber = 0;
        private boolean nextCharMayBeLineFeed;

        public CharacterArrayStream(char[] content) {
            this.content = content;
            this.maxIndex = content.length - 1;
        }

        @Override
        public boolean hasNext() {
            return lastIndex < maxIndex;
        }

        @Override
        public int index() {
            return lastIndex;
        }

        @Override
        public Position position(int startIndex) {
            return new Position(startIndex, lineNumber, columnNumber);
        }

        @Override
        public String substring(int startIndex, int endIndex) {
            return new String(content, startIndex, endIndex - startIndex);
        }

        @Override
        public char next() {
            if (lastIndex >= maxIndex) {
                throw new NoSuchElementException();
            }
            char result = content[++lastIndex];
            ++columnNumber;
            if (result == '\r') {
                nextCharMayBeLineFeed = true;
                ++lineNumber;
                columnNumber = 0;
            }
            else if (result == '\n') {
                if (!nextCharMayBeLineFeed) {
                    ++lineNumber;
                }
                nextCharMayBeLineFeed = false;
                columnNumber = 0;
            }
            else {
                nextCharMayBeLineFeed = false;
            }
            return result;
        }

        @Override
        public boolean isNext(char c) {
            int nextIndex = lastIndex + 1;
            return nextIndex <= maxIndex && content[nextIndex] == c;
        }

        @Override
        public boolean isNext(char nextChar1, char nextChar2) {
            int nextIndex1 = lastIndex + 1;
            int nextIndex2 = lastIndex + 2;
            return nextIndex2 <= maxIndex && content[nextIndex1] == nextChar1 && content[nextIndex2] == nextChar2;
        }

        @Override
        public boolean isNextAnyOf(String characters) {
            int nextIndex = lastIndex + 1;
            return nextIndex <= maxIndex && characters.indexOf(content[nextIndex]) != -1;
        }

        @Override
        public boolean isNextWhitespace() {
            int nextIndex = lastIndex + 1;
            return nextIndex <= maxIndex && Character.isWhitespace(content[nextIndex]);
        }

        @Override
        public char peek(int lookahead) {
            int nextIndex = lastIndex + lookahead;
            return nextIndex >= 0 && nextIndex <= maxIndex ? content[nextIndex] : 0;
        }

        @Override
        public char previous() {
            return lastIndex > 0 ? content[lastIndex - 1] : 0;
        }
    }
}
