/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.sqlddl.relational.ddl;

import java.util.Locale;

import io.sqlddl.text.ParsingException;
import io.sqlddl.text.Position;
import io.sqlddl.text.TokenStream.CharacterStream;
import io.sqlddl.text.TokenStream.Token;
import io.sqlddl.text.TokenStream.Tokenizer;
import io.sqlddl.text.TokenStream.Tokens;

/**
 * A {@link Tokenizer} for DDL in the ANSI, PostgreSQL, MySQL and Hive dialects.
 * <p>
 * Comments in the {@code --}, {@code #} and <code>/&#42; ... &#42;/</code> forms are dropped unless the tokenizer is
 * created to include them. Quote characters switch the tokenizer into a quoted span that runs to the matching closing
 * quote, so comment markers inside string literals and quoted identifiers are kept as content. Identifiers may be quoted
 * with {@code "}, {@code `} or brackets; their value excludes the delimiters.
 */
public class DdlTokenizer implements Tokenizer {

    /**
     * An unquoted word that is not in the {@link DialectKeywords keyword table}.
     */
    public static final int IDENTIFIER = 1;
    /**
     * One of <code>( ) , ; . [ ] { }</code>.
     */
    public static final int PUNCTUATION = 2;
    /**
     * An optionally signed integer or decimal number.
     */
    public static final int NUMBER_LITERAL = 4;
    /**
     * A single-quoted string, without the quotes and with {@code ''} resolved to {@code '}.
     */
    public static final int STRING_LITERAL = 8;
    /**
     * An identifier delimited by {@code "}, {@code `} or brackets, without the delimiters.
     */
    public static final int QUOTED_IDENTIFIER = 16;
    /**
     * A comment, only produced when comments are included.
     */
    public static final int COMMENT = 32;
    /**
     * A word found in the {@link DialectKeywords keyword table}.
     */
    public static final int KEYWORD = 64;
    /**
     * Operators such as {@code =}, {@code <}, {@code ::} or {@code ||}.
     */
    public static final int OPERATOR = 128;
    /**
     * The {@code ;} that ends a statement. Such tokens are also {@link #PUNCTUATION}.
     */
    public static final int STATEMENT_TERMINATOR = 256;

    /**
     * The kind of a token as seen by callers that do not care about the type masks.
     */
    public enum Kind {
        KEYWORD,
        IDENTIFIER,
        QUOTED_IDENTIFIER,
        STRING_LITERAL,
        NUMBER_LITERAL,
        PUNCTUATION,
        OPERATOR,
        COMMENT;

        public static Kind of(Token token) {
            int type = token.type();
            if ((type & DdlTokenizer.KEYWORD) != 0) {
                return KEYWORD;
            }
            if ((type & DdlTokenizer.QUOTED_IDENTIFIER) != 0) {
                return QUOTED_IDENTIFIER;
            }
            if ((type & DdlTokenizer.STRING_LITERAL) != 0) {
                return STRING_LITERAL;
            }
            if ((type & DdlTokenizer.NUMBER_LITERAL) != 0) {
                return NUMBER_LITERAL;
            }
            if ((type & DdlTokenizer.PUNCTUATION) != 0) {
                return PUNCTUATION;
            }
            if ((type & DdlTokenizer.OPERATOR) != 0) {
                return OPERATOR;
            }
            if ((type & DdlTokenizer.COMMENT) != 0) {
                return COMMENT;
            }
            return IDENTIFIER;
        }
    }

    @FunctionalInterface
    public interface TokenTypeFunction {
        /**
         * Determine the type of a token.
         *
         * @param type the type assigned by the tokenizer
         * @param token the upper-cased token text
         * @return the potentially modified token type
         */
        int typeOf(int type, String token);
    }

    private static final String WORD_TERMINATORS = "(){}[],;.*+-/%=<>!|:?&^~'\"`";
    private static final String OPERATOR_CHARACTERS = "*+-/%=<>!|:?&^~";
    private static final int OPERAND_END = IDENTIFIER | NUMBER_LITERAL | STRING_LITERAL | QUOTED_IDENTIFIER;

    private final boolean useComments;
    private final TokenTypeFunction retypingFunction;

    /**
     * Create a tokenizer that drops comments and classifies words with {@link DialectKeywords}.
     */
    public DdlTokenizer() {
        this(false, DialectKeywords::typeOf);
    }

    public DdlTokenizer(boolean useComments, TokenTypeFunction retypingFunction) {
        this.useComments = useComments;
        this.retypingFunction = retypingFunction != null ? retypingFunction : (type, token) -> type;
    }

    /**
     * Wraps the sink to apply the retyping function and to remember the type of the last emitted token, which decides
     * whether a following {@code +} or {@code -} is a sign or an operator.
     */
    private static final class TypedTokens implements Tokens {
        private final CharacterStream input;
        private final Tokens delegate;
        private final TokenTypeFunction retypingFunction;
        private int lastType;
        private char lastChar;

        private TypedTokens(CharacterStream input, Tokens delegate, TokenTypeFunction retypingFunction) {
            this.input = input;
            this.delegate = delegate;
            this.retypingFunction = retypingFunction;
        }

        @Override
        public void addToken(Position position, int startIndex, int endIndex, int type, String value) {
            int actualType = type;
            if (value == null) {
                actualType = retypingFunction.typeOf(type, input.substring(startIndex, endIndex).toUpperCase(Locale.ROOT));
            }
            if (type != COMMENT) {
                lastType = actualType;
                lastChar = input.substring(endIndex - 1, endIndex).charAt(0);
            }
            delegate.addToken(position, startIndex, endIndex, actualType, value);
        }

        boolean signMayFollow() {
            if (lastType == 0) {
                return true;
            }
            if ((lastType & OPERAND_END) != 0) {
                return false;
            }
            return !(lastType == PUNCTUATION && (lastChar == ')' || lastChar == ']'));
        }
    }

    @Override
    public void tokenize(CharacterStream input, Tokens output) throws ParsingException {
        TypedTokens tokens = new TypedTokens(input, output, retypingFunction);
        while (input.hasNext()) {
            char c = input.next();
            int startIndex = input.index();
            Position startPosition = input.position(startIndex);
            switch (c) {
                case '#':
                    lineComment(input, tokens, startIndex, startPosition);
                    break;
                case '-':
                    if (input.isNext('-')) {
                        lineComment(input, tokens, startIndex, startPosition);
                    }
                    else if (isDigit(input.peek(1)) && tokens.signMayFollow()) {
                        number(input, tokens, startIndex, startPosition);
                    }
                    else {
                        operator(input, tokens, startIndex, startPosition);
                    }
                    break;
                case '+':
                    if (isDigit(input.peek(1)) && tokens.signMayFollow()) {
                        number(input, tokens, startIndex, startPosition);
                    }
                    else {
                        operator(input, tokens, startIndex, startPosition);
                    }
                    break;
                case '/':
                    if (input.isNext('*')) {
                        blockComment(input, tokens, startIndex, startPosition);
                    }
                    else {
                        operator(input, tokens, startIndex, startPosition);
                    }
                    break;
                case '(':
                case ')':
                case '{':
                case '}':
                case ',':
                case '.':
                case ']':
                    tokens.addToken(startPosition, startIndex, startIndex + 1, PUNCTUATION);
                    break;
                case ';':
                    tokens.addToken(startPosition, startIndex, startIndex + 1, PUNCTUATION | STATEMENT_TERMINATOR);
                    break;
                case '[':
                    bracket(input, tokens, startIndex, startPosition);
                    break;
                case '"':
                case '`':
                    tokens.addToken(startPosition, startIndex, quoted(input, c, startPosition, "identifier"), QUOTED_IDENTIFIER,
                            unquote(input, startIndex, input.index() + 1, c));
                    break;
                case '\'':
                    tokens.addToken(startPosition, startIndex, quoted(input, c, startPosition, "string literal"), STRING_LITERAL,
                            unquote(input, startIndex, input.index() + 1, c));
                    break;
                default:
                    if (Character.isWhitespace(c)) {
                        break;
                    }
                    if (OPERATOR_CHARACTERS.indexOf(c) != -1) {
                        operator(input, tokens, startIndex, startPosition);
                    }
                    else if (isDigit(c)) {
                        number(input, tokens, startIndex, startPosition);
                    }
                    else {
                        word(input, tokens, startIndex, startPosition);
                    }
            }
        }
    }

    private void lineComment(CharacterStream input, Tokens tokens, int startIndex, Position startPosition) {
        while (input.hasNext() && !input.isNextAnyOf("\r\n")) {
            input.next();
        }
        if (useComments) {
            tokens.addToken(startPosition, startIndex, input.index() + 1, COMMENT);
        }
    }

    private void blockComment(CharacterStream input, Tokens tokens, int startIndex, Position startPosition) {
        input.next(); // the '*'
        while (input.hasNext()) {
            if (input.isNext('*', '/')) {
                input.next();
                input.next();
                if (useComments) {
                    tokens.addToken(startPosition, startIndex, input.index() + 1, COMMENT);
                }
                return;
            }
            input.next();
        }
        throw new ParsingException(startPosition, "Unterminated block comment starting at line " + startPosition.line()
                + ", column " + startPosition.column());
    }

    /**
     * Consume a quoted span whose opening quote was just read. A doubled quote character is an escaped quote.
     *
     * @return the index after the closing quote
     */
    private int quoted(CharacterStream input, char quote, Position startPosition, String what) {
        while (input.hasNext()) {
            char c = input.next();
            if (c == quote) {
                if (input.isNext(quote)) {
                    input.next();
                }
                else {
                    return input.index() + 1;
                }
            }
        }
        throw new ParsingException(startPosition, "Unterminated quoted " + what + " starting at line " + startPosition.line()
                + ", column " + startPosition.column());
    }

    private static String unquote(CharacterStream input, int startIndex, int endIndex, char quote) {
        String inner = input.substring(startIndex + 1, endIndex - 1);
        String doubled = new String(new char[]{ quote, quote });
        return inner.replace(doubled, String.valueOf(quote));
    }

    /**
     * A bracket whose content is empty or all digits is array syntax, as in {@code INT[]} or {@code INT[4]}; any other
     * bracketed text is a quoted identifier.
     */
    private void bracket(CharacterStream input, Tokens tokens, int startIndex, Position startPosition) {
        boolean arraySyntax = true;
        int lookahead = 1;
        char c = input.peek(lookahead);
        while (c != ']' && c != 0) {
            if (!isDigit(c) && !Character.isWhitespace(c)) {
                arraySyntax = false;
            }
            c = input.peek(++lookahead);
        }
        if (arraySyntax) {
            tokens.addToken(startPosition, startIndex, startIndex + 1, PUNCTUATION);
            return;
        }
        if (c == 0) {
            throw new ParsingException(startPosition, "Unterminated bracket-quoted identifier starting at line "
                    + startPosition.line() + ", column " + startPosition.column());
        }
        for (int i = 0; i != lookahead; ++i) {
            input.next();
        }
        int endIndex = input.index() + 1;
        tokens.addToken(startPosition, startIndex, endIndex, QUOTED_IDENTIFIER, input.substring(startIndex + 1, endIndex - 1));
    }

    private void operator(CharacterStream input, Tokens tokens, int startIndex, Position startPosition) {
        char c = input.substring(startIndex, startIndex + 1).charAt(0);
        char next = input.peek(1);
        boolean twoCharacters = (c == ':' && next == ':')
                || (c == '|' && next == '|')
                || (c == '!' && next == '=')
                || (c == '<' && (next == '=' || next == '>'))
                || (c == '>' && next == '=');
        if (twoCharacters) {
            input.next();
        }
        tokens.addToken(startPosition, startIndex, input.index() + 1, OPERATOR);
    }

    private void number(CharacterStream input, Tokens tokens, int startIndex, Position startPosition) {
        while (isDigit(input.peek(1))) {
            input.next();
        }
        if (input.peek(1) == '.' && isDigit(input.peek(2))) {
            input.next();
            while (isDigit(input.peek(1))) {
                input.next();
            }
        }
        if ((input.peek(1) == 'e' || input.peek(1) == 'E')
                && (isDigit(input.peek(2)) || ((input.peek(2) == '-' || input.peek(2) == '+') && isDigit(input.peek(3))))) {
            input.next();
            input.next();
            while (isDigit(input.peek(1))) {
                input.next();
            }
        }
        if (isIdentifierPart(input.peek(1))) {
            // MySQL allows identifiers that start with digits
            word(input, tokens, startIndex, startPosition);
            return;
        }
        tokens.addToken(startPosition, startIndex, input.index() + 1, NUMBER_LITERAL);
    }

    /**
     * Read a word. A {@code --} with identifier characters on both sides stays inside the word, as in {@code table--name}.
     */
    private void word(CharacterStream input, Tokens tokens, int startIndex, Position startPosition) {
        while (input.hasNext()) {
            if (input.isNext('-', '-') && isIdentifierPart(input.peek(3))) {
                input.next();
                input.next();
                continue;
            }
            if (input.isNextWhitespace() || input.isNextAnyOf(WORD_TERMINATORS)) {
                break;
            }
            input.next();
        }
        tokens.addToken(startPosition, startIndex, input.index() + 1, IDENTIFIER);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
