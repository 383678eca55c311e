// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Supplier;
import proofmark.syntax.tree.FullyQualifiedId;
import proofmark.syntax.tree.Identifier;
import proofmark.syntax.tree.IntegerLiteral;
import proofmark.syntax.tree.Operator;
import proofmark.syntax.tree.OperatorToken;
import proofmark.syntax.tree.Span;
import proofmark.syntax.tree.StringLiteral;
import proofmark.syntax.tree.Tag;
import proofmark.syntax.tree.Variable;
import proofmark.util.Trace;
import proofmark.util.condition.ConditionContext;
import proofmark.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A backtracking cursor over one source buffer, shared by all parsers of a single parse.
 * <p>
 * The cursor position is the only state alternatives can change, so rewinding it undoes a failed alternative
 * completely. Besides the position, the scanner remembers the furthest offset at which anything failed to match and
 * what was expected there; that is what gets reported when the whole parse fails.
 * <p>
 * Methods named after a token ({@link #token(String)}, {@link #identifier()}, ...) implement normal rules: they skip
 * whitespace before the token, and leave the position untouched when they fail. Methods with a {@code Here} suffix
 * and the character-level accessors implement atomic rules and never skip anything.
 */
final class Scanner {
    Scanner(final String source, final ParseOptions options) {
        this.source = source;
        this.options = options;
    }

    String source() {
        return source;
    }

    int position() {
        return position;
    }

    void reset(final int mark) {
        assert 0 <= mark && mark <= source.length() : "Mark out of bounds: " + mark;
        position = mark;
    }

    boolean atEnd() {
        return position >= source.length();
    }

    /**
     * Returns the character {@code ahead} characters past the position, or -1 past the end of input.
     */
    int peek(final int ahead) {
        final var index = position + ahead;
        return (index < source.length()) ? source.charAt(index) : -1;
    }

    int peek() {
        return peek(0);
    }

    boolean lookingAt(final String text) {
        return source.startsWith(text, position);
    }

    void advance(final int count) {
        assert position + count <= source.length() : "Advanced past the end of input";
        position += count;
    }

    Span spanFrom(final int start) {
        return new Span(start, position);
    }

    String textFrom(final int start) {
        return source.substring(start, position);
    }

    /**
     * Runs one alternative of an ordered choice. If it returns {@code null}, the position is rewound to where it was
     * before, whatever the alternative consumed in the meantime.
     */
    <T> @Nullable T attempt(final Supplier<@Nullable T> alternative) {
        final var mark = position;
        final var result = alternative.get();
        if (result == null) {
            position = mark;
        }
        return result;
    }

    /**
     * Runs a construct that may nest within itself, signaling {@link SyntaxErrorKind#NESTING_TOO_DEEP} right away
     * once the configured limit is exceeded.
     */
    <T> T nested(final Supplier<T> construct) {
        depth += 1;
        try {
            if (depth > options.maxNestingDepth()) {
                final var error = new SyntaxError(
                    SyntaxErrorKind.NESTING_TOO_DEEP,
                    SourcePosition.of(source, position),
                    new Span(position, position),
                    List.of()
                );
                throw ConditionContext.error(new SyntaxErrorCondition(error, Trace.activeTraces()));
            }
            return construct.get();
        } finally {
            depth -= 1;
        }
    }

    void skipWhitespace() {
        while (isWhitespace(peek())) {
            position += 1;
        }
    }

    /**
     * Records that {@code description} was expected at the current position.
     */
    void expected(final String description, final Expectation expectation) {
        if (position < furthest) {
            return;
        }
        if (position > furthest) {
            furthest = position;
            furthestExpected.clear();
            closingExpected = false;
            atomicContentExpected = false;
            furthestTraces = Trace.activeTraces();
        }
        furthestExpected.add(description);
        switch (expectation) {
            case CLOSING -> closingExpected = true;
            case ATOMIC_CONTENT -> atomicContentExpected = true;
            case TOKEN -> {
            }
        }
    }

    /**
     * Matches the given text after optional whitespace.
     */
    boolean token(final String text) {
        return skipping(() -> tokenHere(text, Expectation.TOKEN)) != null;
    }

    /**
     * Like {@link #token(String)}, for delimiters that close a construct. Missing ones at the end of input make the
     * failure an unterminated construct.
     */
    boolean closing(final String text) {
        return skipping(() -> tokenHere(text, Expectation.CLOSING)) != null;
    }

    /**
     * Matches a backslash keyword such as {@code \Theorem}, which must not run on into an identifier character.
     */
    boolean keyword(final String name) {
        return skipping(() -> wordHere('\\' + name)) != null;
    }

    /**
     * Matches a bare keyword such as {@code name} or {@code prefix}, with the same boundary rule as
     * {@link #keyword(String)}.
     */
    boolean bareKeyword(final String name) {
        return skipping(() -> wordHere(name)) != null;
    }

    @Nullable Identifier identifier() {
        return skipping(this::identifierHere);
    }

    @Nullable IntegerLiteral integer() {
        return skipping(this::integerHere);
    }

    @Nullable StringLiteral string() {
        return skipping(this::stringHere);
    }

    @Nullable Variable variable() {
        return skipping(this::variableHere);
    }

    @Nullable Tag tag() {
        return skipping(this::tagHere);
    }

    @Nullable FullyQualifiedId fullyQualifiedId() {
        return skipping(this::fullyQualifiedIdHere);
    }

    /**
     * Matches the first {@link Operator}, in declaration order, whose spelling starts at the position.
     */
    @Nullable OperatorToken operator() {
        return skipping(this::operatorHere);
    }

    /**
     * Checks that nothing but whitespace is left.
     */
    boolean end() {
        return skipping(() -> {
            if (atEnd()) {
                return Boolean.TRUE;
            }
            expected("end of input", Expectation.TOKEN);
            return null;
        }) != null;
    }

    @Nullable Identifier identifierHere() {
        final var start = position;
        if (!isIdentifierStart(peek())) {
            expected("identifier", Expectation.TOKEN);
            return null;
        }
        position += 1;
        while (isIdentifierPart(peek())) {
            position += 1;
        }
        return new Identifier(textFrom(start), spanFrom(start));
    }

    /**
     * Captures a run of the given sentence punctuation characters, possibly empty.
     */
    String punctuationRunHere(final String allowed) {
        final var start = position;
        while (peek() >= 0 && allowed.indexOf(peek()) >= 0) {
            position += 1;
        }
        return textFrom(start);
    }

    /**
     * Builds the error describing the furthest failure and signals it as a fatal {@link SyntaxErrorCondition}.
     */
    UnhandledErrorError signalFailure() {
        throw ConditionContext.error(new SyntaxErrorCondition(failure(), furthestTraces));
    }

    SyntaxError failure() {
        final var offset = (furthest < 0) ? position : furthest;
        final var atEndOfInput = offset >= source.length();
        final SyntaxErrorKind kind;
        if (atEndOfInput && closingExpected) {
            kind = SyntaxErrorKind.UNTERMINATED_CONSTRUCT;
        } else if (atomicContentExpected) {
            kind = SyntaxErrorKind.MALFORMED_ATOMIC_TOKEN;
        } else {
            kind = SyntaxErrorKind.UNEXPECTED_TOKEN;
        }
        final var span = atEndOfInput ? new Span(offset, offset) : new Span(offset, offset + 1);
        return new SyntaxError(kind, SourcePosition.of(source, offset), span, new ArrayList<>(furthestExpected));
    }

    static boolean isWhitespace(final int c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    static boolean isIdentifierStart(final int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(final int c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    static boolean isDigit(final int c) {
        return c >= '0' && c <= '9';
    }

    private <T> @Nullable T skipping(final Supplier<@Nullable T> term) {
        final var mark = position;
        skipWhitespace();
        final var result = term.get();
        if (result == null) {
            position = mark;
        }
        return result;
    }

    private @Nullable Boolean tokenHere(final String text, final Expectation expectation) {
        if (!lookingAt(text)) {
            expected('"' + text + '"', expectation);
            return null;
        }
        position += text.length();
        return Boolean.TRUE;
    }

    private @Nullable Boolean wordHere(final String word) {
        if (!lookingAt(word) || isIdentifierPart(peek(word.length()))) {
            expected('"' + word + '"', Expectation.TOKEN);
            return null;
        }
        position += word.length();
        return Boolean.TRUE;
    }

    private @Nullable IntegerLiteral integerHere() {
        final var start = position;
        while (isDigit(peek())) {
            position += 1;
        }
        if (position == start) {
            expected("integer", Expectation.TOKEN);
            return null;
        }
        return new IntegerLiteral(textFrom(start), spanFrom(start));
    }

    private @Nullable StringLiteral stringHere() {
        final var start = position;
        if (peek() != '"') {
            expected("string", Expectation.TOKEN);
            return null;
        }
        position += 1;
        final var value = new StringBuilder();
        while (true) {
            final var c = peek();
            if (c < 0) {
                expected("\"\\\"\"", Expectation.CLOSING);
                return null;
            } else if (c == '"') {
                position += 1;
                return new StringLiteral(value.toString(), textFrom(start), spanFrom(start));
            } else if (c == '\\') {
                final var escaped = peek(1);
                if (escaped != '"' && escaped != '\\') {
                    position += 1;
                    expected("escape sequence", Expectation.ATOMIC_CONTENT);
                    return null;
                }
                value.append((char) escaped);
                position += 2;
            } else {
                value.append((char) c);
                position += 1;
            }
        }
    }

    private @Nullable Variable variableHere() {
        final var start = position;
        if (peek() != '\'') {
            expected("variable", Expectation.TOKEN);
            return null;
        }
        position += 1;
        if (!isIdentifierStart(peek())) {
            expected("variable name", Expectation.ATOMIC_CONTENT);
            return null;
        }
        final var name = identifierHere();
        assert name != null : "Identifier start checked above";
        return new Variable(name.name(), spanFrom(start));
    }

    private @Nullable Tag tagHere() {
        final var start = position;
        if (peek() != '#') {
            expected("tag", Expectation.TOKEN);
            return null;
        }
        position += 1;
        final var nameStart = position;
        while (isIdentifierPart(peek()) || peek() == '-') {
            position += 1;
        }
        if (position == nameStart) {
            expected("tag name", Expectation.ATOMIC_CONTENT);
            return null;
        }
        return new Tag(textFrom(nameStart), spanFrom(start));
    }

    private @Nullable FullyQualifiedId fullyQualifiedIdHere() {
        final var start = position;
        final var parent = identifierHere();
        if (parent == null) {
            return null;
        }
        if (peek() != '.') {
            expected("\".\"", Expectation.TOKEN);
            return null;
        }
        position += 1;
        final var child = identifierHere();
        if (child == null) {
            return null;
        }
        return new FullyQualifiedId(parent, child, spanFrom(start));
    }

    private @Nullable OperatorToken operatorHere() {
        final var start = position;
        for (final var operator : Operator.values()) {
            if (lookingAt(operator.spelling())) {
                position += operator.spelling().length();
                return new OperatorToken(operator, spanFrom(start));
            }
        }
        expected("operator", Expectation.TOKEN);
        return null;
    }

    private final String source;
    private final ParseOptions options;
    private int position = 0;
    private int depth = 0;
    private int furthest = -1;
    private final TreeSet<String> furthestExpected = new TreeSet<>();
    private boolean closingExpected = false;
    private boolean atomicContentExpected = false;
    private List<String> furthestTraces = List.of();

    /**
     * How a failed expectation bears on the classification of the final error.
     */
    enum Expectation {
        TOKEN,
        CLOSING,
        ATOMIC_CONTENT
    }
}
