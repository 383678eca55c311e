// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import proofmark.syntax.tree.Bibliography;
import proofmark.syntax.tree.Document;
import proofmark.syntax.tree.Formula;
import proofmark.syntax.tree.Manifest;
import proofmark.syntax.tree.MathRow;
import proofmark.util.Trace;
import proofmark.util.condition.ConditionContext;
import proofmark.util.condition.Handler;

/**
 * Entry points of the parser.
 * <p>
 * The {@code parse} methods return the tree of a well-formed buffer. For a malformed one, they signal a fatal
 * {@link SyntaxErrorCondition}, which the caller is expected to handle, typically by unwinding to a restart. The
 * {@code tryParse} methods establish that handler themselves and return a {@link ParseResult} instead.
 * <p>
 * Each call parses one buffer on the calling thread and shares nothing with other calls, so separate buffers can be
 * parsed concurrently; see {@link BatchParser}.
 */
public final class Syntax {
    private Syntax() {
    }

    public static Document parseDocument(final String source) {
        return parseDocument(source, ParseOptions.DEFAULT);
    }

    public static Document parseDocument(final String source, final ParseOptions options) {
        try (final var trace = new Trace("Parsing document")) {
            trace.use();
            return new DocumentParser(new Scanner(source, options)).document();
        }
    }

    public static Manifest parseManifest(final String source) {
        return parseManifest(source, ParseOptions.DEFAULT);
    }

    public static Manifest parseManifest(final String source, final ParseOptions options) {
        try (final var trace = new Trace("Parsing manifest")) {
            trace.use();
            return new ManifestParser(new Scanner(source, options)).manifest();
        }
    }

    public static Bibliography parseBibliography(final String source) {
        return parseBibliography(source, ParseOptions.DEFAULT);
    }

    public static Bibliography parseBibliography(final String source, final ParseOptions options) {
        try (final var trace = new Trace("Parsing bibliography")) {
            trace.use();
            return new BibliographyParser(new Scanner(source, options)).bibliography();
        }
    }

    /**
     * Parses a buffer holding exactly one formula, surrounding whitespace aside.
     */
    public static Formula parseFormula(final String source) {
        return parseFormula(source, ParseOptions.DEFAULT);
    }

    public static Formula parseFormula(final String source, final ParseOptions options) {
        try (final var trace = new Trace("Parsing formula")) {
            trace.use();
            final var scanner = new Scanner(source, options);
            final var formula = new FormulaParser(scanner).formula();
            if (formula == null || !scanner.end()) {
                throw scanner.signalFailure();
            }
            return formula;
        }
    }

    /**
     * Parses a buffer holding a math row, as written between {@code \(} and {@code \)}.
     */
    public static MathRow parseMathRow(final String source) {
        return parseMathRow(source, ParseOptions.DEFAULT);
    }

    public static MathRow parseMathRow(final String source, final ParseOptions options) {
        try (final var trace = new Trace("Parsing math row")) {
            trace.use();
            final var scanner = new Scanner(source, options);
            final var row = new FormulaParser(scanner).mathRow(false);
            if (!scanner.end()) {
                throw scanner.signalFailure();
            }
            return row;
        }
    }

    public static ParseResult<Document> tryParseDocument(final String source) {
        return tryParseDocument(source, ParseOptions.DEFAULT);
    }

    public static ParseResult<Document> tryParseDocument(final String source, final ParseOptions options) {
        return tryParse(text -> parseDocument(text, options), source);
    }

    public static ParseResult<Manifest> tryParseManifest(final String source) {
        return tryParseManifest(source, ParseOptions.DEFAULT);
    }

    public static ParseResult<Manifest> tryParseManifest(final String source, final ParseOptions options) {
        return tryParse(text -> parseManifest(text, options), source);
    }

    public static ParseResult<Bibliography> tryParseBibliography(final String source) {
        return tryParseBibliography(source, ParseOptions.DEFAULT);
    }

    public static ParseResult<Bibliography> tryParseBibliography(final String source, final ParseOptions options) {
        return tryParse(text -> parseBibliography(text, options), source);
    }

    public static ParseResult<Formula> tryParseFormula(final String source) {
        return tryParse(text -> parseFormula(text, ParseOptions.DEFAULT), source);
    }

    static <T> ParseResult<T> tryParse(final Function<String, T> parser, final String source) {
        final var error = new AtomicReference<SyntaxError>();
        final var result = ConditionContext.withRestart("return-syntax-error", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.condition() instanceof final SyntaxErrorCondition condition) {
                    error.set(condition.error());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                return new ParseResult.Success<>(parser.apply(source));
            }
        });
        if (result != null) {
            return result;
        }
        final var syntaxError = error.get();
        assert syntaxError != null : "Unwound to return-syntax-error without a syntax error";
        return new ParseResult.Failure<>(syntaxError);
    }
}
