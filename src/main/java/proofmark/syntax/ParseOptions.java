// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

/**
 * Knobs of a parse.
 *
 * @param maxNestingDepth How deeply parenthesized formulas, math groups and big operators may nest before the parse
 *                        is abandoned with {@link SyntaxErrorKind#NESTING_TOO_DEEP}.
 */
public record ParseOptions(int maxNestingDepth) {
    public ParseOptions {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Maximum nesting depth must be positive, got " + maxNestingDepth);
        }
    }

    public ParseOptions withMaxNestingDepth(final int newMaxNestingDepth) {
        return new ParseOptions(newMaxNestingDepth);
    }

    public static final ParseOptions DEFAULT = new ParseOptions(150);
}
