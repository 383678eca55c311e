// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

/**
 * What went wrong, as far as syntax can tell.
 */
public enum SyntaxErrorKind {
    /**
     * No alternative matched at the reported position.
     */
    UNEXPECTED_TOKEN("Unexpected input"),
    /**
     * The input ended while a closing delimiter was still expected.
     */
    UNTERMINATED_CONSTRUCT("Unterminated construct"),
    /**
     * A token was started, but its body was missing or invalid, like a {@code #} not followed by a tag name.
     */
    MALFORMED_ATOMIC_TOKEN("Malformed token"),
    /**
     * Parentheses, groups or big operators are nested deeper than {@link ParseOptions#maxNestingDepth()} allows.
     */
    NESTING_TOO_DEEP("Nesting too deep");

    SyntaxErrorKind(final String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    private final String description;
}
