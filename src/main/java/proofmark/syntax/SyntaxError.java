// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.List;
import proofmark.syntax.tree.Span;

/**
 * A syntax error: where parsing got furthest before failing, and what it would have accepted there.
 *
 * @param expected What was tried at {@code position}, sorted and without duplicates.
 */
public record SyntaxError(SyntaxErrorKind kind, SourcePosition position, Span span, List<String> expected) {
    public SyntaxError {
        expected = List.copyOf(expected);
    }

    /**
     * Returns a one-line description, such as {@code Unterminated construct: expected "]"}.
     */
    public String message() {
        if (expected.isEmpty()) {
            return kind.description();
        }
        return kind.description() + ": expected " + String.join(", ", expected);
    }

    @Override
    public String toString() {
        return message() + " (" + position + ")";
    }
}
