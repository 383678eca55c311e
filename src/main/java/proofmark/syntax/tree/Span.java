// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * A half-open range {@code [start, end)} of character offsets into a parsed buffer.
 */
public record Span(int start, int end) {
    public Span {
        assert 0 <= start && start <= end : "Invalid span [" + start + ", " + end + ")";
    }

    public int length() {
        return end - start;
    }

    /**
     * Returns the smallest span covering both this span and {@code other}.
     */
    public Span union(final Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
