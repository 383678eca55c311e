// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

/**
 * A position in a source buffer, both as a character offset and as a 1-based line and column.
 */
public record SourcePosition(int offset, int line, int column) {
    /**
     * Computes the line and column of the given offset in {@code source}. Only {@code \n} ends a line.
     */
    public static SourcePosition of(final CharSequence source, final int offset) {
        assert 0 <= offset && offset <= source.length() : "Offset out of bounds: " + offset;
        var line = 1;
        var lineStart = 0;
        for (var i = 0; i < offset; i += 1) {
            if (source.charAt(i) == '\n') {
                line += 1;
                lineStart = i + 1;
            }
        }
        return new SourcePosition(offset, line, offset - lineStart + 1);
    }

    @Override
    public String toString() {
        return "In line " + line + ", column " + column;
    }
}
