// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code \[ row \]}, followed by the sentence punctuation written right after it.
 *
 * @param end The trailing punctuation, possibly empty.
 */
public record DisplayMath(MathRow row, String end, Span span) implements TextBlock {
    @Override
    public List<Node> children() {
        return Nodes.childList(row);
    }
}
