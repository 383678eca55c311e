// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code \Sublist { 'x >>> row; ... }}: a list of substitutions, each mapping a metavariable to a math row.
 */
public record Sublist(List<Item> items, Span span) implements TextBlock {
    public Sublist {
        items = List.copyOf(items);
    }

    public record Item(Variable variable, MathRow replacement, Span span) implements Node {
        @Override
        public List<Node> children() {
            return Nodes.childList(variable, replacement);
        }
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(items);
    }
}
