// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * A parsed document: its blocks in source order.
 */
public record Document(List<DocumentBlock> blocks, Span span) implements Node {
    public Document {
        blocks = List.copyOf(blocks);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(blocks);
    }
}
