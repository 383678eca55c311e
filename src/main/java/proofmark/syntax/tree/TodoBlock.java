// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

public record TodoBlock(List<TextBlock> blocks, Span span) implements DocumentBlock {
    public TodoBlock {
        blocks = List.copyOf(blocks);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(blocks);
    }
}
