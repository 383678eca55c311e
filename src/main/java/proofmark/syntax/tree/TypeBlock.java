// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

public record TypeBlock(Identifier id, Identifier parentId, List<Entry> entries, Span span)
    implements DeclarationBlock {
    public TypeBlock {
        entries = List.copyOf(entries);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(id, parentId, entries);
    }
}
