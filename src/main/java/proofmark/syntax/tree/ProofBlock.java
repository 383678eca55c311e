// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code \Proof theorem : system { ... }}: proof steps interleaved with prose.
 */
public record ProofBlock(Identifier id, Identifier parentId, List<ProofElement> elements, Span span)
    implements DocumentBlock {
    public ProofBlock {
        elements = List.copyOf(elements);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(id, parentId, elements);
    }
}
