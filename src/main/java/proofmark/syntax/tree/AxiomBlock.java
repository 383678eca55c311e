// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code \Axiom id : system { ... }}: a statement taken without proof.
 */
public record AxiomBlock(Identifier id, Identifier parentId, List<Entry> entries, Span span)
    implements DeclarationBlock {
    public AxiomBlock {
        entries = List.copyOf(entries);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(id, parentId, entries);
    }
}
