// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

public record Bibliography(List<BibEntry> entries, Span span) implements Node {
    public Bibliography {
        entries = List.copyOf(entries);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(entries);
    }
}
