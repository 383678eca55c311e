// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code id { fields }}: one cited work. Fields may come in any order.
 */
public record BibEntry(Identifier id, List<CitationField> fields, Span span) implements Node {
    public BibEntry {
        fields = List.copyOf(fields);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(id, fields);
    }
}
