// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code \Citation { ... }}: a citation record written inline, using the bibliography field syntax.
 */
public record RawCitation(List<CitationField> fields, Span span) implements TextBlock {
    public RawCitation {
        fields = List.copyOf(fields);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(fields);
    }
}
