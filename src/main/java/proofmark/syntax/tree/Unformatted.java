// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * Text without markup: no references, math, citations or markers.
 */
public record Unformatted(List<InlineText> elements, Span span) implements Node {
    public Unformatted {
        elements = List.copyOf(elements);
        assert !elements.isEmpty() : "Empty unformatted text";
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(elements);
    }
}
