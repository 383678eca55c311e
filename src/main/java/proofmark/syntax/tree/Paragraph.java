// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * A non-empty run of text elements. Also used for single-line text such as taglines and captions.
 */
public record Paragraph(List<TextElement> elements, Span span) implements TextBlock {
    public Paragraph {
        elements = List.copyOf(elements);
        assert !elements.isEmpty() : "Empty paragraph";
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(elements);
    }
}
