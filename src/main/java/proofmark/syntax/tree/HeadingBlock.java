// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * One or more consecutive heading lines.
 */
public record HeadingBlock(List<Subheading> subheadings, Span span) implements DocumentBlock {
    public HeadingBlock {
        subheadings = List.copyOf(subheadings);
        assert !subheadings.isEmpty() : "Heading block without headings";
    }

    /**
     * A single heading line; the level is the number of leading hash signs, 1 to 3.
     */
    public record Subheading(int level, Unformatted text, Span span) implements Node {
        @Override
        public List<Node> children() {
            return Nodes.childList(text);
        }
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(subheadings);
    }
}
