// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

public record ListBlock(Kind kind, List<Item> items, Span span) implements DocumentBlock {
    public ListBlock {
        items = List.copyOf(items);
    }

    public enum Kind {
        UNORDERED("UnorderedList"),
        ORDERED("OrderedList");

        Kind(final String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        private final String keyword;
    }

    public record Item(Paragraph content, Span span) implements Node {
        @Override
        public List<Node> children() {
            return Nodes.childList(content);
        }
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(items);
    }
}
