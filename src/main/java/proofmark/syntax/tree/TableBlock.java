// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code \Table { \Head{...} \Body{...} \Foot{...} \Caption{...} }}. Every part is optional, but those present
 * appear in this order.
 */
public record TableBlock(
    @Nullable Section head,
    @Nullable Section body,
    @Nullable Section foot,
    @Nullable Paragraph caption,
    Span span
) implements DocumentBlock {
    public record Section(SectionKind kind, List<Row> rows, Span span) implements Node {
        public Section {
            rows = List.copyOf(rows);
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(rows);
        }
    }

    public enum SectionKind {
        HEAD("Head"),
        BODY("Body"),
        FOOT("Foot");

        SectionKind(final String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        private final String keyword;
    }

    /**
     * {@code \Row {cell} {cell} ...}, with at least one cell.
     */
    public record Row(List<Cell> cells, Span span) implements Node {
        public Row {
            cells = List.copyOf(cells);
            assert !cells.isEmpty() : "Table row without cells";
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(cells);
        }
    }

    /**
     * A braced cell; {@code {}} has no content.
     */
    public record Cell(@Nullable Paragraph content, Span span) implements Node {
        @Override
        public List<Node> children() {
            return Nodes.childList(content);
        }
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(head, body, foot, caption);
    }
}
