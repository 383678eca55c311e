// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code \Theorem}, {@code \Lemma} or {@code \Example}. The three differ only in presentation.
 */
public record TheoremBlock(TheoremKind kind, Identifier id, Identifier parentId, List<Entry> entries, Span span)
    implements DeclarationBlock {
    public TheoremBlock {
        entries = List.copyOf(entries);
    }

    public enum TheoremKind {
        THEOREM("Theorem"),
        LEMMA("Lemma"),
        EXAMPLE("Example");

        TheoremKind(final String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        private final String keyword;
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(id, parentId, entries);
    }
}
