// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code id: "Title" { description [ chapters ] }}.
 */
public record Book(Identifier id, StringLiteral title, Paragraph description, List<Chapter> chapters, Span span)
    implements Node {
    public Book {
        chapters = List.copyOf(chapters);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(id, title, description, chapters);
    }
}
