// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

public record Chapter(Identifier id, StringLiteral title, Paragraph description, List<Page> pages, Span span)
    implements Node {
    public Chapter {
        pages = List.copyOf(pages);
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(id, title, description, pages);
    }
}
