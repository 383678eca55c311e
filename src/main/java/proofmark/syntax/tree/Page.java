// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code id: "Title",}. The identifier names the page's source; loading it is not done here.
 */
public record Page(Identifier id, StringLiteral title, Span span) implements Node {
    @Override
    public List<Node> children() {
        return Nodes.childList(id, title);
    }
}
