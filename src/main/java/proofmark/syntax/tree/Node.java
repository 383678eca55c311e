// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * Base type of every syntax tree node.
 */
public interface Node {
    /**
     * Retrieves the source range this node was parsed from.
     */
    Span span();

    /**
     * Returns the direct child nodes, in source order. Leaves have none.
     */
    default List<Node> children() {
        return List.of();
    }
}
