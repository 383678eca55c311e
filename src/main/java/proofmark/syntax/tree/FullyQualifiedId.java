// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * A dotted {@code parent.child} identifier pair.
 */
public record FullyQualifiedId(Identifier parent, Identifier child, Span span) implements ReferenceTarget {
    @Override
    public String toString() {
        return parent.name() + "." + child.name();
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(parent, child);
    }
}
