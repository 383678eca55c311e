// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code name: type}.
 */
public record VariableDeclaration(Identifier name, TypeSignature type, Span span) implements Node {
    @Override
    public List<Node> children() {
        return Nodes.childList(name, type);
    }
}
