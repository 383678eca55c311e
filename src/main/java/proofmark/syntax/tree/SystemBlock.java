// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code \System id { ... }}, the root of a hierarchy of declarations.
 */
public record SystemBlock(Identifier id, List<Entry> entries, Span span) implements DeclarationBlock {
    public SystemBlock {
        entries = List.copyOf(entries);
    }

    @Override
    public @Nullable Identifier parentId() {
        return null;
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(id, entries);
    }
}
