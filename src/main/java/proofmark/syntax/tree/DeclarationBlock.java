// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A declaration: {@code \Keyword id [: parent] { entries }}.
 * <p>
 * Entries are kept in source order. Neither presence nor uniqueness of entries is checked here, so a block may lack
 * entries it needs or repeat some; that is for later passes to judge.
 */
public sealed interface DeclarationBlock extends DocumentBlock
    permits SystemBlock, TypeBlock, SymbolBlock, DefinitionBlock, AxiomBlock, TheoremBlock {
    Identifier id();

    /**
     * Retrieves the identifier after the colon, or {@code null} for blocks that don't have one.
     */
    @Nullable Identifier parentId();

    List<Entry> entries();

    /**
     * Returns the first entry of the given kind, or {@code null} if there is none.
     */
    default @Nullable Entry entry(final EntryKind kind) {
        for (final var entry : entries()) {
            if (entry.kind() == kind) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Returns every entry of the given kind, in source order.
     */
    default List<Entry> entries(final EntryKind kind) {
        final var result = new ArrayList<Entry>();
        for (final var entry : entries()) {
            if (entry.kind() == kind) {
                result.add(entry);
            }
        }
        return List.copyOf(result);
    }
}
