// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A quotation, optionally with the text in its original language.
 */
public record QuoteBlock(@Nullable Unformatted original, Unformatted value, Span span) implements DocumentBlock {
    @Override
    public List<Node> children() {
        return Nodes.childList(original, value);
    }
}
