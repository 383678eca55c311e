// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * A top-level block of a document.
 */
public sealed interface DocumentBlock extends Node
    permits DeclarationBlock, ProofBlock, ListBlock, TableBlock, QuoteBlock, HeadingBlock, TodoBlock, TextBlock {
}
