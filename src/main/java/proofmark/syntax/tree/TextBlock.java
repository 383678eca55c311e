// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * A prose block that may appear both at the top level and inside descriptions, to-dos and proofs.
 */
public sealed interface TextBlock extends DocumentBlock, ProofElement
    permits Paragraph, DisplayMath, Sublist, RawCitation {
}
