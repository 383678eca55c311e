// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

public sealed interface ProofElement extends Node permits ProofStep, TextBlock {
}
