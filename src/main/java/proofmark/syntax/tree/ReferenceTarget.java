// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * What a {@code <ref>} element points at. Targets are not resolved here.
 */
public sealed interface ReferenceTarget extends Node permits Tag, FullyQualifiedId, Identifier {
}
