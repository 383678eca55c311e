// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The immutable syntax trees produced by {@link proofmark.syntax.Syntax}.
 * <p>
 * Every node is a record implementing {@link proofmark.syntax.tree.Node}, carrying the half-open source
 * {@link proofmark.syntax.tree.Span} it was parsed from. Child lists are unmodifiable. There are no parent pointers;
 * names that refer to other declarations are kept as plain identifiers for later passes to resolve.
 */
@NonNullByDefault
package proofmark.syntax.tree;

import proofmark.util.annotation.NonNullByDefault;
