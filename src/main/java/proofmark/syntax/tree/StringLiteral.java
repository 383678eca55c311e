// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * A double-quoted string.
 *
 * @param value The string with its escape sequences resolved.
 * @param raw   The exact source text, quotes included.
 */
public record StringLiteral(String value, String raw, Span span) implements Node {
}
