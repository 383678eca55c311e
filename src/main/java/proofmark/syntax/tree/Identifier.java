// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * A bare identifier, such as a declaration name or a symbol used in a formula.
 */
public record Identifier(String name, Span span) implements ReferenceTarget {
    @Override
    public String toString() {
        return name;
    }
}
