// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * A metavariable, written {@code 'name}. The name excludes the apostrophe, the span includes it.
 */
public record Variable(String name, Span span) implements Node {
    @Override
    public String toString() {
        return "'" + name;
    }
}
