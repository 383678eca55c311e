// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * A {@code #}-prefixed symbolic label. The name excludes the hash sign, the span includes it.
 */
public record Tag(String name, Span span) implements ReferenceTarget, ProofMeta {
    @Override
    public String toString() {
        return "#" + name;
    }
}
