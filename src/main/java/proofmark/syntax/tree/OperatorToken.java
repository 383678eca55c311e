// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * One occurrence of an {@link Operator} in the source.
 */
public record OperatorToken(Operator operator, Span span) implements Node {
    @Override
    public String toString() {
        return operator.spelling();
    }
}
