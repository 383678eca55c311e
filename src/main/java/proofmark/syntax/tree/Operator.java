// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

/**
 * The operators of the formula language.
 * <p>
 * Declaration order is the order in which the parser tries them, and it matters: {@code <->} must be tried before
 * {@code <}, and {@code ->} before {@code -}, otherwise the shorter spelling would win and leave the rest behind.
 * Whether an operator acts as prefix or infix is left to later passes.
 */
public enum Operator {
    NEGATION("!"),
    EQUIVALENCE("<->"),
    IMPLICATION("->"),
    AND("/\\"),
    OR("\\/"),
    PLUS("+"),
    MINUS("-"),
    ASTERISK("*"),
    SLASH("/"),
    LESS_THAN("<"),
    EQUAL("="),
    GREATER_THAN(">"),
    TWIDDLE("~");

    Operator(final String spelling) {
        this.spelling = spelling;
    }

    /**
     * Retrieves the source spelling of this operator.
     */
    public String spelling() {
        return spelling;
    }

    private final String spelling;
}
