// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.math.BigInteger;

/**
 * A run of decimal digits, kept as written so that leading zeros survive.
 */
public record IntegerLiteral(String digits, Span span) implements Node {
    public BigInteger value() {
        return new BigInteger(digits);
    }
}
