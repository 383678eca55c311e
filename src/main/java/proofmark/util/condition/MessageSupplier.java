// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

/**
 * A message computed only when somebody asks for it, such as a trace message nobody ends up printing.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
