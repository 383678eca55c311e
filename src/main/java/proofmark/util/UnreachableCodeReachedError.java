// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when control reaches a point the surrounding code has proven impossible, such as the default branch of
 * a switch over an exhaustively handled enum.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
