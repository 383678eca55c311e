// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link ConditionContext#error(Condition)} after every handler declined the condition. Parsing without
 * any handler or restart able to take a failure is a bug in the caller.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Unhandled " + condition.getClass().getSimpleName() + ": " + condition.detailedMessage());
        this.condition = condition;
    }

    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
