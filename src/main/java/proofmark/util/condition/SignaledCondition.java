// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * A condition as seen by a {@link HandlerProcedure}.
 *
 * @param isFatal Whether declining it leads to {@link UnhandledErrorError}. Always true for
 *                {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
