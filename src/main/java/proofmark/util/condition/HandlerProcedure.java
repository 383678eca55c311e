// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link Handler} does with a signaled condition: decline it by returning, or act on it by unwinding.
 */
@FunctionalInterface
public interface HandlerProcedure {
    void handle(@NotNull SignaledCondition condition) throws Unwind;

    /**
     * Marks a procedure as safe to run on worker threads, which makes {@link ConditionContext#inheritable()} pass
     * it on to them. Plain procedures only ever see conditions signaled by the thread that installed them.
     */
    @FunctionalInterface
    interface ThreadSafe extends HandlerProcedure {
    }
}
