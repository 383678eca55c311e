// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link HandlerProcedure} installed in the calling thread for the duration of a try-with-resources block.
 */
public final class Handler implements AutoCloseable {
    public Handler(final @NotNull HandlerProcedure procedure) {
        this.procedure = procedure;
        owner = ConditionContext.localContext();
        owner.push(this);
    }

    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == ConditionContext.localContext() : "Handler closed by a thread that didn't install it";
        owner.pop(this);
    }

    void handle(final @NotNull SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    boolean isThreadSafe() {
        return procedure instanceof HandlerProcedure.ThreadSafe;
    }

    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext owner;
}
