// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

import proofmark.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;

/**
 * A restart point established by {@link ConditionContext#withRestart(String, RestartCallback)}.
 * <p>
 * Handlers may unwind to it from any thread doing work on behalf of the thread that established it, but only
 * while the callback is still running.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        this.name = name;
    }

    public @NotNull String name() {
        return name;
    }

    /**
     * Abandons all work between the caller and the restart point. Never returns.
     */
    public void unwindTo() {
        assert active : "Unwinding to restart " + name + " after it was left";
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void deactivate() {
        active = false;
    }

    private final @NotNull String name;
    private volatile boolean active = true;
}
