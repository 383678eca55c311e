// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Carries control from {@link Restart#unwindTo()} back to the frame that established the restart.
 * <p>
 * Extends {@link Throwable} directly so that {@code catch (Exception e)} and {@code catch (Error e)} don't stop it.
 * Only code moving it between threads should catch it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super(target.name(), null, false, false);
        this.target = target;
    }

    boolean isTargeting(final @NotNull Restart restart) {
        return target == restart;
    }

    private final transient @NotNull Restart target;
}
