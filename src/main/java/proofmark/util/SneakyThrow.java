// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util;

import org.jetbrains.annotations.NotNull;

/**
 * Throws checked throwables past the compiler, for {@link proofmark.util.condition.Unwind}, which would otherwise
 * have to be declared by every parser method between a handler and its restart.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} unchanged. The return type lets callers write {@code throw doThrow(t)}.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        SneakyThrow.<RuntimeException>rethrow(throwable);
        throw new UnreachableCodeReachedError();
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void rethrow(final @NotNull Throwable throwable) throws E {
        throw (E) throwable;
    }
}
