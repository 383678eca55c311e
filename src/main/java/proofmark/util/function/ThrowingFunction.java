// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.function;

/**
 * A {@link java.util.function.Function} that may throw a throwable of type {@code E}.
 */
@FunctionalInterface
public interface ThrowingFunction<T, R, E extends Throwable> {
    R apply(T value) throws E;
}
