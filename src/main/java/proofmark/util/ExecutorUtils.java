// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import proofmark.util.condition.ConditionContext;
import proofmark.util.condition.Unwind;
import proofmark.util.function.ThrowingFunction;
import org.jetbrains.annotations.NotNull;

/**
 * Runs per-input work on a caller-owned {@link ExecutorService} without losing the caller's condition handlers.
 */
public final class ExecutorUtils {
    private ExecutorUtils() {
    }

    /**
     * Applies {@code function} to each input on {@code executorService} and waits for all of them.
     * <p>
     * Each task runs with the caller's thread-safe handlers installed and under a trace naming its input index and
     * thread. Results are returned in input order. The first task, in input order, to unwind or throw has its unwind
     * or throwable re-thrown here, after the tasks not yet finished are cancelled.
     */
    public static <T, R> @NotNull List<R> map(
        final @NotNull ExecutorService executorService,
        final @NotNull List<? extends T> inputs,
        final @NotNull ThrowingFunction<? super T, ? extends R, Unwind> function
    ) throws Unwind, InterruptedException {
        final var inheritance = ConditionContext.inheritable();
        final var futures = new ArrayList<@NotNull Future<R>>(inputs.size());
        for (var i = 0; i < inputs.size(); i += 1) {
            futures.add(executorService.submit(task(inheritance, i, inputs.get(i), function)));
        }

        final var results = new ArrayList<R>(futures.size());
        try {
            for (final var future : futures) {
                results.add(join(future));
            }
        } catch (final Unwind | InterruptedException | RuntimeException | Error e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        }
        return results;
    }

    private static <T, R> @NotNull Callable<R> task(
        final ConditionContext.@NotNull Inheritance inheritance,
        final int index,
        final T input,
        final @NotNull ThrowingFunction<? super T, ? extends R, Unwind> function
    ) {
        return () -> {
            try (final var adoption = inheritance.adopt();
                 final var trace = new Trace(() -> "Processing input #" + index + " in thread "
                     + Thread.currentThread().getName())) {
                adoption.use();
                trace.use();
                return function.apply(input);
            } catch (final Unwind unwind) {
                throw new UnwindCarrier(unwind);
            }
        };
    }

    private static <R> R join(final @NotNull Future<R> future) throws Unwind, InterruptedException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof final UnwindCarrier carrier) {
                throw carrier.unwind;
            }
            if (cause instanceof final RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof final Error error) {
                throw error;
            }
            throw new UnreachableCodeReachedError("Worker task threw a checked exception: " + cause);
        }
    }

    // Callable can only throw Exceptions, so an Unwind crosses the future wrapped in one.
    private static final class UnwindCarrier extends Exception {
        private UnwindCarrier(final @NotNull Unwind unwind) {
            super(null, null, false, false);
            this.unwind = unwind;
        }

        private final transient @NotNull Unwind unwind;
    }
}
