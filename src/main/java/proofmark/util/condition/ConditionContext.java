// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

import java.util.ArrayList;
import java.util.List;
import proofmark.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Entry points of the condition system, operating on the calling thread's installed {@link Handler}s.
 * <p>
 * An error is offered to the handlers before anything is unwound. A handler that wants to stop the failed work
 * unwinds to a restart point established by {@link #withRestart(String, RestartCallback)}; one that returns
 * normally lets the next, older handler look at it.
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers the given condition to the installed handlers, newest first.
     * <p>
     * If no handler unwinds, an {@link UnhandledErrorError} is thrown. The declared return type exists only so that
     * call sites can write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().offer(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Calls {@code callback} with a fresh restart point named {@code restartName}.
     *
     * @return Whatever {@code callback} returned, or {@code null} if something unwound to the restart point.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (!unwind.isTargeting(restart)) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.deactivate();
        }
    }

    /**
     * Captures the calling thread's thread-safe handlers, for use by worker threads doing work on its behalf.
     */
    public static @NotNull Inheritance inheritable() {
        final var inherited = new ArrayList<@NotNull Handler>();
        for (final var handler : localContext().handlers) {
            if (handler.isThreadSafe()) {
                inherited.add(handler);
            }
        }
        return new Inheritance(List.copyOf(inherited));
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    void push(final @NotNull Handler handler) {
        handlers.add(handler);
    }

    void pop(final @NotNull Handler handler) {
        assert !handlers.isEmpty() && handlers.get(handlers.size() - 1) == handler : "Handlers closed out of order";
        handlers.remove(handlers.size() - 1);
    }

    private void offer(final @NotNull SignaledCondition condition) {
        // Conditions signaled by a running handler only reach handlers installed before it.
        final var outerCeiling = ceiling;
        var index = (outerCeiling < 0) ? handlers.size() : outerCeiling;
        try {
            while (index > 0) {
                index -= 1;
                ceiling = index;
                handlers.get(index).handle(condition);
            }
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        } finally {
            ceiling = outerCeiling;
        }
    }

    private final @NotNull List<@NotNull Handler> handlers = new ArrayList<>();
    // Number of handlers visible to a nested signal, or -1 outside of any handler.
    private int ceiling = -1;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    /**
     * Thread-safe handlers captured by {@link #inheritable()}.
     */
    public static final class Inheritance {
        private Inheritance(final @NotNull List<@NotNull Handler> handlers) {
            this.handlers = handlers;
        }

        /**
         * Installs the captured handlers in the calling thread, which must have none of its own, until the returned
         * adoption is closed.
         */
        public @NotNull Adoption adopt() {
            final var context = localContext();
            assert context.handlers.isEmpty() : "Adopting handlers into a thread that already has some";
            context.handlers.addAll(handlers);
            return new Adoption(context);
        }

        private final @NotNull List<@NotNull Handler> handlers;
    }

    /**
     * The scope of an {@link Inheritance#adopt()}, meant for try-with-resources.
     */
    public static final class Adoption implements AutoCloseable {
        private Adoption(final @NotNull ConditionContext context) {
            this.context = context;
        }

        @SuppressWarnings("EmptyMethod")
        public void use() {
        }

        @Override
        public void close() {
            assert context == localContext() : "Adoption closed by a different thread";
            context.handlers.clear();
        }

        private final @NotNull ConditionContext context;
    }
}
