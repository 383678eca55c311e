// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import proofmark.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A note about what the current thread is working on, in terms of the source being read ("Parsing chapter groups",
 * "Parsing document block #4"). Open it with try-with-resources.
 * <p>
 * Syntax errors copy the notes that were open where they happened, so a reader sees the path into the buffer
 * instead of Java stack frames.
 */
public final class Trace implements AutoCloseable {
    public Trace(final String message) {
        this.message = message;
        supplier = null;
        open();
    }

    /**
     * Opens a trace whose message is only computed if somebody reads it.
     */
    public Trace(final MessageSupplier supplier) {
        message = null;
        this.supplier = supplier;
        open();
    }

    /**
     * Returns a snapshot of the messages of the calling thread's open traces, innermost first.
     */
    public static List<String> activeTraces() {
        final var stack = stack();
        final var result = new ArrayList<String>(stack.size());
        for (final var trace : stack) {
            result.add(trace.message());
        }
        return List.copyOf(result);
    }

    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        final var stack = stack();
        assert stack.peekFirst() == this : "Traces closed out of order, or by another thread";
        stack.removeFirst();
    }

    private void open() {
        stack().addFirst(this);
    }

    private String message() {
        var result = message;
        if (result == null) {
            assert supplier != null;
            result = supplier.get();
            message = result;
        }
        return result;
    }

    private static Deque<Trace> stack() {
        return stack.get();
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<Deque<Trace>> stack = ThreadLocal.withInitial(ArrayDeque::new);

    private @Nullable String message;
    private final @Nullable MessageSupplier supplier;
}
