// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import proofmark.util.ExecutorUtils;
import proofmark.util.Trace;
import proofmark.util.condition.Condition;
import proofmark.util.condition.ConditionContext;
import proofmark.util.condition.Handler;
import proofmark.util.condition.HandlerProcedure;
import proofmark.util.condition.UnhandledErrorError;
import proofmark.util.condition.Unwind;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class ExecutorUtilsTest {
    @BeforeEach
    void startExecutor() {
        executorService = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void stopExecutor() {
        executorService.shutdownNow();
    }

    @Test
    void resultsAreInInputOrder() throws Unwind, InterruptedException {
        final var inputs = new ArrayList<Integer>();
        for (var i = 0; i < 100; i += 1) {
            inputs.add(i);
        }
        final List<Integer> results = ExecutorUtils.map(executorService, inputs, input -> input * input);
        for (var i = 0; i < inputs.size(); i += 1) {
            assertThat(results.get(i)).isEqualTo(i * i);
        }
    }

    @Test
    void tasksRunUnderATrace() throws Unwind, InterruptedException {
        try (final var trace = new Trace("Outer")) {
            trace.use();
            final List<List<String>> results =
                ExecutorUtils.map(executorService, List.of("a", "b"), input -> Trace.activeTraces());
            assertThat(Trace.activeTraces()).containsExactly("Outer");
            assertThat(results.get(1)).hasSize(1);
            assertThat(results.get(1).get(0)).startsWith("Processing input #1 in thread ");
        }
    }

    @Test
    void threadSafeHandlersCanUnwindToTheCaller() {
        final var handled = new AtomicInteger();
        final var result = ConditionContext.withRestart("abort-batch", restart -> {
            try (final var handler = new Handler((HandlerProcedure.ThreadSafe) signaled -> {
                handled.incrementAndGet();
                restart.unwindTo();
            })) {
                handler.use();
                return ExecutorUtils.map(executorService, List.of(1, 2, 3), input -> {
                    if (input == 2) {
                        throw ConditionContext.error(new TestCondition("Input two"));
                    }
                    return input;
                });
            } catch (final InterruptedException e) {
                throw new AssertionError("Interrupted", e);
            }
        });
        assertThat(result).isNull();
        assertThat(handled.get()).isEqualTo(1);
    }

    @Test
    void otherHandlersStayInTheirThread() {
        assertThatThrownBy(() -> {
            try (final var handler = new Handler(signaled -> {
                throw new IllegalStateException("Ran in a worker");
            })) {
                handler.use();
                ExecutorUtils.map(executorService, List.of(1), input -> {
                    throw ConditionContext.error(new TestCondition("Nobody listens"));
                });
            }
        }).isInstanceOf(UnhandledErrorError.class);
    }

    @Test
    void runtimeExceptionsPassThrough() {
        assertThatThrownBy(() -> ExecutorUtils.map(executorService, List.of("x"), Integer::parseInt))
            .isInstanceOf(NumberFormatException.class);
    }

    private ExecutorService executorService;

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
