// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of a parse that is allowed to fail: either the tree or the error.
 */
public sealed interface ParseResult<T> permits ParseResult.Success, ParseResult.Failure {
    boolean isSuccess();

    /**
     * Returns the tree, or throws {@link IllegalStateException} if the parse failed.
     */
    T value();

    /**
     * Returns the error, or {@code null} if the parse succeeded.
     */
    @Nullable SyntaxError error();

    <R> ParseResult<R> map(Function<? super T, ? extends R> function);

    record Success<T>(T value) implements ParseResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public @Nullable SyntaxError error() {
            return null;
        }

        @Override
        public <R> ParseResult<R> map(final Function<? super T, ? extends R> function) {
            return new Success<>(function.apply(value));
        }
    }

    record Failure<T>(SyntaxError syntaxError) implements ParseResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Parse failed: " + syntaxError);
        }

        @Override
        public SyntaxError error() {
            return syntaxError;
        }

        @Override
        public <R> ParseResult<R> map(final Function<? super T, ? extends R> function) {
            return new Failure<>(syntaxError);
        }
    }
}
