// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Something worth telling the installed handlers about. Subclasses carry the details; the message is the summary
 * shown to people.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    public final @NotNull String message() {
        return message;
    }

    /**
     * Returns the message together with whatever context the subclass knows about. Without an override, this is
     * just {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + "[" + message + "]";
    }

    private final @NotNull String message;
}
