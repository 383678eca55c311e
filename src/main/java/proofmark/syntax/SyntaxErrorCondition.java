// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.List;
import proofmark.util.condition.Condition;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A condition type indicating that a source buffer could not be parsed.
 */
public final class SyntaxErrorCondition extends Condition {
    SyntaxErrorCondition(final SyntaxError error, final List<String> traces) {
        super(error.message());
        this.error = error;
        this.traces = List.copyOf(traces);
    }

    public SyntaxError error() {
        return error;
    }

    /**
     * Retrieves the operation traces that were active when the parser got stuck, innermost first.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The list is immutable")
    public List<String> traces() {
        return traces;
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder(message()).append('\n').append(error.position());
        for (final var trace : traces) {
            builder.append("\n - ").append(trace);
        }
        return builder.toString();
    }

    private final SyntaxError error;
    private final List<String> traces;
}
