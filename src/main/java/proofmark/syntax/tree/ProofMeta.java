// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * An item between the bars of a {@link ProofStep}.
 */
public sealed interface ProofMeta extends Node permits ProofMeta.Justification, ProofMeta.StepReference, Tag {
    /**
     * The evidence for a step: a built-in rule or a named declaration.
     */
    sealed interface Justification extends ProofMeta permits MacroJustification, NamedJustification {
    }

    record MacroJustification(Kind kind, Span span) implements Justification {
        public enum Kind {
            BY_DEFINITION("!def"),
            BY_FUNCTION_APPLICATION("!app"),
            BY_SUBSTITUTION("!sub");

            Kind(final String spelling) {
                this.spelling = spelling;
            }

            public String spelling() {
                return spelling;
            }

            private final String spelling;
        }
    }

    /**
     * A justification naming an axiom, theorem or definition. The name is not resolved here.
     */
    record NamedJustification(Identifier identifier) implements Justification {
        @Override
        public Span span() {
            return identifier.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(identifier);
        }
    }

    /**
     * A reference to an earlier step by its number.
     */
    record StepReference(IntegerLiteral line) implements ProofMeta {
        @Override
        public Span span() {
            return line.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(line);
        }
    }
}
