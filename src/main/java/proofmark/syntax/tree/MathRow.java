// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * A row of typeset mathematics, as found between {@code \(} and {@code \)} or {@code \[} and {@code \]}.
 * <p>
 * Rows are purely presentational: unlike {@link Formula}, their items carry no operand/operator structure.
 */
public record MathRow(List<Item> items, Span span) implements Node {
    public MathRow {
        items = List.copyOf(items);
    }

    public sealed interface Item extends Node
        permits VariableItem, IdentifierItem, IntegerItem, Group, BigOperator, OperatorItem, Ellipsis, Separator {
    }

    public record VariableItem(Variable variable) implements Item {
        @Override
        public Span span() {
            return variable.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(variable);
        }
    }

    public record IdentifierItem(Identifier identifier) implements Item {
        @Override
        public Span span() {
            return identifier.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(identifier);
        }
    }

    public record IntegerItem(IntegerLiteral integer) implements Item {
        @Override
        public Span span() {
            return integer.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(integer);
        }
    }

    /**
     * A parenthesized sub-row.
     */
    public record Group(MathRow row, Span span) implements Item {
        @Override
        public List<Node> children() {
            return Nodes.childList(row);
        }
    }

    /**
     * {@code \sqrt{...}} or {@code \pow{...}} applied to one or more comma-separated rows.
     */
    public record BigOperator(Kind kind, List<MathRow> arguments, Span span) implements Item {
        public BigOperator {
            arguments = List.copyOf(arguments);
            assert !arguments.isEmpty() : "Big operator without arguments";
        }

        public enum Kind {
            SQRT("sqrt"),
            POW("pow");

            Kind(final String keyword) {
                this.keyword = keyword;
            }

            public String keyword() {
                return keyword;
            }

            private final String keyword;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(arguments);
        }
    }

    public record OperatorItem(OperatorToken operator) implements Item {
        @Override
        public Span span() {
            return operator.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(operator);
        }
    }

    public record Ellipsis(Span span) implements Item {
    }

    /**
     * A top-level comma.
     */
    public record Separator(Span span) implements Item {
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(items);
    }
}
