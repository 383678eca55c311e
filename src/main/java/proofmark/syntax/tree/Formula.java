// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * A formula of the logic, as a flat, precedence-free chain.
 * <p>
 * No operator precedence or associativity is applied: {@code a -> b /\ c} is a chain of three primaries joined by
 * two operators, in source order. Parentheses are the only grouping recognized. A formula without any operator is
 * just its {@link Primary}.
 */
public sealed interface Formula extends Node permits Formula.Primary, Formula.OperatorChain {
    /**
     * An operand: a symbol, a metavariable or a parenthesized formula.
     */
    sealed interface Primary extends Formula permits SymbolPrimary, VariablePrimary, Parenthesized {
    }

    record SymbolPrimary(Identifier symbol) implements Primary {
        @Override
        public Span span() {
            return symbol.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(symbol);
        }
    }

    record VariablePrimary(Variable variable) implements Primary {
        @Override
        public Span span() {
            return variable.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(variable);
        }
    }

    record Parenthesized(Formula inner, Span span) implements Primary {
        @Override
        public List<Node> children() {
            return Nodes.childList(inner);
        }
    }

    /**
     * {@code prefixes first (operator prefixes operand)*}, with at least one operator somewhere.
     */
    record OperatorChain(List<OperatorToken> prefixes, Primary first, List<Link> links, Span span)
        implements Formula {
        public OperatorChain {
            prefixes = List.copyOf(prefixes);
            links = List.copyOf(links);
            assert !prefixes.isEmpty() || !links.isEmpty() : "Operator chain without operators";
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(prefixes, first, links);
        }
    }

    /**
     * An infix position in an {@link OperatorChain}: the joining operator, any prefix operators, then the operand.
     */
    record Link(OperatorToken operator, List<OperatorToken> prefixes, Primary operand, Span span) implements Node {
        public Link {
            prefixes = List.copyOf(prefixes);
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(operator, prefixes, operand);
        }
    }
}
