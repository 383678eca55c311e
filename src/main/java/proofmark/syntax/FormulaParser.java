// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.ArrayList;
import java.util.List;
import proofmark.syntax.tree.Formula;
import proofmark.syntax.tree.MathRow;
import proofmark.syntax.tree.OperatorToken;
import proofmark.syntax.tree.Span;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses the two mathematical sub-languages: formulas of the logic, and presentational math rows.
 * <p>
 * Formulas are parsed into flat {@link Formula.OperatorChain}s. Deciding precedence, associativity and whether an
 * operator is used as prefix or infix is left to later passes.
 */
final class FormulaParser {
    FormulaParser(final Scanner scanner) {
        this.scanner = scanner;
    }

    /**
     * {@code operator* primary (operator operator* primary)*}.
     */
    @Nullable Formula formula() {
        return scanner.attempt(this::formulaImpl);
    }

    /**
     * A possibly empty sequence of math items. Never fails.
     *
     * @param insideBigOperator Whether commas separate big operator arguments rather than being row items.
     */
    MathRow mathRow(final boolean insideBigOperator) {
        scanner.skipWhitespace();
        final var start = scanner.position();
        var end = start;
        final var items = new ArrayList<MathRow.Item>();
        while (true) {
            final var item = mathItem(insideBigOperator);
            if (item == null) {
                break;
            }
            items.add(item);
            end = item.span().end();
        }
        return new MathRow(items, new Span(start, end));
    }

    private @Nullable Formula formulaImpl() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        final var prefixes = prefixRun();
        final var first = primary();
        if (first == null) {
            return null;
        }
        final var links = new ArrayList<Formula.Link>();
        while (true) {
            final var link = scanner.attempt(this::link);
            if (link == null) {
                break;
            }
            links.add(link);
        }
        if (prefixes.isEmpty() && links.isEmpty()) {
            return first;
        }
        return new Formula.OperatorChain(prefixes, first, links, scanner.spanFrom(start));
    }

    private Formula.@Nullable Link link() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        final var operator = scanner.operator();
        if (operator == null) {
            return null;
        }
        final var prefixes = prefixRun();
        final var operand = primary();
        if (operand == null) {
            return null;
        }
        return new Formula.Link(operator, prefixes, operand, scanner.spanFrom(start));
    }

    private List<OperatorToken> prefixRun() {
        final var result = new ArrayList<OperatorToken>();
        while (true) {
            final var operator = scanner.operator();
            if (operator == null) {
                return result;
            }
            result.add(operator);
        }
    }

    private Formula.@Nullable Primary primary() {
        final var identifier = scanner.identifier();
        if (identifier != null) {
            return new Formula.SymbolPrimary(identifier);
        }
        final var variable = scanner.variable();
        if (variable != null) {
            return new Formula.VariablePrimary(variable);
        }
        return scanner.attempt(this::parenthesized);
    }

    private Formula.@Nullable Parenthesized parenthesized() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.token("(")) {
            return null;
        }
        final var inner = scanner.nested(this::formula);
        if (inner == null || !scanner.closing(")")) {
            return null;
        }
        return new Formula.Parenthesized(inner, scanner.spanFrom(start));
    }

    private MathRow.@Nullable Item mathItem(final boolean insideBigOperator) {
        final var bigOperator = scanner.attempt(this::bigOperator);
        if (bigOperator != null) {
            return bigOperator;
        }
        final var group = scanner.attempt(this::group);
        if (group != null) {
            return group;
        }
        final var variable = scanner.variable();
        if (variable != null) {
            return new MathRow.VariableItem(variable);
        }
        final var integer = scanner.integer();
        if (integer != null) {
            return new MathRow.IntegerItem(integer);
        }
        final var identifier = scanner.identifier();
        if (identifier != null) {
            return new MathRow.IdentifierItem(identifier);
        }
        return scanner.attempt(() -> punctuationItem(insideBigOperator));
    }

    private MathRow.@Nullable Item punctuationItem(final boolean insideBigOperator) {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (scanner.token("...")) {
            return new MathRow.Ellipsis(scanner.spanFrom(start));
        }
        if (!insideBigOperator && scanner.token(",")) {
            return new MathRow.Separator(scanner.spanFrom(start));
        }
        final var operator = scanner.operator();
        return (operator != null) ? new MathRow.OperatorItem(operator) : null;
    }

    private MathRow.@Nullable Group group() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.token("(")) {
            return null;
        }
        final var row = scanner.nested(() -> mathRow(false));
        if (!scanner.closing(")")) {
            return null;
        }
        return new MathRow.Group(row, scanner.spanFrom(start));
    }

    private MathRow.@Nullable BigOperator bigOperator() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        final MathRow.BigOperator.Kind kind;
        if (scanner.keyword(MathRow.BigOperator.Kind.SQRT.keyword())) {
            kind = MathRow.BigOperator.Kind.SQRT;
        } else if (scanner.keyword(MathRow.BigOperator.Kind.POW.keyword())) {
            kind = MathRow.BigOperator.Kind.POW;
        } else {
            return null;
        }
        if (!scanner.token("{")) {
            return null;
        }
        final var arguments = scanner.nested(this::bigOperatorArguments);
        if (arguments == null) {
            return null;
        }
        return new MathRow.BigOperator(kind, arguments, scanner.spanFrom(start));
    }

    // Consumes the closing brace too; a trailing comma before it is allowed.
    private @Nullable List<MathRow> bigOperatorArguments() {
        final var arguments = new ArrayList<MathRow>();
        arguments.add(mathRow(true));
        while (scanner.token(",")) {
            if (scanner.closing("}")) {
                return arguments;
            }
            arguments.add(mathRow(true));
        }
        return scanner.closing("}") ? arguments : null;
    }

    private final Scanner scanner;
}
