// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.test;

import java.util.stream.Stream;
import proofmark.syntax.Syntax;
import proofmark.syntax.tree.Formula;
import proofmark.syntax.tree.Identifier;
import proofmark.syntax.tree.Operator;
import proofmark.syntax.tree.OperatorToken;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class FormulaTest {
    @Test
    void implicationIsOneLink() {
        final var chain = chain("a->b");
        assertThat(chain.prefixes()).isEmpty();
        assertThat(symbolName(chain.first())).isEqualTo("a");
        assertThat(chain.links()).hasSize(1);
        final var link = chain.links().get(0);
        assertThat(link.operator().operator()).isEqualTo(Operator.IMPLICATION);
        assertThat(link.prefixes()).isEmpty();
        assertThat(symbolName(link.operand())).isEqualTo("b");
    }

    @Test
    void equivalenceIsNotLessThan() {
        assertThat(chain("a<->b").links().get(0).operator().operator()).isEqualTo(Operator.EQUIVALENCE);
        assertThat(chain("a<b").links().get(0).operator().operator()).isEqualTo(Operator.LESS_THAN);
        assertThat(chain("a - > b").links().get(0).operator().operator()).isEqualTo(Operator.MINUS);
    }

    @ParameterizedTest
    @EnumSource(Operator.class)
    void everyOperatorJoinsTwoOperands(final Operator operator) {
        final var chain = chain("x " + operator.spelling() + " y");
        assertThat(chain.links()).singleElement()
            .extracting(link -> link.operator().operator())
            .isEqualTo(operator);
    }

    @Test
    void chainsStayFlatInSourceOrder() {
        final var chain = chain("a -> b /\\ c \\/ d");
        assertThat(chain.links())
            .extracting(link -> link.operator().operator())
            .containsExactly(Operator.IMPLICATION, Operator.AND, Operator.OR);
        assertThat(chain.links())
            .extracting(link -> symbolName(link.operand()))
            .containsExactly("b", "c", "d");
    }

    @Test
    void prefixOperatorsAreKeptInBothPositions() {
        final var chain = chain("!!a = ~ 'b");
        assertThat(chain.prefixes()).extracting(OperatorToken::operator)
            .containsExactly(Operator.NEGATION, Operator.NEGATION);
        final var link = chain.links().get(0);
        assertThat(link.operator().operator()).isEqualTo(Operator.EQUAL);
        assertThat(link.prefixes()).extracting(OperatorToken::operator).containsExactly(Operator.TWIDDLE);
        assertThat(link.operand()).isInstanceOf(Formula.VariablePrimary.class);
        assertThat(((Formula.VariablePrimary) link.operand()).variable().name()).isEqualTo("b");
    }

    @Test
    void formulaWithoutOperatorsIsItsPrimary() {
        assertThat(Syntax.parseFormula("  alpha ")).isInstanceOf(Formula.SymbolPrimary.class);
        assertThat(Syntax.parseFormula("'x")).isInstanceOf(Formula.VariablePrimary.class);
    }

    @Test
    void parenthesesGroup() {
        final var formula = Syntax.parseFormula("(a -> b) -> c");
        assertThat(formula).isInstanceOf(Formula.OperatorChain.class);
        final var chain = (Formula.OperatorChain) formula;
        assertThat(chain.first()).isInstanceOf(Formula.Parenthesized.class);
        final var inner = ((Formula.Parenthesized) chain.first()).inner();
        assertThat(inner).isInstanceOf(Formula.OperatorChain.class);
        assertThat(((Formula.OperatorChain) inner).links()).hasSize(1);
        assertThat(chain.links()).hasSize(1);
    }

    @ParameterizedTest
    @MethodSource("spans")
    void spansCoverTheFormula(final String source, final int start, final int end) {
        final var span = Syntax.parseFormula(source).span();
        assertThat(span.start()).isEqualTo(start);
        assertThat(span.end()).isEqualTo(end);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "->", "a ->", "(a", "a b", "'", "a -> (b"})
    void malformedFormulasFail(final String source) {
        assertThat(Syntax.tryParseFormula(source).isSuccess()).isFalse();
    }

    static Stream<Object[]> spans() {
        return Stream.of(
            new Object[]{"a", 0, 1},
            new Object[]{"  a -> b  ", 2, 8},
            new Object[]{"!(a)", 0, 4}
        );
    }

    private static Formula.OperatorChain chain(final String source) {
        final var formula = Syntax.parseFormula(source);
        assertThat(formula).isInstanceOf(Formula.OperatorChain.class);
        return (Formula.OperatorChain) formula;
    }

    private static String symbolName(final Formula.Primary primary) {
        assertThat(primary).isInstanceOf(Formula.SymbolPrimary.class);
        final Identifier symbol = ((Formula.SymbolPrimary) primary).symbol();
        return symbol.name();
    }
}
