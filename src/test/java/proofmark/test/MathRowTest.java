// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.test;

import proofmark.syntax.Syntax;
import proofmark.syntax.tree.MathRow;
import proofmark.syntax.tree.Operator;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class MathRowTest {
    @Test
    void itemsKeepTheirKinds() {
        final var row = Syntax.parseMathRow("'x + 12 * y, ...");
        assertThat(row.items()).extracting(Object::getClass).containsExactly(
            MathRow.VariableItem.class,
            MathRow.OperatorItem.class,
            MathRow.IntegerItem.class,
            MathRow.OperatorItem.class,
            MathRow.IdentifierItem.class,
            MathRow.Separator.class,
            MathRow.Ellipsis.class
        );
        assertThat(((MathRow.IntegerItem) row.items().get(2)).integer().digits()).isEqualTo("12");
    }

    @Test
    void emptyRowIsAllowed() {
        assertThat(Syntax.parseMathRow("   ").items()).isEmpty();
    }

    @Test
    void groupsNest() {
        final var row = Syntax.parseMathRow("(a (b, c))");
        assertThat(row.items()).singleElement().isInstanceOf(MathRow.Group.class);
        final var outer = ((MathRow.Group) row.items().get(0)).row();
        assertThat(outer.items()).hasSize(2);
        final var inner = ((MathRow.Group) outer.items().get(1)).row();
        assertThat(inner.items()).extracting(Object::getClass).containsExactly(
            MathRow.IdentifierItem.class,
            MathRow.Separator.class,
            MathRow.IdentifierItem.class
        );
    }

    @Test
    void bigOperatorArgumentsAreSeparatedByCommas() {
        final var row = Syntax.parseMathRow("\\pow{a + b, 2}");
        final var pow = (MathRow.BigOperator) row.items().get(0);
        assertThat(pow.kind()).isEqualTo(MathRow.BigOperator.Kind.POW);
        assertThat(pow.arguments()).hasSize(2);
        assertThat(pow.arguments().get(0).items()).hasSize(3);
        assertThat(((MathRow.OperatorItem) pow.arguments().get(0).items().get(1)).operator().operator())
            .isEqualTo(Operator.PLUS);
    }

    @Test
    void bigOperatorAllowsTrailingComma() {
        final var sqrt = (MathRow.BigOperator) Syntax.parseMathRow("\\sqrt{ x, }").items().get(0);
        assertThat(sqrt.kind()).isEqualTo(MathRow.BigOperator.Kind.SQRT);
        assertThat(sqrt.arguments()).hasSize(1);
    }

    @Test
    void commasInsideGroupsOfBigOperatorArgumentsAreSeparators() {
        final var sqrt = (MathRow.BigOperator) Syntax.parseMathRow("\\sqrt{(a, b)}").items().get(0);
        assertThat(sqrt.arguments()).hasSize(1);
        final var group = (MathRow.Group) sqrt.arguments().get(0).items().get(0);
        assertThat(group.row().items()).hasSize(3);
    }
}
