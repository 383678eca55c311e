// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.stream.Stream;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

final class ParagraphBoundaryTest {
    @ParameterizedTest
    @MethodSource("paragraphs")
    void paragraphStopsBeforeTheSeparatorRun(final String source, final int end, final int elements) {
        final var scanner = new Scanner(source, ParseOptions.DEFAULT);
        final var markup = new MarkupParser(scanner, new FormulaParser(scanner));
        final var paragraph = markup.paragraph();
        assertThat(paragraph).isNotNull();
        assertThat(paragraph.elements()).hasSize(elements);
        assertThat(scanner.position()).isEqualTo(end);
        assertThat(paragraph.span().end()).isEqualTo(end);
    }

    private static Stream<Arguments> paragraphs() {
        return Stream.of(
            Arguments.of("foo\n\nbar", 3, 1),
            Arguments.of("foo bar\n \n\tx", 7, 2),
            Arguments.of("foo\nbar", 7, 2),
            Arguments.of("foo  ", 3, 1)
        );
    }
}
