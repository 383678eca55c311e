// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.test;

import proofmark.syntax.Syntax;
import proofmark.syntax.tree.CitationField;
import proofmark.syntax.tree.FieldKind;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class BibliographyTest {
    @Test
    void entriesWithContainers() {
        final var bibliography = Syntax.parseBibliography("""
            knuth68 {
                authors { Donald E. Knuth }
                title { Fundamental Algorithms }
                container {
                    container_title { The Art of Computer Programming }
                    version { 1st }
                    publisher { Addison-Wesley }
                }
            }
            empty {}
            """);
        assertThat(bibliography.entries()).extracting(entry -> entry.id().name()).containsExactly("knuth68", "empty");
        final var knuth = bibliography.entries().get(0);
        assertThat(knuth.fields()).hasSize(3);
        assertThat(knuth.fields().get(0)).isInstanceOfSatisfying(CitationField.TextField.class, field -> {
            assertThat(field.kind()).isEqualTo(FieldKind.AUTHORS);
            assertThat(field.value().elements()).extracting(Object::toString)
                .containsExactly("Donald", "E.", "Knuth");
        });
        assertThat(knuth.fields().get(2)).isInstanceOfSatisfying(CitationField.ContainerField.class,
            container -> assertThat(container.fields()).extracting(CitationField.TextField::kind).containsExactly(
                FieldKind.CONTAINER_TITLE,
                FieldKind.VERSION,
                FieldKind.PUBLISHER
            ));
        assertThat(bibliography.entries().get(1).fields()).isEmpty();
    }

    @Test
    void emptyBibliography() {
        assertThat(Syntax.parseBibliography(" \n ").entries()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "a { container { title { Nested title } } }",
        "a { publisher { Entry-level publisher } }",
        "a { title { } }",
        "a { title { Unclosed }",
        "a { container { container { version { 2 } } } }",
    })
    void fieldsAtTheWrongLevel(final String source) {
        assertThat(Syntax.tryParseBibliography(source).isSuccess()).isFalse();
    }
}
