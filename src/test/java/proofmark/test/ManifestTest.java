// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.test;

import proofmark.syntax.Syntax;
import proofmark.syntax.tree.Book;
import proofmark.syntax.tree.Chapter;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class ManifestTest {
    @Test
    void twoBooksWithOneChapterOfTwoPagesEach() {
        final var manifest = Syntax.parseManifest("""
            algebra: "Algebra" {
                A first course.
                [
                    groups: "Groups" { Sets with structure. [
                        intro: "Introduction",
                        axioms: "The group axioms",
                    ] }
                ]
            }
            logic: "Logic" { Reasoning, formally. [
                props: "Propositions" { Basics. [ p2: "Second", p1: "First", ] }
            ] }
            """);
        assertThat(manifest.books()).extracting(book -> book.id().name()).containsExactly("algebra", "logic");
        for (final var book : manifest.books()) {
            assertThat(book.chapters()).hasSize(1);
            assertThat(book.chapters().get(0).pages()).hasSize(2);
        }
        final Book algebra = manifest.books().get(0);
        assertThat(algebra.title().value()).isEqualTo("Algebra");
        assertThat(algebra.description().elements()).extracting(Object::toString)
            .containsExactly("A", "first", "course.");
        final Chapter props = manifest.books().get(1).chapters().get(0);
        assertThat(props.title().value()).isEqualTo("Propositions");
        assertThat(props.pages()).extracting(page -> page.id().name()).containsExactly("p2", "p1");
        assertThat(props.pages()).extracting(page -> page.title().value()).containsExactly("Second", "First");
    }

    @Test
    void chaptersAndPagesMayBeEmpty() {
        final var manifest = Syntax.parseManifest("b: \"B\" { Nothing yet. [ c: \"C\" { Soon. [] } ] }");
        assertThat(manifest.books().get(0).chapters().get(0).pages()).isEmpty();
        assertThat(Syntax.parseManifest("b: \"B\" { Empty. [] }").books().get(0).chapters()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "   \n",
        "b: \"B\" { No brackets. }",
        "b: \"B\" { [] }",
        "b: \"B\" { Missing comma. [ c: \"C\" { Text. [ p: \"P\" ] } ] }",
        "b: \"B\" { Two\nlines. [] }",
        "b: \"B\" { Text. [] } trailing",
    })
    void rejected(final String source) {
        assertThat(Syntax.tryParseManifest(source).isSuccess()).isFalse();
    }
}
