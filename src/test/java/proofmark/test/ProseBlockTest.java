// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.test;

import java.util.List;
import proofmark.syntax.Syntax;
import proofmark.syntax.tree.CitationField;
import proofmark.syntax.tree.DisplayMath;
import proofmark.syntax.tree.DocumentBlock;
import proofmark.syntax.tree.FieldKind;
import proofmark.syntax.tree.HeadingBlock;
import proofmark.syntax.tree.ListBlock;
import proofmark.syntax.tree.Paragraph;
import proofmark.syntax.tree.QuoteBlock;
import proofmark.syntax.tree.RawCitation;
import proofmark.syntax.tree.Sublist;
import proofmark.syntax.tree.TableBlock;
import proofmark.syntax.tree.TodoBlock;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

final class ProseBlockTest {
    @ParameterizedTest
    @EnumSource(ListBlock.Kind.class)
    void lists(final ListBlock.Kind kind) {
        final var list = (ListBlock) single("\\" + kind.keyword() + """
             {
                \\Item { First item. }
                \\Item {
                    Second item,
                    over two lines.
                }
            }
            """);
        assertThat(list.kind()).isEqualTo(kind);
        assertThat(list.items()).hasSize(2);
        assertThat(list.items().get(1).content().elements()).hasSize(5);
    }

    @Test
    void emptyListItemIsRejected() {
        assertThat(Syntax.tryParseDocument("\\UnorderedList { \\Item { } }").isSuccess()).isFalse();
    }

    @Test
    void fullTable() {
        final var table = (TableBlock) single("""
            \\Table {
                \\Head { \\Row {Operator} {Meaning} }
                \\Body {
                    \\Row {\\( -> \\)} {implication}
                    \\Row {} {nothing}
                }
                \\Foot { \\Row {end} }
                \\Caption { Operators & meanings }
            }
            """);
        assertThat(table.head()).isNotNull();
        assertThat(table.head().rows()).singleElement()
            .satisfies(row -> assertThat(row.cells()).hasSize(2));
        assertThat(table.body()).isNotNull();
        assertThat(table.body().rows()).hasSize(2);
        assertThat(table.body().rows().get(1).cells().get(0).content()).isNull();
        assertThat(table.foot()).isNotNull();
        assertThat(table.caption()).isNotNull();
        assertThat(table.caption().elements()).hasSize(3);
    }

    @Test
    void tableSectionsAreOptional() {
        final var table = (TableBlock) single("\\Table { \\Body { \\Row {a} } }");
        assertThat(table.head()).isNull();
        assertThat(table.body()).isNotNull();
        assertThat(table.foot()).isNull();
        assertThat(table.caption()).isNull();
        assertThat(((TableBlock) single("\\Table {}")).body()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "\\Table { \\Foot { \\Row {a} } \\Head { \\Row {b} } }",
        "\\Table { \\Body { \\Row } }",
        "\\Table { \\Caption { [bracketed] } }",
    })
    void malformedTables(final String source) {
        assertThat(Syntax.tryParseDocument(source).isSuccess()).isFalse();
    }

    @Test
    void quoteWithOriginal() {
        final var quote = (QuoteBlock) single("""
            \\Quote {
                \\Original { Alea iacta est. }
                \\Value { The die is cast. }
            }
            """);
        assertThat(quote.original()).isNotNull();
        assertThat(quote.original().elements()).extracting(Object::toString)
            .containsExactly("Alea", "iacta", "est.");
        assertThat(quote.value().elements()).hasSize(4);
    }

    @Test
    void quoteWithoutOriginal() {
        final var quote = (QuoteBlock) single("\\Quote { \\Value { Hello. } }");
        assertThat(quote.original()).isNull();
        assertThat(Syntax.tryParseDocument("\\Quote { \\Original { Hello. } }").isSuccess()).isFalse();
    }

    @Test
    void headingLevels() {
        final var blocks = Syntax.parseDocument("""
            # Chapter one
            ## A section
            ### A subsection
            Body text.
            """).blocks();
        assertThat(blocks).extracting(Object::getClass).containsExactly(HeadingBlock.class, Paragraph.class);
        final var heading = (HeadingBlock) blocks.get(0);
        assertThat(heading.subheadings()).extracting(HeadingBlock.Subheading::level).containsExactly(1, 2, 3);
        assertThat(heading.subheadings().get(1).text().elements()).extracting(Object::toString)
            .containsExactly("A", "section");
    }

    @Test
    void headingNeedsSpaceAfterHashes() {
        assertThat(Syntax.tryParseDocument("#Title").isSuccess()).isFalse();
    }

    @Test
    void todoHoldsTextBlocks() {
        final var todo = (TodoBlock) single("""
            \\Todo {
                Prove this.

                \\[ 'x \\]
            }
            """);
        assertThat(todo.blocks()).extracting(Object::getClass).containsExactly(Paragraph.class, DisplayMath.class);
        assertThat(((TodoBlock) single("\\Todo {}")).blocks()).isEmpty();
    }

    @Test
    void sublist() {
        final var sublist = (Sublist) single("\\Sublist { 'x >>> a + b; 'y >>> (c); }");
        assertThat(sublist.items()).extracting(item -> item.variable().name()).containsExactly("x", "y");
        assertThat(sublist.items().get(0).replacement().items()).hasSize(3);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", ".", ",", "?!", ".;:"})
    void displayMathKeepsTrailingPunctuation(final String punctuation) {
        final var math = (DisplayMath) single("\\[ 'a = 'b \\]" + punctuation);
        assertThat(math.end()).isEqualTo(punctuation);
        assertThat(math.row().items()).hasSize(3);
    }

    @Test
    void rawCitation() {
        final var citation = (RawCitation) single("""
            \\Citation {
                authors { Donald Knuth }
                title { The Art of Computer Programming }
                container { publisher { Addison-Wesley } publication_date { 1968 } }
            }
            """);
        assertThat(citation.fields()).hasSize(3);
        assertThat(citation.fields().get(2)).isInstanceOfSatisfying(CitationField.ContainerField.class,
            container -> assertThat(container.fields()).extracting(CitationField.TextField::kind)
                .containsExactly(FieldKind.PUBLISHER, FieldKind.PUBLICATION_DATE));
    }

    @Test
    void blocksInSourceOrder() {
        final List<DocumentBlock> blocks = Syntax.parseDocument("""
            Intro.

            \\OrderedList { \\Item { one } }
            \\Todo { later }
            Outro.
            """).blocks();
        assertThat(blocks).extracting(Object::getClass)
            .containsExactly(Paragraph.class, ListBlock.class, TodoBlock.class, Paragraph.class);
    }

    private static DocumentBlock single(final String source) {
        final var blocks = Syntax.parseDocument(source).blocks();
        assertThat(blocks).hasSize(1);
        return blocks.get(0);
    }
}
