// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.test;

import proofmark.syntax.Syntax;
import proofmark.syntax.tree.AxiomBlock;
import proofmark.syntax.tree.DefinitionBlock;
import proofmark.syntax.tree.DisplayMath;
import proofmark.syntax.tree.Entry;
import proofmark.syntax.tree.EntryKind;
import proofmark.syntax.tree.Formula;
import proofmark.syntax.tree.Operator;
import proofmark.syntax.tree.Paragraph;
import proofmark.syntax.tree.SymbolBlock;
import proofmark.syntax.tree.SystemBlock;
import proofmark.syntax.tree.TheoremBlock;
import proofmark.syntax.tree.TypeBlock;
import proofmark.syntax.tree.TypeSignature;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

final class DeclarationBlockTest {
    @Test
    void axiomWithName() {
        final var document = Syntax.parseDocument("\\Axiom a : s { name = \"X\"; }");
        assertThat(document.blocks()).singleElement().isInstanceOf(AxiomBlock.class);
        final var axiom = (AxiomBlock) document.blocks().get(0);
        assertThat(axiom.id().name()).isEqualTo("a");
        assertThat(axiom.parentId()).isNotNull();
        assertThat(axiom.parentId().name()).isEqualTo("s");
        assertThat(axiom.entries()).singleElement().isInstanceOf(Entry.NameEntry.class);
        assertThat(((Entry.NameEntry) axiom.entries().get(0)).value().value()).isEqualTo("X");
    }

    @Test
    void systemHasNoParent() {
        final var source = """
            \\System logic {
                name = "Propositional \\"logic\\"";
                description {
                    Some text.
                    \\[ 'a -> 'b \\].
                }
            }
            """;
        final var system = (SystemBlock) Syntax.parseDocument(source).blocks().get(0);
        assertThat(system.id().name()).isEqualTo("logic");
        assertThat(system.parentId()).isNull();
        final var name = (Entry.NameEntry) system.entry(EntryKind.NAME);
        assertThat(name).isNotNull();
        assertThat(name.value().value()).isEqualTo("Propositional \"logic\"");
        final var description = (Entry.DescriptionEntry) system.entry(EntryKind.DESCRIPTION);
        assertThat(description).isNotNull();
        assertThat(description.blocks()).extracting(Object::getClass)
            .containsExactly(Paragraph.class, DisplayMath.class);
        assertThat(((DisplayMath) description.blocks().get(1)).end()).isEqualTo(".");
    }

    @Test
    void typeAndSymbol() {
        final var source = """
            \\Type Prop : logic {}
            \\Symbol neg : logic {
                type = (Prop) -> Prop;
                read = prefix ~;
                tagline { Logical negation }
            }
            """;
        final var blocks = Syntax.parseDocument(source).blocks();
        assertThat(blocks).extracting(Object::getClass).containsExactly(TypeBlock.class, SymbolBlock.class);
        final var symbol = (SymbolBlock) blocks.get(1);
        final var type = (Entry.TypeEntry) symbol.entry(EntryKind.TYPE);
        assertThat(type).isNotNull();
        assertThat(type.signature()).isInstanceOf(TypeSignature.Function.class);
        assertThat(((TypeSignature.Function) type.signature()).parameters()).hasSize(1);
        final var read = (Entry.ReadEntry) symbol.entry(EntryKind.READ);
        assertThat(read).isNotNull();
        assertThat(read.fixity()).isEqualTo(Entry.Fixity.PREFIX);
        assertThat(read.operator().operator()).isEqualTo(Operator.TWIDDLE);
        final var tagline = (Entry.TaglineEntry) symbol.entry(EntryKind.TAGLINE);
        assertThat(tagline).isNotNull();
        assertThat(tagline.text().elements()).hasSize(2);
    }

    @Test
    void definitionEntries() {
        final var source = """
            \\Definition implies : logic {
                name = "Implication";
                type = (Prop, Prop) -> Prop;
                inputs = [p: Prop, q: Prop];
                read = infix ->;
                display = \\( 'p -> 'q \\);
                expanded = !p \\/ q;
            }
            """;
        final var definition = (DefinitionBlock) Syntax.parseDocument(source).blocks().get(0);
        assertThat(definition.entries()).extracting(Entry::kind).containsExactly(
            EntryKind.NAME,
            EntryKind.TYPE,
            EntryKind.INPUTS,
            EntryKind.READ,
            EntryKind.DISPLAY,
            EntryKind.EXPANDED
        );
        final var inputs = (Entry.InputsEntry) definition.entry(EntryKind.INPUTS);
        assertThat(inputs).isNotNull();
        assertThat(inputs.declarations()).extracting(declaration -> declaration.name().name())
            .containsExactly("p", "q");
        final var expanded = (Entry.ExpandedEntry) definition.entry(EntryKind.EXPANDED);
        assertThat(expanded).isNotNull();
        final var chain = (Formula.OperatorChain) expanded.formula();
        assertThat(chain.prefixes()).hasSize(1);
        assertThat(chain.links()).singleElement()
            .satisfies(link -> assertThat(link.operator().operator()).isEqualTo(Operator.OR));
    }

    @ParameterizedTest
    @ValueSource(strings = {"[x: T, y: T]", "[x: T, y: T,]", "[ x : T , y : (T, T) -> T ]"})
    void inputsWithTwoDeclarations(final String list) {
        final var result = Syntax.tryParseDocument(definitionWithInputs(list));
        assertThat(result.isSuccess()).isTrue();
        final var definition = (DefinitionBlock) result.value().blocks().get(0);
        final var inputs = (Entry.InputsEntry) definition.entry(EntryKind.INPUTS);
        assertThat(inputs).isNotNull();
        assertThat(inputs.declarations()).hasSize(2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"[]", "[x: T]", "[x: T,]", "[x: T, y: T, z: T]"})
    void inputsWithOtherArities(final String list) {
        assertThat(Syntax.tryParseDocument(definitionWithInputs(list)).isSuccess()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(TheoremBlock.TheoremKind.class)
    void statementEntries(final TheoremBlock.TheoremKind kind) {
        final var source = "\\" + kind.keyword() + """
             law : logic {
                flags = [reflexive, transitive,];
                vars = [x: Prop, f: (Prop, Prop,) -> Prop];
                premise = [ x; x -> x; ];
                assertion = x;
            }
            """;
        final var theorem = (TheoremBlock) Syntax.parseDocument(source).blocks().get(0);
        assertThat(theorem.kind()).isEqualTo(kind);
        assertThat(theorem.id().name()).isEqualTo("law");
        final var flags = (Entry.FlagsEntry) theorem.entry(EntryKind.FLAGS);
        assertThat(flags).isNotNull();
        assertThat(flags.flags()).containsExactly(Entry.Flag.REFLEXIVE, Entry.Flag.TRANSITIVE);
        final var vars = (Entry.VarsEntry) theorem.entry(EntryKind.VARS);
        assertThat(vars).isNotNull();
        assertThat(vars.declarations()).hasSize(2);
        assertThat(((TypeSignature.Function) vars.declarations().get(1).type()).parameters()).hasSize(2);
        final var premise = (Entry.PremiseEntry) theorem.entry(EntryKind.PREMISE);
        assertThat(premise).isNotNull();
        assertThat(premise.formulas()).hasSize(2);
        assertThat(theorem.entry(EntryKind.ASSERTION)).isNotNull();
    }

    @Test
    void emptyListsAreAllowed() {
        final var axiom = (AxiomBlock) Syntax.parseDocument(
            "\\Axiom a : s { flags = []; vars = []; premise = []; }").blocks().get(0);
        assertThat(axiom.entries()).hasSize(3);
        assertThat(((Entry.FlagsEntry) axiom.entries().get(0)).flags()).isEmpty();
    }

    @Test
    void repeatedEntriesAreKeptInOrder() {
        final var axiom = (AxiomBlock) Syntax.parseDocument(
            "\\Axiom a : s { name = \"X\"; assertion = a; name = \"Y\"; }").blocks().get(0);
        assertThat(axiom.entries(EntryKind.NAME))
            .extracting(entry -> ((Entry.NameEntry) entry).value().value())
            .containsExactly("X", "Y");
        assertThat(((Entry.NameEntry) axiom.entry(EntryKind.NAME)).value().value()).isEqualTo("X");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "\\Axiom a : s { type = Prop; }",
        "\\Type t : s { assertion = a; }",
        "\\System s : parent { }",
        "\\Axiom a { }",
        "\\Axioms a : s { }",
        "\\Symbol x : s { read = postfix ~; }",
        "\\Axiom a : s { flags = [commutative]; }",
    })
    void rejected(final String source) {
        assertThat(Syntax.tryParseDocument(source).isSuccess()).isFalse();
    }

    private static String definitionWithInputs(final String list) {
        return "\\Definition d : s { inputs = " + list + "; }";
    }
}
