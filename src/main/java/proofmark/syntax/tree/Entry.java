// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * A named entry of a {@link DeclarationBlock}.
 */
public sealed interface Entry extends Node
    permits Entry.NameEntry, Entry.TaglineEntry, Entry.DescriptionEntry, Entry.TypeEntry, Entry.ReadEntry,
    Entry.DisplayEntry, Entry.InputsEntry, Entry.ExpandedEntry, Entry.FlagsEntry, Entry.VarsEntry,
    Entry.PremiseEntry, Entry.AssertionEntry {
    EntryKind kind();

    /**
     * {@code name = "Human readable name";}
     */
    record NameEntry(StringLiteral value, Span span) implements Entry {
        @Override
        public EntryKind kind() {
            return EntryKind.NAME;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(value);
        }
    }

    /**
     * {@code tagline { single line of text }}
     */
    record TaglineEntry(Paragraph text, Span span) implements Entry {
        @Override
        public EntryKind kind() {
            return EntryKind.TAGLINE;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(text);
        }
    }

    record DescriptionEntry(List<TextBlock> blocks, Span span) implements Entry {
        public DescriptionEntry {
            blocks = List.copyOf(blocks);
        }

        @Override
        public EntryKind kind() {
            return EntryKind.DESCRIPTION;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(blocks);
        }
    }

    record TypeEntry(TypeSignature signature, Span span) implements Entry {
        @Override
        public EntryKind kind() {
            return EntryKind.TYPE;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(signature);
        }
    }

    /**
     * {@code read = prefix ~;} or {@code read = infix ->;}: how a symbol is written in formulas.
     */
    record ReadEntry(Fixity fixity, OperatorToken operator, Span span) implements Entry {
        @Override
        public EntryKind kind() {
            return EntryKind.READ;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(operator);
        }
    }

    record DisplayEntry(MathRow row, Span span) implements Entry {
        @Override
        public EntryKind kind() {
            return EntryKind.DISPLAY;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(row);
        }
    }

    /**
     * {@code inputs = [x: T, y: T];}. The syntax admits exactly two declarations.
     */
    record InputsEntry(VariableDeclaration first, VariableDeclaration second, Span span) implements Entry {
        public List<VariableDeclaration> declarations() {
            return List.of(first, second);
        }

        @Override
        public EntryKind kind() {
            return EntryKind.INPUTS;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(first, second);
        }
    }

    record ExpandedEntry(Formula formula, Span span) implements Entry {
        @Override
        public EntryKind kind() {
            return EntryKind.EXPANDED;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(formula);
        }
    }

    record FlagsEntry(List<Flag> flags, Span span) implements Entry {
        public FlagsEntry {
            flags = List.copyOf(flags);
        }

        @Override
        public EntryKind kind() {
            return EntryKind.FLAGS;
        }
    }

    record VarsEntry(List<VariableDeclaration> declarations, Span span) implements Entry {
        public VarsEntry {
            declarations = List.copyOf(declarations);
        }

        @Override
        public EntryKind kind() {
            return EntryKind.VARS;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(declarations);
        }
    }

    /**
     * {@code premise = [ f1; f2; ];}, possibly empty.
     */
    record PremiseEntry(List<Formula> formulas, Span span) implements Entry {
        public PremiseEntry {
            formulas = List.copyOf(formulas);
        }

        @Override
        public EntryKind kind() {
            return EntryKind.PREMISE;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(formulas);
        }
    }

    record AssertionEntry(Formula formula, Span span) implements Entry {
        @Override
        public EntryKind kind() {
            return EntryKind.ASSERTION;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(formula);
        }
    }

    enum Fixity {
        PREFIX("prefix"),
        INFIX("infix");

        Fixity(final String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        private final String keyword;
    }

    /**
     * Algebraic properties a statement declares about the relation or function it defines.
     */
    enum Flag {
        REFLEXIVE("reflexive"),
        SYMMETRIC("symmetric"),
        TRANSITIVE("transitive"),
        FUNCTION("function");

        Flag(final String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        private final String keyword;
    }
}
