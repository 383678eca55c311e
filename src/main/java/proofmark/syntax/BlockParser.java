// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import proofmark.syntax.tree.AxiomBlock;
import proofmark.syntax.tree.DefinitionBlock;
import proofmark.syntax.tree.Entry;
import proofmark.syntax.tree.EntryKind;
import proofmark.syntax.tree.Formula;
import proofmark.syntax.tree.Identifier;
import proofmark.syntax.tree.ProofBlock;
import proofmark.syntax.tree.ProofElement;
import proofmark.syntax.tree.ProofMeta;
import proofmark.syntax.tree.ProofStep;
import proofmark.syntax.tree.SymbolBlock;
import proofmark.syntax.tree.SystemBlock;
import proofmark.syntax.tree.TheoremBlock;
import proofmark.syntax.tree.TypeBlock;
import proofmark.syntax.tree.TypeSignature;
import proofmark.syntax.tree.VariableDeclaration;
import proofmark.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses declaration blocks and proofs.
 * <p>
 * Every declaration has the shape {@code \Keyword id [: parent] { entry* }}; the keyword decides which entry kinds
 * are legal inside. Entries may come in any order and may repeat.
 */
final class BlockParser {
    BlockParser(final Scanner scanner, final FormulaParser formulas, final MarkupParser markup) {
        this.scanner = scanner;
        this.formulas = formulas;
        this.markup = markup;
    }

    @Nullable SystemBlock systemBlock() {
        return scanner.attempt(() -> {
            final var header = header("System", false);
            if (header == null) {
                return null;
            }
            final var entries = body(header, EntryKind.commonEntries());
            return (entries != null) ? new SystemBlock(header.id, entries, scanner.spanFrom(header.start)) : null;
        });
    }

    @Nullable TypeBlock typeBlock() {
        return scanner.attempt(() -> {
            final var header = header("Type", true);
            if (header == null) {
                return null;
            }
            final var entries = body(header, EntryKind.commonEntries());
            return (entries != null) ? new TypeBlock(header.id, parentOf(header), entries, scanner.spanFrom(
                header.start)) : null;
        });
    }

    @Nullable SymbolBlock symbolBlock() {
        return scanner.attempt(() -> {
            final var header = header("Symbol", true);
            if (header == null) {
                return null;
            }
            final var entries = body(header, EntryKind.symbolEntries());
            return (entries != null) ? new SymbolBlock(header.id, parentOf(header), entries, scanner.spanFrom(
                header.start)) : null;
        });
    }

    @Nullable DefinitionBlock definitionBlock() {
        return scanner.attempt(() -> {
            final var header = header("Definition", true);
            if (header == null) {
                return null;
            }
            final var entries = body(header, EntryKind.definitionEntries());
            return (entries != null) ? new DefinitionBlock(header.id, parentOf(header), entries, scanner.spanFrom(
                header.start)) : null;
        });
    }

    @Nullable AxiomBlock axiomBlock() {
        return scanner.attempt(() -> {
            final var header = header("Axiom", true);
            if (header == null) {
                return null;
            }
            final var entries = body(header, EntryKind.statementEntries());
            return (entries != null) ? new AxiomBlock(header.id, parentOf(header), entries, scanner.spanFrom(
                header.start)) : null;
        });
    }

    /**
     * {@code \Theorem}, {@code \Lemma} or {@code \Example}, which share their syntax.
     */
    @Nullable TheoremBlock theoremBlock() {
        for (final var kind : TheoremBlock.TheoremKind.values()) {
            final var block = scanner.attempt(() -> {
                final var header = header(kind.keyword(), true);
                if (header == null) {
                    return null;
                }
                final var entries = body(header, EntryKind.statementEntries());
                return (entries != null) ? new TheoremBlock(kind, header.id, parentOf(header), entries,
                    scanner.spanFrom(header.start)) : null;
            });
            if (block != null) {
                return block;
            }
        }
        return null;
    }

    /**
     * {@code \Proof theorem : system { (proof_step | text_block)* }}.
     */
    @Nullable ProofBlock proofBlock() {
        return scanner.attempt(() -> {
            final var header = header("Proof", true);
            if (header == null) {
                return null;
            }
            try (final var trace = new Trace(() -> "Parsing \\Proof " + header.id.name())) {
                trace.use();
                final var elements = new ArrayList<ProofElement>();
                while (true) {
                    final var element = proofElement();
                    if (element == null) {
                        break;
                    }
                    elements.add(element);
                }
                if (!scanner.closing("}")) {
                    return null;
                }
                return new ProofBlock(header.id, parentOf(header), elements, scanner.spanFrom(header.start));
            }
        });
    }

    /**
     * {@code name : type}.
     */
    @Nullable VariableDeclaration variableDeclaration() {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            final var start = scanner.position();
            final var name = scanner.identifier();
            if (name == null || !scanner.token(":")) {
                return null;
            }
            final var type = typeSignature();
            return (type != null) ? new VariableDeclaration(name, type, scanner.spanFrom(start)) : null;
        });
    }

    /**
     * {@code (T, ...) -> R} or a plain type name.
     */
    @Nullable TypeSignature typeSignature() {
        final var function = scanner.attempt(this::functionSignature);
        if (function != null) {
            return function;
        }
        final var name = scanner.identifier();
        return (name != null) ? new TypeSignature.Named(name) : null;
    }

    private @Nullable Header header(final String keyword, final boolean hasParent) {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.keyword(keyword)) {
            return null;
        }
        final var id = scanner.identifier();
        if (id == null) {
            return null;
        }
        @Nullable Identifier parentId = null;
        if (hasParent) {
            if (!scanner.token(":")) {
                return null;
            }
            parentId = scanner.identifier();
            if (parentId == null) {
                return null;
            }
        }
        if (!scanner.token("{")) {
            return null;
        }
        return new Header(start, keyword, id, parentId);
    }

    // Entries up to and including the closing brace.
    private @Nullable List<Entry> body(final Header header, final Set<EntryKind> allowed) {
        try (final var trace = new Trace(() -> "Parsing \\" + header.keyword + " " + header.id.name())) {
            trace.use();
            final var entries = new ArrayList<Entry>();
            outer:
            while (true) {
                for (final var kind : allowed) {
                    final var entry = scanner.attempt(() -> entry(kind));
                    if (entry != null) {
                        entries.add(entry);
                        continue outer;
                    }
                }
                break;
            }
            return scanner.closing("}") ? entries : null;
        }
    }

    private @Nullable Entry entry(final EntryKind kind) {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.bareKeyword(kind.keyword())) {
            return null;
        }
        return switch (kind) {
            case NAME -> nameEntry(start);
            case TAGLINE -> taglineEntry(start);
            case DESCRIPTION -> descriptionEntry(start);
            case TYPE -> typeEntry(start);
            case READ -> readEntry(start);
            case DISPLAY -> displayEntry(start);
            case INPUTS -> inputsEntry(start);
            case EXPANDED -> expandedEntry(start);
            case FLAGS -> flagsEntry(start);
            case VARS -> varsEntry(start);
            case PREMISE -> premiseEntry(start);
            case ASSERTION -> assertionEntry(start);
        };
    }

    private Entry.@Nullable NameEntry nameEntry(final int start) {
        if (!scanner.token("=")) {
            return null;
        }
        final var value = scanner.string();
        if (value == null || !scanner.token(";")) {
            return null;
        }
        return new Entry.NameEntry(value, scanner.spanFrom(start));
    }

    private Entry.@Nullable TaglineEntry taglineEntry(final int start) {
        if (!scanner.token("{")) {
            return null;
        }
        final var text = markup.oneline();
        if (text == null || !scanner.closing("}")) {
            return null;
        }
        return new Entry.TaglineEntry(text, scanner.spanFrom(start));
    }

    private Entry.@Nullable DescriptionEntry descriptionEntry(final int start) {
        if (!scanner.token("{")) {
            return null;
        }
        final var blocks = markup.textBlocks();
        if (!scanner.closing("}")) {
            return null;
        }
        return new Entry.DescriptionEntry(blocks, scanner.spanFrom(start));
    }

    private Entry.@Nullable TypeEntry typeEntry(final int start) {
        if (!scanner.token("=")) {
            return null;
        }
        final var signature = typeSignature();
        if (signature == null || !scanner.token(";")) {
            return null;
        }
        return new Entry.TypeEntry(signature, scanner.spanFrom(start));
    }

    private Entry.@Nullable ReadEntry readEntry(final int start) {
        if (!scanner.token("=")) {
            return null;
        }
        Entry.@Nullable Fixity fixity = null;
        for (final var candidate : Entry.Fixity.values()) {
            if (scanner.bareKeyword(candidate.keyword())) {
                fixity = candidate;
                break;
            }
        }
        if (fixity == null) {
            return null;
        }
        final var operator = scanner.operator();
        if (operator == null || !scanner.token(";")) {
            return null;
        }
        return new Entry.ReadEntry(fixity, operator, scanner.spanFrom(start));
    }

    private Entry.@Nullable DisplayEntry displayEntry(final int start) {
        if (!scanner.token("=") || !scanner.token("\\(")) {
            return null;
        }
        final var row = formulas.mathRow(false);
        if (!scanner.closing("\\)") || !scanner.token(";")) {
            return null;
        }
        return new Entry.DisplayEntry(row, scanner.spanFrom(start));
    }

    // Exactly two declarations, unlike vars.
    private Entry.@Nullable InputsEntry inputsEntry(final int start) {
        if (!scanner.token("=") || !scanner.token("[")) {
            return null;
        }
        final var first = variableDeclaration();
        if (first == null || !scanner.token(",")) {
            return null;
        }
        final var second = variableDeclaration();
        if (second == null) {
            return null;
        }
        scanner.token(",");
        if (!scanner.closing("]") || !scanner.token(";")) {
            return null;
        }
        return new Entry.InputsEntry(first, second, scanner.spanFrom(start));
    }

    private Entry.@Nullable ExpandedEntry expandedEntry(final int start) {
        final var formula = assignedFormula();
        return (formula != null) ? new Entry.ExpandedEntry(formula, scanner.spanFrom(start)) : null;
    }

    private Entry.@Nullable FlagsEntry flagsEntry(final int start) {
        if (!scanner.token("=")) {
            return null;
        }
        final var flags = bracketedList(this::flag);
        if (flags == null || !scanner.token(";")) {
            return null;
        }
        return new Entry.FlagsEntry(flags, scanner.spanFrom(start));
    }

    private Entry.@Nullable VarsEntry varsEntry(final int start) {
        if (!scanner.token("=")) {
            return null;
        }
        final var declarations = bracketedList(this::variableDeclaration);
        if (declarations == null || !scanner.token(";")) {
            return null;
        }
        return new Entry.VarsEntry(declarations, scanner.spanFrom(start));
    }

    private Entry.@Nullable PremiseEntry premiseEntry(final int start) {
        if (!scanner.token("=") || !scanner.token("[")) {
            return null;
        }
        final var formulaList = new ArrayList<Formula>();
        while (true) {
            final var formula = scanner.attempt(() -> {
                final var candidate = formulas.formula();
                return (candidate != null && scanner.token(";")) ? candidate : null;
            });
            if (formula == null) {
                break;
            }
            formulaList.add(formula);
        }
        if (!scanner.closing("]") || !scanner.token(";")) {
            return null;
        }
        return new Entry.PremiseEntry(formulaList, scanner.spanFrom(start));
    }

    private Entry.@Nullable AssertionEntry assertionEntry(final int start) {
        final var formula = assignedFormula();
        return (formula != null) ? new Entry.AssertionEntry(formula, scanner.spanFrom(start)) : null;
    }

    // = formula ;
    private @Nullable Formula assignedFormula() {
        if (!scanner.token("=")) {
            return null;
        }
        final var formula = formulas.formula();
        return (formula != null && scanner.token(";")) ? formula : null;
    }

    private Entry.@Nullable Flag flag() {
        for (final var flag : Entry.Flag.values()) {
            if (scanner.bareKeyword(flag.keyword())) {
                return flag;
            }
        }
        return null;
    }

    // [ (element (, element)* ,?)? ], brackets included.
    private <T> @Nullable List<T> bracketedList(final Supplier<@Nullable T> element) {
        if (!scanner.token("[")) {
            return null;
        }
        final var result = new ArrayList<T>();
        final var first = element.get();
        if (first != null) {
            result.add(first);
            while (scanner.token(",")) {
                final var next = element.get();
                if (next == null) {
                    break;
                }
                result.add(next);
            }
        }
        return scanner.closing("]") ? result : null;
    }

    private TypeSignature.@Nullable Function functionSignature() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.token("(")) {
            return null;
        }
        final var parameters = scanner.nested(this::signatureParameters);
        if (parameters == null || !scanner.token("->")) {
            return null;
        }
        final var result = scanner.identifier();
        return (result != null) ? new TypeSignature.Function(parameters, result, scanner.spanFrom(start)) : null;
    }

    // Non-empty, trailing comma allowed, closing parenthesis included.
    private @Nullable List<TypeSignature> signatureParameters() {
        final var parameters = new ArrayList<TypeSignature>();
        final var first = typeSignature();
        if (first == null) {
            return null;
        }
        parameters.add(first);
        while (scanner.token(",")) {
            final var next = typeSignature();
            if (next == null) {
                break;
            }
            parameters.add(next);
        }
        return scanner.closing(")") ? parameters : null;
    }

    private @Nullable ProofElement proofElement() {
        final var step = scanner.attempt(this::proofStep);
        if (step != null) {
            return step;
        }
        return markup.textBlock();
    }

    private @Nullable ProofStep proofStep() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.token("|")) {
            return null;
        }
        final var metadata = new ArrayList<ProofMeta>();
        do {
            final var item = proofMeta();
            if (item == null) {
                return null;
            }
            metadata.add(item);
        } while (scanner.token(","));
        if (!scanner.token("|")) {
            return null;
        }
        final var formula = formulas.formula();
        if (formula == null || !scanner.token(";")) {
            return null;
        }
        final var end = scanner.punctuationRunHere(MarkupParser.sentencePunctuation);
        return new ProofStep(metadata, formula, end, scanner.spanFrom(start));
    }

    // macro justification | integer | tag | identifier
    private @Nullable ProofMeta proofMeta() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        for (final var kind : ProofMeta.MacroJustification.Kind.values()) {
            if (scanner.token(kind.spelling())) {
                return new ProofMeta.MacroJustification(kind, scanner.spanFrom(start));
            }
        }
        final var line = scanner.integer();
        if (line != null) {
            return new ProofMeta.StepReference(line);
        }
        final var tag = scanner.tag();
        if (tag != null) {
            return tag;
        }
        final var name = scanner.identifier();
        return (name != null) ? new ProofMeta.NamedJustification(name) : null;
    }

    private static Identifier parentOf(final Header header) {
        final var parentId = header.parentId;
        assert parentId != null : "Block header parsed without a parent";
        return parentId;
    }

    private final Scanner scanner;
    private final FormulaParser formulas;
    private final MarkupParser markup;

    private record Header(int start, String keyword, Identifier id, @Nullable Identifier parentId) {
    }
}
