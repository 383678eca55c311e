// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import proofmark.syntax.Scanner.Expectation;
import proofmark.syntax.tree.CitationField;
import proofmark.syntax.tree.DisplayMath;
import proofmark.syntax.tree.FieldKind;
import proofmark.syntax.tree.HeadingBlock;
import proofmark.syntax.tree.InlineText;
import proofmark.syntax.tree.ListBlock;
import proofmark.syntax.tree.Node;
import proofmark.syntax.tree.Paragraph;
import proofmark.syntax.tree.QuoteBlock;
import proofmark.syntax.tree.RawCitation;
import proofmark.syntax.tree.ReferenceTarget;
import proofmark.syntax.tree.Span;
import proofmark.syntax.tree.Sublist;
import proofmark.syntax.tree.TableBlock;
import proofmark.syntax.tree.TextBlock;
import proofmark.syntax.tree.TextElement;
import proofmark.syntax.tree.TodoBlock;
import proofmark.syntax.tree.Unformatted;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses prose: inline text elements, paragraphs and the block-level prose constructs.
 * <p>
 * Whitespace between text elements is classified once, by a single lookahead: in paragraphs a run holding at most one
 * line feed separates elements of the same paragraph, while a run with two or more ends the paragraph before the
 * run. Single-line text only allows spaces and tabs between elements, and treats brackets as structure rather than
 * punctuation.
 */
final class MarkupParser {
    MarkupParser(final Scanner scanner, final FormulaParser formulas) {
        this.scanner = scanner;
        this.formulas = formulas;
    }

    @Nullable Paragraph paragraph() {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            final var elements = run(TextContext.PARAGRAPH, () -> textElement(TextContext.PARAGRAPH));
            return (elements != null) ? new Paragraph(elements, spanOf(elements)) : null;
        });
    }

    /**
     * Single-line text, as used by taglines, captions and manifest descriptions.
     */
    @Nullable Paragraph oneline() {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            final var elements = run(TextContext.ONELINE, () -> textElement(TextContext.ONELINE));
            return (elements != null) ? new Paragraph(elements, spanOf(elements)) : null;
        });
    }

    @Nullable Unformatted unformatted() {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            return unformattedHere(TextContext.PARAGRAPH, true);
        });
    }

    /**
     * {@code raw_citation | sublist | display_math | paragraph}.
     */
    @Nullable TextBlock textBlock() {
        final var rawCitation = scanner.attempt(this::rawCitation);
        if (rawCitation != null) {
            return rawCitation;
        }
        final var sublist = scanner.attempt(this::sublist);
        if (sublist != null) {
            return sublist;
        }
        final var displayMath = scanner.attempt(this::displayMath);
        if (displayMath != null) {
            return displayMath;
        }
        return paragraph();
    }

    /**
     * Zero or more text blocks, for bodies such as descriptions and to-dos.
     */
    List<TextBlock> textBlocks() {
        final var blocks = new ArrayList<TextBlock>();
        while (true) {
            final var block = textBlock();
            if (block == null) {
                return blocks;
            }
            blocks.add(block);
        }
    }

    /**
     * A field of a citation record, either directly in an entry or inside its {@code container}.
     */
    @Nullable CitationField citationField() {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            final var start = scanner.position();
            if (scanner.bareKeyword("container")) {
                return containerBody(start);
            }
            return textField(false);
        });
    }

    @Nullable ListBlock listBlock(final ListBlock.Kind kind) {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            final var start = scanner.position();
            if (!scanner.keyword(kind.keyword()) || !scanner.token("{")) {
                return null;
            }
            final var items = new ArrayList<ListBlock.Item>();
            while (true) {
                final var item = scanner.attempt(this::listItem);
                if (item == null) {
                    break;
                }
                items.add(item);
            }
            return scanner.closing("}") ? new ListBlock(kind, items, scanner.spanFrom(start)) : null;
        });
    }

    /**
     * {@code \Table { head? body? foot? caption? }}.
     */
    @Nullable TableBlock tableBlock() {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            final var start = scanner.position();
            if (!scanner.keyword("Table") || !scanner.token("{")) {
                return null;
            }
            final var head = scanner.attempt(() -> tableSection(TableBlock.SectionKind.HEAD));
            final var body = scanner.attempt(() -> tableSection(TableBlock.SectionKind.BODY));
            final var foot = scanner.attempt(() -> tableSection(TableBlock.SectionKind.FOOT));
            final var caption = scanner.attempt(this::tableCaption);
            if (!scanner.closing("}")) {
                return null;
            }
            return new TableBlock(head, body, foot, caption, scanner.spanFrom(start));
        });
    }

    @Nullable QuoteBlock quoteBlock() {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            final var start = scanner.position();
            if (!scanner.keyword("Quote") || !scanner.token("{")) {
                return null;
            }
            final var original = scanner.attempt(() -> bracedUnformatted("Original"));
            final var value = bracedUnformatted("Value");
            if (value == null || !scanner.closing("}")) {
                return null;
            }
            return new QuoteBlock(original, value, scanner.spanFrom(start));
        });
    }

    /**
     * One or more heading lines.
     */
    @Nullable HeadingBlock headingBlock() {
        return scanner.attempt(() -> {
            final var subheadings = new ArrayList<HeadingBlock.Subheading>();
            while (true) {
                final var subheading = scanner.attempt(this::subheading);
                if (subheading == null) {
                    break;
                }
                subheadings.add(subheading);
            }
            if (subheadings.isEmpty()) {
                return null;
            }
            return new HeadingBlock(subheadings, spanOf(subheadings));
        });
    }

    @Nullable TodoBlock todoBlock() {
        return scanner.attempt(() -> {
            scanner.skipWhitespace();
            final var start = scanner.position();
            if (!scanner.keyword("Todo") || !scanner.token("{")) {
                return null;
            }
            final var blocks = textBlocks();
            return scanner.closing("}") ? new TodoBlock(blocks, scanner.spanFrom(start)) : null;
        });
    }

    // Elements separated by whitespace the context accepts, or by nothing at all. Callers skip leading whitespace.
    private <T extends Node> @Nullable List<T> run(final TextContext context, final Supplier<@Nullable T> element) {
        final var first = element.get();
        if (first == null) {
            return null;
        }
        final var result = new ArrayList<T>();
        result.add(first);
        while (true) {
            final var mark = scanner.position();
            if (!skipSeparator(context)) {
                scanner.reset(mark);
                break;
            }
            final var next = element.get();
            if (next == null) {
                scanner.reset(mark);
                break;
            }
            result.add(next);
        }
        return result;
    }

    private boolean skipSeparator(final TextContext context) {
        var lineFeeds = 0;
        while (true) {
            final var c = scanner.peek();
            if (c == ' ' || c == '\t') {
                scanner.advance(1);
            } else if (context == TextContext.PARAGRAPH && (c == '\r' || c == '\n')) {
                if (c == '\n') {
                    lineFeeds += 1;
                }
                scanner.advance(1);
            } else {
                return lineFeeds <= 1;
            }
        }
    }

    private @Nullable TextElement textElement(final TextContext context) {
        if (Scanner.isWhitespace(scanner.peek())) {
            return null;
        }
        final var reference = scanner.attempt(this::reference);
        if (reference != null) {
            return reference;
        }
        final var inlineMath = scanner.attempt(this::inlineMath);
        if (inlineMath != null) {
            return inlineMath;
        }
        final var citation = scanner.attempt(this::citation);
        if (citation != null) {
            return citation;
        }
        final var marker = marker();
        if (marker != null) {
            return marker;
        }
        return inlineText(context, true);
    }

    private TextElement.@Nullable Reference reference() {
        final var start = scanner.position();
        if (!scanner.token("<ref") || !requireWhitespace()) {
            return null;
        }
        final var target = referenceTarget();
        if (target == null) {
            return null;
        }
        if (scanner.token("/>")) {
            return new TextElement.Reference(target, null, scanner.spanFrom(start));
        }
        if (!scanner.token(">")) {
            return null;
        }
        final var bodyStart = scanner.position();
        final var bodyEnd = scanner.source().indexOf("</ref>", bodyStart);
        if (bodyEnd < 0) {
            scanner.reset(scanner.source().length());
            scanner.expected("\"</ref>\"", Expectation.CLOSING);
            return null;
        }
        scanner.reset(bodyEnd + "</ref>".length());
        final var body = scanner.source().substring(bodyStart, bodyEnd);
        return new TextElement.Reference(target, body, scanner.spanFrom(start));
    }

    private @Nullable ReferenceTarget referenceTarget() {
        final var tag = scanner.tag();
        if (tag != null) {
            return tag;
        }
        final var fullyQualifiedId = scanner.fullyQualifiedId();
        if (fullyQualifiedId != null) {
            return fullyQualifiedId;
        }
        return scanner.identifier();
    }

    private TextElement.@Nullable InlineMath inlineMath() {
        final var start = scanner.position();
        if (!scanner.token("\\(")) {
            return null;
        }
        final var row = formulas.mathRow(false);
        return scanner.closing("\\)") ? new TextElement.InlineMath(row, scanner.spanFrom(start)) : null;
    }

    private TextElement.@Nullable Citation citation() {
        final var start = scanner.position();
        if (!scanner.token("<cite") || !requireWhitespace()) {
            return null;
        }
        final var identifier = scanner.identifier();
        if (identifier == null || !scanner.token("/>")) {
            return null;
        }
        return new TextElement.Citation(identifier, scanner.spanFrom(start));
    }

    private TextElement.@Nullable Marker marker() {
        final var start = scanner.position();
        for (final var kind : TextElement.Marker.Kind.values()) {
            if (scanner.lookingAt(kind.spelling())) {
                scanner.advance(kind.spelling().length());
                return new TextElement.Marker(kind, scanner.spanFrom(start));
            }
        }
        scanner.expected("marker", Expectation.TOKEN);
        return null;
    }

    private @Nullable InlineText inlineText(final TextContext context, final boolean allowHyperlinks) {
        if (allowHyperlinks) {
            final var hyperlink = scanner.attempt(() -> hyperlink(context));
            if (hyperlink != null) {
                return hyperlink;
            }
        }
        final var punctuation = punctuation(context);
        if (punctuation != null) {
            return punctuation;
        }
        return word();
    }

    private InlineText.@Nullable Hyperlink hyperlink(final TextContext context) {
        final var start = scanner.position();
        if (!scanner.token("<a") || !requireWhitespace()) {
            return null;
        }
        scanner.skipWhitespace();
        final var urlStart = scanner.position();
        while (scanner.peek() >= 0 && scanner.peek() != '>' && !Scanner.isWhitespace(scanner.peek())) {
            scanner.advance(1);
        }
        if (scanner.position() == urlStart) {
            scanner.expected("URL", Expectation.ATOMIC_CONTENT);
            return null;
        }
        final var url = scanner.textFrom(urlStart);
        if (!scanner.token(">")) {
            return null;
        }
        scanner.skipWhitespace();
        final var text = unformattedHere(context, false);
        if (text == null || !scanner.closing("</a>")) {
            return null;
        }
        return new InlineText.Hyperlink(url, text, scanner.spanFrom(start));
    }

    private InlineText.@Nullable Punctuation punctuation(final TextContext context) {
        final var start = scanner.position();
        for (final var kind : InlineText.Punctuation.Kind.values()) {
            if (context == TextContext.ONELINE && !kind.allowedOnOneLine()) {
                continue;
            }
            if (scanner.lookingAt(kind.spelling())) {
                scanner.advance(kind.spelling().length());
                return new InlineText.Punctuation(kind, scanner.spanFrom(start));
            }
        }
        scanner.expected("punctuation", Expectation.TOKEN);
        return null;
    }

    private InlineText.@Nullable Word word() {
        final var start = scanner.position();
        while (scanner.peek() >= 0 && !Scanner.isWhitespace(scanner.peek()) && wordSpecialCharacters.indexOf(
            scanner.peek()) < 0 && !scanner.lookingAt("...")) {
            scanner.advance(1);
        }
        if (scanner.position() == start) {
            scanner.expected("word", Expectation.TOKEN);
            return null;
        }
        return new InlineText.Word(scanner.textFrom(start), scanner.spanFrom(start));
    }

    private @Nullable Unformatted unformattedHere(final TextContext context, final boolean allowHyperlinks) {
        final var elements = run(context, () -> Scanner.isWhitespace(scanner.peek())
            ? null
            : inlineText(context, allowHyperlinks));
        return (elements != null) ? new Unformatted(elements, spanOf(elements)) : null;
    }

    private boolean requireWhitespace() {
        if (Scanner.isWhitespace(scanner.peek())) {
            return true;
        }
        scanner.expected("whitespace", Expectation.TOKEN);
        return false;
    }

    private @Nullable RawCitation rawCitation() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.keyword("Citation") || !scanner.token("{")) {
            return null;
        }
        final var fields = new ArrayList<CitationField>();
        while (true) {
            final var field = citationField();
            if (field == null) {
                break;
            }
            fields.add(field);
        }
        return scanner.closing("}") ? new RawCitation(fields, scanner.spanFrom(start)) : null;
    }

    private CitationField.@Nullable ContainerField containerBody(final int start) {
        if (!scanner.token("{")) {
            return null;
        }
        final var fields = new ArrayList<CitationField.TextField>();
        while (true) {
            final var field = scanner.attempt(() -> textField(true));
            if (field == null) {
                break;
            }
            fields.add(field);
        }
        return scanner.closing("}") ? new CitationField.ContainerField(fields, scanner.spanFrom(start)) : null;
    }

    private CitationField.@Nullable TextField textField(final boolean containerLevel) {
        scanner.skipWhitespace();
        final var start = scanner.position();
        for (final var kind : FieldKind.fieldsAt(containerLevel)) {
            if (scanner.bareKeyword(kind.keyword())) {
                if (!scanner.token("{")) {
                    return null;
                }
                final var value = unformatted();
                if (value == null || !scanner.closing("}")) {
                    return null;
                }
                return new CitationField.TextField(kind, value, scanner.spanFrom(start));
            }
        }
        return null;
    }

    private @Nullable Sublist sublist() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.keyword("Sublist") || !scanner.token("{")) {
            return null;
        }
        final var items = new ArrayList<Sublist.Item>();
        while (true) {
            final var item = scanner.attempt(this::sublistItem);
            if (item == null) {
                break;
            }
            items.add(item);
        }
        return scanner.closing("}") ? new Sublist(items, scanner.spanFrom(start)) : null;
    }

    private Sublist.@Nullable Item sublistItem() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        final var variable = scanner.variable();
        if (variable == null || !scanner.token(">>>")) {
            return null;
        }
        final var replacement = formulas.mathRow(false);
        if (!scanner.token(";")) {
            return null;
        }
        return new Sublist.Item(variable, replacement, scanner.spanFrom(start));
    }

    private @Nullable DisplayMath displayMath() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.token("\\[")) {
            return null;
        }
        final var row = formulas.mathRow(false);
        if (!scanner.closing("\\]")) {
            return null;
        }
        final var end = scanner.punctuationRunHere(sentencePunctuation);
        return new DisplayMath(row, end, scanner.spanFrom(start));
    }

    private ListBlock.@Nullable Item listItem() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.keyword("Item") || !scanner.token("{")) {
            return null;
        }
        final var content = paragraph();
        if (content == null || !scanner.closing("}")) {
            return null;
        }
        return new ListBlock.Item(content, scanner.spanFrom(start));
    }

    private TableBlock.@Nullable Section tableSection(final TableBlock.SectionKind kind) {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.keyword(kind.keyword()) || !scanner.token("{")) {
            return null;
        }
        final var rows = new ArrayList<TableBlock.Row>();
        while (true) {
            final var row = scanner.attempt(this::tableRow);
            if (row == null) {
                break;
            }
            rows.add(row);
        }
        return scanner.closing("}") ? new TableBlock.Section(kind, rows, scanner.spanFrom(start)) : null;
    }

    private TableBlock.@Nullable Row tableRow() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.keyword("Row")) {
            return null;
        }
        final var cells = new ArrayList<TableBlock.Cell>();
        while (true) {
            final var cell = scanner.attempt(this::tableCell);
            if (cell == null) {
                break;
            }
            cells.add(cell);
        }
        return cells.isEmpty() ? null : new TableBlock.Row(cells, scanner.spanFrom(start));
    }

    private TableBlock.@Nullable Cell tableCell() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        if (!scanner.token("{")) {
            return null;
        }
        final var content = paragraph();
        return scanner.closing("}") ? new TableBlock.Cell(content, scanner.spanFrom(start)) : null;
    }

    private @Nullable Paragraph tableCaption() {
        if (!scanner.keyword("Caption") || !scanner.token("{")) {
            return null;
        }
        final var caption = oneline();
        return (caption != null && scanner.closing("}")) ? caption : null;
    }

    private @Nullable Unformatted bracedUnformatted(final String keyword) {
        if (!scanner.keyword(keyword) || !scanner.token("{")) {
            return null;
        }
        final var text = unformatted();
        return (text != null && scanner.closing("}")) ? text : null;
    }

    private HeadingBlock.@Nullable Subheading subheading() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        final int level;
        if (scanner.lookingAt("###")) {
            level = 3;
        } else if (scanner.lookingAt("##")) {
            level = 2;
        } else if (scanner.lookingAt("#")) {
            level = 1;
        } else {
            scanner.expected("heading", Expectation.TOKEN);
            return null;
        }
        scanner.advance(level);
        if (scanner.peek() != ' ' && scanner.peek() != '\t') {
            scanner.expected("whitespace", Expectation.TOKEN);
            return null;
        }
        while (scanner.peek() == ' ' || scanner.peek() == '\t') {
            scanner.advance(1);
        }
        final var text = unformattedHere(TextContext.ONELINE, true);
        if (text == null) {
            return null;
        }
        return new HeadingBlock.Subheading(level, text, scanner.spanFrom(start));
    }

    private static Span spanOf(final List<? extends Node> nodes) {
        return nodes.get(0).span().union(nodes.get(nodes.size() - 1).span());
    }

    static final String sentencePunctuation = ".,;:!?";

    private static final String wordSpecialCharacters = "\\{}[]<>|&`'\"#";

    private final Scanner scanner;
    private final FormulaParser formulas;

    private enum TextContext {
        PARAGRAPH,
        ONELINE
    }
}
