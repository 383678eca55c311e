// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import proofmark.syntax.tree.Document;
import proofmark.syntax.tree.DocumentBlock;
import proofmark.syntax.tree.ListBlock;
import proofmark.syntax.tree.Span;
import proofmark.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The document dialect's top level: blocks until the end of input.
 */
final class DocumentParser {
    DocumentParser(final Scanner scanner) {
        this.scanner = scanner;
        final var formulas = new FormulaParser(scanner);
        final var markup = new MarkupParser(scanner, formulas);
        final var blocks = new BlockParser(scanner, formulas, markup);
        alternatives = List.of(
            blocks::systemBlock,
            blocks::typeBlock,
            blocks::symbolBlock,
            blocks::definitionBlock,
            blocks::axiomBlock,
            blocks::theoremBlock,
            blocks::proofBlock,
            () -> markup.listBlock(ListBlock.Kind.UNORDERED),
            () -> markup.listBlock(ListBlock.Kind.ORDERED),
            markup::tableBlock,
            markup::quoteBlock,
            markup::headingBlock,
            markup::todoBlock,
            markup::textBlock
        );
    }

    Document document() {
        final var result = new ArrayList<DocumentBlock>();
        var index = 1;
        while (true) {
            final var blockIndex = index;
            try (final var trace = new Trace(() -> "Parsing document block #" + blockIndex)) {
                trace.use();
                final var block = documentBlock();
                if (block == null) {
                    break;
                }
                result.add(block);
            }
            index += 1;
        }
        if (!scanner.end()) {
            throw scanner.signalFailure();
        }
        return new Document(result, new Span(0, scanner.source().length()));
    }

    private @Nullable DocumentBlock documentBlock() {
        for (final var alternative : alternatives) {
            final var block = alternative.get();
            if (block != null) {
                return block;
            }
        }
        return null;
    }

    private final Scanner scanner;
    // Keyword-introduced blocks come first, so that plain paragraphs never swallow them.
    private final List<Supplier<? extends @Nullable DocumentBlock>> alternatives;
}
