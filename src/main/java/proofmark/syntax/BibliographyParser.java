// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.ArrayList;
import proofmark.syntax.tree.BibEntry;
import proofmark.syntax.tree.Bibliography;
import proofmark.syntax.tree.CitationField;
import proofmark.syntax.tree.Span;
import proofmark.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The bibliography dialect: a sequence of {@code id { fields }} records.
 */
final class BibliographyParser {
    BibliographyParser(final Scanner scanner) {
        this.scanner = scanner;
        markup = new MarkupParser(scanner, new FormulaParser(scanner));
    }

    Bibliography bibliography() {
        final var entries = new ArrayList<BibEntry>();
        while (true) {
            final var entry = scanner.attempt(this::entry);
            if (entry == null) {
                break;
            }
            entries.add(entry);
        }
        if (!scanner.end()) {
            throw scanner.signalFailure();
        }
        return new Bibliography(entries, new Span(0, scanner.source().length()));
    }

    private @Nullable BibEntry entry() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        final var id = scanner.identifier();
        if (id == null || !scanner.token("{")) {
            return null;
        }
        try (final var trace = new Trace(() -> "Parsing bibliography entry " + id.name())) {
            trace.use();
            final var fields = new ArrayList<CitationField>();
            while (true) {
                final var field = markup.citationField();
                if (field == null) {
                    break;
                }
                fields.add(field);
            }
            return scanner.closing("}") ? new BibEntry(id, fields, scanner.spanFrom(start)) : null;
        }
    }

    private final Scanner scanner;
    private final MarkupParser markup;
}
