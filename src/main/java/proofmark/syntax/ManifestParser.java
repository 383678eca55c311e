// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.ArrayList;
import proofmark.syntax.tree.Book;
import proofmark.syntax.tree.Chapter;
import proofmark.syntax.tree.Identifier;
import proofmark.syntax.tree.Manifest;
import proofmark.syntax.tree.Page;
import proofmark.syntax.tree.Paragraph;
import proofmark.syntax.tree.Span;
import proofmark.syntax.tree.StringLiteral;
import proofmark.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The manifest dialect: one or more books, each holding chapters, each holding pages.
 * <pre>
 * algebra: "Algebra" {
 *     A first course.
 *     [
 *         groups: "Groups" { Sets with structure. [ intro: "Introduction", ] }
 *     ]
 * }
 * </pre>
 */
final class ManifestParser {
    ManifestParser(final Scanner scanner) {
        this.scanner = scanner;
        markup = new MarkupParser(scanner, new FormulaParser(scanner));
    }

    Manifest manifest() {
        final var books = new ArrayList<Book>();
        while (true) {
            final var book = scanner.attempt(this::book);
            if (book == null) {
                break;
            }
            books.add(book);
        }
        if (books.isEmpty() || !scanner.end()) {
            throw scanner.signalFailure();
        }
        return new Manifest(books, new Span(0, scanner.source().length()));
    }

    private @Nullable Book book() {
        final var header = header();
        if (header == null) {
            return null;
        }
        try (final var trace = new Trace(() -> "Parsing book " + header.id.name())) {
            trace.use();
            final var chapters = new ArrayList<Chapter>();
            while (true) {
                final var chapter = scanner.attempt(this::chapter);
                if (chapter == null) {
                    break;
                }
                chapters.add(chapter);
            }
            if (!closeGroup()) {
                return null;
            }
            return new Book(header.id, header.title, header.description, chapters, scanner.spanFrom(header.start));
        }
    }

    private @Nullable Chapter chapter() {
        final var header = header();
        if (header == null) {
            return null;
        }
        try (final var trace = new Trace(() -> "Parsing chapter " + header.id.name())) {
            trace.use();
            final var pages = new ArrayList<Page>();
            while (true) {
                final var page = scanner.attempt(this::page);
                if (page == null) {
                    break;
                }
                pages.add(page);
            }
            if (!closeGroup()) {
                return null;
            }
            return new Chapter(header.id, header.title, header.description, pages, scanner.spanFrom(header.start));
        }
    }

    private @Nullable Page page() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        final var id = scanner.identifier();
        if (id == null || !scanner.token(":")) {
            return null;
        }
        final var title = scanner.string();
        if (title == null || !scanner.token(",")) {
            return null;
        }
        return new Page(id, title, scanner.spanFrom(start));
    }

    // id: "Title" { description [
    private @Nullable Header header() {
        scanner.skipWhitespace();
        final var start = scanner.position();
        final var id = scanner.identifier();
        if (id == null || !scanner.token(":")) {
            return null;
        }
        final var title = scanner.string();
        if (title == null || !scanner.token("{")) {
            return null;
        }
        final var description = markup.oneline();
        if (description == null || !scanner.token("[")) {
            return null;
        }
        return new Header(start, id, title, description);
    }

    private boolean closeGroup() {
        return scanner.closing("]") && scanner.closing("}");
    }

    private final Scanner scanner;
    private final MarkupParser markup;

    private record Header(int start, Identifier id, StringLiteral title, Paragraph description) {
    }
}
