// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * The table of contents of a book collection: books, their chapters and the chapters' pages, in order.
 */
public record Manifest(List<Book> books, Span span) implements Node {
    public Manifest {
        books = List.copyOf(books);
        assert !books.isEmpty() : "Manifest without books";
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(books);
    }
}
