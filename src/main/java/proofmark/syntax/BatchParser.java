// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.function.BiFunction;
import proofmark.syntax.tree.Bibliography;
import proofmark.syntax.tree.Document;
import proofmark.syntax.tree.Manifest;
import proofmark.util.ExecutorUtils;
import proofmark.util.SneakyThrow;
import proofmark.util.Trace;
import proofmark.util.condition.Unwind;

/**
 * Parses many independent buffers concurrently, such as every page of a book.
 * <p>
 * Every buffer gets its own {@link ParseResult}, so a malformed buffer never affects the others. Results come back in
 * the order of the sources. The executor is owned by the caller.
 */
public final class BatchParser {
    public BatchParser(final ExecutorService executorService) {
        this(executorService, ParseOptions.DEFAULT);
    }

    public BatchParser(final ExecutorService executorService, final ParseOptions options) {
        this.executorService = executorService;
        this.options = options;
    }

    public List<ParseResult<Document>> parseDocuments(final List<Source> sources) throws InterruptedException {
        return parseAll(sources, Syntax::tryParseDocument);
    }

    public List<ParseResult<Manifest>> parseManifests(final List<Source> sources) throws InterruptedException {
        return parseAll(sources, Syntax::tryParseManifest);
    }

    public List<ParseResult<Bibliography>> parseBibliographies(final List<Source> sources)
        throws InterruptedException {
        return parseAll(sources, Syntax::tryParseBibliography);
    }

    private <T> List<ParseResult<T>> parseAll(
        final List<Source> sources,
        final BiFunction<String, ParseOptions, ParseResult<T>> parser
    ) throws InterruptedException {
        try {
            return ExecutorUtils.map(executorService, sources, source -> {
                try (final var trace = new Trace(() -> "Parsing source " + source.name())) {
                    trace.use();
                    return parser.apply(source.text(), options);
                }
            });
        } catch (final Unwind u) {
            // Only restarts established by the caller can be targeted from here, let it keep unwinding.
            throw SneakyThrow.doThrow(u);
        }
    }

    private final ExecutorService executorService;
    private final ParseOptions options;

    /**
     * A named source buffer. The name only appears in diagnostics.
     */
    public record Source(String name, String text) {
    }
}
