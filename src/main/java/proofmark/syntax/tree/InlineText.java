// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * Plain prose: words, typographic punctuation and hyperlinks. This is all {@link Unformatted} text may contain.
 */
public sealed interface InlineText extends TextElement
    permits InlineText.Word, InlineText.Punctuation, InlineText.Hyperlink {
    record Word(String text, Span span) implements InlineText {
        @Override
        public String toString() {
            return text;
        }
    }

    record Punctuation(Kind kind, Span span) implements InlineText {
        /**
         * Punctuation kinds, in the order they are tried.
         */
        public enum Kind {
            ELLIPSIS("..."),
            LEFT_DOUBLE_QUOTE("``"),
            RIGHT_DOUBLE_QUOTE("''"),
            LEFT_SINGLE_QUOTE("`"),
            RIGHT_SINGLE_QUOTE("'"),
            AMPERSAND("&"),
            OPEN_BRACKET("["),
            CLOSE_BRACKET("]");

            Kind(final String spelling) {
                this.spelling = spelling;
            }

            public String spelling() {
                return spelling;
            }

            /**
             * Returns whether this punctuation may appear in single-line text, where brackets delimit structure.
             */
            public boolean allowedOnOneLine() {
                return this != OPEN_BRACKET && this != CLOSE_BRACKET;
            }

            private final String spelling;
        }
    }

    /**
     * {@code <a url>text</a>}. The URL is kept verbatim.
     */
    record Hyperlink(String url, Unformatted text, Span span) implements InlineText {
        @Override
        public List<Node> children() {
            return Nodes.childList(text);
        }
    }
}
