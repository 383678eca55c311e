// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An element of running prose.
 */
public sealed interface TextElement extends Node
    permits TextElement.Reference, TextElement.InlineMath, TextElement.Citation, TextElement.Marker, InlineText {
    /**
     * A cross-reference. The void form {@code <ref target/>} has a {@code null} body; the full form
     * {@code <ref target>body</ref>} keeps its body exactly as written.
     */
    record Reference(ReferenceTarget target, @Nullable String body, Span span) implements TextElement {
        public boolean isVoid() {
            return body == null;
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(target);
        }
    }

    record InlineMath(MathRow row, Span span) implements TextElement {
        @Override
        public List<Node> children() {
            return Nodes.childList(row);
        }
    }

    /**
     * {@code <cite id/>}, naming a bibliography entry.
     */
    record Citation(Identifier identifier, Span span) implements TextElement {
        @Override
        public List<Node> children() {
            return Nodes.childList(identifier);
        }
    }

    /**
     * An emphasis or highlight boundary. Markers aren't required to balance.
     */
    record Marker(Kind kind, Span span) implements TextElement {
        public enum Kind {
            EMPHASIS_BEGIN("<em>"),
            EMPHASIS_END("</em>"),
            HIGHLIGHT_BEGIN("<hl>"),
            HIGHLIGHT_END("</hl>");

            Kind(final String spelling) {
                this.spelling = spelling;
            }

            public String spelling() {
                return spelling;
            }

            private final String spelling;
        }
    }
}
