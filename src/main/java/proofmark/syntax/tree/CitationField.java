// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * A field of a citation record, shared by bibliography entries and {@code \Citation} blocks.
 */
public sealed interface CitationField extends Node permits CitationField.TextField, CitationField.ContainerField {
    /**
     * {@code keyword { text }}.
     */
    record TextField(FieldKind kind, Unformatted value, Span span) implements CitationField {
        @Override
        public List<Node> children() {
            return Nodes.childList(value);
        }
    }

    /**
     * {@code container { fields }}: the work the cited one was published in.
     */
    record ContainerField(List<TextField> fields, Span span) implements CitationField {
        public ContainerField {
            fields = List.copyOf(fields);
            assert fields.stream().allMatch(field -> field.kind().isContainerField()) : "Entry field in container";
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(fields);
        }
    }
}
