// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * {@code | meta, ... | formula ;} followed by optional sentence punctuation.
 *
 * @param metadata The justifications, step references and tags between the bars, in source order.
 * @param end      The punctuation written after the semicolon, possibly empty. It only matters for rendering.
 */
public record ProofStep(List<ProofMeta> metadata, Formula formula, String end, Span span) implements ProofElement {
    public ProofStep {
        metadata = List.copyOf(metadata);
        assert !metadata.isEmpty() : "Proof step without metadata";
    }

    @Override
    public List<Node> children() {
        return Nodes.childList(metadata, formula);
    }
}
