// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.List;

/**
 * A type: either a named type, or {@code (T1, T2, ...) -> R}.
 */
public sealed interface TypeSignature extends Node permits TypeSignature.Named, TypeSignature.Function {
    record Named(Identifier type) implements TypeSignature {
        @Override
        public Span span() {
            return type.span();
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(type);
        }
    }

    record Function(List<TypeSignature> parameters, Identifier result, Span span) implements TypeSignature {
        public Function {
            parameters = List.copyOf(parameters);
            assert !parameters.isEmpty() : "Function type without parameters";
        }

        @Override
        public List<Node> children() {
            return Nodes.childList(parameters, result);
        }
    }
}
