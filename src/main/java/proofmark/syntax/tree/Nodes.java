// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import proofmark.util.UnreachableCodeReachedError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only, node-kind-agnostic traversal of syntax trees, built on {@link Node#children()}.
 */
public final class Nodes {
    private Nodes() {
    }

    /**
     * Returns the direct children of the given node, in source order.
     */
    public static List<Node> children(final Node node) {
        return node.children();
    }

    /**
     * Visits the given node and all of its descendants in pre-order.
     */
    public static void walk(final Node root, final Consumer<? super Node> visitor) {
        final var stack = new ArrayDeque<Node>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final var node = stack.pop();
            visitor.accept(node);
            final var children = node.children();
            for (var i = children.size() - 1; i >= 0; i -= 1) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Returns every node of the given type in the tree rooted at {@code root}, root included, in pre-order.
     */
    public static <T extends Node> List<T> collect(final Node root, final Class<T> type) {
        final var result = new ArrayList<T>();
        walk(root, node -> {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        });
        return result;
    }

    /**
     * Returns the source text covered by the given node.
     */
    public static String text(final Node node, final CharSequence source) {
        final var span = node.span();
        return source.subSequence(span.start(), span.end()).toString();
    }

    // Flattens record components into a child list: nodes are kept, lists contribute their elements, absent
    // optional parts are skipped.
    static List<Node> childList(final @Nullable Object... components) {
        final var result = new ArrayList<Node>();
        for (final var component : components) {
            if (component instanceof final Node node) {
                result.add(node);
            } else if (component instanceof final List<?> list) {
                for (final var element : list) {
                    result.add((Node) element);
                }
            } else if (component != null) {
                throw new UnreachableCodeReachedError("Not a child component: " + component.getClass());
            }
        }
        return List.copyOf(result);
    }
}
