// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.EnumSet;
import java.util.Set;

/**
 * The kinds of entries a declaration block may hold, each introduced by its bare keyword.
 */
public enum EntryKind {
    NAME("name"),
    TAGLINE("tagline"),
    DESCRIPTION("description"),
    TYPE("type"),
    READ("read"),
    DISPLAY("display"),
    INPUTS("inputs"),
    EXPANDED("expanded"),
    FLAGS("flags"),
    VARS("vars"),
    PREMISE("premise"),
    ASSERTION("assertion");

    EntryKind(final String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Entries legal in {@code \System} and {@code \Type} blocks.
     */
    public static Set<EntryKind> commonEntries() {
        return EnumSet.copyOf(common);
    }

    /**
     * Entries legal in {@code \Symbol} blocks.
     */
    public static Set<EntryKind> symbolEntries() {
        return EnumSet.copyOf(symbol);
    }

    /**
     * Entries legal in {@code \Definition} blocks.
     */
    public static Set<EntryKind> definitionEntries() {
        return EnumSet.copyOf(definition);
    }

    /**
     * Entries legal in {@code \Axiom}, {@code \Theorem}, {@code \Lemma} and {@code \Example} blocks.
     */
    public static Set<EntryKind> statementEntries() {
        return EnumSet.copyOf(statement);
    }

    private final String keyword;

    private static final EnumSet<EntryKind> common = EnumSet.of(NAME, TAGLINE, DESCRIPTION);
    private static final EnumSet<EntryKind> symbol = EnumSet.of(NAME, TAGLINE, DESCRIPTION, TYPE, READ, DISPLAY);
    private static final EnumSet<EntryKind> definition =
        EnumSet.of(NAME, TAGLINE, DESCRIPTION, TYPE, INPUTS, READ, DISPLAY, EXPANDED);
    private static final EnumSet<EntryKind> statement =
        EnumSet.of(NAME, TAGLINE, DESCRIPTION, FLAGS, VARS, PREMISE, ASSERTION);
}
