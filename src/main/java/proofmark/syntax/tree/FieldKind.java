// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package proofmark.syntax.tree;

import java.util.EnumSet;
import java.util.Set;

public enum FieldKind {
    AUTHORS("authors", false),
    TITLE("title", false),
    CONTAINER_TITLE("container_title", true),
    OTHER_CONTRIBUTORS("other_contributors", true),
    VERSION("version", true),
    NUMBER("number", true),
    PUBLISHER("publisher", true),
    PUBLICATION_DATE("publication_date", true),
    LOCATION("location", true);

    FieldKind(final String keyword, final boolean containerField) {
        this.keyword = keyword;
        this.containerField = containerField;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Returns whether this field belongs inside {@code container { ... }} rather than directly in an entry.
     */
    public boolean isContainerField() {
        return containerField;
    }

    /**
     * Returns the fields that may appear at the given level.
     */
    public static Set<FieldKind> fieldsAt(final boolean containerLevel) {
        final var result = EnumSet.noneOf(FieldKind.class);
        for (final var kind : values()) {
            if (kind.containerField == containerLevel) {
                result.add(kind);
            }
        }
        return result;
    }

    private final String keyword;
    private final boolean containerField;
}
