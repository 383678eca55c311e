// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Functional interfaces that are allowed to throw checked throwables.
 */
@NonNullByDefault
package proofmark.util.function;

import proofmark.util.annotation.NonNullByDefault;
