// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small pieces of infrastructure that don't belong to any particular dialect: operation traces, sneaky throws and
 * executor helpers.
 */
@NonNullByDefault
package proofmark.util;

import proofmark.util.annotation.NonNullByDefault;
