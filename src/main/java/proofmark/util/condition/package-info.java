// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system, used to report syntax errors without forcing every caller to
 * unwind the stack.
 */
@NonNullByDefault
package proofmark.util.condition;

import proofmark.util.annotation.NonNullByDefault;
