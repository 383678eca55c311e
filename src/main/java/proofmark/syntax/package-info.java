// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Parsers for the document, manifest and bibliography dialects.
 * <p>
 * {@link proofmark.syntax.Syntax} is the entry point. Parsers are hand-written ordered-choice recursive descent over
 * a backtracking {@link proofmark.syntax.Scanner}: each alternative is tried at the same position and the position is
 * rewound when it fails. Failures are reported through the condition system as
 * {@link proofmark.syntax.SyntaxErrorCondition}s.
 */
@NonNullByDefault
package proofmark.syntax;

import proofmark.util.annotation.NonNullByDefault;
