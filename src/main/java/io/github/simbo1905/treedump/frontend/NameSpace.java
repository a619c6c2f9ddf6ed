// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

/// The namespaces an occurrence name can live in.
public enum NameSpace {
  VAR_NAME,
  DATA_NAME,
  TV_NAME,
  TC_CLS_NAME,
  /// Record field labels; only some front ends keep them apart from ordinary variables
  FIELD_NAME
}
