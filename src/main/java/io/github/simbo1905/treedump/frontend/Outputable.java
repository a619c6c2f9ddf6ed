// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

/// A front end value with a canonical pretty-printed form.
///
/// Implementations may throw when asked to print something the front end has not populated yet,
/// for example a placeholder that is only filled in by a later compiler phase.
public interface Outputable {

  /// @return the pretty-printed form of this value
  String ppr();
}
