// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.io.Serial;
import java.util.List;

/// Thrown by a front end when a module cannot be parsed or type checked.
/// Carries the rendered diagnostic messages in the order the front end reported them.
public class SourceErrorException extends Exception {
  @Serial
  private static final long serialVersionUID = 1L;

  private final List<String> messages;

  public SourceErrorException(List<String> messages) {
    super(String.join("\n", messages));
    this.messages = List.copyOf(messages);
  }

  public List<String> messages() {
    return messages;
  }

  /// The messages as a single block of text, one message after another
  public String diagnosticText() {
    return String.join("\n", messages);
  }
}
