// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

/// A front end assigned identity: a one character domain tag plus a key, printed in base 62.
public record Unique(char domain, long key) implements Outputable {
  private static final String DIGITS = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

  public Unique {
    if (key < 0) {
      throw new IllegalArgumentException("Unique key must not be negative: " + key);
    }
  }

  @Override
  public String ppr() {
    final var digits = new StringBuilder();
    long remaining = key;
    do {
      digits.append(DIGITS.charAt((int) (remaining % DIGITS.length())));
      remaining /= DIGITS.length();
    } while (remaining > 0);
    return domain + digits.reverse().toString();
  }
}
