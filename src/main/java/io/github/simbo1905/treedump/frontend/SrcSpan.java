// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// A source location. Columns are 1-based and the end column is exclusive.
public sealed interface SrcSpan extends Outputable permits SrcSpan.Real, SrcSpan.Unhelpful {

  static SrcSpan of(String file, int startLine, int startCol, int endLine, int endCol) {
    return new Real(file, startLine, startCol, endLine, endCol);
  }

  static SrcSpan noSrcSpan() {
    return new Unhelpful("<no location info>");
  }

  /// A span inside a real file
  record Real(String file, int startLine, int startCol, int endLine, int endCol) implements SrcSpan {
    public Real {
      Objects.requireNonNull(file, "file must not be null");
      if (startLine < 1 || startCol < 1 || endLine < startLine || (endLine == startLine && endCol < startCol)) {
        throw new IllegalArgumentException("Invalid span " + file + " " + startLine + ":" + startCol
            + "-" + endLine + ":" + endCol);
      }
    }

    @Override
    public String ppr() {
      if (startLine == endLine) {
        if (endCol - startCol <= 1) {
          return file + ":" + startLine + ":" + startCol;
        }
        return file + ":" + startLine + ":" + startCol + "-" + (endCol - 1);
      }
      return file + ":(" + startLine + "," + startCol + ")-(" + endLine + "," + (endCol - 1) + ")";
    }
  }

  /// A span the front end cannot attribute to a file, with the reason why
  record Unhelpful(String reason) implements SrcSpan {
    public Unhelpful {
      Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String ppr() {
      return reason;
    }
  }
}
