// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// Where a resolved name was bound.
///
/// The four kinds below are the ones every front end shares. The interface is left open so a front end
/// can carry its own kinds, but the dumper only knows how to render these four.
public interface NameSort {

  NameSort INTERNAL = new Internal();
  NameSort SYSTEM = new System();

  /// Built into the compiler and defined in the given module
  record WiredIn(Module module) implements NameSort {
    public WiredIn {
      Objects.requireNonNull(module, "module must not be null");
    }
  }

  /// A top level binding of the given module
  record External(Module module) implements NameSort {
    public External {
      Objects.requireNonNull(module, "module must not be null");
    }
  }

  /// A local binding written by the user
  record Internal() implements NameSort {
  }

  /// A binding invented by the compiler
  record System() implements NameSort {
  }
}
