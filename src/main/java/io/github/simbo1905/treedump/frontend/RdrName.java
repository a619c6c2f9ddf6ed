// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// An identifier as the parser sees it, before name resolution.
public sealed interface RdrName extends Outputable
    permits RdrName.Unqual, RdrName.Qual, RdrName.Orig, RdrName.Exact {

  OccName occName();

  /// `foo`
  record Unqual(OccName occName) implements RdrName {
    public Unqual {
      Objects.requireNonNull(occName, "occName must not be null");
    }

    @Override
    public String ppr() {
      return occName.ppr();
    }
  }

  /// `M.foo` as written in the source, where `M` may be an import alias
  record Qual(ModuleName moduleName, OccName occName) implements RdrName {
    public Qual {
      Objects.requireNonNull(moduleName, "moduleName must not be null");
      Objects.requireNonNull(occName, "occName must not be null");
    }

    @Override
    public String ppr() {
      return moduleName.ppr() + "." + occName.ppr();
    }
  }

  /// A name the compiler generated that refers to a definition in a known module
  record Orig(Module module, OccName occName) implements RdrName {
    public Orig {
      Objects.requireNonNull(module, "module must not be null");
      Objects.requireNonNull(occName, "occName must not be null");
    }

    @Override
    public String ppr() {
      return module.moduleName().ppr() + "." + occName.ppr();
    }
  }

  /// A name that was already resolved when the parser produced it
  record Exact(Name name) implements RdrName {
    public Exact {
      Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public OccName occName() {
      return name.occName();
    }

    @Override
    public String ppr() {
      return name.ppr();
    }
  }
}
