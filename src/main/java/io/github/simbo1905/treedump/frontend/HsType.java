// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// Source level types as written by the user, parameterised by the identifier type of the phase
/// that produced them: `RdrName` after parsing, `Name` after renaming.
public sealed interface HsType<I> extends Outputable
    permits HsType.HsTyVar, HsType.HsAppTy, HsType.HsFunTy, HsType.HsListTy, HsType.HsParTy {

  record HsTyVar<I>(Located<I> name) implements HsType<I> {
    public HsTyVar {
      Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String ppr() {
      return identifier(name.value());
    }
  }

  record HsAppTy<I>(Located<HsType<I>> function, Located<HsType<I>> argument) implements HsType<I> {
    @Override
    public String ppr() {
      return function.value().ppr() + " " + atomic(argument.value());
    }
  }

  record HsFunTy<I>(Located<HsType<I>> argument, Located<HsType<I>> result) implements HsType<I> {
    @Override
    public String ppr() {
      final var left = argument.value();
      return (left instanceof HsFunTy ? "(" + left.ppr() + ")" : left.ppr()) + " -> " + result.value().ppr();
    }
  }

  record HsListTy<I>(Located<HsType<I>> element) implements HsType<I> {
    @Override
    public String ppr() {
      return "[" + element.value().ppr() + "]";
    }
  }

  record HsParTy<I>(Located<HsType<I>> inner) implements HsType<I> {
    @Override
    public String ppr() {
      return "(" + inner.value().ppr() + ")";
    }
  }

  private static String atomic(HsType<?> type) {
    return type instanceof HsAppTy || type instanceof HsFunTy ? "(" + type.ppr() + ")" : type.ppr();
  }

  private static String identifier(Object id) {
    return id instanceof Outputable outputable ? outputable.ppr() : String.valueOf(id);
  }
}
