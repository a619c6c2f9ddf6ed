// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// The type checker's internal representation of types.
public sealed interface Type extends Outputable
    permits Type.TyVarTy, Type.TyConApp, Type.FunTy, Type.ForAllTy, Type.LitTy {

  int TOP_PREC = 0;
  int FUN_PREC = 1;
  int APP_PREC = 2;

  /// Prints this type for a context of the given precedence, adding parentheses when needed.
  String ppr(int precedence);

  @Override
  default String ppr() {
    return ppr(TOP_PREC);
  }

  record TyVarTy(Name name) implements Type {
    public TyVarTy {
      Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String ppr(int precedence) {
      return name.ppr();
    }
  }

  record TyConApp(TyCon tyCon, List<Type> arguments) implements Type {
    public TyConApp {
      Objects.requireNonNull(tyCon, "tyCon must not be null");
      arguments = List.copyOf(arguments);
    }

    @Override
    public String ppr(int precedence) {
      if (arguments.isEmpty()) {
        return tyCon.ppr();
      }
      if ("[]".equals(tyCon.ppr()) && arguments.size() == 1) {
        return "[" + arguments.get(0).ppr(TOP_PREC) + "]";
      }
      final var applied = tyCon.ppr() + " " + arguments.stream()
          .map(argument -> argument.ppr(APP_PREC))
          .collect(Collectors.joining(" "));
      return precedence >= APP_PREC ? "(" + applied + ")" : applied;
    }
  }

  record FunTy(Type argument, Type result) implements Type {
    public FunTy {
      Objects.requireNonNull(argument, "argument must not be null");
      Objects.requireNonNull(result, "result must not be null");
    }

    @Override
    public String ppr(int precedence) {
      final var arrow = argument.ppr(FUN_PREC) + " -> " + result.ppr(TOP_PREC);
      return precedence >= FUN_PREC ? "(" + arrow + ")" : arrow;
    }
  }

  record ForAllTy(Name binder, Type body) implements Type {
    public ForAllTy {
      Objects.requireNonNull(binder, "binder must not be null");
      Objects.requireNonNull(body, "body must not be null");
    }

    @Override
    public String ppr(int precedence) {
      final var forAll = "forall " + binder.ppr() + ". " + body.ppr(TOP_PREC);
      return precedence > TOP_PREC ? "(" + forAll + ")" : forAll;
    }
  }

  /// A type level literal, printed as written
  record LitTy(String literal) implements Type {
    public LitTy {
      Objects.requireNonNull(literal, "literal must not be null");
    }

    @Override
    public String ppr(int precedence) {
      return literal;
    }
  }
}
