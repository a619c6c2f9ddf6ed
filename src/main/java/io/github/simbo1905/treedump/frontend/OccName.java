// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump.frontend;

import java.util.Objects;

/// The simplest kind of identifier: a string in a namespace, as it occurs in the source.
public record OccName(NameSpace nameSpace, String string) implements Outputable {
  public OccName {
    Objects.requireNonNull(nameSpace, "nameSpace must not be null");
    Objects.requireNonNull(string, "string must not be null");
  }

  public static OccName mkVarOcc(String string) {
    return new OccName(NameSpace.VAR_NAME, string);
  }

  public static OccName mkDataOcc(String string) {
    return new OccName(NameSpace.DATA_NAME, string);
  }

  public static OccName mkTyVarOcc(String string) {
    return new OccName(NameSpace.TV_NAME, string);
  }

  public static OccName mkTcOcc(String string) {
    return new OccName(NameSpace.TC_CLS_NAME, string);
  }

  @Override
  public String ppr() {
    return string;
  }
}
