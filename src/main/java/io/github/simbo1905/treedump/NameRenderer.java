// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import io.github.simbo1905.treedump.frontend.EvBind;
import io.github.simbo1905.treedump.frontend.Module;
import io.github.simbo1905.treedump.frontend.ModuleName;
import io.github.simbo1905.treedump.frontend.Name;
import io.github.simbo1905.treedump.frontend.NameSort;
import io.github.simbo1905.treedump.frontend.OccName;
import io.github.simbo1905.treedump.frontend.RdrName;
import io.github.simbo1905.treedump.frontend.TcEvBinds;
import io.github.simbo1905.treedump.frontend.Var;

import java.util.ArrayList;
import java.util.List;

import static io.github.simbo1905.treedump.Value.field;
import static io.github.simbo1905.treedump.Value.leaf;

/// Renders identifiers as small records that show which phase resolved them and how.
///
/// Every identifier starts from its occurrence, `{ VarName = foo }`, and each richer identifier prepends
/// what it knows: a qualifier, an original module, a binding site or a type.
final class NameRenderer {

  private NameRenderer() {
  }

  static Value occName(OccName occName) {
    final String nameSpace = switch (occName.nameSpace()) {
      case VAR_NAME -> "VarName";
      case DATA_NAME -> "DataName";
      case TV_NAME -> "TvName";
      case TC_CLS_NAME -> "TcClsName";
      default -> throw new TreeInvariantException("Unexpected name space " + occName.nameSpace()
          + " for occurrence " + occName.string());
    };
    return Value.rec(field(nameSpace, leaf(occName.string())));
  }

  static Value rdrName(RdrName rdrName) {
    if (rdrName instanceof RdrName.Qual qual) {
      return prepend(occName(qual.occName()), field("Qual", moduleName(qual.moduleName())));
    }
    if (rdrName instanceof RdrName.Orig orig) {
      return prepend(occName(orig.occName()), field("Orig", module(orig.module())));
    }
    if (rdrName instanceof RdrName.Exact exact) {
      return name(exact.name());
    }
    return occName(rdrName.occName());
  }

  static Value name(Name name) {
    return prepend(occName(name.occName()),
        field("n_loc", leaf(Faults.prettyOrFault(name.srcSpan()))),
        field("n_sort", nameSort(name)),
        field("n_uniq", leaf(Faults.prettyOrFault(name.unique()))));
  }

  static Value var(Var var, TreeConverter converter) {
    return prepend(name(var.varName()), field("varType", converter.convert(var.varType(), false)));
  }

  static Value module(Module module) {
    return Value.con("Module", leaf(module.unitId().string()), leaf(module.moduleName().string()));
  }

  static Value moduleName(ModuleName moduleName) {
    return leaf(moduleName.string());
  }

  static Value tcEvBinds(TcEvBinds evBinds, TreeConverter converter) {
    if (evBinds instanceof TcEvBinds.Mutable mutable) {
      return leaf(Faults.prettyOrFault(mutable.var()));
    }
    final var binds = ((TcEvBinds.Binds) evBinds).binds().stream()
        .map(bind -> evBind(bind, converter))
        .toList();
    return new Value.ConNode("TcEvBinds", binds);
  }

  private static Value evBind(EvBind bind, TreeConverter converter) {
    return Value.rec(
        field("ev_var", var(bind.var(), converter)),
        field("ev_term", leaf(Faults.prettyOrFault(bind.term()))),
        field("ev_is_given", leaf(bind.isGiven() ? Tags.TRUE : Tags.FALSE)));
  }

  private static Value nameSort(Name name) {
    final NameSort sort = name.sort();
    if (sort instanceof NameSort.WiredIn wiredIn) {
      return Value.rec(field("WiredIn", module(wiredIn.module())));
    }
    if (sort instanceof NameSort.External external) {
      return Value.rec(field("External", module(external.module())));
    }
    if (sort instanceof NameSort.Internal) {
      return leaf("Internal");
    }
    if (sort instanceof NameSort.System) {
      return leaf("System");
    }
    throw new TreeInvariantException("Unexpected name sort " + sort.getClass().getName()
        + " for name " + name.occName().string());
  }

  /// Puts the given fields in front of those of an unlabelled record
  private static Value prepend(Value record, Value.Field... leading) {
    final var fields = new ArrayList<>(List.of(leading));
    fields.addAll(((Value.RecNode) record).fields());
    return new Value.RecNode("", fields);
  }
}
