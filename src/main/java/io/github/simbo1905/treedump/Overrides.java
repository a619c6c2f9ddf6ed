// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import io.github.simbo1905.treedump.frontend.HsType;
import io.github.simbo1905.treedump.frontend.Module;
import io.github.simbo1905.treedump.frontend.ModuleName;
import io.github.simbo1905.treedump.frontend.Name;
import io.github.simbo1905.treedump.frontend.OccName;
import io.github.simbo1905.treedump.frontend.Outputable;
import io.github.simbo1905.treedump.frontend.RdrName;
import io.github.simbo1905.treedump.frontend.SrcSpan;
import io.github.simbo1905.treedump.frontend.TcEvBinds;
import io.github.simbo1905.treedump.frontend.TyCon;
import io.github.simbo1905.treedump.frontend.Type;
import io.github.simbo1905.treedump.frontend.Var;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/// An ordered, immutable table of type-directed rendering rules consulted before generic decomposition.
/// The first rule whose type matches the runtime class of a value wins.
public final class Overrides {

  public enum Kind {
    /// Pretty-printed text paired with the structural tree
    DUAL_RENDER,
    /// Pretty-printed text only
    PRETTY_ONLY,
    /// A dedicated renderer
    BESPOKE
  }

  /// Renders one value, with access to the converter for its children
  @FunctionalInterface
  public interface Renderer {
    Value render(Object value, TreeConverter converter);
  }

  public record Rule(Class<?> type, Kind kind, @Nullable Renderer renderer) {
    public Rule {
      Objects.requireNonNull(type, "type must not be null");
      Objects.requireNonNull(kind, "kind must not be null");
      if (kind == Kind.BESPOKE) {
        Objects.requireNonNull(renderer, "A bespoke rule needs a renderer");
      } else if (!Outputable.class.isAssignableFrom(type)) {
        throw new IllegalArgumentException(kind + " rule for " + type.getName() + " requires an Outputable type");
      }
    }
  }

  private static final Overrides STANDARD = builder()
      .dualRender(Type.class)
      .dualRender(HsType.class)
      .prettyOnly(SrcSpan.class)
      .prettyOnly(TyCon.class)
      .bespoke(Module.class, (module, converter) -> NameRenderer.module(module))
      .bespoke(ModuleName.class, (moduleName, converter) -> NameRenderer.moduleName(moduleName))
      .bespoke(Name.class, (name, converter) -> NameRenderer.name(name))
      .bespoke(OccName.class, (occName, converter) -> NameRenderer.occName(occName))
      .bespoke(RdrName.class, (rdrName, converter) -> NameRenderer.rdrName(rdrName))
      .bespoke(TcEvBinds.class, NameRenderer::tcEvBinds)
      .bespoke(Var.class, NameRenderer::var)
      .build();

  private final List<Rule> rules;

  private Overrides(List<Rule> rules) {
    this.rules = List.copyOf(rules);
  }

  /// The rules for the standard front end vocabulary
  public static Overrides standard() {
    return STANDARD;
  }

  /// A table with no rules: every value is decomposed generically
  public static Overrides none() {
    return new Overrides(List.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  /// @return the first rule matching the value, or null for generic decomposition
  @Nullable Rule ruleFor(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    for (Rule rule : rules) {
      if (rule.type().isInstance(value)) {
        return rule;
      }
    }
    return null;
  }

  public static final class Builder {
    private final List<Rule> rules = new ArrayList<>();

    private Builder() {
    }

    /// Starts from the rules of an existing table, keeping their order
    public Builder addAll(Overrides overrides) {
      rules.addAll(overrides.rules);
      return this;
    }

    public Builder dualRender(Class<? extends Outputable> type) {
      rules.add(new Rule(type, Kind.DUAL_RENDER, null));
      return this;
    }

    public Builder prettyOnly(Class<? extends Outputable> type) {
      rules.add(new Rule(type, Kind.PRETTY_ONLY, null));
      return this;
    }

    public <T> Builder bespoke(Class<T> type, BiFunction<T, TreeConverter, Value> renderer) {
      Objects.requireNonNull(renderer, "renderer must not be null");
      rules.add(new Rule(type, Kind.BESPOKE, (value, converter) -> renderer.apply(type.cast(value), converter)));
      return this;
    }

    public Overrides build() {
      return new Overrides(rules);
    }
  }
}
