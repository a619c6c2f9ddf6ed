// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.treedump;

import io.github.simbo1905.LoggingControl;
import io.github.simbo1905.treedump.frontend.DumpAs;
import io.github.simbo1905.treedump.frontend.HsType;
import io.github.simbo1905.treedump.frontend.Located;
import io.github.simbo1905.treedump.frontend.Module;
import io.github.simbo1905.treedump.frontend.Name;
import io.github.simbo1905.treedump.frontend.NameSort;
import io.github.simbo1905.treedump.frontend.OccName;
import io.github.simbo1905.treedump.frontend.Outputable;
import io.github.simbo1905.treedump.frontend.SrcSpan;
import io.github.simbo1905.treedump.frontend.TyCon;
import io.github.simbo1905.treedump.frontend.Type;
import io.github.simbo1905.treedump.frontend.Unique;
import io.github.simbo1905.treedump.frontend.Var;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.AbstractList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.IntStream;

import static io.github.simbo1905.treedump.Value.con;
import static io.github.simbo1905.treedump.Value.field;
import static io.github.simbo1905.treedump.Value.leaf;
import static io.github.simbo1905.treedump.Value.list;
import static io.github.simbo1905.treedump.Value.rec;
import static io.github.simbo1905.treedump.Value.tuple;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeConverterTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static final Name INT_NAME = new Name(OccName.mkTcOcc("Int"),
      new NameSort.WiredIn(Module.of("ghc-prim", "GHC.Types")), new SrcSpan.Unhelpful("<wired into compiler>"),
      new Unique('3', 1));
  static final Type INT = new Type.TyConApp(new TyCon(INT_NAME), List.of());
  static final Value INT_TREE = con("TyConApp", leaf("Int"), list());

  public record Point(int x, int y) {
  }

  @DumpAs("Pt")
  public record Renamed(int x) {
  }

  public enum Colour {RED, GREEN}

  static class Base {
    final int id = 7;
  }

  static class Derived extends Base {
    static int count = 1;
    final String label = "d";
    transient int cache = 3;
  }

  public record Flaky(int before, String broken, int after) {
    @Override
    public String broken() {
      throw new IllegalStateException("boom");
    }
  }

  public record Asserting(int before, String broken, int after) {
    @Override
    public String broken() {
      throw new AssertionError("internal invariant violated");
    }
  }

  /// Pretty-prints fine but cannot be walked
  static final class Unlisted extends AbstractList<String> implements Outputable {
    @Override
    public String get(int index) {
      throw new IllegalStateException("no elements");
    }

    @Override
    public int size() {
      return 1;
    }

    @Override
    public String ppr() {
      return "unlisted";
    }
  }

  public record Unfixed(String operator, String fixity) {
    @Override
    public String fixity() {
      throw new IllegalStateException("Evaluated the place holder for an operator fixity");
    }
  }

  public record Corrupt(String value) {
    @Override
    public String value() {
      throw new TreeInvariantException("corrupt");
    }
  }

  public record Broken(String reason) implements Outputable {
    @Override
    public String ppr() {
      throw new IllegalStateException(reason);
    }
  }

  @Nested
  @DisplayName("Generic decomposition")
  class Generic {

    @Test
    void scalars() {
      assertThat(TreeDump.valueOf(42)).isEqualTo(con("42"));
      assertThat(TreeDump.valueOf(2.5d)).isEqualTo(con("2.5"));
      assertThat(TreeDump.valueOf(true)).isEqualTo(con("True"));
      assertThat(TreeDump.valueOf(false)).isEqualTo(con("False"));
      assertThat(TreeDump.valueOf('c')).isEqualTo(con("'c'"));
      assertThat(TreeDump.valueOf(null)).isEqualTo(con("null"));
      assertThat(TreeDump.valueOf(Colour.GREEN)).isEqualTo(con("GREEN"));
    }

    @Test
    void stringsAreQuotedLiterals() {
      assertThat(TreeDump.valueOf("hi")).isEqualTo(con("\"hi\""));
      assertThat(TreeDump.valueOf("say \"hi\"\n")).isEqualTo(con("\"say \\\"hi\\\"\\n\""));
      assertThat(TreeDump.valueOf("")).isEqualTo(con("\"\""));
    }

    @Test
    void recordsUseTheirComponents() {
      assertThat(TreeDump.valueOf(new Point(1, 2))).isEqualTo(con("Point", con("1"), con("2")));
      assertThat(TreeDump.valueOf(new Renamed(3))).isEqualTo(con("Pt", con("3")));
    }

    @Test
    void locatedUsesTheShortTag() {
      final var span = SrcSpan.of("A.hs", 1, 1, 1, 4);
      assertThat(TreeDump.valueOf(Located.at(span, 5))).isEqualTo(con("L", leaf("A.hs:1:1-3"), con("5")));
    }

    @Test
    void objectsUseTheirFieldsSuperclassFirst() {
      assertThat(TreeDump.valueOf(new Derived())).isEqualTo(con("Derived", con("7"), con("\"d\"")));
    }

    @Test
    void sequences() {
      assertThat(TreeDump.valueOf(List.of(1, 2))).isEqualTo(list(con("1"), con("2")));
      assertThat(TreeDump.valueOf(new int[]{3, 4})).isEqualTo(list(con("3"), con("4")));
      assertThat(TreeDump.valueOf(List.of())).isEqualTo(list());
    }

    @Test
    void rawSequenceIsAConsChain() {
      final var raw = new TreeConverter(Overrides.standard()).convert(List.of(1, 2));
      assertThat(raw).isEqualTo(con("(:)", con("1"), con("(:)", con("2"), con("[]"))));
    }

    @Test
    void longSequenceDoesNotOverflow() {
      final var items = IntStream.range(0, 50_000).boxed().toList();
      final var value = (Value.ListNode) TreeDump.valueOf(items);
      assertThat(value.items()).hasSize(50_000);
      assertThat(value.items().get(49_999)).isEqualTo(con("49999"));
    }

    @Test
    void collectionsAreBags() {
      assertThat(TreeDump.valueOf(new TreeSet<>(List.of(2, 1))))
          .isEqualTo(con("Bag.listToBag", list(con("1"), con("2"))));
    }

    @Test
    void mapsAreAssociationLists() {
      assertThat(TreeDump.valueOf(new TreeMap<>(Map.of("a", 1, "b", 2))))
          .isEqualTo(con("fromList", list(tuple(con("\"a\""), con("1")), tuple(con("\"b\""), con("2")))));
    }

    @Test
    void optionals() {
      assertThat(TreeDump.valueOf(Optional.of(1))).isEqualTo(con("Optional.of", con("1")));
      assertThat(TreeDump.valueOf(Optional.empty())).isEqualTo(con("Optional.empty"));
    }

    @Test
    void platformValuesAreQuotedText() {
      assertThat(TreeDump.valueOf(Path.of("src", "Main.hs")))
          .isEqualTo(con(Decomposers.quote(Path.of("src", "Main.hs").toString())));
    }
  }

  @Nested
  @DisplayName("Fault containment")
  class Containment {

    @Test
    void failingChildBecomesALeafAndSiblingsSurvive() {
      assertThat(TreeDump.valueOf(new Flaky(1, "x", 3)))
          .isEqualTo(con("Flaky", con("1"), leaf("java.lang.IllegalStateException: boom"), con("3")));
    }

    @Test
    void assertionErrorsAreContainedLikeExceptions() {
      assertThat(TreeDump.valueOf(new Asserting(1, "x", 3)))
          .isEqualTo(con("Asserting", con("1"), leaf("java.lang.AssertionError: internal invariant violated"),
              con("3")));
    }

    @Test
    void prettyPrintingAssertionErrorsBecomeTheirDescription() {
      final Outputable failing = () -> {
        throw new AssertionError("no span");
      };
      assertThat(Faults.prettyOrFault(failing)).isEqualTo("java.lang.AssertionError: no span");
    }

    @Test
    void knownPlaceholderGetsAShortMarker() {
      assertThat(TreeDump.valueOf(new Unfixed("+", null)))
          .isEqualTo(con("Unfixed", con("\"+\""), leaf("<<fixity>>")));
    }

    @Test
    void placeholderMarkers() {
      assertThat(Faults.describe(new IllegalStateException("Evaluated the place holder for a PostTcType")))
          .isEqualTo("<<PostTcType>>");
      assertThat(Faults.describe(new IllegalStateException("placeHolderNames")))
          .isEqualTo("<<placeHolderNames>>");
      assertThat(Faults.describe(new ArithmeticException("/ by zero")))
          .isEqualTo("java.lang.ArithmeticException: / by zero");
    }

    @Test
    void faultsInsideListsOnlyReplaceTheElement() {
      assertThat(TreeDump.valueOf(List.of(new Point(0, 0), new Flaky(1, "x", 2))))
          .isEqualTo(list(con("Point", con("0"), con("0")),
              con("Flaky", con("1"), leaf("java.lang.IllegalStateException: boom"), con("2"))));
    }

    @Test
    void invariantViolationsAreNotContained() {
      assertThatThrownBy(() -> TreeDump.valueOf(List.of(new Corrupt("x"))))
          .isInstanceOf(TreeInvariantException.class)
          .hasMessage("corrupt");
    }
  }

  @Nested
  @DisplayName("Override table")
  class Table {

    @Test
    void typesCarryTheirPrettyFormAndTheirStructure() {
      final var function = new Type.FunTy(INT, INT);
      assertThat(TreeDump.valueOf(function))
          .isEqualTo(rec(field("Int -> Int", con("FunTy", INT_TREE, INT_TREE))));
    }

    @Test
    void nestedTypesAreNotRenderedTwice() {
      final var list = new Type.TyConApp(new TyCon(new Name(OccName.mkTcOcc("[]"), INT_NAME.sort(),
          INT_NAME.srcSpan(), new Unique('3', 2))), List.of(INT));
      assertThat(TreeDump.valueOf(list))
          .isEqualTo(rec(field("[Int]", con("TyConApp", leaf("[]"), list(INT_TREE)))));
    }

    @Test
    void variablesInsideSourceTypesRenderTheirTypeAgain() {
      final var span = SrcSpan.of("A.hs", 2, 1, 2, 2);
      final var name = new Name(OccName.mkTyVarOcc("a"), NameSort.INTERNAL, span, new Unique('r', 7));
      final var var = new Var(name, INT);
      final HsType<Var> type = new HsType.HsTyVar<>(Located.at(span, var));

      final var varTree = Cleanup.cleanup(NameRenderer.var(var, new TreeConverter(Overrides.standard())));
      assertThat(((Value.RecNode) varTree).fields().get(0))
          .isEqualTo(field("varType", rec(field("Int", INT_TREE))));
      assertThat(TreeDump.valueOf(type))
          .isEqualTo(rec(field("a", con("HsTyVar", con("L", leaf("A.hs:2:1"), varTree)))));
    }

    @Test
    void prettyOnlyTypes() {
      assertThat(TreeDump.valueOf(SrcSpan.of("A.hs", 1, 5, 2, 3))).isEqualTo(leaf("A.hs:(1,5)-(2,2)"));
      assertThat(TreeDump.valueOf(new TyCon(INT_NAME))).isEqualTo(leaf("Int"));
    }

    @Test
    void prettyPrintingFailureBecomesAFault() {
      final var overrides = Overrides.builder().dualRender(Broken.class).build();
      assertThat(TreeDump.valueOf(new Broken("PostTcKind"), overrides)).isEqualTo(leaf("<<PostTcKind>>"));
    }

    @Test
    void structureFailureKeepsThePrettyForm() {
      final var overrides = Overrides.builder().dualRender(Unlisted.class).build();
      assertThat(TreeDump.valueOf(new Unlisted(), overrides))
          .isEqualTo(rec(field("unlisted", leaf("java.lang.IllegalStateException: no elements"))));
    }

    @Test
    void suppressedDualRenderFallsBackToStructure() {
      final var converter = new TreeConverter(Overrides.standard());
      assertThat(Cleanup.cleanup(converter.convert(INT, true))).isEqualTo(INT_TREE);
    }

    @Test
    void customRules() {
      final var overrides = Overrides.builder()
          .bespoke(Point.class, (point, converter) -> leaf(point.x() + "," + point.y()))
          .addAll(Overrides.standard())
          .build();
      assertThat(TreeDump.valueOf(List.of(new Point(1, 2)), overrides)).isEqualTo(list(leaf("1,2")));
      assertThat(TreeDump.valueOf(new Point(1, 2), Overrides.none())).isEqualTo(con("Point", con("1"), con("2")));
    }

    @Test
    void firstMatchingRuleWins() {
      final var overrides = Overrides.builder()
          .prettyOnly(Type.class)
          .addAll(Overrides.standard())
          .build();
      assertThat(TreeDump.valueOf(new Type.FunTy(INT, INT), overrides)).isEqualTo(leaf("Int -> Int"));
    }

    @Test
    void prettyRulesNeedOutputableTypes() {
      assertThatThrownBy(() -> new Overrides.Rule(String.class, Overrides.Kind.PRETTY_ONLY, null))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
