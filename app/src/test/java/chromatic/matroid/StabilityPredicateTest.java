package chromatic.matroid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chromatic.ChromaticEngine;
import chromatic.core.EngineOptions;
import chromatic.core.error.DomainMismatchException;
import chromatic.core.model.SetComposition;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class StabilityPredicateTest {
  private final Matroid u23 = Matroids.uniform(2, 3);

  @Test
  void singleBlockTiesEveryBasis() {
    assertFalse(StabilityPredicate.isStable(u23, SetComposition.parse("(1,2,3)")));
  }

  @Test
  void tiedMaximumIsNotStable() {
    SetComposition opi = SetComposition.parse("(1,2|3)");

    assertEquals(
        Map.of(Set.of(1, 2), 0, Set.of(1, 3), 1, Set.of(2, 3), 1),
        StabilityPredicate.scores(u23, opi));
    assertFalse(StabilityPredicate.isStable(u23, opi));
  }

  @Test
  void lateBlockHoldingABasisIsStable() {
    SetComposition opi = SetComposition.parse("(3|1,2)");

    assertEquals(
        Map.of(Set.of(1, 2), 2, Set.of(1, 3), 1, Set.of(2, 3), 1),
        StabilityPredicate.scores(u23, opi));
    assertTrue(StabilityPredicate.isStable(u23, opi));
  }

  @Test
  void uniqueMaximumIsStable() {
    SetComposition opi = SetComposition.parse("(1|2|3)");

    assertEquals(
        Map.of(Set.of(1, 2), 1, Set.of(1, 3), 2, Set.of(2, 3), 3),
        StabilityPredicate.scores(u23, opi));
    assertTrue(StabilityPredicate.isStable(u23, opi));
  }

  @Test
  void setCompositionMustCoverTheGroundSet() {
    assertThrows(
        DomainMismatchException.class,
        () -> StabilityPredicate.isStable(u23, SetComposition.parse("(1|2)")));
  }

  @Test
  void countsStableSetCompositionsOfUniformMatroid() {
    long stable =
        new ChromaticEngine(EngineOptions.lazy())
            .setCompositions(3).stream()
                .filter(opi -> StabilityPredicate.isStable(u23, opi))
                .count();

    // For U(2,3) exactly the set compositions whose first block is a singleton.
    assertEquals(9, stable);
  }
}
