package chromatic.matroid;

import chromatic.core.error.DomainMismatchException;
import chromatic.core.model.SetComposition;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a set composition is stable for a matroid.
 *
 * <p>Each basis B is scored by summing, over its elements, the zero-based index of the block that
 * contains the element. The pair is stable iff exactly one basis reaches the maximum score.
 */
public final class StabilityPredicate {
  private StabilityPredicate() {}

  public static boolean isStable(Matroid matroid, SetComposition opi) {
    Map<Set<Integer>, Integer> scores = scores(matroid, opi);
    int best = Integer.MIN_VALUE;
    int attained = 0;
    for (int score : scores.values()) {
      if (score > best) {
        best = score;
        attained = 1;
      } else if (score == best) {
        attained++;
      }
    }
    return attained == 1;
  }

  /**
   * Score of every basis under {@code opi}.
   *
   * @throws DomainMismatchException if {@code opi} does not cover the matroid's ground set
   */
  public static Map<Set<Integer>, Integer> scores(Matroid matroid, SetComposition opi) {
    Objects.requireNonNull(matroid, "matroid");
    Objects.requireNonNull(opi, "opi");
    for (Integer element : matroid.groundSet()) {
      if (!opi.contains(element)) {
        throw new DomainMismatchException(
            "Set composition " + opi + " does not cover element " + element + " of the matroid");
      }
    }
    Map<Set<Integer>, Integer> scores = new LinkedHashMap<>();
    for (Set<Integer> basis : matroid.bases()) {
      int score = 0;
      for (Integer element : basis) {
        score += opi.blockIndexOf(element);
      }
      scores.put(basis, score);
    }
    return scores;
  }
}
