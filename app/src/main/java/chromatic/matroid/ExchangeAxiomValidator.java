package chromatic.matroid;

import chromatic.core.error.InvalidMatroidException;
import java.util.HashSet;
import java.util.Set;

/**
 * Brute-force check of the basis axioms.
 *
 * <ol>
 *   <li>There is at least one basis, every basis lies in the ground set and all bases have the
 *       same size.
 *   <li>Exchange: for every ordered pair of distinct bases (B1, B2) and every i in B2 \ B1 there
 *       is j in B1 \ B2 such that (B2 \ {i}) u {j} is a basis.
 * </ol>
 *
 * <p>Both orders of each pair are checked since the exchanged element comes from B2 only. The
 * cost is O(bases^2 * rank^2) lookups; for basis families given directly rather than built by a
 * matroid construction this can be exponential in the ground set size. Nothing is truncated.
 */
public final class ExchangeAxiomValidator implements BasisValidator {
  public static final ExchangeAxiomValidator INSTANCE = new ExchangeAxiomValidator();

  private ExchangeAxiomValidator() {}

  @Override
  public void validate(Set<Integer> groundSet, Set<Set<Integer>> bases) {
    if (bases.isEmpty()) {
      throw new InvalidMatroidException("Matroid needs at least one basis");
    }
    int rank = -1;
    for (Set<Integer> basis : bases) {
      if (!groundSet.containsAll(basis)) {
        throw new InvalidMatroidException(
            "Basis " + basis + " is not contained in ground set " + groundSet);
      }
      if (rank < 0) {
        rank = basis.size();
      } else if (basis.size() != rank) {
        throw new InvalidMatroidException(
            "Bases must have equal size, found " + rank + " and " + basis.size());
      }
    }

    for (Set<Integer> first : bases) {
      for (Set<Integer> second : bases) {
        if (first.equals(second)) {
          continue;
        }
        for (Integer removed : second) {
          if (first.contains(removed)) {
            continue;
          }
          if (!hasExchange(first, second, removed, bases)) {
            throw new InvalidMatroidException(
                "Exchange axiom fails: removing "
                    + removed
                    + " from "
                    + second
                    + " admits no replacement from "
                    + first);
          }
        }
      }
    }
  }

  private static boolean hasExchange(
      Set<Integer> first, Set<Integer> second, Integer removed, Set<Set<Integer>> bases) {
    for (Integer added : first) {
      if (second.contains(added)) {
        continue;
      }
      Set<Integer> candidate = new HashSet<>(second);
      candidate.remove(removed);
      candidate.add(added);
      if (bases.contains(candidate)) {
        return true;
      }
    }
    return false;
  }
}
