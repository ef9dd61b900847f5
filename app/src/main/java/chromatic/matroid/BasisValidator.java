package chromatic.matroid;

import chromatic.core.error.InvalidMatroidException;
import java.util.Set;

/** Checks that a basis family defines a matroid on a ground set. */
@FunctionalInterface
public interface BasisValidator {

  /**
   * @throws InvalidMatroidException if {@code bases} violates a basis axiom
   */
  void validate(Set<Integer> groundSet, Set<Set<Integer>> bases);
}
