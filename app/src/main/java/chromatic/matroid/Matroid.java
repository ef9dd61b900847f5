package chromatic.matroid;

import chromatic.core.error.StructuralViolationException;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Matroid given by its ground set and its family of bases. The family is validated once, on
 * construction; an invalid family never yields an instance.
 *
 * <p>Bases are stored as an unordered set. Nothing here depends on their iteration order.
 */
public final class Matroid {
  private final ImmutableSet<Integer> groundSet;
  private final ImmutableSet<Set<Integer>> bases;
  private final BasisValidator validator;
  private final int rank;

  public Matroid(Collection<Integer> groundSet, Collection<? extends Collection<Integer>> bases) {
    this(groundSet, bases, ExchangeAxiomValidator.INSTANCE);
  }

  public Matroid(
      Collection<Integer> groundSet,
      Collection<? extends Collection<Integer>> bases,
      BasisValidator validator) {
    Objects.requireNonNull(groundSet, "groundSet");
    Objects.requireNonNull(bases, "bases");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.groundSet = ImmutableSet.copyOf(groundSet);
    ImmutableSet.Builder<Set<Integer>> family = ImmutableSet.builder();
    for (Collection<Integer> basis : bases) {
      family.add(ImmutableSet.copyOf(basis));
    }
    this.bases = family.build();
    validator.validate(this.groundSet, this.bases);
    this.rank = this.bases.isEmpty() ? 0 : this.bases.iterator().next().size();
  }

  public Set<Integer> groundSet() {
    return groundSet;
  }

  public Set<Set<Integer>> bases() {
    return bases;
  }

  public int size() {
    return groundSet.size();
  }

  public int rank() {
    return rank;
  }

  /** Largest intersection of {@code subset} with a basis. */
  public int rank(Collection<Integer> subset) {
    Objects.requireNonNull(subset, "subset");
    Set<Integer> lookup = subset instanceof Set<Integer> set ? set : new HashSet<>(subset);
    int best = 0;
    for (Set<Integer> basis : bases) {
      int shared = 0;
      for (Integer element : basis) {
        if (lookup.contains(element)) {
          shared++;
        }
      }
      best = Math.max(best, shared);
    }
    return best;
  }

  public boolean isBasis(Collection<Integer> candidate) {
    return bases.contains(ImmutableSet.copyOf(candidate));
  }

  public boolean isIndependent(Collection<Integer> candidate) {
    for (Set<Integer> basis : bases) {
      if (basis.containsAll(candidate)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Every subset of some basis. Exponential in the rank; meant for the small instances used in
   * experiments and tests.
   */
  public Set<Set<Integer>> independentSets() {
    Set<Set<Integer>> independent = new LinkedHashSet<>();
    for (Set<Integer> basis : bases) {
      for (Set<Integer> subset : Sets.powerSet(basis)) {
        independent.add(ImmutableSet.copyOf(subset));
      }
    }
    return Collections.unmodifiableSet(independent);
  }

  /**
   * Adds {@code elements} one at a time. For each new element e, every basis of the current
   * family that contains an element i of the original ground set also yields the basis with i
   * replaced by e. The result goes through validation again.
   *
   * @throws StructuralViolationException if an element is already in the ground set
   */
  public Matroid extend(Collection<Integer> elements) {
    Objects.requireNonNull(elements, "elements");
    Set<Integer> nextGround = new LinkedHashSet<>(groundSet);
    Set<Set<Integer>> family = new LinkedHashSet<>(bases);
    for (Integer element : elements) {
      Objects.requireNonNull(element, "element");
      if (!nextGround.add(element)) {
        throw new StructuralViolationException(
            "Element " + element + " is already in the ground set " + nextGround);
      }
      List<Set<Integer>> current = new ArrayList<>(family);
      for (Set<Integer> basis : current) {
        for (Integer replaced : basis) {
          if (!groundSet.contains(replaced)) {
            continue;
          }
          Set<Integer> candidate = new HashSet<>(basis);
          candidate.remove(replaced);
          candidate.add(element);
          family.add(ImmutableSet.copyOf(candidate));
        }
      }
    }
    return new Matroid(nextGround, family, validator);
  }

  /**
   * Renames the ground set through {@code bijection}, which must be defined and injective on
   * every element.
   */
  public Matroid relabel(Map<Integer, Integer> bijection) {
    Objects.requireNonNull(bijection, "bijection");
    Set<Integer> images = new HashSet<>();
    for (Integer element : groundSet) {
      Integer image = bijection.get(element);
      if (image == null) {
        throw new StructuralViolationException(
            "Relabeling is not defined on element " + element);
      }
      if (!images.add(image)) {
        throw new StructuralViolationException(
            "Relabeling is not injective: label " + image + " used twice");
      }
    }
    List<Integer> nextGround = groundSet.stream().map(bijection::get).toList();
    List<List<Integer>> nextBases =
        bases.stream().map(basis -> basis.stream().map(bijection::get).toList()).toList();
    return new Matroid(nextGround, nextBases, validator);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Matroid other)) {
      return false;
    }
    return groundSet.equals(other.groundSet) && bases.equals(other.bases);
  }

  @Override
  public int hashCode() {
    return Objects.hash(groundSet, bases);
  }

  @Override
  public String toString() {
    return "Matroid[groundSet=" + groundSet + ", rank=" + rank + ", bases=" + bases + "]";
  }
}
