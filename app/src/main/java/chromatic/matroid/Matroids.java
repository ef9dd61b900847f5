package chromatic.matroid;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;
import java.util.Set;

/** Factories for standard matroids on {@code {1..n}}. */
public final class Matroids {
  private Matroids() {}

  /** Uniform matroid U(rank, size): every rank-subset of {@code {1..size}} is a basis. */
  public static Matroid uniform(int rank, int size) {
    if (size < 0 || rank < 0 || rank > size) {
      throw new IllegalArgumentException(
          "Uniform matroid needs 0 <= rank <= size, got rank=" + rank + ", size=" + size);
    }
    Set<Integer> groundSet =
        ContiguousSet.create(Range.closedOpen(1, size + 1), DiscreteDomain.integers());
    return new Matroid(groundSet, Sets.combinations(groundSet, rank));
  }
}
