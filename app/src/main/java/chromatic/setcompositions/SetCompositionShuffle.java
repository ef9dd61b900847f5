package chromatic.setcompositions;

import chromatic.cache.AlgebraCache;
import chromatic.cache.AlgebraCache.ShuffleKey;
import chromatic.cache.MemoTable;
import chromatic.core.error.DomainMismatchException;
import chromatic.core.model.SetComposition;
import chromatic.util.Coefficients;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Quasi-shuffle product of two set compositions over disjoint ground sets.
 *
 * <p>Same recurrence as for compositions, the merge term taking the union of both first blocks:
 *
 * <pre>
 *   qs(A.q, B.t) = A.qs(q, B.t) + B.qs(A.q, t) + (A u B).qs(q, t)
 * </pre>
 *
 * <p>Memoization goes through a {@link CanonicalFrame}: the operands are relabeled onto {@code
 * 1..|q|} and {@code |q|+1..|q|+|t|}, the product is looked up or computed there, and the result
 * is relabeled back. The cache therefore only grows with the number of shapes, not labelings.
 */
public final class SetCompositionShuffle {
  private final MemoTable<ShuffleKey<SetComposition>, Map<SetComposition, BigInteger>> table;

  public SetCompositionShuffle(AlgebraCache cache) {
    this.table = Objects.requireNonNull(cache, "cache").setCompositionShuffles();
  }

  /**
   * @throws DomainMismatchException if the ground sets of {@code q} and {@code t} intersect
   */
  public Map<SetComposition, BigInteger> quasiShuffle(SetComposition q, SetComposition t) {
    Objects.requireNonNull(q, "q");
    Objects.requireNonNull(t, "t");
    if (!q.isDisjointFrom(t)) {
      throw new DomainMismatchException(
          "Quasi-shuffle needs disjoint ground sets, got " + q + " and " + t);
    }
    if (q.isEmpty()) {
      return Map.of(t, BigInteger.ONE);
    }
    if (t.isEmpty()) {
      return Map.of(q, BigInteger.ONE);
    }
    CanonicalFrame frame = CanonicalFrame.of(q, t);
    Map<SetComposition, BigInteger> canonical = canonicalShuffle(frame.left(), frame.right());
    return Collections.unmodifiableMap(frame.restore(canonical));
  }

  private Map<SetComposition, BigInteger> canonicalShuffle(SetComposition q, SetComposition t) {
    ShuffleKey<SetComposition> key = new ShuffleKey<>(q, t);
    Map<SetComposition, BigInteger> cached = table.lookup(key);
    if (cached != null) {
      return cached;
    }
    return table.store(key, Coefficients.freeze(expand(q, t)));
  }

  private Map<SetComposition, BigInteger> expand(SetComposition q, SetComposition t) {
    List<Integer> a = q.first();
    List<Integer> b = t.first();
    SetComposition qRest = q.rest();
    SetComposition tRest = t.rest();
    List<Integer> union = new ArrayList<>(a);
    union.addAll(b);

    Map<SetComposition, BigInteger> answer = new LinkedHashMap<>();
    Coefficients.accumulate(answer, quasiShuffle(qRest, t), s -> s.prepend(a));
    Coefficients.accumulate(answer, quasiShuffle(q, tRest), s -> s.prepend(b));
    Coefficients.accumulate(answer, quasiShuffle(qRest, tRest), s -> s.prepend(union));
    return answer;
  }
}
