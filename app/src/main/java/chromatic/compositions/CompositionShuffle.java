package chromatic.compositions;

import chromatic.cache.AlgebraCache;
import chromatic.cache.AlgebraCache.ShuffleKey;
import chromatic.cache.MemoTable;
import chromatic.core.model.Composition;
import chromatic.util.Coefficients;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Quasi-shuffle product of two compositions.
 *
 * <p>With {@code a}, {@code b} the first parts of {@code q}, {@code t}:
 *
 * <pre>
 *   qs(q, t) = a.qs(q', t) + b.qs(q, t') + (a+b).qs(q', t')
 * </pre>
 *
 * where {@code x.S} prepends x to every term of S and equal terms add their coefficients. An
 * empty operand returns the other one with coefficient 1. Results are stored under both operand
 * orders since the product is commutative. A merged part that overflows {@code int} fails with an
 * {@link ArithmeticException}.
 */
public final class CompositionShuffle {
  private final MemoTable<ShuffleKey<Composition>, Map<Composition, BigInteger>> table;

  public CompositionShuffle(AlgebraCache cache) {
    this.table = Objects.requireNonNull(cache, "cache").compositionShuffles();
  }

  public Map<Composition, BigInteger> quasiShuffle(Composition q, Composition t) {
    Objects.requireNonNull(q, "q");
    Objects.requireNonNull(t, "t");
    if (q.isEmpty()) {
      return Map.of(t, BigInteger.ONE);
    }
    if (t.isEmpty()) {
      return Map.of(q, BigInteger.ONE);
    }
    ShuffleKey<Composition> key = new ShuffleKey<>(q, t);
    Map<Composition, BigInteger> cached = table.lookup(key);
    if (cached != null) {
      return cached;
    }

    int a = q.first();
    int b = t.first();
    int merged = Math.addExact(a, b);
    Composition qRest = q.rest();
    Composition tRest = t.rest();

    Map<Composition, BigInteger> answer = new LinkedHashMap<>();
    Coefficients.accumulate(answer, quasiShuffle(qRest, t), c -> c.prepend(a));
    Coefficients.accumulate(answer, quasiShuffle(q, tRest), c -> c.prepend(b));
    Coefficients.accumulate(answer, quasiShuffle(qRest, tRest), c -> c.prepend(merged));

    Map<Composition, BigInteger> result = table.store(key, Coefficients.freeze(answer));
    table.store(key.swapped(), result);
    return result;
  }
}
