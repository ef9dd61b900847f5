package chromatic.compositions;

import chromatic.cache.AlgebraCache;
import chromatic.cache.MemoTable;
import chromatic.core.model.Composition;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates all compositions of n.
 *
 * <p>The compositions of n are {@code (n)} followed, for k = 1..n-1, by every composition of k
 * with {@code n-k} prepended. For n = 3 this yields {@code (3), (2,1), (1,2), (1,1,1)}. Each size
 * is memoized, so the work is proportional to the 2^(n-1) compositions produced.
 */
public final class CompositionGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(CompositionGenerator.class);

  private final MemoTable<Integer, List<Composition>> table;

  public CompositionGenerator(AlgebraCache cache) {
    this.table = Objects.requireNonNull(cache, "cache").compositions();
  }

  /** All compositions of {@code n}; empty for negative n, {@code [()]} for n = 0. */
  public List<Composition> generateAll(int n) {
    if (n < 0) {
      return List.of();
    }
    List<Composition> cached = table.lookup(n);
    if (cached != null) {
      return cached;
    }
    List<Composition> result = new ArrayList<>();
    if (n == 0) {
      result.add(Composition.EMPTY);
    } else {
      result.add(Composition.of(n));
      for (int k = 1; k < n; k++) {
        for (Composition smaller : generateAll(k)) {
          result.add(smaller.prepend(n - k));
        }
      }
    }
    LOG.debug("Generated {} compositions of {}", result.size(), n);
    return table.store(n, List.copyOf(result));
  }
}
