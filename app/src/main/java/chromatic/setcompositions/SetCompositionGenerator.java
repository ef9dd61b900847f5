package chromatic.setcompositions;

import chromatic.cache.AlgebraCache;
import chromatic.cache.MemoTable;
import chromatic.core.model.SetComposition;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates all set compositions of {@code {1..n}}.
 *
 * <p>The single-block composition comes first. Then, for every size r = 1..n-1 of the part that
 * follows the first block, and every r-subset {@code rest} of the ground set, each set
 * composition of {@code {1..r}} is relabeled onto {@code rest} and the complement of {@code rest}
 * is prepended as first block. The first block is therefore fixed by the choice of {@code rest},
 * which makes every set composition appear exactly once. Sizes follow the ordered Bell numbers 1,
 * 1, 3, 13, 75, ...
 */
public final class SetCompositionGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(SetCompositionGenerator.class);

  private final MemoTable<Integer, List<SetComposition>> table;

  public SetCompositionGenerator(AlgebraCache cache) {
    this.table = Objects.requireNonNull(cache, "cache").setCompositions();
  }

  /** All set compositions of {@code {1..n}}; empty for negative n, {@code [()]} for n = 0. */
  public List<SetComposition> generateAll(int n) {
    if (n < 0) {
      return List.of();
    }
    List<SetComposition> cached = table.lookup(n);
    if (cached != null) {
      return cached;
    }
    List<SetComposition> result = new ArrayList<>();
    if (n == 0) {
      result.add(SetComposition.EMPTY);
    } else {
      Set<Integer> groundSet = ContiguousSet.create(Range.closed(1, n), DiscreteDomain.integers());
      result.add(SetComposition.of(List.of(groundSet)));
      for (int restSize = 1; restSize < n; restSize++) {
        List<SetComposition> smaller = generateAll(restSize);
        for (Set<Integer> rest : Sets.combinations(groundSet, restSize)) {
          Map<Integer, Integer> onto = ontoRest(rest);
          Set<Integer> first = Sets.difference(groundSet, rest);
          for (SetComposition composition : smaller) {
            result.add(composition.relabel(onto).prepend(first));
          }
        }
      }
    }
    LOG.debug("Generated {} set compositions of size {}", result.size(), n);
    return table.store(n, List.copyOf(result));
  }

  /** Maps {@code i} to the i-th smallest element of {@code rest}. */
  private static Map<Integer, Integer> ontoRest(Set<Integer> rest) {
    List<Integer> sorted = rest.stream().sorted().toList();
    Map<Integer, Integer> onto = new HashMap<>();
    for (int i = 0; i < sorted.size(); i++) {
      onto.put(i + 1, sorted.get(i));
    }
    return onto;
  }
}
